package com.example.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Administrator attempted a destructive action on their own account.
 */
public class SelfActionException extends BaseException {

    public SelfActionException(String action) {
        super("SELF_ACTION_FORBIDDEN", String.format("Cannot %s your own account", action),
                HttpStatus.BAD_REQUEST);
    }
}
