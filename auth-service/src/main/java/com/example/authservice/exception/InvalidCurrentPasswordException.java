package com.example.authservice.exception;

import org.springframework.http.HttpStatus;

public class InvalidCurrentPasswordException extends BaseException {

    public InvalidCurrentPasswordException() {
        super("INVALID_CURRENT_PASSWORD", "Current password is incorrect", HttpStatus.BAD_REQUEST);
    }
}
