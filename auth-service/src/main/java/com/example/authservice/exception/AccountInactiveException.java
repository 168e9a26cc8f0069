package com.example.authservice.exception;

import org.springframework.http.HttpStatus;

public class AccountInactiveException extends BaseException {

    public AccountInactiveException() {
        super("ACCOUNT_INACTIVE", "Account is inactive", HttpStatus.FORBIDDEN);
    }
}
