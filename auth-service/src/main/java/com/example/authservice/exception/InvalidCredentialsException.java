package com.example.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Login failed. Unknown email and wrong password share this exact message.
 */
public class InvalidCredentialsException extends BaseException {

    public static final String MESSAGE = "Invalid email or password";

    public InvalidCredentialsException() {
        super("INVALID_CREDENTIALS", MESSAGE, HttpStatus.UNAUTHORIZED);
    }
}
