package com.example.authservice.exception;

import org.springframework.http.HttpStatus;

/**
 * Exception for resource conflicts (HTTP 409).
 */
public class ConflictException extends BaseException {

    public ConflictException(String code, String message) {
        super(code, message, HttpStatus.CONFLICT);
    }

    public static ConflictException emailAlreadyExists(String email) {
        return new ConflictException(
            "EMAIL_ALREADY_EXISTS",
            String.format("User with email %s already exists", email)
        );
    }
}
