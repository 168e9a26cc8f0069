package com.example.authservice.exception;

import com.example.authservice.entity.Permission;
import org.springframework.http.HttpStatus;

/**
 * Actor lacks a permission or may not act on the target (HTTP 403).
 */
public class PermissionDeniedException extends BaseException {

    public PermissionDeniedException(String message) {
        super("PERMISSION_DENIED", message, HttpStatus.FORBIDDEN);
    }

    public static PermissionDeniedException missing(Permission permission) {
        return new PermissionDeniedException(
            String.format("Permission '%s' required", permission.getValue()));
    }
}
