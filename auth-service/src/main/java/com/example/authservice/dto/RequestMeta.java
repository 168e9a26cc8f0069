package com.example.authservice.dto;

import jakarta.servlet.http.HttpServletRequest;

/**
 * Client context of a request, recorded on sessions, reset requests and audit entries.
 */
public record RequestMeta(
    String ipAddress,
    String userAgent
) {
    private static final RequestMeta NONE = new RequestMeta(null, null);

    public static RequestMeta none() {
        return NONE;
    }

    public static RequestMeta from(HttpServletRequest request) {
        if (request == null) {
            return NONE;
        }
        return new RequestMeta(clientIp(request), truncate(request.getHeader("User-Agent"), 500));
    }

    private static String clientIp(HttpServletRequest request) {
        String xForwardedFor = request.getHeader("X-Forwarded-For");
        if (xForwardedFor != null && !xForwardedFor.isEmpty()) {
            return truncate(xForwardedFor.split(",")[0].trim(), 45);
        }
        return request.getRemoteAddr();
    }

    private static String truncate(String value, int max) {
        return value != null && value.length() > max ? value.substring(0, max) : value;
    }
}
