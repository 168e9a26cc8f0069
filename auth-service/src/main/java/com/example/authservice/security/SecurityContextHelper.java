package com.example.authservice.security;

import com.example.authservice.dto.UserClaims;
import com.example.authservice.entity.User;
import com.example.authservice.exception.InvalidTokenException;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;

import java.util.Optional;
import java.util.UUID;

/**
 * Helper class to extract current user from SecurityContext.
 * Returns Optional to handle anonymous requests gracefully.
 */
@Component
public class SecurityContextHelper {

    /**
     * Get current authenticated user.
     * @return Optional<User> - empty if not authenticated
     */
    public Optional<User> getCurrentUser() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();

        if (authentication == null || !authentication.isAuthenticated()) {
            return Optional.empty();
        }

        if (authentication.getPrincipal() instanceof User user) {
            return Optional.of(user);
        }

        return Optional.empty();
    }

    /**
     * Current user, for endpoints behind authentication.
     * @throws InvalidTokenException if the request is anonymous
     */
    public User requireCurrentUser() {
        return getCurrentUser().orElseThrow(InvalidTokenException::new);
    }

    /**
     * Session the current access token was issued for.
     */
    public Optional<UUID> getCurrentSessionId() {
        Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
        if (authentication != null && authentication.getDetails() instanceof UserClaims claims) {
            return Optional.ofNullable(claims.sessionId());
        }
        return Optional.empty();
    }
}
