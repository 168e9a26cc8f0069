package com.example.authservice.dto;

import com.example.authservice.entity.Role;

/**
 * Optional filters for the user directory search. Null means "any".
 */
public record UserSearchCriteria(
    String search,
    Role role,
    Boolean active,
    Boolean verified,
    Boolean locked
) {
    public static UserSearchCriteria empty() {
        return new UserSearchCriteria(null, null, null, null, null);
    }

    public UserSearchCriteria withRole(Role forcedRole) {
        return new UserSearchCriteria(search, forcedRole, active, verified, locked);
    }
}
