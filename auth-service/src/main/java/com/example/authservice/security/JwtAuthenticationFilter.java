package com.example.authservice.security;

import com.example.authservice.dto.UserClaims;
import com.example.authservice.entity.Permission;
import com.example.authservice.entity.User;
import com.example.authservice.exception.BaseException;
import com.example.authservice.service.AuthService;
import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.lang.NonNull;
import org.springframework.security.authentication.UsernamePasswordAuthenticationToken;
import org.springframework.security.core.GrantedAuthority;
import org.springframework.security.core.authority.SimpleGrantedAuthority;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;

/**
 * JWT Authentication Filter.
 * Resolves the Bearer access token to an active, unlocked user and sets the SecurityContext.
 *
 * Authorities: ROLE_<ROLE> plus one authority per permission value (e.g. "manage_users").
 * The verified {@link UserClaims} are kept as authentication details.
 * A rejected token leaves the request anonymous; protected routes then answer 401.
 */
@Component
public class JwtAuthenticationFilter extends OncePerRequestFilter {

    private static final Logger log = LoggerFactory.getLogger(JwtAuthenticationFilter.class);

    private static final String BEARER_PREFIX = "Bearer ";

    private final AuthService authService;

    public JwtAuthenticationFilter(AuthService authService) {
        this.authService = authService;
    }

    @Override
    protected void doFilterInternal(
            @NonNull HttpServletRequest request,
            @NonNull HttpServletResponse response,
            @NonNull FilterChain filterChain) throws ServletException, IOException {

        final String authHeader = request.getHeader("Authorization");

        if (authHeader == null || !authHeader.startsWith(BEARER_PREFIX)
                || SecurityContextHolder.getContext().getAuthentication() != null) {
            filterChain.doFilter(request, response);
            return;
        }

        final String jwt = authHeader.substring(BEARER_PREFIX.length());

        try {
            UserClaims claims = authService.verifyAccessToken(jwt);
            User user = authService.resolveUser(claims);

            UsernamePasswordAuthenticationToken authToken = new UsernamePasswordAuthenticationToken(
                    user,
                    null,
                    authoritiesOf(user)
            );
            authToken.setDetails(claims);
            SecurityContextHolder.getContext().setAuthentication(authToken);
        } catch (BaseException e) {
            log.debug("Access token rejected for {} {}: {}", request.getMethod(), request.getRequestURI(), e.getCode());
        }

        filterChain.doFilter(request, response);
    }

    static List<GrantedAuthority> authoritiesOf(User user) {
        List<GrantedAuthority> authorities = new ArrayList<>();
        authorities.add(new SimpleGrantedAuthority("ROLE_" + user.getRole().name()));
        for (Permission permission : user.getRole().getPermissions()) {
            authorities.add(new SimpleGrantedAuthority(permission.getValue()));
        }
        return authorities;
    }
}
