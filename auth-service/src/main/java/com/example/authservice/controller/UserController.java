package com.example.authservice.controller;

import com.example.authservice.dto.*;
import com.example.authservice.entity.Role;
import com.example.authservice.entity.User;
import com.example.authservice.security.SecurityContextHelper;
import com.example.authservice.service.UserAdminService;
import com.example.authservice.service.UserService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.UUID;

/**
 * Self-service and user administration endpoints.
 * Authorization decisions (who may see or manage whom) live in the service layer.
 */
@RestController
@RequestMapping("/api/users")
@Validated
@Tag(name = "Users", description = "Profile self-service and user administration")
public class UserController {

    private final UserService userService;
    private final UserAdminService userAdminService;
    private final SecurityContextHelper securityContextHelper;

    public UserController(UserService userService,
                          UserAdminService userAdminService,
                          SecurityContextHelper securityContextHelper) {
        this.userService = userService;
        this.userAdminService = userAdminService;
        this.securityContextHelper = securityContextHelper;
    }

    // ========================================
    // SELF-SERVICE
    // ========================================

    @GetMapping("/me")
    public ResponseEntity<UserDto> getProfile() {
        return ResponseEntity.ok(UserDto.fromEntity(userService.getProfile(currentUser())));
    }

    @PutMapping("/me")
    public ResponseEntity<UserDto> updateProfile(@Valid @RequestBody UpdateProfileRequest request,
                                                 HttpServletRequest httpRequest) {
        User updated = userService.updateProfile(currentUser(), request, RequestMeta.from(httpRequest));
        return ResponseEntity.ok(UserDto.fromEntity(updated));
    }

    /**
     * Changing the password signs out every session, including the current one.
     */
    @Operation(
            summary = "Change own password",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Password changed"),
                    @ApiResponse(responseCode = "400", description = "Current password incorrect or new password weak")
            }
    )
    @PostMapping("/me/change-password")
    public ResponseEntity<MessageResponse> changePassword(@Valid @RequestBody ChangePasswordRequest request,
                                                          HttpServletRequest httpRequest) {
        userService.changePassword(currentUser(), request.currentPassword(), request.newPassword(),
                RequestMeta.from(httpRequest));
        return ResponseEntity.ok(MessageResponse.of("Password changed successfully"));
    }

    // ========================================
    // ADMINISTRATION
    // ========================================

    @Operation(
            summary = "Create user",
            responses = {
                    @ApiResponse(responseCode = "201", description = "User created"),
                    @ApiResponse(responseCode = "403", description = "Not allowed to assign this role"),
                    @ApiResponse(responseCode = "409", description = "Email already exists")
            }
    )
    @PostMapping
    public ResponseEntity<UserDto> createUser(@Valid @RequestBody CreateUserRequest request,
                                              HttpServletRequest httpRequest) {
        User created = userAdminService.createUser(currentUser(), request, RequestMeta.from(httpRequest));
        return ResponseEntity.status(HttpStatus.CREATED).body(UserDto.fromEntity(created));
    }

    @Operation(summary = "Search users")
    @GetMapping
    public ResponseEntity<PageResponse<UserDto>> searchUsers(
            @Parameter(description = "Matches email, first or last name") @RequestParam(value = "search", required = false) String search,
            @RequestParam(value = "role", required = false) String role,
            @RequestParam(value = "isActive", required = false) Boolean active,
            @RequestParam(value = "isVerified", required = false) Boolean verified,
            @RequestParam(value = "isLocked", required = false) Boolean locked,
            @RequestParam(value = "page", defaultValue = "1") @Min(1) int page,
            @RequestParam(value = "size", defaultValue = "20") @Min(1) @Max(100) int size,
            @RequestParam(value = "sortBy", defaultValue = "created_at") String sortBy,
            @RequestParam(value = "sortOrder", defaultValue = "desc") String sortOrder) {

        UserSearchCriteria criteria = new UserSearchCriteria(
                search, role != null ? Role.fromValue(role) : null, active, verified, locked);
        return ResponseEntity.ok(PageResponse.from(
                userAdminService.searchUsers(currentUser(), criteria, page, size, sortBy, sortOrder),
                UserDto::fromEntity));
    }

    @GetMapping("/stats")
    public ResponseEntity<UserStatsResponse> getStats() {
        return ResponseEntity.ok(userAdminService.getStats(currentUser()));
    }

    @GetMapping("/{userId}")
    public ResponseEntity<UserDto> getUser(@PathVariable("userId") UUID userId) {
        return ResponseEntity.ok(UserDto.fromEntity(userAdminService.getUser(currentUser(), userId)));
    }

    @PutMapping("/{userId}")
    public ResponseEntity<UserDto> updateUser(@PathVariable("userId") UUID userId,
                                              @Valid @RequestBody UpdateUserRequest request,
                                              HttpServletRequest httpRequest) {
        User updated = userAdminService.updateUser(currentUser(), userId, request, RequestMeta.from(httpRequest));
        return ResponseEntity.ok(UserDto.fromEntity(updated));
    }

    /**
     * Soft delete: the account is deactivated and its sessions revoked.
     */
    @Operation(
            summary = "Delete (deactivate) user",
            responses = {
                    @ApiResponse(responseCode = "200", description = "User deactivated"),
                    @ApiResponse(responseCode = "400", description = "Self-delete attempt"),
                    @ApiResponse(responseCode = "404", description = "User not found")
            }
    )
    @DeleteMapping("/{userId}")
    public ResponseEntity<MessageResponse> deleteUser(@PathVariable("userId") UUID userId,
                                                      HttpServletRequest httpRequest) {
        userAdminService.deleteUser(currentUser(), userId, RequestMeta.from(httpRequest));
        return ResponseEntity.ok(MessageResponse.of("User deleted successfully"));
    }

    @Operation(summary = "Lock user account permanently and revoke its sessions")
    @PostMapping("/{userId}/lock")
    public ResponseEntity<UserDto> lockUser(@PathVariable("userId") UUID userId, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(UserDto.fromEntity(
                userAdminService.lockUser(currentUser(), userId, RequestMeta.from(httpRequest))));
    }

    @PostMapping("/{userId}/unlock")
    public ResponseEntity<UserDto> unlockUser(@PathVariable("userId") UUID userId, HttpServletRequest httpRequest) {
        return ResponseEntity.ok(UserDto.fromEntity(
                userAdminService.unlockUser(currentUser(), userId, RequestMeta.from(httpRequest))));
    }

    @GetMapping("/{userId}/audit-logs")
    public ResponseEntity<PageResponse<AuditLogDto>> getUserAuditLogs(
            @PathVariable("userId") UUID userId,
            @RequestParam(value = "page", defaultValue = "1") @Min(1) int page,
            @RequestParam(value = "size", defaultValue = "20") @Min(1) @Max(100) int size) {
        return ResponseEntity.ok(PageResponse.from(
                userAdminService.getUserAuditLogs(currentUser(), userId, page, size),
                AuditLogDto::fromEntity));
    }

    private User currentUser() {
        return securityContextHelper.requireCurrentUser();
    }
}
