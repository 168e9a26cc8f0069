package com.example.authservice.controller;

import com.example.authservice.dto.AuditLogDto;
import com.example.authservice.dto.PageResponse;
import com.example.authservice.dto.RoleDto;
import com.example.authservice.entity.AuditAction;
import com.example.authservice.entity.Role;
import com.example.authservice.service.AuditService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.Parameter;
import io.swagger.v3.oas.annotations.responses.ApiResponse;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import org.springframework.http.ResponseEntity;
import org.springframework.security.access.prepost.PreAuthorize;
import org.springframework.validation.annotation.Validated;
import org.springframework.web.bind.annotation.*;

import java.util.Arrays;
import java.util.List;
import java.util.UUID;

/**
 * Admin endpoints for audit log browsing and the role catalogue.
 */
@RestController
@RequestMapping("/api/admin")
@Validated
@Tag(name = "Admin", description = "Audit trail and role catalogue")
public class AdminController {

    private final AuditService auditService;

    public AdminController(AuditService auditService) {
        this.auditService = auditService;
    }

    /**
     * GET /api/admin/audit-logs
     * Newest first; every filter is optional.
     */
    @Operation(
            summary = "Browse audit logs",
            responses = {
                    @ApiResponse(responseCode = "200", description = "Audit logs retrieved"),
                    @ApiResponse(responseCode = "403", description = "view_audit_logs permission required")
            }
    )
    @PreAuthorize("hasAuthority('view_audit_logs')")
    @GetMapping("/audit-logs")
    public ResponseEntity<PageResponse<AuditLogDto>> getAuditLogs(
            @Parameter(description = "Actor user ID") @RequestParam(value = "userId", required = false) UUID userId,
            @Parameter(description = "Action, e.g. login_failed") @RequestParam(value = "action", required = false) String action,
            @Parameter(description = "Resource, e.g. user") @RequestParam(value = "resource", required = false) String resource,
            @RequestParam(value = "page", defaultValue = "1") @Min(1) int page,
            @RequestParam(value = "size", defaultValue = "20") @Min(1) @Max(100) int size) {

        AuditAction actionFilter = action != null && !action.isBlank() ? AuditAction.fromValue(action) : null;
        return ResponseEntity.ok(PageResponse.from(
                auditService.search(userId, actionFilter, resource, page, size),
                AuditLogDto::fromEntity));
    }

    /**
     * GET /api/admin/roles
     */
    @Operation(summary = "List roles with their permissions")
    @GetMapping("/roles")
    public ResponseEntity<List<RoleDto>> getRoles() {
        return ResponseEntity.ok(Arrays.stream(Role.values()).map(RoleDto::of).toList());
    }
}
