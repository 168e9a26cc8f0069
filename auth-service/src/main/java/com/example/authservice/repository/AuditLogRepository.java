package com.example.authservice.repository;

import com.example.authservice.entity.AuditAction;
import com.example.authservice.entity.AuditLog;
import org.springframework.data.domain.Page;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.UUID;

/**
 * Repository for AuditLog entity.
 *
 * Read-only queries: no update/delete methods are declared here.
 */
@Repository
public interface AuditLogRepository extends JpaRepository<AuditLog, Long> {

    /**
     * Filtered, newest-first audit search.
     * Use case: admin audit browsing and per-user history.
     */
    @Query("SELECT a FROM AuditLog a WHERE " +
            "(:actorId IS NULL OR a.actorId = :actorId) AND " +
            "(:action IS NULL OR a.action = :action) AND " +
            "(:resource IS NULL OR a.resource = :resource) " +
            "ORDER BY a.createdAt DESC, a.id DESC")
    Page<AuditLog> search(@Param("actorId") UUID actorId,
                          @Param("action") AuditAction action,
                          @Param("resource") String resource,
                          Pageable pageable);

    List<AuditLog> findByActionOrderByIdAsc(AuditAction action);

    List<AuditLog> findByResourceIdOrderByIdAsc(String resourceId);
}
