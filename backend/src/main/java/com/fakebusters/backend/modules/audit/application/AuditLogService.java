package com.fakebusters.backend.modules.audit.application;

import java.time.Clock;
import java.time.OffsetDateTime;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.UUID;

import com.fakebusters.backend.modules.audit.domain.AuditLog;
import com.fakebusters.backend.modules.audit.infrastructure.AuditLogRepository;
import com.fakebusters.backend.modules.auth.domain.UserAccount;

import jakarta.persistence.EntityManager;

import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Keeps the trail of terminal join-request transitions, which are otherwise lost when the row is deleted.
 */
@Service
public class AuditLogService {

    public static final String ACTION_JOIN_REQUEST_APPROVED = "JOIN_REQUEST_APPROVED";
    public static final String ACTION_JOIN_REQUEST_WITHDRAWN = "JOIN_REQUEST_WITHDRAWN";
    public static final String ACTION_BOARD_DELETED = "BOARD_DELETED";
    public static final String RESOURCE_JOIN_REQUEST = "JOIN_REQUEST";
    public static final String RESOURCE_BOARD = "BOARD";

    private final AuditLogRepository auditLogRepository;
    private final EntityManager entityManager;
    private final Clock clock;

    public AuditLogService(AuditLogRepository auditLogRepository, EntityManager entityManager, Clock clock) {
        this.auditLogRepository = auditLogRepository;
        this.entityManager = entityManager;
        this.clock = clock;
    }

    @Transactional
    public void record(AuditLogCommand command) {
        Objects.requireNonNull(command.actionType(), "actionType is required");
        Objects.requireNonNull(command.resourceType(), "resourceType is required");
        Objects.requireNonNull(command.resourceKey(), "resourceKey is required");

        AuditLog auditLog = new AuditLog();
        auditLog.setActionType(command.actionType());
        auditLog.setResourceType(command.resourceType());
        auditLog.setResourceKey(command.resourceKey());
        auditLog.setCreatedAt(OffsetDateTime.now(clock));

        if (command.actorUserId() != null) {
            UserAccount actorReference = entityManager.getReference(UserAccount.class, command.actorUserId());
            auditLog.setActor(actorReference);
        }

        if (command.detail() != null && !command.detail().isEmpty()) {
            auditLog.setDetail(new HashMap<>(command.detail()));
        }

        auditLogRepository.save(auditLog);
    }

    public record AuditLogCommand(
            String actionType,
            String resourceType,
            String resourceKey,
            UUID actorUserId,
            Map<String, Object> detail
    ) {
    }
}
