package com.flagship.service_entitlement.ledger;

import jakarta.persistence.Column;
import jakarta.persistence.Entity;
import jakarta.persistence.EnumType;
import jakarta.persistence.Enumerated;
import jakarta.persistence.Id;
import jakarta.persistence.PrePersist;
import jakarta.persistence.PreUpdate;
import jakarta.persistence.Table;
import lombok.AccessLevel;
import lombok.Getter;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.UUID;

/**
 * How long ledger rows stay in the live table. A SERVICE_TYPE policy overrides
 * the GLOBAL one for its service type; at most one policy per scope key is enabled.
 */
@Entity
@Table(name = "service_ledger_archive_policies")
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
public class LedgerArchivePolicyEntity {

    @Id
    @Column(nullable = false, updatable = false)
    private UUID id;

    @Enumerated(EnumType.STRING)
    @Column(nullable = false, updatable = false, length = 20)
    private ArchiveScope scope;

    @Column(name = "service_type", updatable = false, length = 100)
    private String serviceType;

    @Column(name = "archive_after_days", nullable = false)
    private int archiveAfterDays;

    @Column(name = "delete_after_archive", nullable = false)
    private boolean deleteAfterArchive;

    @Column(nullable = false)
    private boolean enabled;

    @Column(name = "created_by", nullable = false, updatable = false, length = 100)
    private String createdBy;

    @Column(name = "created_at", nullable = false, updatable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    static LedgerArchivePolicyEntity create(ArchiveScope scope, String serviceType, int archiveAfterDays,
                                            boolean deleteAfterArchive, boolean enabled, String createdBy,
                                            Instant now) {
        LedgerArchivePolicyEntity entity = new LedgerArchivePolicyEntity();
        entity.id = UUID.randomUUID();
        entity.scope = scope;
        entity.serviceType = serviceType;
        entity.archiveAfterDays = archiveAfterDays;
        entity.deleteAfterArchive = deleteAfterArchive;
        entity.enabled = enabled;
        entity.createdBy = createdBy;
        entity.createdAt = now;
        return entity;
    }

    @PrePersist
    void onCreate() {
        if (this.createdAt == null) {
            this.createdAt = Instant.now();
        }
        this.updatedAt = this.createdAt;
    }

    @PreUpdate
    void onUpdate() {
        this.updatedAt = Instant.now();
    }

    /**
     * Applies the non-null fields.
     */
    void update(Integer archiveAfterDays, Boolean deleteAfterArchive, Boolean enabled) {
        if (archiveAfterDays != null) {
            this.archiveAfterDays = archiveAfterDays;
        }
        if (deleteAfterArchive != null) {
            this.deleteAfterArchive = deleteAfterArchive;
        }
        if (enabled != null) {
            this.enabled = enabled;
        }
    }

    boolean sameScopeAs(ArchiveScope otherScope, String otherServiceType) {
        return scope == otherScope
                && (serviceType == null ? otherServiceType == null : serviceType.equals(otherServiceType));
    }
}
