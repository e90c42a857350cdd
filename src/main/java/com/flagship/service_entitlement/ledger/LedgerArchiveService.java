package com.flagship.service_entitlement.ledger;

import com.flagship.service_entitlement.exception.ConflictException;
import com.flagship.service_entitlement.exception.NotFoundException;
import com.flagship.service_entitlement.exception.ValidationException;
import com.flagship.service_entitlement.observability.EntitlementMetrics;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.UUID;

/**
 * Moves old ledger rows to the archive partition and manages archive policies.
 *
 * SERVICE_TYPE policies take precedence over the GLOBAL policy; without a
 * GLOBAL policy the configured defaults apply. Archived rows keep counting in
 * refunds and reconciliation because those read live and archive together.
 */
@Service
@Slf4j
public class LedgerArchiveService {

    private final LedgerArchivePolicyRepository policyRepository;
    private final LedgerRepository ledgerRepository;
    private final EntitlementMetrics metrics;
    private final Clock clock;
    private final int defaultArchiveAfterDays;
    private final boolean defaultDeleteAfterArchive;

    public LedgerArchiveService(LedgerArchivePolicyRepository policyRepository,
                                LedgerRepository ledgerRepository,
                                EntitlementMetrics metrics,
                                Clock clock,
                                @Value("${ledger.archive.after-days:90}") int defaultArchiveAfterDays,
                                @Value("${ledger.archive.delete-after-archive:false}") boolean defaultDeleteAfterArchive) {
        this.policyRepository = policyRepository;
        this.ledgerRepository = ledgerRepository;
        this.metrics = metrics;
        this.clock = clock;
        this.defaultArchiveAfterDays = defaultArchiveAfterDays;
        this.defaultDeleteAfterArchive = defaultDeleteAfterArchive;
    }

    /**
     * Archives every service type according to its effective policy.
     *
     * @return rows archived and deleted across all policies
     */
    @Transactional
    public LedgerRepository.ArchiveResult archiveOldLedgers() {
        long startTime = System.currentTimeMillis();
        Instant now = clock.instant();
        List<LedgerArchivePolicyEntity> enabled = policyRepository.findByEnabledTrue();

        int archived = 0;
        int deleted = 0;
        List<String> overridden = new ArrayList<>();
        List<LedgerArchivePolicyEntity> serviceTypePolicies = enabled.stream()
                .filter(p -> p.getScope() == ArchiveScope.SERVICE_TYPE)
                .sorted(Comparator.comparing(LedgerArchivePolicyEntity::getServiceType))
                .toList();
        for (LedgerArchivePolicyEntity policy : serviceTypePolicies) {
            LedgerRepository.ArchiveResult result = ledgerRepository.archiveBefore(
                    now.minus(Duration.ofDays(policy.getArchiveAfterDays())), policy.getServiceType(), null,
                    policy.isDeleteAfterArchive(), now);
            archived += result.archived();
            deleted += result.deleted();
            overridden.add(policy.getServiceType());
        }

        EffectiveArchivePolicy global = globalPolicy(enabled);
        LedgerRepository.ArchiveResult result = ledgerRepository.archiveBefore(
                now.minus(Duration.ofDays(global.archiveAfterDays())), null, overridden,
                global.deleteAfterArchive(), now);
        archived += result.archived();
        deleted += result.deleted();

        metrics.recordArchivedRows(archived);
        log.info("Ledger archive finished: archived={}, deleted={}, servicePolicies={}, globalAfterDays={}, duration={}ms",
                archived, deleted, serviceTypePolicies.size(), global.archiveAfterDays(),
                System.currentTimeMillis() - startTime);
        return new LedgerRepository.ArchiveResult(archived, deleted);
    }

    @Transactional(readOnly = true)
    public EffectiveArchivePolicy effectivePolicy(String serviceType) {
        List<LedgerArchivePolicyEntity> enabled = policyRepository.findByEnabledTrue();
        return enabled.stream()
                .filter(p -> p.sameScopeAs(ArchiveScope.SERVICE_TYPE, serviceType))
                .findFirst()
                .map(p -> new EffectiveArchivePolicy(p.getId(), p.getScope(), p.getServiceType(),
                        p.getArchiveAfterDays(), p.isDeleteAfterArchive()))
                .orElseGet(() -> globalPolicy(enabled));
    }

    @Transactional
    public LedgerArchivePolicyEntity createPolicy(ArchivePolicyCommand command) {
        if (command.scope() == null) {
            throw new ValidationException("Archive policy scope is required");
        }
        boolean hasServiceType = command.serviceType() != null && !command.serviceType().isBlank();
        if (command.scope() == ArchiveScope.SERVICE_TYPE && !hasServiceType) {
            throw new ValidationException("A SERVICE_TYPE policy requires a service type");
        }
        if (command.scope() == ArchiveScope.GLOBAL && hasServiceType) {
            throw new ValidationException("A GLOBAL policy cannot name a service type");
        }
        requireValidDays(command.archiveAfterDays());
        if (command.createdBy() == null || command.createdBy().isBlank()) {
            throw new ValidationException("createdBy is required");
        }
        String serviceType = hasServiceType ? command.serviceType() : null;
        if (command.enabled()) {
            requireNoEnabledPolicy(command.scope(), serviceType, null);
        }

        LedgerArchivePolicyEntity saved = policyRepository.save(LedgerArchivePolicyEntity.create(
                command.scope(), serviceType, command.archiveAfterDays(), command.deleteAfterArchive(),
                command.enabled(), command.createdBy(), clock.instant()));
        log.info("Archive policy created: id={}, scope={}, serviceType={}, afterDays={}, delete={}",
                saved.getId(), saved.getScope(), saved.getServiceType(), saved.getArchiveAfterDays(),
                saved.isDeleteAfterArchive());
        return saved;
    }

    /**
     * Updates the non-null fields of a policy.
     */
    @Transactional
    public LedgerArchivePolicyEntity updatePolicy(UUID policyId, Integer archiveAfterDays,
                                                  Boolean deleteAfterArchive, Boolean enabled) {
        LedgerArchivePolicyEntity policy = policyRepository.findById(policyId)
                .orElseThrow(() -> NotFoundException.archivePolicy(policyId));
        if (archiveAfterDays != null) {
            requireValidDays(archiveAfterDays);
        }
        if (Boolean.TRUE.equals(enabled) && !policy.isEnabled()) {
            requireNoEnabledPolicy(policy.getScope(), policy.getServiceType(), policyId);
        }

        policy.update(archiveAfterDays, deleteAfterArchive, enabled);
        LedgerArchivePolicyEntity saved = policyRepository.saveAndFlush(policy);
        log.info("Archive policy updated: id={}, afterDays={}, delete={}, enabled={}",
                policyId, saved.getArchiveAfterDays(), saved.isDeleteAfterArchive(), saved.isEnabled());
        return saved;
    }

    @Transactional(readOnly = true)
    public List<LedgerArchivePolicyEntity> listPolicies() {
        return policyRepository.findAllByOrderByCreatedAtAsc();
    }

    private EffectiveArchivePolicy globalPolicy(List<LedgerArchivePolicyEntity> enabled) {
        return enabled.stream()
                .filter(p -> p.getScope() == ArchiveScope.GLOBAL)
                .findFirst()
                .map(p -> new EffectiveArchivePolicy(p.getId(), ArchiveScope.GLOBAL, null,
                        p.getArchiveAfterDays(), p.isDeleteAfterArchive()))
                .orElseGet(() -> new EffectiveArchivePolicy(null, ArchiveScope.GLOBAL, null,
                        defaultArchiveAfterDays, defaultDeleteAfterArchive));
    }

    private void requireNoEnabledPolicy(ArchiveScope scope, String serviceType, UUID exceptId) {
        boolean exists = policyRepository.findByEnabledTrue().stream()
                .anyMatch(p -> !p.getId().equals(exceptId) && p.sameScopeAs(scope, serviceType));
        if (exists) {
            throw new ConflictException(serviceType == null
                    ? "An enabled " + scope + " archive policy already exists"
                    : "An enabled archive policy already exists for service type " + serviceType);
        }
    }

    private static void requireValidDays(int archiveAfterDays) {
        if (archiveAfterDays < 1) {
            throw new ValidationException("archiveAfterDays must be at least 1");
        }
    }
}
