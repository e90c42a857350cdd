package com.flagship.service_entitlement.contract;

import com.flagship.service_entitlement.exception.ValidationException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;
import java.util.UUID;

/**
 * Idempotency-Key lookups for contract creation.
 *
 * Redis is the fast path. The unique contracts.idempotency_key column is the
 * source of truth, so a Redis outage only costs a database read.
 */
@Service
@Slf4j
public class ContractIdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:contract:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final ContractRepository contractRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public ContractIdempotencyService(ContractRepository contractRepository,
                                      Optional<StringRedisTemplate> redisTemplate) {
        this.contractRepository = contractRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the contract previously created with this key, if any
     */
    public Optional<UUID> findContractId(String idempotencyKey) {
        requireKey(idempotencyKey);

        if (redisTemplate.isPresent()) {
            try {
                String cached = redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey);
                if (cached != null) {
                    log.debug("Idempotency key found in Redis: {}", idempotencyKey);
                    return Optional.of(UUID.fromString(cached));
                }
            } catch (Exception e) {
                log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                        idempotencyKey, e.getMessage());
            }
        }

        Optional<UUID> contractId = contractRepository.findByIdempotencyKey(idempotencyKey)
            .map(ContractEntity::getId);
        contractId.ifPresent(id -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            cache(idempotencyKey, id);
        });
        return contractId;
    }

    /**
     * Caches the key after the contract row (which carries the key) has been written.
     */
    public void remember(String idempotencyKey, UUID contractId) {
        requireKey(idempotencyKey);
        if (contractId == null) {
            throw new IllegalArgumentException("Contract ID cannot be null");
        }
        cache(idempotencyKey, contractId);
    }

    private void cache(String idempotencyKey, UUID contractId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, contractId.toString(), REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new ValidationException("Idempotency key cannot be null or blank");
        }
    }
}
