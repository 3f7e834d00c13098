package com.flagship.payroll_ledger.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Idempotency keys for payment creation requests.
 *
 * Strategy:
 * 1. Try Redis first (fast, but may be down)
 * 2. Fall back to the idempotency_keys table
 * 3. Store in both after a payment is created
 *
 * A double-submitted payment form would otherwise mark the same days twice
 * and create two payments, so the table is the source of truth and Redis is
 * only a cache.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "payroll:idempotency:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final IdempotencyKeyRepository idempotencyKeyRepository;
    private final Optional<StringRedisTemplate> redisTemplate;

    public IdempotencyService(IdempotencyKeyRepository idempotencyKeyRepository,
                              Optional<StringRedisTemplate> redisTemplate) {
        this.idempotencyKeyRepository = idempotencyKeyRepository;
        this.redisTemplate = redisTemplate;
    }

    /**
     * @return the payment id recorded for {@code idempotencyKey}, if any
     */
    public Optional<String> findPaymentId(String idempotencyKey) {
        requireKey(idempotencyKey);

        Optional<String> cached = readFromRedis(idempotencyKey);
        if (cached.isPresent()) {
            log.debug("Idempotency key found in Redis: {}", idempotencyKey);
            return cached;
        }

        Optional<String> stored = idempotencyKeyRepository.findById(idempotencyKey)
            .map(IdempotencyKeyEntity::getPaymentId);
        stored.ifPresent(paymentId -> {
            log.debug("Idempotency key found in database: {}", idempotencyKey);
            writeToRedis(idempotencyKey, paymentId);
        });
        return stored;
    }

    /**
     * Records that {@code idempotencyKey} produced {@code paymentId}.
     */
    public void remember(String idempotencyKey, String paymentId) {
        requireKey(idempotencyKey);
        if (paymentId == null || paymentId.isBlank()) {
            throw new IllegalArgumentException("Payment ID cannot be null or blank");
        }
        idempotencyKeyRepository.save(IdempotencyKeyEntity.of(idempotencyKey, paymentId));
        writeToRedis(idempotencyKey, paymentId);
    }

    private Optional<String> readFromRedis(String idempotencyKey) {
        if (redisTemplate.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(redisTemplate.get().opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey));
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key {}, falling back to database: {}",
                idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeToRedis(String idempotencyKey, String paymentId) {
        if (redisTemplate.isEmpty()) {
            return;
        }
        try {
            redisTemplate.get().opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, paymentId, REDIS_TTL);
        } catch (Exception e) {
            // the database row is authoritative
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
