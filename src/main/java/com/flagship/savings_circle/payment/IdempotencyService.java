package com.flagship.savings_circle.payment;

import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.Optional;

/**
 * Maps client Idempotency-Key values to the payment reference they minted.
 *
 * Redis is a cache in front of payment_records.idempotency_key. Any Redis
 * failure falls through to the database, which stays the source of truth.
 */
@Service
@Slf4j
public class IdempotencyService {

    private static final String REDIS_KEY_PREFIX = "idempotency:payment:";
    private static final Duration REDIS_TTL = Duration.ofDays(7);

    private final PaymentLedger paymentLedger;
    private final ObjectProvider<StringRedisTemplate> redisTemplateProvider;
    private final boolean cacheEnabled;

    public IdempotencyService(PaymentLedger paymentLedger,
                              ObjectProvider<StringRedisTemplate> redisTemplateProvider,
                              @Value("${idempotency.cache.enabled:true}") boolean cacheEnabled) {
        this.paymentLedger = paymentLedger;
        this.redisTemplateProvider = redisTemplateProvider;
        this.cacheEnabled = cacheEnabled;
    }

    /**
     * @return the reference previously minted for this key, if any
     */
    public Optional<String> findReference(String idempotencyKey) {
        requireKey(idempotencyKey);

        Optional<String> cached = readCache(idempotencyKey);
        if (cached.isPresent()) {
            log.debug("Idempotency key {} found in Redis", idempotencyKey);
            return cached;
        }

        Optional<String> stored = paymentLedger.findByIdempotencyKey(idempotencyKey)
            .map(PaymentRecord::getReference);
        stored.ifPresent(reference -> {
            log.debug("Idempotency key {} found in database", idempotencyKey);
            writeCache(idempotencyKey, reference);
        });
        return stored;
    }

    /**
     * Caches the mapping. The database row written by the ledger already holds it.
     */
    public void remember(String idempotencyKey, String reference) {
        requireKey(idempotencyKey);
        if (reference == null) {
            throw new IllegalArgumentException("Reference cannot be null");
        }
        writeCache(idempotencyKey, reference);
    }

    private Optional<String> readCache(String idempotencyKey) {
        StringRedisTemplate redis = redis();
        if (redis == null) {
            return Optional.empty();
        }
        try {
            return Optional.ofNullable(redis.opsForValue().get(REDIS_KEY_PREFIX + idempotencyKey));
        } catch (Exception e) {
            log.warn("Redis lookup failed for idempotency key {}, using database: {}", idempotencyKey, e.getMessage());
            return Optional.empty();
        }
    }

    private void writeCache(String idempotencyKey, String reference) {
        StringRedisTemplate redis = redis();
        if (redis == null) {
            return;
        }
        try {
            redis.opsForValue().set(REDIS_KEY_PREFIX + idempotencyKey, reference, REDIS_TTL);
        } catch (Exception e) {
            log.warn("Failed to cache idempotency key {} in Redis: {}", idempotencyKey, e.getMessage());
        }
    }

    private StringRedisTemplate redis() {
        return cacheEnabled ? redisTemplateProvider.getIfAvailable() : null;
    }

    private static void requireKey(String idempotencyKey) {
        if (idempotencyKey == null || idempotencyKey.isBlank()) {
            throw new IllegalArgumentException("Idempotency key cannot be null or blank");
        }
    }
}
