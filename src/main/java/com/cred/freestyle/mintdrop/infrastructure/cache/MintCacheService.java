package com.cred.freestyle.mintdrop.infrastructure.cache;

import com.cred.freestyle.mintdrop.repository.MintInventoryStore.InventoryCounts;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.math.BigDecimal;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;

/**
 * Redis cache for display data. Never consulted for allocation decisions.
 * Every call fails open: a Redis outage degrades to cache misses.
 *
 * Cache Keys:
 * - availability:{collection_id} -> inventory counts (JSON)
 * - rate:last -> last good price feed rate (JSON)
 *
 * @author Mint Drop Team
 */
@Service
public class MintCacheService {

    private static final Logger logger = LoggerFactory.getLogger(MintCacheService.class);

    private static final String AVAILABILITY_PREFIX = "availability:";
    private static final String LAST_RATE_KEY = "rate:last";

    private static final Duration AVAILABILITY_TTL = Duration.ofSeconds(5);
    private static final Duration LAST_RATE_TTL = Duration.ofHours(1);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;

    public MintCacheService(StringRedisTemplate redisTemplate, ObjectMapper objectMapper) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
    }

    public Optional<InventoryCounts> getAvailability(String collectionId) {
        try {
            String value = redisTemplate.opsForValue().get(AVAILABILITY_PREFIX + collectionId);
            if (value == null) {
                logger.debug("Cache miss for availability: {}", collectionId);
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(value, InventoryCounts.class));
        } catch (Exception e) {
            logger.warn("Error reading availability from cache for collection: {}", collectionId, e);
            return Optional.empty();
        }
    }

    public void setAvailability(String collectionId, InventoryCounts counts) {
        try {
            redisTemplate.opsForValue().set(AVAILABILITY_PREFIX + collectionId,
                    objectMapper.writeValueAsString(counts), AVAILABILITY_TTL);
        } catch (Exception e) {
            logger.warn("Error caching availability for collection: {}", collectionId, e);
        }
    }

    public void invalidateAvailability(String collectionId) {
        try {
            redisTemplate.delete(AVAILABILITY_PREFIX + collectionId);
        } catch (Exception e) {
            logger.warn("Error invalidating availability cache for collection: {}", collectionId, e);
        }
    }

    /**
     * Last good rate shared across instances, used when this instance has no rate of its own.
     */
    public Optional<CachedRate> getLastRate() {
        try {
            String value = redisTemplate.opsForValue().get(LAST_RATE_KEY);
            if (value == null) {
                return Optional.empty();
            }
            return Optional.of(objectMapper.readValue(value, CachedRate.class));
        } catch (Exception e) {
            logger.warn("Error reading last rate from cache", e);
            return Optional.empty();
        }
    }

    public void setLastRate(CachedRate rate) {
        try {
            redisTemplate.opsForValue().set(LAST_RATE_KEY, objectMapper.writeValueAsString(rate), LAST_RATE_TTL);
        } catch (Exception e) {
            logger.warn("Error caching last rate", e);
        }
    }

    public record CachedRate(BigDecimal fiatPerCoin, Instant fetchedAt) {}
}
