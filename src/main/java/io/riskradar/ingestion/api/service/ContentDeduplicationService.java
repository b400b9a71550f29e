package io.riskradar.ingestion.api.service;

import org.apache.commons.codec.digest.DigestUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.LocalDateTime;
import java.util.Set;

/**
 * Remembers processed content URLs across runs. A Redis failure is treated as "not processed":
 * the item is analyzed again rather than lost.
 */
@Service
public class ContentDeduplicationService {

    private static final Logger logger = LoggerFactory.getLogger(ContentDeduplicationService.class);

    private static final String CONTENT_PREFIX = "riskradar:content:";
    private static final Duration DEFAULT_TTL = Duration.ofDays(7);

    private final RedisTemplate<String, String> redisTemplate;

    public ContentDeduplicationService(RedisTemplate<String, String> redisTemplate) {
        this.redisTemplate = redisTemplate;
    }

    public boolean isAlreadyProcessed(String contentUrl) {
        try {
            return Boolean.TRUE.equals(redisTemplate.hasKey(generateKey(contentUrl)));
        } catch (DataAccessException e) {
            logger.warn("Redis lookup failed for {}, treating as new: {}", contentUrl, e.getMessage());
            return false;
        }
    }

    public void markAsProcessed(String contentUrl) {
        try {
            redisTemplate.opsForValue().set(generateKey(contentUrl), LocalDateTime.now().toString(), DEFAULT_TTL);
        } catch (DataAccessException e) {
            logger.warn("Could not mark {} as processed: {}", contentUrl, e.getMessage());
        }
    }

    public long getCachedContentCount() {
        Set<String> keys = redisTemplate.keys(CONTENT_PREFIX + "*");
        return keys != null ? keys.size() : 0;
    }

    private String generateKey(String contentUrl) {
        return CONTENT_PREFIX + DigestUtils.md5Hex(contentUrl);
    }
}
