package com.collectvoice.recording.service;

import com.collectvoice.config.AppProperties;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.redis.core.StringRedisTemplate;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Optional;
import java.util.Set;

@Service
public class RecordingUploadRetryQueue {

    private static final Logger log = LoggerFactory.getLogger(RecordingUploadRetryQueue.class);

    private final StringRedisTemplate redisTemplate;
    private final ObjectMapper objectMapper;
    private final Clock clock;
    private final String queueKey;

    public RecordingUploadRetryQueue(StringRedisTemplate redisTemplate,
                                     ObjectMapper objectMapper,
                                     AppProperties appProperties,
                                     Clock clock) {
        this.redisTemplate = redisTemplate;
        this.objectMapper = objectMapper;
        this.clock = clock;
        this.queueKey = appProperties.retry().queueKey();
    }

    public void enqueue(RecordingRetryJob job) {
        String payload;
        try {
            payload = objectMapper.writeValueAsString(job);
        } catch (JsonProcessingException exception) {
            throw new IllegalStateException("Unable to serialize upload retry for " + job.egressId(), exception);
        }
        Instant availableAt = job.availableAt() == null ? clock.instant() : job.availableAt();
        redisTemplate.opsForZSet().add(queueKey, payload, availableAt.toEpochMilli());
    }

    public Optional<RecordingRetryJob> pollReadyJob() {
        Set<String> ready = redisTemplate.opsForZSet()
                .rangeByScore(queueKey, Double.NEGATIVE_INFINITY, clock.millis(), 0, 1);
        if (ready == null || ready.isEmpty()) {
            return Optional.empty();
        }

        String payload = ready.iterator().next();
        // whoever removes the entry owns the job
        Long removed = redisTemplate.opsForZSet().remove(queueKey, payload);
        if (removed == null || removed == 0) {
            return Optional.empty();
        }

        try {
            return Optional.of(objectMapper.readValue(payload, RecordingRetryJob.class));
        } catch (JsonProcessingException exception) {
            log.error("Dropping unreadable upload retry entry {}", payload, exception);
            return Optional.empty();
        }
    }
}
