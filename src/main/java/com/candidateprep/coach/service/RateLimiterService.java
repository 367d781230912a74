package com.candidateprep.coach.service;

import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.data.redis.core.RedisCallback;
import org.springframework.data.redis.core.RedisTemplate;
import org.springframework.stereotype.Service;

/**
 * Fixed-window request counters in Redis, one per client and window. Lets
 * requests through when Redis cannot be reached.
 */
@Service
public class RateLimiterService {

    private static final Logger log = LoggerFactory.getLogger(RateLimiterService.class);

    private record Window(String name, int limit, long seconds) {}

    private final RedisTemplate<String, String> redisTemplate;
    private final List<Window> windows;

    public RateLimiterService(
        RedisTemplate<String, String> redisTemplate,
        @Value("${rate-limit.max-requests-per-minute}") int maxPerMinute,
        @Value("${rate-limit.window-minute-seconds:60}") long minuteSeconds,
        @Value("${rate-limit.max-requests-per-day}") int maxPerDay,
        @Value("${rate-limit.window-day-seconds:86400}") long daySeconds
    ) {
        this.redisTemplate = redisTemplate;
        this.windows = List.of(
            new Window("minute", maxPerMinute, minuteSeconds),
            new Window("day", maxPerDay, daySeconds)
        );
    }

    public RateLimitStatus consume(String clientKey) {
        List<WindowStatus> statuses = new ArrayList<>();
        for (Window window : windows) {
            statuses.add(consumeWindow("rate_limit:" + window.name() + ":" + clientKey, window));
        }

        boolean allowed = statuses.stream().allMatch(WindowStatus::allowed);
        WindowStatus primary = pickPrimary(statuses);
        if (!allowed) {
            log.info("Rate limit exceeded client={} window={}", clientKey, primary.name());
        }
        return new RateLimitStatus(allowed, primary.limit(), primary.remaining(), primary.resetSeconds(), statuses);
    }

    private WindowStatus consumeWindow(String key, Window window) {
        Long count;
        try {
            count = redisTemplate.execute((RedisCallback<Long>) connection ->
                connection.stringCommands().incr(key.getBytes(StandardCharsets.UTF_8))
            );
        } catch (DataAccessException ex) {
            log.warn("Rate limiter unavailable, allowing request: {}", ex.getMessage());
            return new WindowStatus(window.name(), true, window.limit(), window.limit(), window.seconds());
        }

        if (count == null) {
            return new WindowStatus(window.name(), true, window.limit(), window.limit(), window.seconds());
        }

        if (count == 1) {
            redisTemplate.expire(key, Duration.ofSeconds(window.seconds()));
        }

        Long ttl = redisTemplate.getExpire(key, TimeUnit.SECONDS);
        long resetSeconds = ttl != null && ttl > 0 ? ttl : window.seconds();
        long remaining = Math.max(0, window.limit() - count);
        return new WindowStatus(window.name(), count <= window.limit(), window.limit(), remaining, resetSeconds);
    }

    /** The window closest to exhaustion; ties go to the one resetting first. */
    private WindowStatus pickPrimary(List<WindowStatus> statuses) {
        WindowStatus primary = statuses.get(0);
        for (WindowStatus status : statuses) {
            if (status.remaining() < primary.remaining()
                || (status.remaining() == primary.remaining() && status.resetSeconds() < primary.resetSeconds())) {
                primary = status;
            }
        }
        return primary;
    }

    public record RateLimitStatus(
        boolean allowed,
        long limit,
        long remaining,
        long resetSeconds,
        List<WindowStatus> windows
    ) {}

    public record WindowStatus(
        String name,
        boolean allowed,
        long limit,
        long remaining,
        long resetSeconds
    ) {}
}
