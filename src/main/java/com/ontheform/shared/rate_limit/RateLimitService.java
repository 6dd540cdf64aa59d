package com.ontheform.shared.rate_limit;

import com.ontheform.shared.exception.RateLimitExceededException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Fixed one-minute window counter keyed by operation and caller (usually the client IP).
 * State is per instance; a multi-node deployment limits per node.
 */
@Service
public class RateLimitService {

    private static final Duration WINDOW = Duration.ofMinutes(1);

    private final Map<String, Window> windows = new ConcurrentHashMap<>();
    private final Clock clock;

    public RateLimitService(Clock clock) {
        this.clock = clock;
    }

    public void checkRateLimit(String operation, String key, int limitPerMinute) {
        if (limitPerMinute <= 0) {
            return;
        }
        Instant now = clock.instant();
        windows.values().removeIf(window -> !window.start().plus(WINDOW).isAfter(now));

        String rateLimitKey = operation + ":" + key;
        Window updated = windows.compute(rateLimitKey, (k, current) -> {
            if (current == null) {
                return new Window(now, 1);
            }
            return new Window(current.start(), current.count() + 1);
        });

        if (updated.count() > limitPerMinute) {
            long retryAfter = Duration.between(now, updated.start().plus(WINDOW)).getSeconds();
            throw new RateLimitExceededException("Too many requests for " + operation, retryAfter);
        }
    }

    private record Window(Instant start, int count) {
    }
}
