package com.ontheform.shared.rate_limit;

import com.ontheform.shared.exception.RateLimitExceededException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatCode;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@DisplayName("RateLimitService")
class RateLimitServiceTest {

    private static final class MutableClock extends Clock {
        private Instant now = Instant.parse("2024-01-01T12:00:00Z");

        @Override
        public ZoneId getZone() {
            return ZoneOffset.UTC;
        }

        @Override
        public Clock withZone(ZoneId zone) {
            return this;
        }

        @Override
        public Instant instant() {
            return now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }
    }

    private final MutableClock clock = new MutableClock();
    private final RateLimitService rateLimitService = new RateLimitService(clock);

    @Test
    @DisplayName("requests over the limit within a minute are rejected with a retry hint")
    void overLimit_rejected() {
        rateLimitService.checkRateLimit("form-submit", "10.0.0.1", 2);
        rateLimitService.checkRateLimit("form-submit", "10.0.0.1", 2);
        clock.advance(Duration.ofSeconds(20));

        assertThatThrownBy(() -> rateLimitService.checkRateLimit("form-submit", "10.0.0.1", 2))
                .isInstanceOf(RateLimitExceededException.class)
                .satisfies(ex -> assertThat(((RateLimitExceededException) ex).getRetryAfterSeconds()).isEqualTo(40));
    }

    @Test
    @DisplayName("callers are counted separately")
    void callersSeparate() {
        rateLimitService.checkRateLimit("form-submit", "10.0.0.1", 1);

        assertThatCode(() -> rateLimitService.checkRateLimit("form-submit", "10.0.0.2", 1)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("window resets after a minute")
    void windowResets() {
        rateLimitService.checkRateLimit("form-submit", "10.0.0.1", 1);
        clock.advance(Duration.ofSeconds(61));

        assertThatCode(() -> rateLimitService.checkRateLimit("form-submit", "10.0.0.1", 1)).doesNotThrowAnyException();
    }

    @Test
    @DisplayName("limit of zero disables the check")
    void zeroLimit_disabled() {
        for (int i = 0; i < 100; i++) {
            rateLimitService.checkRateLimit("form-submit", "10.0.0.1", 0);
        }
    }
}
