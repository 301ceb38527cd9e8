package com.captainsprep.engine.service.memory;

import org.junit.jupiter.api.Test;
import org.springframework.util.DigestUtils;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneId;
import java.time.ZoneOffset;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class InMemorySeenPatternTrackerTest {

    @Test
    void signatureIsTruncatedMd5OfNormalisedParts() {
        String expected = DigestUtils.md5DigestAsHex("math_percentage".getBytes(StandardCharsets.UTF_8)).substring(0, 12);

        assertThat(PatternSignatures.of("math", "percentage", null)).hasSize(12).isEqualTo(expected);
        assertThat(PatternSignatures.of("Math", "Percentage", "")).isEqualTo(expected);
        assertThat(PatternSignatures.of("math", "percentage", "pump pressure"))
                .isEqualTo(DigestUtils.md5DigestAsHex("math_percentage_pump_pressure".getBytes(StandardCharsets.UTF_8)).substring(0, 12));
    }

    @Test
    void marksPatternsPerUser() {
        InMemorySeenPatternTracker tracker = new InMemorySeenPatternTracker();

        assertThat(tracker.checkAndMark("user-1", "math", "percentage", "pump pressure")).isTrue();
        assertThat(tracker.checkAndMark("user-1", "math", "percentage", "pump pressure")).isFalse();
        assertThat(tracker.checkAndMark("user-2", "math", "percentage", "pump pressure")).isTrue();

        String seen = PatternSignatures.of("math", "percentage", "pump pressure");
        String other = PatternSignatures.of("math", "fraction", null);
        assertThat(tracker.unseen("user-1", List.of(seen, other))).containsExactly(other);
    }

    @Test
    void statsReportCountsAndSessionLength() {
        MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
        InMemorySeenPatternTracker tracker = new InMemorySeenPatternTracker(clock);

        tracker.checkAndMark("user-1", "math", "percentage", null);
        tracker.checkAndMark("user-1", "math", "fraction", null);
        tracker.checkAndMark("user-1", "math", "fraction", null);
        clock.advance(Duration.ofMinutes(25));

        SeenPatternStats stats = tracker.stats("user-1");
        assertThat(stats.userId()).isEqualTo("user-1");
        assertThat(stats.questionsSeen()).isEqualTo(2);
        assertThat(stats.uniquePatterns()).isEqualTo(2);
        assertThat(stats.sessionDurationMinutes()).isEqualTo(25);

        tracker.clear("user-1");
        assertThat(tracker.stats("user-1").questionsSeen()).isZero();
    }

    @Test
    void blankUserIsRejected() {
        InMemorySeenPatternTracker tracker = new InMemorySeenPatternTracker();

        assertThatThrownBy(() -> tracker.checkAndMark(" ", "math", "percentage", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private static final class MutableClock extends Clock {

        private Instant now;

        private MutableClock(Instant now) {
            this.now = now;
        }

        void advance(Duration duration) {
            now = now.plus(duration);
        }

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
    }
}
