package com.captainsprep.engine.service.memory;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

@Component
public class InMemorySeenPatternTracker implements SeenPatternTracker {

    private static final Logger log = LoggerFactory.getLogger(InMemorySeenPatternTracker.class);

    private final Map<String, UserSession> sessions = new ConcurrentHashMap<>();
    private final Clock clock;

    public InMemorySeenPatternTracker() {
        this(Clock.systemUTC());
    }

    InMemorySeenPatternTracker(Clock clock) {
        this.clock = clock;
    }

    @Override
    public boolean checkAndMark(String userId, String subject, String questionType, String keyVariable) {
        String signature = PatternSignatures.of(subject, questionType, keyVariable);
        boolean fresh = session(userId).markSeen(signature);
        if (!fresh) {
            log.debug("User {} already saw pattern {}", userId, signature);
        }
        return fresh;
    }

    @Override
    public List<String> unseen(String userId, List<String> signatures) {
        UserSession session = session(userId);
        return signatures.stream()
                .filter(signature -> !session.hasSeen(signature))
                .toList();
    }

    @Override
    public SeenPatternStats stats(String userId) {
        UserSession session = session(userId);
        long minutes = Duration.between(session.startedAt, clock.instant()).toMinutes();
        return new SeenPatternStats(userId, session.questionCount(), session.uniquePatterns(), minutes);
    }

    @Override
    public void clear(String userId) {
        sessions.remove(userId);
    }

    private UserSession session(String userId) {
        if (userId == null || userId.isBlank()) {
            throw new IllegalArgumentException("userId is required");
        }
        return sessions.computeIfAbsent(userId, id -> new UserSession(clock.instant()));
    }

    private static final class UserSession {

        private final Set<String> seen = ConcurrentHashMap.newKeySet();
        private final Instant startedAt;
        private int questionCount;

        private UserSession(Instant startedAt) {
            this.startedAt = startedAt;
        }

        boolean hasSeen(String signature) {
            return seen.contains(signature);
        }

        synchronized boolean markSeen(String signature) {
            if (!seen.add(signature)) {
                return false;
            }
            questionCount++;
            return true;
        }

        synchronized int questionCount() {
            return questionCount;
        }

        int uniquePatterns() {
            return seen.size();
        }
    }
}
