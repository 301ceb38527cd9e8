package com.captainsprep.engine.service.memory;

import java.util.List;

/**
 * Remembers which question patterns each user has already been shown.
 */
public interface SeenPatternTracker {

    /**
     * Marks the pattern as seen.
     *
     * @return {@code true} if the user had not seen it before
     */
    boolean checkAndMark(String userId, String subject, String questionType, String keyVariable);

    List<String> unseen(String userId, List<String> signatures);

    SeenPatternStats stats(String userId);

    void clear(String userId);
}
