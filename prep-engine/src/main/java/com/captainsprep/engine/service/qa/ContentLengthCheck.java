package com.captainsprep.engine.service.qa;

import com.captainsprep.engine.model.GeneratedItem;

import java.util.List;
import java.util.Optional;

/**
 * The answer side must carry at least {@code minWords} whitespace-separated words.
 */
public class ContentLengthCheck implements QaCheck {

    private final int minWords;

    public ContentLengthCheck(int minWords) {
        this.minWords = Math.max(0, minWords);
    }

    @Override
    public String name() {
        return "Content Length";
    }

    @Override
    public Optional<QaIssue> check(GeneratedItem candidate, List<? extends GeneratedItem> pool) {
        int words = wordCount(candidate.back());
        if (words < minWords) {
            return issue("back content too short (" + words + " words, min " + minWords + ")");
        }
        return Optional.empty();
    }

    static int wordCount(String text) {
        if (text == null || text.isBlank()) {
            return 0;
        }
        return text.trim().split("\\s+").length;
    }
}
