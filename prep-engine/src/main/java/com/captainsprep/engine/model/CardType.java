package com.captainsprep.engine.model;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Arrays;
import java.util.Locale;

public enum CardType {
    TERM_DEFINITION("term_definition", "TERM", "DEFINITION"),
    SCENARIO_ACTION("scenario_action", "SCENARIO", "ACTION"),
    FILL_BLANK("fill_blank", "PROMPT", "ANSWER");

    private final String code;
    private final String frontLabel;
    private final String backLabel;

    CardType(String code, String frontLabel, String backLabel) {
        this.code = code;
        this.frontLabel = frontLabel;
        this.backLabel = backLabel;
    }

    @JsonValue
    public String code() {
        return code;
    }

    public String frontLabel() {
        return frontLabel;
    }

    public String backLabel() {
        return backLabel;
    }

    @JsonCreator
    public static CardType fromCode(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Card type must not be null");
        }
        String normalised = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
        return Arrays.stream(values())
                .filter(type -> type.code.equals(normalised))
                .findFirst()
                .orElseThrow(() -> new IllegalArgumentException("Unknown card type: " + value));
    }
}
