package com.captainsprep.engine.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record Flashcard(
        @JsonProperty("front_content") String frontContent,
        @JsonProperty("back_content") String backContent,
        @JsonProperty("hint") String hint,
        @JsonProperty("source") String source,
        @JsonProperty("subject") String subject,
        @JsonProperty("card_type") CardType cardType
) implements GeneratedItem {

    public Flashcard withSubject(String value) {
        return new Flashcard(frontContent, backContent, hint, source, value, cardType);
    }

    @Override
    @JsonIgnore
    public ContentKind kind() {
        return ContentKind.FLASHCARD;
    }

    @Override
    @JsonIgnore
    public String front() {
        return frontContent;
    }

    @Override
    @JsonIgnore
    public String back() {
        return backContent;
    }

    @Override
    @JsonIgnore
    public String itemType() {
        return cardType == null ? null : cardType.code();
    }
}
