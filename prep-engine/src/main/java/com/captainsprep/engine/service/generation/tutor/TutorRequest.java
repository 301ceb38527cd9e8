package com.captainsprep.engine.service.generation.tutor;

public record TutorRequest(String subject, String userInput) {

    public TutorRequest {
        if (subject == null || subject.isBlank()) {
            throw new IllegalArgumentException("subject is required");
        }
        subject = subject.trim();
    }

    public String topic() {
        return TutorPrompts.request(subject, userInput);
    }

    public String retrievalQuery() {
        return subject + " " + (userInput == null ? "" : userInput.trim());
    }
}
