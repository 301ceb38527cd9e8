package com.captainsprep.engine.service.generation;

public record TextPrompt(String systemInstruction,
                         String userPrompt,
                         double temperature,
                         int maxTokens) {
}
