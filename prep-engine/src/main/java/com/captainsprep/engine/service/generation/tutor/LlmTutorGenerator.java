package com.captainsprep.engine.service.generation.tutor;

import com.captainsprep.engine.service.generation.GenerationUnavailableException;
import com.captainsprep.engine.service.generation.ItemGenerator;
import com.captainsprep.engine.service.generation.PromptBuilder;
import com.captainsprep.engine.service.generation.TextGenerator;
import com.captainsprep.engine.service.generation.TextPrompt;

/**
 * Free-text tutoring. {@code topic} carries the learner request built by
 * {@link TutorRequest#topic()}.
 */
public class LlmTutorGenerator implements ItemGenerator<String> {

    private final TextGenerator textGenerator;
    private final int maxContextChars;
    private final double temperature;
    private final int maxTokens;

    public LlmTutorGenerator(TextGenerator textGenerator, int maxContextChars, double temperature, int maxTokens) {
        this.textGenerator = textGenerator;
        this.maxContextChars = maxContextChars;
        this.temperature = temperature;
        this.maxTokens = maxTokens;
    }

    @Override
    public String generate(String topic, String context) {
        String userPrompt = PromptBuilder.withContextLimit(maxContextChars)
                .task(topic)
                .context("RELEVANT MANUAL CONTENT:", context,
                        "[No specific manual content found, use general fire service knowledge]")
                .instruction(TutorPrompts.CLOSING)
                .build();
        String response = textGenerator.generate(new TextPrompt(TutorPrompts.SYSTEM_INSTRUCTION, userPrompt, temperature, maxTokens));
        if (response == null || response.isBlank()) {
            throw new GenerationUnavailableException("Tutor response was empty");
        }
        return response.trim();
    }
}
