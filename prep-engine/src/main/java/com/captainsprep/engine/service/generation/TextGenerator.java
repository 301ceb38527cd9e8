package com.captainsprep.engine.service.generation;

/**
 * Text generation capability. Implementations throw {@link GenerationUnavailableException} on
 * quota, transport or availability errors.
 */
public interface TextGenerator {

    String generate(TextPrompt prompt);
}
