package com.captainsprep.engine.service.generation.openai;

import com.captainsprep.engine.service.generation.GenerationUnavailableException;
import com.captainsprep.engine.service.generation.TextGenerator;
import com.captainsprep.engine.service.generation.TextPrompt;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.Mono;

import java.util.ArrayList;
import java.util.List;

/**
 * Streams a chat completion and hands back the assembled text once the stream completes.
 */
public class OpenAiTextGenerator implements TextGenerator {

    private static final Logger log = LoggerFactory.getLogger(OpenAiTextGenerator.class);

    private final OpenAiChatClient chatClient;
    private final ObjectMapper objectMapper;
    private final String model;

    public OpenAiTextGenerator(OpenAiChatClient chatClient, ObjectMapper objectMapper, String model) {
        this.chatClient = chatClient;
        this.objectMapper = objectMapper;
        this.model = model;
    }

    @Override
    public String generate(TextPrompt prompt) {
        OpenAiChatClient.Request request = new OpenAiChatClient.Request(
                model,
                buildMessages(prompt),
                prompt.temperature(),
                prompt.maxTokens()
        );
        String text;
        try {
            text = chatClient.stream(request)
                    .takeUntil(OpenAiChatClient.StreamEvent::done)
                    .filter(event -> !event.done())
                    .concatMap(event -> Mono.justOrEmpty(deltaContent(event.data())))
                    .reduce(new StringBuilder(), StringBuilder::append)
                    .map(builder -> builder.toString().trim())
                    .block(chatClient.timeout().plusSeconds(5));
        } catch (GenerationUnavailableException ex) {
            throw ex;
        } catch (Exception ex) {
            throw new GenerationUnavailableException("Chat completion did not finish", ex);
        }
        if (text == null || text.isEmpty()) {
            throw new GenerationUnavailableException("Chat completion returned no content");
        }
        return text;
    }

    private List<OpenAiChatClient.Message> buildMessages(TextPrompt prompt) {
        List<OpenAiChatClient.Message> messages = new ArrayList<>();
        if (prompt.systemInstruction() != null && !prompt.systemInstruction().isBlank()) {
            messages.add(new OpenAiChatClient.Message("system", prompt.systemInstruction()));
        }
        messages.add(new OpenAiChatClient.Message("user", prompt.userPrompt() == null ? "" : prompt.userPrompt()));
        return List.copyOf(messages);
    }

    private String deltaContent(String data) {
        try {
            StreamResponse response = objectMapper.readValue(data, StreamResponse.class);
            if (response.choices() == null || response.choices().isEmpty()) {
                return null;
            }
            StreamChoice choice = response.choices().get(0);
            if ("length".equals(choice.finishReason())) {
                log.debug("Chat completion stopped at the token limit");
            }
            return choice.delta() == null ? null : choice.delta().content();
        } catch (JsonProcessingException e) {
            log.warn("Failed to parse streaming chunk", e);
            return null;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StreamResponse(List<StreamChoice> choices) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StreamChoice(StreamDelta delta, @JsonProperty("finish_reason") String finishReason) {
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record StreamDelta(@JsonProperty("content") String content) {
    }
}
