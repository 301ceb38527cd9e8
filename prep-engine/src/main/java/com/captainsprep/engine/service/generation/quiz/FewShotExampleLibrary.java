package com.captainsprep.engine.service.generation.quiz;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.core.io.ClassPathResource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.List;
import java.util.Locale;

/**
 * Curated example questions per subject, embedded into quiz prompts whose topic matches one of
 * the subject's keywords.
 */
@Component
public class FewShotExampleLibrary {

    private static final Logger log = LoggerFactory.getLogger(FewShotExampleLibrary.class);

    static final String DEFAULT_LOCATION = "prompts/few-shot-examples.json";

    private final List<SubjectExamples> subjects;
    private final int examplesPerPrompt;

    @Autowired
    public FewShotExampleLibrary(ObjectMapper objectMapper,
                                 @Value("${prep.generation.few-shot-location:" + DEFAULT_LOCATION + "}") String location,
                                 @Value("${prep.generation.few-shot-count:3}") int examplesPerPrompt) {
        this.subjects = load(objectMapper, location);
        this.examplesPerPrompt = Math.max(0, examplesPerPrompt);
    }

    FewShotExampleLibrary(List<SubjectExamples> subjects, int examplesPerPrompt) {
        this.subjects = List.copyOf(subjects);
        this.examplesPerPrompt = examplesPerPrompt;
    }

    /**
     * Renders up to the configured number of examples for the subject matching {@code topic},
     * or an empty string when no subject matches.
     */
    public String examplesFor(String topic) {
        if (topic == null || examplesPerPrompt == 0) {
            return "";
        }
        String normalised = topic.toLowerCase(Locale.ROOT);
        return subjects.stream()
                .filter(subject -> subject.matches(normalised))
                .findFirst()
                .map(this::render)
                .orElse("");
    }

    private String render(SubjectExamples subject) {
        StringBuilder builder = new StringBuilder("HERE ARE EXAMPLE QUESTIONS FOR REFERENCE:\n");
        List<Example> examples = subject.examples() == null ? List.of() : subject.examples();
        int limit = Math.min(examplesPerPrompt, examples.size());
        for (int i = 0; i < limit; i++) {
            Example example = examples.get(i);
            builder.append("\nExample ").append(i + 1).append(":\n");
            if (example.scenario() != null && !example.scenario().isBlank()) {
                builder.append("Scenario: ").append(example.scenario()).append('\n');
            }
            builder.append("Question: ").append(example.question()).append('\n');
            List<String> options = example.options() == null ? List.of() : example.options();
            for (int o = 0; o < options.size(); o++) {
                builder.append((char) ('A' + o)).append(") ").append(options.get(o)).append('\n');
            }
            builder.append("Correct: ").append(example.correctAnswer()).append('\n');
            builder.append("Why: ").append(example.explanation()).append('\n');
        }
        builder.append("\nNow create a NEW, ORIGINAL question following these patterns.");
        return builder.toString();
    }

    private static List<SubjectExamples> load(ObjectMapper objectMapper, String location) {
        ClassPathResource resource = new ClassPathResource(location);
        if (!resource.exists()) {
            log.info("No few-shot examples found at {}", location);
            return List.of();
        }
        try (InputStream input = resource.getInputStream()) {
            List<SubjectExamples> loaded = objectMapper.readValue(input, new TypeReference<List<SubjectExamples>>() {
            });
            log.info("Loaded few-shot examples for {} subjects", loaded.size());
            return List.copyOf(loaded);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read few-shot examples from " + location, e);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record SubjectExamples(@JsonProperty("subject") String subject,
                           @JsonProperty("keywords") List<String> keywords,
                           @JsonProperty("examples") List<Example> examples) {

        boolean matches(String normalisedTopic) {
            if (subject != null && normalisedTopic.contains(subject.toLowerCase(Locale.ROOT))) {
                return true;
            }
            return keywords != null && keywords.stream()
                    .anyMatch(keyword -> normalisedTopic.contains(keyword.toLowerCase(Locale.ROOT)));
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    record Example(@JsonProperty("scenario") String scenario,
                   @JsonProperty("question") String question,
                   @JsonProperty("options") List<String> options,
                   @JsonProperty("correct_answer") String correctAnswer,
                   @JsonProperty("explanation") String explanation) {
    }
}
