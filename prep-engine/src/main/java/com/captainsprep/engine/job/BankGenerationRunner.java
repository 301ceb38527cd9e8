package com.captainsprep.engine.job;

import com.captainsprep.engine.model.CardType;
import com.captainsprep.engine.model.ContentKind;
import com.captainsprep.engine.service.generation.flashcard.FlashcardPromptCatalog;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;

/**
 * Runs {@link BankGenerationJob} once at startup when {@code prep.job.enabled=true} and writes
 * the report to {@code prep.job.report-dir}.
 */
@Component
@ConditionalOnProperty(prefix = "prep.job", name = "enabled", havingValue = "true")
public class BankGenerationRunner implements ApplicationRunner {

    private static final Logger log = LoggerFactory.getLogger(BankGenerationRunner.class);

    private static final String ALL = "all";

    private final BankGenerationJob job;
    private final ObjectMapper objectMapper;
    private final BankGenerationRequest request;
    private final Path reportDir;

    public BankGenerationRunner(BankGenerationJob job,
                                ObjectMapper objectMapper,
                                @Value("${prep.job.kind:flashcard}") String kind,
                                @Value("${prep.job.subjects:all}") String subjects,
                                @Value("${prep.job.card-types:all}") String cardTypes,
                                @Value("${prep.job.count:50}") int count,
                                @Value("${prep.job.dry-run:false}") boolean dryRun,
                                @Value("${prep.job.report-dir:reports}") String reportDir) {
        this.job = job;
        this.objectMapper = objectMapper.copy().enable(SerializationFeature.INDENT_OUTPUT);
        this.request = new BankGenerationRequest(parseKind(kind), parseSubjects(subjects), parseCardTypes(cardTypes), count, dryRun);
        this.reportDir = Path.of(reportDir);
    }

    @Override
    public void run(ApplicationArguments args) throws IOException {
        BankGenerationReport report = job.run(request);
        log.info("Bank generation finished: {} generated, {} passed, {} failed",
                report.totalGenerated(), report.totalPassed(), report.totalFailed());
        Path written = writeReport(report);
        log.info("Generation report saved to {}", written);
    }

    Path writeReport(BankGenerationReport report) throws IOException {
        Files.createDirectories(reportDir);
        String prefix = report.kind() == ContentKind.FLASHCARD ? "flashcard" : "question";
        Path target = reportDir.resolve(prefix + "_generation_report.json");
        objectMapper.writeValue(target.toFile(), report);
        return target;
    }

    BankGenerationRequest request() {
        return request;
    }

    static ContentKind parseKind(String value) {
        String normalised = value == null ? "" : value.trim().toLowerCase(Locale.ROOT);
        return switch (normalised) {
            case "quiz", "question", "questions" -> ContentKind.QUIZ_QUESTION;
            case "flashcard", "flashcards" -> ContentKind.FLASHCARD;
            default -> throw new IllegalArgumentException("Unknown job kind: " + value);
        };
    }

    static List<String> parseSubjects(String value) {
        if (value == null || value.isBlank() || ALL.equalsIgnoreCase(value.trim())) {
            return FlashcardPromptCatalog.SUBJECTS;
        }
        List<String> subjects = split(value);
        for (String subject : subjects) {
            if (!FlashcardPromptCatalog.SUBJECTS.contains(subject)) {
                throw new IllegalArgumentException("Unknown subject: " + subject + ". Valid: "
                        + String.join(", ", FlashcardPromptCatalog.SUBJECTS));
            }
        }
        return subjects;
    }

    static List<CardType> parseCardTypes(String value) {
        if (value == null || value.isBlank() || ALL.equalsIgnoreCase(value.trim())) {
            return List.of(CardType.values());
        }
        return split(value).stream().map(CardType::fromCode).toList();
    }

    private static List<String> split(String value) {
        return Arrays.stream(value.split(","))
                .map(String::trim)
                .map(part -> part.toLowerCase(Locale.ROOT))
                .filter(part -> !part.isEmpty())
                .toList();
    }
}
