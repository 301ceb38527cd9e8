package com.captainsprep.engine.service.review;

import com.captainsprep.engine.model.Citation;
import com.captainsprep.engine.model.RetrievalContext;
import com.captainsprep.engine.model.ReviewGrade;
import com.captainsprep.engine.service.generation.ContentGenerators;
import com.captainsprep.engine.service.generation.GenerationUnavailableException;
import com.captainsprep.engine.service.generation.TextGenerator;
import com.captainsprep.engine.service.retrieval.RagContextService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.List;
import java.util.Optional;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anySet;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class AnswerReviewServiceTest {

    private static final Citation CITATION = new Citation(1, "hydraulics.pdf", "Friction loss is the pressure lost...", 0.81);

    @Mock
    private ContentGenerators generators;

    @Mock
    private RagContextService ragContextService;

    @Mock
    private TextGenerator textGenerator;

    private AnswerReviewService service;

    @BeforeEach
    void setUp() {
        service = new AnswerReviewService(generators, ragContextService, new ObjectMapper(), 5, 8000, 0.3, 1024);
    }

    @Test
    void gradesParsedResponseAndAttachesCitations() {
        stubContext();
        when(generators.textGenerator()).thenReturn(Optional.of(textGenerator));
        when(textGenerator.generate(any())).thenReturn(
                "```json\n{\"grade\": \"Partial\", \"feedback\": \"Mentioned hose length only.\", \"textbook_answer\": \"Pressure lost to friction in the hose.\"}\n```");

        ReviewGrade grade = service.review("What is friction loss?", "It depends on hose length", Set.of("doc-1"));

        assertThat(grade.grade()).isEqualTo("partial");
        assertThat(grade.feedback()).isEqualTo("Mentioned hose length only.");
        assertThat(grade.textbookAnswer()).isEqualTo("Pressure lost to friction in the hose.");
        assertThat(grade.citations()).containsExactly(CITATION);
    }

    @Test
    void unparseableResponseBecomesIncorrectWithRawFeedback() {
        stubContext();
        when(generators.textGenerator()).thenReturn(Optional.of(textGenerator));
        when(textGenerator.generate(any())).thenReturn("Good effort, but you missed the key point.");

        ReviewGrade grade = service.review("What is friction loss?", "No idea", Set.of("doc-1"));

        assertThat(grade.grade()).isEqualTo("incorrect");
        assertThat(grade.feedback()).isEqualTo("Good effort, but you missed the key point.");
        assertThat(grade.textbookAnswer()).isEqualTo(AnswerReviewService.FALLBACK_TEXTBOOK_ANSWER);
        assertThat(grade.citations()).containsExactly(CITATION);
    }

    @Test
    void unavailableBackendReturnsPartialGrade() {
        stubContext();
        when(generators.textGenerator()).thenReturn(Optional.of(textGenerator));
        when(textGenerator.generate(any())).thenThrow(new GenerationUnavailableException("HTTP 503"));

        ReviewGrade grade = service.review("What is friction loss?", "Pressure lost in hose", Set.of("doc-1"));

        assertThat(grade.grade()).isEqualTo("partial");
        assertThat(grade.feedback()).isEqualTo(AnswerReviewService.UNAVAILABLE_FEEDBACK);
        assertThat(grade.citations()).containsExactly(CITATION);
    }

    @Test
    void mockModeSkipsGeneration() {
        stubContext();
        when(generators.textGenerator()).thenReturn(Optional.empty());

        ReviewGrade grade = service.review("What is friction loss?", "Pressure lost in hose", Set.of("doc-1"));

        assertThat(grade.grade()).isEqualTo("partial");
        assertThat(grade.citations()).hasSize(1);
    }

    @Test
    void unknownGradeIsTreatedAsIncorrect() {
        ObjectMapper objectMapper = new ObjectMapper();
        ReviewGrade grade = AnswerReviewService.toGrade("Q", objectMapper.createObjectNode()
                .put("grade", "excellent")
                .put("feedback", "Nice"));

        assertThat(grade.grade()).isEqualTo("incorrect");
        assertThat(grade.textbookAnswer()).isEqualTo("Unable to parse textbook answer");
    }

    @Test
    void blankQuestionIsRejected() {
        assertThatThrownBy(() -> service.review(" ", "answer", null))
                .isInstanceOf(IllegalArgumentException.class);
    }

    private void stubContext() {
        when(ragContextService.buildContext(anyString(), anySet(), eq(5)))
                .thenReturn(new RetrievalContext("[1] Friction loss is the pressure lost...", List.of(CITATION)));
    }
}
