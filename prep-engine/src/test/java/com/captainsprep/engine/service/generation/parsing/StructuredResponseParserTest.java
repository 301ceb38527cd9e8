package com.captainsprep.engine.service.generation.parsing;

import com.captainsprep.engine.service.generation.ParseFailureException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class StructuredResponseParserTest {

    private final ObjectMapper objectMapper = new ObjectMapper();
    private final StructuredResponseParser parser = StructuredResponseParser.forJson(objectMapper, List.of("question", "options"));

    @Test
    void parsesPlainJson() {
        ObjectNode node = parser.parse("{\"question\": \"Q?\", \"options\": [\"a\", \"b\", \"c\", \"d\"]}");

        assertThat(node.get("question").asText()).isEqualTo("Q?");
    }

    @Test
    void parsesFirstObjectOfJsonArray() {
        ObjectNode node = parser.parse("[{\"question\": \"First\", \"options\": []}, {\"question\": \"Second\"}]");

        assertThat(node.get("question").asText()).isEqualTo("First");
    }

    @Test
    void parsesFencedBlock() {
        String response = "Here you go:\n```json\n{\"question\": \"Fenced?\", \"options\": [\"a\"]}\n```\nGood luck!";

        assertThat(parser.parse(response).get("question").asText()).isEqualTo("Fenced?");
    }

    @Test
    void findsBraceObjectWithExpectedKeysInsideProse() {
        String response = "Note {not json} and {\"other\": 1} then {\"question\": \"Has {braces} inside\", \"options\": [\"a\"]} done.";

        assertThat(parser.parse(response).get("question").asText()).isEqualTo("Has {braces} inside");
    }

    @Test
    void failureCarriesRawResponseAndShortExcerpt() {
        String response = "no structure here " + "z".repeat(400);

        assertThatThrownBy(() -> parser.parse(response))
                .isInstanceOf(ParseFailureException.class)
                .satisfies(ex -> {
                    ParseFailureException failure = (ParseFailureException) ex;
                    assertThat(failure.rawResponse()).isEqualTo(response);
                    assertThat(failure.getMessage()).hasSizeLessThan(300);
                });
    }

    @Test
    void labelledLinesAreTheLastResort() {
        StructuredResponseParser labelled = StructuredResponseParser.forJsonOrLabels(objectMapper,
                List.of("front_content", "back_content"),
                Map.of("TERM", "front_content", "DEFINITION", "back_content", "SOURCE", "source"));
        String response = """
                **TERM:** Friction loss
                DEFINITION: Pressure lost as water moves through hose,
                growing with flow and hose length.
                SOURCE: Fire Math
                """;

        ObjectNode node = labelled.parse(response);

        assertThat(node.get("front_content").asText()).isEqualTo("Friction loss");
        assertThat(node.get("back_content").asText())
                .isEqualTo("Pressure lost as water moves through hose, growing with flow and hose length.");
        assertThat(node.get("source").asText()).isEqualTo("Fire Math");
    }

    @Test
    void labelledLinesRequireEveryField() {
        StructuredResponseParser labelled = StructuredResponseParser.forJsonOrLabels(objectMapper,
                List.of("front_content", "back_content"),
                Map.of("TERM", "front_content", "DEFINITION", "back_content"));

        assertThatThrownBy(() -> labelled.parse("TERM: Only a term"))
                .isInstanceOf(ParseFailureException.class);
    }
}
