package com.captainsprep.engine.service.bank;

import com.captainsprep.engine.model.ContentKind;
import com.captainsprep.engine.model.GeneratedItem;
import com.captainsprep.engine.model.QuizQuestion;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class BankItemCodecTest {

    private final BankItemCodec codec = new BankItemCodec(new ObjectMapper());

    @Test
    void readsStoredQuizWithNullOption() {
        String payload = "{\"question\":\"Which tool forces doors?\",\"options\":[\"Halligan\",null,\"Axe\",\"Pike pole\"],"
                + "\"correct_answer\":\"Halligan\",\"explanation\":\"The Halligan bar is the forcible entry tool.\",\"subject\":\"mechanical-aptitude\"}";

        GeneratedItem item = codec.read(ContentKind.QUIZ_QUESTION, payload);

        assertThat(item).isInstanceOfSatisfying(QuizQuestion.class, question -> {
            assertThat(question.options()).containsExactly("Halligan", null, "Axe", "Pike pole");
            assertThat(question.correctAnswer()).isEqualTo("Halligan");
        });
    }
}
