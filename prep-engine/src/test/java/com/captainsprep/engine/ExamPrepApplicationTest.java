package com.captainsprep.engine;

import com.captainsprep.engine.job.BankGenerationRunner;
import com.captainsprep.engine.service.bank.ContentBank;
import com.captainsprep.engine.service.bank.JpaContentBank;
import com.captainsprep.engine.service.generation.ContentGenerators;
import com.captainsprep.engine.service.vectorstore.QdrantVectorStoreClient;
import com.captainsprep.engine.service.vectorstore.VectorStoreClient;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.context.ApplicationContext;
import org.springframework.test.context.ActiveProfiles;

import static org.assertj.core.api.Assertions.assertThat;

@SpringBootTest
@ActiveProfiles("test")
class ExamPrepApplicationTest {

    @Autowired
    private ApplicationContext context;

    @Test
    void blankLanguageModelSettingsSelectMockMode() {
        ContentGenerators generators = context.getBean(ContentGenerators.class);

        assertThat(generators.mockMode()).isTrue();
        assertThat(generators.quiz().mockOnly()).isTrue();
        assertThat(generators.tutor().mockOnly()).isTrue();
        assertThat(context.getBean(ContentBank.class)).isInstanceOf(JpaContentBank.class);
        assertThat(context.getBean(VectorStoreClient.class)).isInstanceOf(QdrantVectorStoreClient.class);
        assertThat(context.getBeanNamesForType(BankGenerationRunner.class)).isEmpty();
    }
}
