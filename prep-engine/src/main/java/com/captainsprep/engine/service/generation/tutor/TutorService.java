package com.captainsprep.engine.service.generation.tutor;

import com.captainsprep.engine.model.RetrievalContext;
import com.captainsprep.engine.service.generation.ContentGenerators;
import com.captainsprep.engine.service.retrieval.RagContextService;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

import java.util.Set;

@Service
public class TutorService {

    private final ContentGenerators generators;
    private final RagContextService ragContextService;
    private final int topK;

    public TutorService(ContentGenerators generators,
                        RagContextService ragContextService,
                        @Value("${prep.tutor.top-k:3}") int topK) {
        this.generators = generators;
        this.ragContextService = ragContextService;
        this.topK = Math.max(1, topK);
    }

    public TutorResponse explain(TutorRequest request, Set<String> scope) {
        RetrievalContext context = ragContextService.buildContext(request.retrievalQuery(), scope, topK);
        String response = generators.tutor().generate(request.topic(), context.context());
        return new TutorResponse(response, context.citations());
    }
}
