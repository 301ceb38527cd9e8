package com.captainsprep.engine.service.generation.tutor;

import com.captainsprep.engine.model.Citation;

import java.util.List;

public record TutorResponse(String response, List<Citation> citations) {

    public TutorResponse {
        citations = citations == null ? List.of() : List.copyOf(citations);
    }
}
