package com.captainsprep.engine.model;

import java.util.List;

public record RetrievalContext(String context, List<Citation> citations) {

    private static final RetrievalContext EMPTY = new RetrievalContext("", List.of());

    public RetrievalContext {
        context = context == null ? "" : context;
        citations = citations == null ? List.of() : List.copyOf(citations);
    }

    public static RetrievalContext empty() {
        return EMPTY;
    }

    public boolean isEmpty() {
        return context.isBlank();
    }
}
