package com.captainsprep.engine.service.generation;

public class ParseFailureException extends RuntimeException {

    private final String rawResponse;

    public ParseFailureException(String message, String rawResponse) {
        super(message);
        this.rawResponse = rawResponse;
    }

    public String rawResponse() {
        return rawResponse;
    }
}
