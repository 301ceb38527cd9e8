package com.captainsprep.engine.service.qa;

public record QaIssue(String check, String message) {

    @Override
    public String toString() {
        return check + ": " + message;
    }
}
