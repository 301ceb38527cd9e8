package com.captainsprep.engine.service.generation.parsing;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.Optional;

/**
 * One way of recovering a structured object from free-form model output.
 */
public interface ResponseParsingStrategy {

    String name();

    Optional<ObjectNode> parse(String response);
}
