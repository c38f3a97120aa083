package dev.sfn.model;

import com.fasterxml.jackson.databind.node.ObjectNode;

import java.util.List;

/**
 * The ASL definition of one state machine function plus its decorator effects.
 */
public record CompiledStateMachine(
    String name,
    ObjectNode definition,
    List<DecoratorEffect> effects
) {}
