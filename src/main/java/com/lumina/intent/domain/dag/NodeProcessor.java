package com.lumina.intent.domain.dag;

/**
 * Body of a DAG node: reads the shared context and returns it, usually the same instance, updated.
 */
@FunctionalInterface
public interface NodeProcessor<C> {
    C process(String input, C context);
}
