package com.lumina.intent.domain.dag;

import java.util.Objects;
import java.util.Set;

public record DagNode<C>(String name, NodeProcessor<C> processor, Set<String> dependencies) {

    public DagNode {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(processor, "processor");
        dependencies = dependencies == null ? Set.of() : Set.copyOf(dependencies);
    }

    public static <C> DagNode<C> root(String name, NodeProcessor<C> processor) {
        return new DagNode<>(name, processor, Set.of());
    }

    public static <C> DagNode<C> after(String dependency, String name, NodeProcessor<C> processor) {
        return new DagNode<>(name, processor, Set.of(dependency));
    }
}
