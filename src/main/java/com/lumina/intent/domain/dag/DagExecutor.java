package com.lumina.intent.domain.dag;

import com.lumina.intent.domain.exception.DagValidationException;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * 왜: 고정된 선형 실행 순서가 선언된 의존성과 맞는지 검증한 뒤에만 단계들을 실행하기 위함.
 *
 * <p>The order is a total order over every node. There is no branching, skipping or parallelism;
 * each node runs exactly once, in order, on the calling thread.
 */
public class DagExecutor {

    private final boolean telemetryEnabled;

    public DagExecutor(boolean telemetryEnabled) {
        this.telemetryEnabled = telemetryEnabled;
    }

    /**
     * Checks that {@code order} is a linearization of {@code nodes} that respects every declared
     * dependency. All violations are collected before failing.
     *
     * @throws DagValidationException if any node is missing, unscheduled or ordered before one of its dependencies
     */
    public <C> void validate(Map<String, DagNode<C>> nodes, List<String> order) {
        List<String> missing = new ArrayList<>();
        for (String name : order) {
            if (!nodes.containsKey(name)) {
                missing.add(name);
            }
        }

        List<String> unscheduled = new ArrayList<>();
        for (String name : new TreeSet<>(nodes.keySet())) {
            if (!order.contains(name)) {
                unscheduled.add(name);
            }
        }

        Map<String, Integer> position = new HashMap<>();
        List<String> violations = new ArrayList<>();
        for (int i = 0; i < order.size(); i++) {
            if (position.putIfAbsent(order.get(i), i) != null) {
                violations.add(order.get(i) + " scheduled twice");
            }
        }
        for (String name : new TreeSet<>(nodes.keySet())) {
            Integer own = position.get(name);
            for (String dependency : new TreeSet<>(nodes.get(name).dependencies())) {
                Integer dep = position.get(dependency);
                if (dep == null || own == null || dep >= own) {
                    violations.add(dependency + " -> " + name);
                }
            }
        }

        if (!missing.isEmpty() || !unscheduled.isEmpty() || !violations.isEmpty()) {
            throw new DagValidationException(missing, unscheduled, violations);
        }
    }

    /**
     * Validates, then runs every node in {@code order}, recording per-node wall-clock time in
     * milliseconds rounded to three decimals.
     */
    public <C extends NodeTimingRecorder> C run(Map<String, DagNode<C>> nodes,
                                                List<String> order,
                                                String input,
                                                C context) {
        validate(nodes, order);

        C current = context;
        for (String name : order) {
            DagNode<C> node = nodes.get(name);
            long start = System.nanoTime();
            current = node.processor().process(input, current);
            double elapsedMs = (System.nanoTime() - start) / 1_000_000.0;
            if (telemetryEnabled && current != null) {
                current.recordNodeTiming(name, roundMillis(elapsedMs));
            }
        }
        return current;
    }

    static double roundMillis(double elapsedMs) {
        return Math.round(elapsedMs * 1000.0) / 1000.0;
    }
}
