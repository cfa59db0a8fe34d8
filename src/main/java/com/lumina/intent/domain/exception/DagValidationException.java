package com.lumina.intent.domain.exception;

import java.util.List;

/**
 * 왜: 그래프 구조 오류를 한 번에 모두 보고해 잘못된 실행 순서를 첫 위반만 보고 고치는 일을 막기 위함.
 */
public class DagValidationException extends RuntimeException {

    private final List<String> missingNodes;
    private final List<String> unscheduledNodes;
    private final List<String> orderViolations;

    public DagValidationException(List<String> missingNodes,
                                  List<String> unscheduledNodes,
                                  List<String> orderViolations) {
        super(buildMessage(missingNodes, unscheduledNodes, orderViolations));
        this.missingNodes = List.copyOf(missingNodes);
        this.unscheduledNodes = List.copyOf(unscheduledNodes);
        this.orderViolations = List.copyOf(orderViolations);
    }

    public List<String> missingNodes() {
        return missingNodes;
    }

    public List<String> unscheduledNodes() {
        return unscheduledNodes;
    }

    /**
     * Offending edges as {@code "dependency -> node"} (dependency unscheduled or scheduled at or after
     * the node), plus {@code "<name> scheduled twice"} for duplicate order entries.
     */
    public List<String> orderViolations() {
        return orderViolations;
    }

    private static String buildMessage(List<String> missing, List<String> unscheduled, List<String> violations) {
        StringBuilder sb = new StringBuilder("Invalid DAG:");
        if (!missing.isEmpty()) {
            sb.append(" missing nodes ").append(missing).append(';');
        }
        if (!unscheduled.isEmpty()) {
            sb.append(" unscheduled nodes ").append(unscheduled).append(';');
        }
        if (!violations.isEmpty()) {
            sb.append(" dependency order violation ").append(violations).append(';');
        }
        return sb.toString();
    }
}
