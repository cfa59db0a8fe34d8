package com.lumina.intent.domain.model;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;

/**
 * 왜: 최근 의도만 유지해 메모리 사용량을 고정하고 진단용 조회를 제공하기 위함.
 */
public class IntentHistory {

    public static final int DEFAULT_MAX_ENTRIES = 10;

    private final int maxEntries;
    private final Deque<AiIntent> entries = new ArrayDeque<>();

    public IntentHistory(int maxEntries) {
        if (maxEntries < 1) {
            throw new IllegalArgumentException("maxEntries는 1 이상이어야 합니다: " + maxEntries);
        }
        this.maxEntries = maxEntries;
    }

    public void append(AiIntent intent) {
        entries.addLast(intent);
        if (entries.size() > maxEntries) {
            entries.removeFirst();
        }
    }

    /**
     * Oldest first.
     */
    public List<AiIntent> snapshot() {
        return List.copyOf(entries);
    }

    public int size() {
        return entries.size();
    }

    public int maxEntries() {
        return maxEntries;
    }
}
