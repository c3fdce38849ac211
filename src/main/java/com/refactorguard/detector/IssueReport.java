package com.refactorguard.detector;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Issues of one program unit, grouped by detector kind in report order.
 */
public class IssueReport {

    private final Map<DetectorKind, List<Issue>> byKind = new EnumMap<>(DetectorKind.class);

    public static IssueReport empty() {
        return new IssueReport();
    }

    void addAll(DetectorKind kind, List<Issue> issues) {
        byKind.computeIfAbsent(kind, k -> new ArrayList<>()).addAll(issues);
    }

    public List<Issue> of(DetectorKind kind) {
        return Collections.unmodifiableList(byKind.getOrDefault(kind, List.of()));
    }

    /** All issues: loop, then nested-conditional, then conditional-chain. */
    public List<Issue> all() {
        List<Issue> all = new ArrayList<>();
        for (DetectorKind kind : DetectorKind.values()) {
            all.addAll(of(kind));
        }
        return all;
    }

    public int size() {
        return byKind.values().stream().mapToInt(List::size).sum();
    }

    public boolean isEmpty() {
        return size() == 0;
    }
}
