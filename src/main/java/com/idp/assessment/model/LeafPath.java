package com.idp.assessment.model;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Position of one value inside an extraction result, made of key and index steps.
 * Renders as {@code AccountDetails.AccountNumber} or {@code Transactions[3].Amount}.
 */
public record LeafPath(List<Step> steps) {

    /** One navigation step. */
    public sealed interface Step permits Key, Index {
    }

    public record Key(String name) implements Step {
    }

    public record Index(int value) implements Step {
    }

    public static final LeafPath ROOT = new LeafPath(List.of());

    public LeafPath {
        steps = List.copyOf(steps);
    }

    public static LeafPath of(Object... steps) {
        List<Step> parsed = new ArrayList<>(steps.length);
        for (Object step : steps) {
            if (step instanceof Integer index) {
                parsed.add(new Index(index));
            } else {
                parsed.add(new Key(String.valueOf(step)));
            }
        }
        return new LeafPath(parsed);
    }

    public LeafPath child(String key) {
        return append(new Key(key));
    }

    public LeafPath child(int index) {
        return append(new Index(index));
    }

    private LeafPath append(Step step) {
        List<Step> next = new ArrayList<>(steps.size() + 1);
        next.addAll(steps);
        next.add(step);
        return new LeafPath(next);
    }

    public boolean isRoot() {
        return steps.isEmpty();
    }

    public int depth() {
        return steps.size();
    }

    public boolean startsWith(LeafPath prefix) {
        return prefix.steps.size() <= steps.size()
                && steps.subList(0, prefix.steps.size()).equals(prefix.steps);
    }

    /** Steps after {@code prefix}; the caller guarantees {@link #startsWith(LeafPath)}. */
    public List<Step> relativeTo(LeafPath prefix) {
        return Collections.unmodifiableList(steps.subList(prefix.steps.size(), steps.size()));
    }

    /** Path with list indices dropped, e.g. {@code Transactions.Amount}. */
    public String schemaPath() {
        StringBuilder sb = new StringBuilder();
        for (Step step : steps) {
            if (step instanceof Key key) {
                if (!sb.isEmpty()) {
                    sb.append('.');
                }
                sb.append(key.name());
            }
        }
        return sb.toString();
    }

    @JsonValue
    @Override
    public String toString() {
        if (steps.isEmpty()) {
            return "$";
        }
        StringBuilder sb = new StringBuilder();
        for (Step step : steps) {
            if (step instanceof Index index) {
                sb.append('[').append(index.value()).append(']');
            } else {
                if (!sb.isEmpty()) {
                    sb.append('.');
                }
                sb.append(((Key) step).name());
            }
        }
        return sb.toString();
    }
}
