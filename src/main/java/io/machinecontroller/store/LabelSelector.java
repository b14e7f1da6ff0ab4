package io.machinecontroller.store;

import lombok.EqualsAndHashCode;

import java.util.Map;

/**
 * Equality-based label selector. An empty selector matches everything.
 */
@EqualsAndHashCode
public final class LabelSelector {

    private static final LabelSelector EVERYTHING = new LabelSelector(Map.of());

    private final Map<String, String> matchLabels;

    private LabelSelector(Map<String, String> matchLabels) {
        this.matchLabels = Map.copyOf(matchLabels);
    }

    public static LabelSelector everything() {
        return EVERYTHING;
    }

    public static LabelSelector of(Map<String, String> matchLabels) {
        if (matchLabels == null || matchLabels.isEmpty()) {
            return EVERYTHING;
        }
        return new LabelSelector(matchLabels);
    }

    public boolean matches(Map<String, String> labels) {
        if (matchLabels.isEmpty()) {
            return true;
        }
        if (labels == null) {
            return false;
        }
        for (Map.Entry<String, String> entry : matchLabels.entrySet()) {
            if (!entry.getValue().equals(labels.get(entry.getKey()))) {
                return false;
            }
        }
        return true;
    }

    @Override
    public String toString() {
        return matchLabels.isEmpty() ? "<everything>" : matchLabels.toString();
    }
}
