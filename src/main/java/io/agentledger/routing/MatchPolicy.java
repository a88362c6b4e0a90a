package io.agentledger.routing;

import java.util.Set;

public enum MatchPolicy {
    /** Agent declares at least one of the required tags. */
    ANY,
    /** Agent declares every required tag. */
    ALL;

    public boolean matches(Set<String> declared, Set<String> required) {
        if (required.isEmpty()) {
            return false;
        }
        return switch (this) {
            case ANY -> required.stream().anyMatch(declared::contains);
            case ALL -> declared.containsAll(required);
        };
    }

    public static MatchPolicy fromString(String raw) {
        if (raw == null || raw.isBlank()) {
            return ANY;
        }
        for (MatchPolicy value : values()) {
            if (value.name().equalsIgnoreCase(raw.trim())) {
                return value;
            }
        }
        throw new IllegalArgumentException("Unknown match policy: " + raw);
    }
}
