package io.agentledger.routing;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;

/**
 * Read-only mapping of agent identity to capability tags, plus the catalog of every tag the
 * router is allowed to recognise in a task payload.
 */
public final class Roster {
    private final List<RosterEntry> entries;
    private final Set<String> catalog;
    private final MatchPolicy matchPolicy;

    public Roster(Collection<RosterEntry> entries, Collection<String> declaredCatalog, MatchPolicy matchPolicy) {
        List<RosterEntry> sorted = new ArrayList<>(entries);
        sorted.sort(Comparator.comparing(RosterEntry::agentId));
        for (int i = 1; i < sorted.size(); i++) {
            if (sorted.get(i).agentId().equals(sorted.get(i - 1).agentId())) {
                throw new IllegalArgumentException("Duplicate roster agent: " + sorted.get(i).agentId());
            }
        }
        Set<String> tags = new TreeSet<>(CapabilityTags.normalizeAll(declaredCatalog));
        for (RosterEntry entry : sorted) {
            tags.addAll(entry.capabilities());
        }
        this.entries = List.copyOf(sorted);
        this.catalog = Collections.unmodifiableSet(tags);
        this.matchPolicy = matchPolicy == null ? MatchPolicy.ANY : matchPolicy;
    }

    public static Roster of(RosterEntry... entries) {
        return new Roster(List.of(entries), List.of(), MatchPolicy.ANY);
    }

    public static Roster empty() {
        return new Roster(List.of(), List.of(), MatchPolicy.ANY);
    }

    public List<RosterEntry> entries() {
        return entries;
    }

    public Set<String> catalog() {
        return catalog;
    }

    public MatchPolicy matchPolicy() {
        return matchPolicy;
    }

    public Optional<RosterEntry> find(String agentId) {
        return entries.stream().filter(e -> e.agentId().equals(agentId)).findFirst();
    }
}
