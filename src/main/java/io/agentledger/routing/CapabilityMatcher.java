package io.agentledger.routing;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Decides which agent receives a task. Required capabilities are the catalog tags the payload
 * names, as a token or, for multi-word tags, as a phrase. The winner is the lexicographically
 * smallest eligible agent id, so the same roster and payload always produce the same choice.
 */
public final class CapabilityMatcher {
    private final Roster roster;
    private final String routerId;

    public CapabilityMatcher(Roster roster, String routerId) {
        this.roster = roster;
        this.routerId = routerId;
    }

    public Set<String> requiredCapabilities(String payload) {
        Set<String> required = new LinkedHashSet<>();
        for (String token : tokenize(payload)) {
            if (roster.catalog().contains(token)) {
                required.add(token);
            }
        }
        String text = CapabilityTags.normalize(payload);
        for (String tag : roster.catalog()) {
            if (!CapabilityTags.isWord(tag) && CapabilityTags.containsPhrase(text, tag)) {
                required.add(tag);
            }
        }
        return Collections.unmodifiableSet(required);
    }

    public Optional<String> select(Set<String> required) {
        if (required == null || required.isEmpty()) {
            return Optional.empty();
        }
        // entries are sorted by agent id
        return roster.entries().stream()
                .filter(entry -> !entry.agentId().equals(routerId))
                .filter(entry -> roster.matchPolicy().matches(entry.capabilities(), required))
                .map(RosterEntry::agentId)
                .findFirst();
    }

    public Optional<String> route(String payload) {
        return select(requiredCapabilities(payload));
    }

    static Set<String> tokenize(String payload) {
        Set<String> out = new LinkedHashSet<>();
        if (payload == null || payload.isBlank()) {
            return out;
        }
        StringBuilder token = new StringBuilder();
        String lower = payload.toLowerCase(Locale.ROOT);
        for (int i = 0; i <= lower.length(); i++) {
            char ch = i < lower.length() ? lower.charAt(i) : ' ';
            if (CapabilityTags.isTagChar(ch)) {
                token.append(ch);
                continue;
            }
            if (token.length() > 0) {
                addToken(out, token.toString());
                token.setLength(0);
            }
        }
        return out;
    }

    private static void addToken(Set<String> out, String token) {
        // sentence punctuation such as "probe." should still match "probe"
        String trimmed = token;
        while (trimmed.endsWith(".")) {
            trimmed = trimmed.substring(0, trimmed.length() - 1);
        }
        if (!trimmed.isEmpty()) {
            out.add(trimmed);
        }
    }
}
