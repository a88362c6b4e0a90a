package io.agentledger.routing;

import java.util.Collection;
import java.util.Collections;
import java.util.Locale;
import java.util.Set;
import java.util.TreeSet;

/**
 * Capability tags are opaque labels: trimmed, lower-cased, inner whitespace collapsed to one
 * space. A tag made only of word characters matches a payload token; any other tag, such as
 * {@code web search}, matches as a whole-word phrase of the payload.
 */
final class CapabilityTags {
    private CapabilityTags() {
    }

    static String normalize(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        return raw.strip().toLowerCase(Locale.ROOT).replaceAll("\\s+", " ");
    }

    /**
     * Blank tags are dropped.
     */
    static Set<String> normalizeAll(Collection<String> raw) {
        Set<String> out = new TreeSet<>();
        if (raw == null) {
            return Collections.unmodifiableSet(out);
        }
        for (String tag : raw) {
            String normalized = normalize(tag);
            if (!normalized.isEmpty()) {
                out.add(normalized);
            }
        }
        return Collections.unmodifiableSet(out);
    }

    static boolean isWord(String tag) {
        if (tag.isEmpty()) {
            return false;
        }
        for (int i = 0; i < tag.length(); i++) {
            if (!isTagChar(tag.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    static boolean containsPhrase(String text, String phrase) {
        if (phrase.isEmpty()) {
            return false;
        }
        int from = 0;
        while (true) {
            int at = text.indexOf(phrase, from);
            if (at < 0) {
                return false;
            }
            int end = at + phrase.length();
            boolean startsWord = at == 0 || !isTagChar(text.charAt(at - 1)) || !isTagChar(phrase.charAt(0));
            boolean endsWord = end == text.length() || !isTagChar(text.charAt(end))
                    || !isTagChar(phrase.charAt(phrase.length() - 1));
            if (startsWord && endsWord) {
                return true;
            }
            from = at + 1;
        }
    }

    static boolean isTagChar(char ch) {
        return (ch >= 'a' && ch <= 'z')
                || (ch >= '0' && ch <= '9')
                || ch == '_' || ch == '-' || ch == '.';
    }
}
