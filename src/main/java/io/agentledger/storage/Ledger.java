package io.agentledger.storage;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * The consolidated ledger: a header followed by one block per consolidated task, in
 * consolidation order. A block starts with a {@code ---} separator line directly followed by
 * its {@code ## Task: <id> (by <agent>)} heading, which is what makes re-running a
 * consolidation harmless.
 *
 * <p>Artifact lines that would read as a block heading are indented by one space before they
 * are appended, so worker output can never claim another task's entry.
 */
public final class Ledger {
    static final String HEADER = "# Active Specification\n\n";
    private static final String SEPARATOR = "---";
    private static final String ENTRY_PREFIX = "## Task: ";
    private static final Pattern HEADING_IN_CONTENT = Pattern.compile("(?m)^" + Pattern.quote(ENTRY_PREFIX));

    private final StateStore store;
    private final Path path;

    public Ledger(StateStore store, Path path) {
        this.store = store;
        this.path = path;
    }

    public Path path() {
        return path;
    }

    public void initialize() {
        store.appendIfAbsent(path, HEADER.trim(), HEADER);
    }

    /**
     * @return {@code false} when the task already has an entry
     */
    public boolean append(String taskId, String agentId, String content) {
        String block = "\n\n" + SEPARATOR + "\n" + ENTRY_PREFIX + taskId + " (by " + agentId + ")\n\n"
                + escape(content) + "\n";
        return store.appendIfAbsent(path, marker(taskId), block);
    }

    public boolean contains(String taskId) {
        if (!store.exists(path)) {
            return false;
        }
        return store.read(path).contains(marker(taskId));
    }

    public List<String> taskIds() {
        List<String> out = new ArrayList<>();
        if (!store.exists(path)) {
            return out;
        }
        String previous = null;
        for (String line : store.read(path).split("\n")) {
            if (SEPARATOR.equals(previous) && line.startsWith(ENTRY_PREFIX)) {
                String rest = line.substring(ENTRY_PREFIX.length());
                int space = rest.indexOf(" (by ");
                out.add(space < 0 ? rest.trim() : rest.substring(0, space));
            }
            previous = line;
        }
        return out;
    }

    static String marker(String taskId) {
        return "\n" + SEPARATOR + "\n" + ENTRY_PREFIX + taskId + " (by ";
    }

    static String escape(String content) {
        if (content == null) {
            return "";
        }
        return HEADING_IN_CONTENT.matcher(content).replaceAll(Matcher.quoteReplacement(" " + ENTRY_PREFIX));
    }
}
