package io.agentledger.routing;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.agentledger.util.Jsons;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Reads the capability roster. {@code .json} files use the structured format; anything else is
 * parsed as the Markdown roster ({@code ## agent} headings with {@code capabilities:} lists).
 * A missing file yields an empty roster.
 */
public final class RosterLoader {
    private RosterLoader() {
    }

    public static Roster load(Path file) {
        if (file == null || !Files.exists(file)) {
            return Roster.empty();
        }
        try {
            String name = file.getFileName().toString().toLowerCase(Locale.ROOT);
            String raw = Files.readString(file, StandardCharsets.UTF_8);
            return name.endsWith(".json") ? parseJson(raw) : parseMarkdown(raw);
        } catch (IOException e) {
            throw new RuntimeException("Failed to read roster: " + file, e);
        }
    }

    public static Roster parseJson(String raw) {
        JsonNode root = Jsons.readTree(raw);
        if (root == null || !root.isObject()) {
            throw new IllegalArgumentException("Roster must be a JSON object");
        }
        List<RosterEntry> entries = new ArrayList<>();
        JsonNode agents = root.path("agents");
        if (agents.isObject()) {
            agents.fields().forEachRemaining(entry -> {
                JsonNode agent = entry.getValue();
                entries.add(new RosterEntry(
                        entry.getKey(),
                        textList(agent.path("capabilities")),
                        commandList(agent.path("command")),
                        agent.path("timeout_ms").asLong(0L)
                ));
            });
        }
        return new Roster(
                entries,
                textList(root.path("capabilities")),
                MatchPolicy.fromString(root.path("match_policy").asText(null))
        );
    }

    public static Roster parseMarkdown(String raw) {
        Map<String, Set<String>> capabilities = new LinkedHashMap<>();
        String currentAgent = null;
        String currentSection = null;
        for (String line : raw.split("\n")) {
            String stripped = line.strip();
            if (stripped.startsWith("##") && !stripped.startsWith("###")) {
                currentAgent = stripped.substring(2).strip();
                currentSection = null;
                if (!currentAgent.isEmpty()) {
                    capabilities.putIfAbsent(currentAgent, new LinkedHashSet<>());
                } else {
                    currentAgent = null;
                }
                continue;
            }
            if (currentAgent == null) {
                continue;
            }
            if (stripped.contains(":") && !stripped.startsWith("-")) {
                String section = stripped.toLowerCase(Locale.ROOT);
                currentSection = section.contains("capabilities") ? "capabilities" : "other";
                continue;
            }
            if ("capabilities".equals(currentSection) && stripped.startsWith("-")) {
                String item = stripped.substring(1).strip();
                if (!item.isEmpty()) {
                    capabilities.get(currentAgent).add(item);
                }
            }
        }
        List<RosterEntry> entries = new ArrayList<>();
        capabilities.forEach((agentId, tags) -> entries.add(new RosterEntry(agentId, tags, List.of(), 0L)));
        return new Roster(entries, List.of(), MatchPolicy.ANY);
    }

    public static void writeJson(Path file, Roster roster) throws IOException {
        Path parent = file.getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        ObjectNode root = Jsons.mapper().createObjectNode();
        root.put("match_policy", roster.matchPolicy().name().toLowerCase(Locale.ROOT));
        ArrayNode catalog = root.putArray("capabilities");
        roster.catalog().forEach(catalog::add);
        ObjectNode agents = root.putObject("agents");
        for (RosterEntry entry : roster.entries()) {
            ObjectNode agent = agents.putObject(entry.agentId());
            ArrayNode tags = agent.putArray("capabilities");
            entry.capabilities().forEach(tags::add);
            if (entry.scripted()) {
                ArrayNode command = agent.putArray("command");
                entry.command().forEach(command::add);
                agent.put("timeout_ms", entry.timeoutMs());
            }
        }
        Jsons.mapper().writerWithDefaultPrettyPrinter().writeValue(file.toFile(), root);
    }

    private static Set<String> textList(JsonNode node) {
        Set<String> out = new LinkedHashSet<>();
        if (node == null || !node.isArray()) {
            return out;
        }
        for (JsonNode item : node) {
            if (item != null && item.isTextual() && !item.asText().isBlank()) {
                out.add(item.asText());
            }
        }
        return out;
    }

    private static List<String> commandList(JsonNode node) {
        List<String> out = new ArrayList<>();
        if (node == null || !node.isArray()) {
            return out;
        }
        for (JsonNode item : node) {
            if (item != null && item.isTextual()) {
                out.add(item.asText());
            }
        }
        return out;
    }
}
