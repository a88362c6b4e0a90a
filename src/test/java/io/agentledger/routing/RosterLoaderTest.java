package io.agentledger.routing;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Set;
import java.util.stream.Stream;

final class RosterLoaderTest {

    @Test
    void parsesJsonRosterWithScriptedAgentAndPolicy() {
        Roster roster = RosterLoader.parseJson("""
                {
                  "match_policy": "all",
                  "capabilities": ["security_review"],
                  "agents": {
                    "probe": {"capabilities": ["Probe", "testing"]},
                    "linter": {"capabilities": ["lint"], "command": ["sh", "-c", "cat"], "timeout_ms": 2500}
                  }
                }
                """);

        Assertions.assertEquals(MatchPolicy.ALL, roster.matchPolicy());
        Assertions.assertEquals(List.of("linter", "probe"), roster.entries().stream().map(RosterEntry::agentId).toList());
        Assertions.assertEquals(Set.of("security_review", "lint", "probe", "testing"), roster.catalog());

        RosterEntry linter = roster.find("linter").orElseThrow();
        Assertions.assertTrue(linter.scripted());
        Assertions.assertEquals(List.of("sh", "-c", "cat"), linter.command());
        Assertions.assertEquals(2500L, linter.timeoutMs());
        Assertions.assertFalse(roster.find("probe").orElseThrow().scripted());
    }

    @Test
    void parsesMarkdownRosterIgnoringPermissions() {
        Roster roster = RosterLoader.parseMarkdown("""
                # Agent Roster

                ## librarian
                Role: routing and consolidation
                capabilities:
                - task_routing
                - spec_consolidation
                permissions:
                - write_ledger

                ## probe
                capabilities:
                - probe
                """);

        Assertions.assertEquals(MatchPolicy.ANY, roster.matchPolicy());
        Assertions.assertEquals(Set.of("task_routing", "spec_consolidation"),
                roster.find("librarian").orElseThrow().capabilities());
        Assertions.assertEquals(Set.of("probe"), roster.find("probe").orElseThrow().capabilities());
        Assertions.assertFalse(roster.catalog().contains("write_ledger"));
    }

    @Test
    void missingFileGivesEmptyRoster() {
        Roster roster = RosterLoader.load(Path.of("does-not-exist", "agent_roster.json"));
        Assertions.assertTrue(roster.entries().isEmpty());
        Assertions.assertTrue(roster.catalog().isEmpty());
    }

    @Test
    void writtenRosterLoadsBack() throws Exception {
        Path root = Files.createTempDirectory("agentledger-test-roster-");
        try {
            Path file = root.resolve("docs").resolve("agent_roster.json");
            Roster original = new Roster(
                    List.of(
                            RosterEntry.of("probe", "probe", "testing"),
                            new RosterEntry("linter", Set.of("lint"), List.of("sh", "-c", "cat"), 2_000L)
                    ),
                    List.of("security_review"),
                    MatchPolicy.ALL
            );

            RosterLoader.writeJson(file, original);
            Roster loaded = RosterLoader.load(file);

            Assertions.assertEquals(original.entries(), loaded.entries());
            Assertions.assertEquals(original.catalog(), loaded.catalog());
            Assertions.assertEquals(MatchPolicy.ALL, loaded.matchPolicy());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void markdownExtensionIsParsedAsMarkdown() throws Exception {
        Path root = Files.createTempDirectory("agentledger-test-roster-md-");
        try {
            Path file = root.resolve("agent_roster.md");
            Files.writeString(file, "## probe\ncapabilities:\n- probe\n", StandardCharsets.UTF_8);
            Assertions.assertEquals(Set.of("probe"), RosterLoader.load(file).catalog());
        } finally {
            deleteRecursively(root);
        }
    }

    @Test
    void markdownTagsAreOpaqueLabels() {
        Roster roster = RosterLoader.parseMarkdown("""
                ## researcher
                capabilities:
                - Web   Search
                - c++
                -
                ## probe
                capabilities:
                - probe
                """);

        Assertions.assertEquals(Set.of("web search", "c++"), roster.find("researcher").orElseThrow().capabilities());
        Assertions.assertEquals(Set.of("c++", "probe", "web search"), roster.catalog());
    }

    @Test
    void jsonTagsAreTrimmedAndBlankTagsDropped() {
        Roster roster = RosterLoader.parseJson("""
                {"agents": {"probe": {"capabilities": [" Two Words ", " ", "probe"], "command": ["echo", "a", "a"]}}}
                """);
        RosterEntry probe = roster.find("probe").orElseThrow();
        Assertions.assertEquals(Set.of("two words", "probe"), probe.capabilities());
        Assertions.assertEquals(List.of("echo", "a", "a"), probe.command());
    }

    @Test
    void rejectsDuplicateAgentsAndMalformedJson() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> Roster.of(RosterEntry.of("probe", "probe"), RosterEntry.of(" probe ", "testing")));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> RosterLoader.parseJson("[]"));
    }

    private static void deleteRecursively(Path root) throws IOException {
        if (root == null || !Files.exists(root)) {
            return;
        }
        try (Stream<Path> walk = Files.walk(root)) {
            for (Path path : walk.sorted((a, b) -> Integer.compare(b.getNameCount(), a.getNameCount())).toList()) {
                Files.deleteIfExists(path);
            }
        }
    }
}
