package io.agentledger.storage;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.List;

final class LedgerTest {
    private static final Path LEDGER = Path.of("ws", "logs", "active_spec.md");

    @Test
    void initializeWritesHeaderOnce() {
        InMemoryStateStore store = new InMemoryStateStore();
        Ledger ledger = new Ledger(store, LEDGER);

        ledger.initialize();
        ledger.initialize();

        Assertions.assertEquals("# Active Specification\n\n", store.read(LEDGER));
        Assertions.assertTrue(ledger.taskIds().isEmpty());
    }

    @Test
    void appendedBlocksCarryTaskAndAgentInConsolidationOrder() {
        InMemoryStateStore store = new InMemoryStateStore();
        Ledger ledger = new Ledger(store, LEDGER);
        ledger.initialize();

        Assertions.assertTrue(ledger.append("TASK-000002", "probe", "second report"));
        Assertions.assertTrue(ledger.append("TASK-000001", "writer", "first report"));

        String content = store.read(LEDGER);
        Assertions.assertTrue(content.startsWith("# Active Specification\n\n"));
        Assertions.assertTrue(content.contains("\n\n---\n## Task: TASK-000002 (by probe)\n\nsecond report\n"));
        Assertions.assertEquals(List.of("TASK-000002", "TASK-000001"), ledger.taskIds());
        Assertions.assertTrue(ledger.contains("TASK-000001"));
        Assertions.assertFalse(ledger.contains("TASK-000003"));
    }

    @Test
    void secondAppendForSameTaskIsSkipped() {
        InMemoryStateStore store = new InMemoryStateStore();
        Ledger ledger = new Ledger(store, LEDGER);
        ledger.initialize();

        Assertions.assertTrue(ledger.append("TASK-000001", "probe", "report"));
        Assertions.assertFalse(ledger.append("TASK-000001", "probe", "report again"));

        Assertions.assertEquals(List.of("TASK-000001"), ledger.taskIds());
        Assertions.assertFalse(store.read(LEDGER).contains("report again"));
    }

    @Test
    void taskIdPrefixDoesNotMatchLongerIdentifier() {
        InMemoryStateStore store = new InMemoryStateStore();
        Ledger ledger = new Ledger(store, LEDGER);
        ledger.initialize();
        ledger.append("TASK-0000010", "probe", "report");

        Assertions.assertFalse(ledger.contains("TASK-000001"));
    }

    @Test
    void headingForAnotherTaskInsideContentIsNotAnEntry() {
        InMemoryStateStore store = new InMemoryStateStore();
        Ledger ledger = new Ledger(store, LEDGER);
        ledger.initialize();

        String outline = "intro\n## Task: TASK-000002 (draft outline)\n---\n## Task: TASK-000003 (by writer)\nend";
        Assertions.assertTrue(ledger.append("TASK-000001", "writer", outline));

        Assertions.assertEquals(List.of("TASK-000001"), ledger.taskIds());
        Assertions.assertFalse(ledger.contains("TASK-000002"));
        Assertions.assertFalse(ledger.contains("TASK-000003"));
        Assertions.assertTrue(store.read(LEDGER).contains("\n ## Task: TASK-000002 (draft outline)\n"));

        Assertions.assertTrue(ledger.append("TASK-000002", "writer", "second draft"));
        Assertions.assertTrue(ledger.append("TASK-000003", "writer", "third draft"));
        Assertions.assertEquals(List.of("TASK-000001", "TASK-000002", "TASK-000003"), ledger.taskIds());
    }

    @Test
    void missingLedgerFileHasNoEntries() {
        Ledger ledger = new Ledger(new InMemoryStateStore(), LEDGER);
        Assertions.assertFalse(ledger.contains("TASK-000001"));
        Assertions.assertTrue(ledger.taskIds().isEmpty());
    }
}
