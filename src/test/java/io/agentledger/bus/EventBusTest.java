package io.agentledger.bus;

import io.agentledger.model.Message;
import io.agentledger.model.MessageType;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

final class EventBusTest {

    @Test
    void addressedMessageReachesOnlyItsRecipient() {
        EventBus bus = new EventBus();
        List<String> seen = new ArrayList<>();
        bus.subscribe("probe", MessageType.DELEGATED_TASK, m -> seen.add("probe:" + m.taskId()));
        bus.subscribe("writer", MessageType.DELEGATED_TASK, m -> seen.add("writer:" + m.taskId()));

        int delivered = bus.publish(Message.delegated("TASK-000001", "probe task", "librarian", "probe"));

        Assertions.assertEquals(1, delivered);
        Assertions.assertEquals(List.of("probe:TASK-000001"), seen);
    }

    @Test
    void broadcastReachesEverySubscriberInRegistrationOrder() {
        EventBus bus = new EventBus();
        List<String> seen = new ArrayList<>();
        bus.subscribe("b", MessageType.TASK_COMPLETE, m -> seen.add("b"));
        bus.subscribe("a", MessageType.TASK_COMPLETE, m -> seen.add("a"));
        bus.subscribe("c", MessageType.TASK_FAILED, m -> seen.add("c"));

        int delivered = bus.publish(Message.taskComplete("probe", "TASK-000001", null));

        Assertions.assertEquals(2, delivered);
        Assertions.assertEquals(List.of("b", "a"), seen);
    }

    @Test
    void messageWithoutSubscriberIsDroppedAndCounted() {
        EventBus bus = new EventBus();
        bus.subscribe("librarian", MessageType.NEW_TASK, m -> {
        });

        Assertions.assertEquals(0, bus.publish(Message.delegated("TASK-000001", "x", "librarian", "probe")));
        Assertions.assertEquals(0, bus.publish(Message.newTask("TASK-000002", "x", "manager", "nobody")));
        Assertions.assertEquals(2L, bus.droppedCount());
    }

    @Test
    void handlersMayPublishAndSubscribeDuringDelivery() {
        EventBus bus = new EventBus();
        List<String> seen = new ArrayList<>();
        bus.subscribe("librarian", MessageType.TASK_COMPLETE, m -> seen.add("router:" + m.taskId()));
        bus.subscribe("probe", MessageType.DELEGATED_TASK, m -> {
            bus.subscribe("late", MessageType.DELEGATED_TASK, late -> seen.add("late:" + late.taskId()));
            bus.publish(Message.taskComplete("probe", m.taskId(), m.fromAgent()));
            seen.add("probe:" + m.taskId());
        });

        bus.publish(Message.delegated("TASK-000001", "x", "librarian", null));

        // the late subscriber was not part of the snapshot taken for this delivery
        Assertions.assertEquals(List.of("router:TASK-000001", "probe:TASK-000001"), seen);
        Assertions.assertTrue(bus.hasSubscriber("late", MessageType.DELEGATED_TASK));
    }

    @Test
    void unsubscribeAllAndClearRemoveHandlers() {
        EventBus bus = new EventBus();
        bus.subscribe("probe", MessageType.DELEGATED_TASK, m -> {
        });
        bus.subscribe("probe", MessageType.NEW_TASK, m -> {
        });
        bus.subscribe("librarian", MessageType.TASK_COMPLETE, m -> {
        });

        Assertions.assertEquals(2, bus.unsubscribeAll("probe"));
        Assertions.assertFalse(bus.hasSubscriber("probe", MessageType.DELEGATED_TASK));
        Assertions.assertTrue(bus.hasSubscriber("librarian", MessageType.TASK_COMPLETE));

        bus.clear();
        Assertions.assertFalse(bus.hasSubscriber("librarian", MessageType.TASK_COMPLETE));
    }

    @Test
    void subscribeRejectsMissingIdentity() {
        EventBus bus = new EventBus();
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> bus.subscribe(" ", MessageType.NEW_TASK, m -> {
                }));
    }
}
