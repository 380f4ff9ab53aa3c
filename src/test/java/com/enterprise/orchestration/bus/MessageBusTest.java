package com.enterprise.orchestration.bus;

import com.enterprise.orchestration.MutableClock;
import com.enterprise.orchestration.core.ErrorKind;
import com.enterprise.orchestration.core.WorkerDescriptor;
import com.enterprise.orchestration.core.WorkerRoster;
import com.enterprise.orchestration.dlq.DeadLetterEntry;
import com.enterprise.orchestration.dlq.InMemoryDeadLetterQueue;
import com.enterprise.orchestration.events.EventPublisher;
import com.enterprise.orchestration.events.EventType;
import com.enterprise.orchestration.events.OrchestrationEvent;
import com.enterprise.orchestration.exception.ValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for message delivery, retry and dead-lettering
 */
class MessageBusTest {

    private EventPublisher events;
    private List<OrchestrationEvent> recorded;
    private InMemoryDeadLetterQueue dlq;
    private MessageBus bus;

    @BeforeEach
    void setUp() {
        events = new EventPublisher();
        recorded = new CopyOnWriteArrayList<>();
        events.subscribe(recorded::add);
        dlq = new InMemoryDeadLetterQueue(100, false, Duration.ofDays(1));
        bus = new MessageBus(RetryPolicy.Predefined.immediate(3), Duration.ofHours(1), dlq, events,
                             WorkerRoster.empty());
    }

    @Test
    void testDeliveryAfterOneTick() {
        List<Message> received = new CopyOnWriteArrayList<>();
        bus.subscribe("W1", List.of("assign"), received::add);

        // Publishing only enqueues
        String id = bus.publish(Message.builder().type("assign").to("W1").payload(Map.of("n", 1)).build());
        assertTrue(received.isEmpty());
        assertEquals(1, bus.getQueueStatus().getQueueSize());

        int delivered = bus.deliverPending();

        assertEquals(1, delivered);
        assertEquals(1, received.size());
        assertEquals(id, received.get(0).getId());
        assertEquals(MessageStatus.DELIVERED, received.get(0).getStatus());
        assertNotNull(received.get(0).getDeliveredAt());
        assertEquals(0, bus.getQueueStatus().getQueueSize());

        // Nothing left for a second tick
        assertEquals(0, bus.deliverPending());
        assertEquals(1, received.size());
    }

    @Test
    void testUnknownRecipientIsDeadLetteredAfterRetryBound() {
        Message message = Message.builder().type("assign").to("ghost").build();
        bus.publish(message);

        // One failed attempt per tick
        for (int i = 0; i < 5; i++) {
            bus.deliverPending();
        }

        assertEquals(MessageStatus.FAILED, message.getStatus());
        assertEquals(3, message.getRetryCount());
        assertEquals(ErrorKind.RECIPIENT_NOT_FOUND, message.getLastFailure());

        List<DeadLetterEntry> deadLetters = bus.getDeadLetters();
        assertEquals(1, deadLetters.size());
        assertEquals(message.getId(), deadLetters.get(0).getMessageId());
        assertEquals(3, deadLetters.get(0).getRetryCount());
        assertEquals(ErrorKind.RECIPIENT_NOT_FOUND, deadLetters.get(0).getErrorKind());

        long deadLetterEvents = recorded.stream()
            .filter(e -> e.getType() == EventType.MESSAGE_DEAD_LETTERED)
            .count();
        assertEquals(1, deadLetterEvents);
        long retryEvents = recorded.stream()
            .filter(e -> e.getType() == EventType.MESSAGE_RETRY_SCHEDULED)
            .count();
        assertEquals(2, retryEvents);
        assertEquals(0, bus.getQueueStatus().getQueueSize());
    }

    @Test
    void testUnsubscribedTypeFails() {
        List<Message> received = new CopyOnWriteArrayList<>();
        bus.subscribe("W1", List.of("assign"), received::add);

        Message message = Message.builder().type("report").to("W1").build();
        bus.publish(message);
        bus.deliverPending();

        assertTrue(received.isEmpty());
        assertEquals(1, message.getRetryCount());
        assertEquals(ErrorKind.TYPE_NOT_SUBSCRIBED, message.getLastFailure());
    }

    @Test
    void testWildcardSubscriptionReceivesEveryType() {
        List<Message> received = new CopyOnWriteArrayList<>();
        bus.subscribe("W1", List.of(MessageBus.ALL_TYPES), received::add);

        bus.publish(Message.builder().type("assign").to("W1").build());
        bus.publish(Message.builder().type("report").to("W1").build());
        bus.deliverPending();

        assertEquals(2, received.size());
    }

    @Test
    void testFailingHeadHoldsBackLaterMessages() {
        List<Message> received = new CopyOnWriteArrayList<>();
        bus.subscribe("W1", List.of("assign"), received::add);

        // The first message can never be delivered to W1
        Message blocked = Message.builder().type("report").to("W1").build();
        Message later = Message.builder().type("assign").to("W1").build();
        bus.publish(blocked);
        bus.publish(later);

        bus.deliverPending();
        bus.deliverPending();
        assertTrue(received.isEmpty());
        assertEquals(MessageStatus.PENDING, later.getStatus());

        // Third failure dead-letters the head and releases the queue behind it
        bus.deliverPending();
        assertEquals(MessageStatus.FAILED, blocked.getStatus());
        assertEquals(1, received.size());
        assertEquals(later.getId(), received.get(0).getId());
    }

    @Test
    void testPublishOrderPerRecipient() {
        List<Message> received = new CopyOnWriteArrayList<>();
        bus.subscribe("W1", List.of("step"), received::add);

        for (int i = 0; i < 5; i++) {
            bus.publish(Message.builder().type("step").to("W1").payload(i).build());
        }
        bus.deliverPending();

        assertEquals(5, received.size());
        for (int i = 0; i < 5; i++) {
            assertEquals(i, received.get(i).getPayload());
        }
    }

    @Test
    void testLinearBackOff() {
        MutableClock clock = new MutableClock(Instant.parse("2026-01-01T00:00:00Z"));
        MessageBus timedBus = new MessageBus(RetryPolicy.Predefined.standard(), Duration.ofHours(1), dlq, events,
                                             WorkerRoster.empty(), clock);

        Message message = Message.builder().type("assign").to("ghost").createdAt(clock.instant()).build();
        timedBus.publish(message);

        // First failure schedules a retry one second out
        timedBus.deliverPending();
        assertEquals(1, message.getRetryCount());

        // Not due yet
        timedBus.deliverPending();
        assertEquals(1, message.getRetryCount());

        clock.advance(Duration.ofSeconds(1));
        timedBus.deliverPending();
        assertEquals(2, message.getRetryCount());

        // Second retry waits two seconds
        clock.advance(Duration.ofSeconds(1));
        timedBus.deliverPending();
        assertEquals(2, message.getRetryCount());

        clock.advance(Duration.ofSeconds(1));
        timedBus.deliverPending();
        assertEquals(3, message.getRetryCount());
        assertEquals(MessageStatus.FAILED, message.getStatus());
        assertEquals(1, dlq.size());
    }

    @Test
    void testRetryDelayIsCapped() {
        RetryPolicy policy = RetryPolicy.builder()
            .maxRetries(10)
            .baseDelay(Duration.ofSeconds(5))
            .maxDelay(Duration.ofSeconds(12))
            .build();
        Message message = Message.builder().type("assign").to("W1").build();

        assertEquals(Duration.ofSeconds(5), policy.getRetryDelay(message, 1));
        assertEquals(Duration.ofSeconds(10), policy.getRetryDelay(message, 2));
        assertEquals(Duration.ofSeconds(12), policy.getRetryDelay(message, 3));
        assertTrue(policy.shouldRetry(message, 9));
        assertFalse(policy.shouldRetry(message, 10));
    }

    @Test
    void testSubscriberExceptionDoesNotRetry() {
        bus.subscribe("W1", List.of("assign"), m -> {
            throw new IllegalStateException("handler failed");
        });

        Message message = Message.builder().type("assign").to("W1").build();
        bus.publish(message);

        assertEquals(1, bus.deliverPending());
        assertEquals(MessageStatus.DELIVERED, message.getStatus());
        assertEquals(0, message.getRetryCount());
        assertEquals(0, dlq.size());
    }

    @Test
    void testBroadcastReachesEveryoneButSender() {
        List<Message> w1 = new CopyOnWriteArrayList<>();
        List<Message> w2 = new CopyOnWriteArrayList<>();
        List<Message> w3 = new CopyOnWriteArrayList<>();
        bus.subscribe("W1", List.of("announce"), w1::add);
        bus.subscribe("W2", List.of("announce"), w2::add);
        bus.subscribe("W3", List.of("announce"), w3::add);

        Message original = Message.builder().type("announce").from("W1").to(Message.BROADCAST)
            .payload("hello").build();
        List<Message> copies = bus.broadcast(original);

        assertEquals(2, copies.size());
        assertTrue(copies.stream().noneMatch(c -> c.getId().equals(original.getId())));
        assertEquals(2, copies.stream().map(Message::getId).distinct().count());

        bus.deliverPending();
        assertTrue(w1.isEmpty());
        assertEquals(1, w2.size());
        assertEquals(1, w3.size());
        assertEquals("hello", w2.get(0).getPayload());
        assertEquals("W2", w2.get(0).getTo());
    }

    @Test
    void testPublishToBroadcastAddressFansOut() {
        List<Message> w2 = new CopyOnWriteArrayList<>();
        bus.subscribe("W2", List.of("announce"), w2::add);

        bus.publish(Message.builder().type("announce").from("W1").to(Message.BROADCAST).build());
        bus.deliverPending();

        assertEquals(1, w2.size());
    }

    @Test
    void testBroadcastParksCopiesForLateSubscribers() {
        WorkerRoster roster = WorkerRoster.of(List.of(
            WorkerDescriptor.idle("W1", "leader", Set.of()),
            WorkerDescriptor.idle("W2", "developer", Set.of()),
            WorkerDescriptor.idle("W3", "researcher", Set.of())));
        MessageBus rosterBus = new MessageBus(RetryPolicy.Predefined.immediate(3), Duration.ofHours(1), dlq,
                                              events, roster);

        rosterBus.broadcast(Message.builder().type("announce").from("W1").to(Message.BROADCAST).build());

        // Neither W2 nor W3 has subscribed yet
        QueueStatus status = rosterBus.getQueueStatus();
        assertEquals(0, status.getQueueSize());
        assertEquals(2, status.getParkedCount());

        List<Message> w2 = new CopyOnWriteArrayList<>();
        rosterBus.subscribe("W2", List.of("announce"), w2::add);
        assertEquals(1, rosterBus.getQueueStatus().getQueueSize());
        assertEquals(1, rosterBus.getQueueStatus().getParkedCount());

        rosterBus.deliverPending();
        assertEquals(1, w2.size());
        assertEquals(0, dlq.size());
    }

    @Test
    void testUnsubscribeStopsDelivery() {
        List<Message> received = new CopyOnWriteArrayList<>();
        bus.subscribe("W1", List.of("assign"), received::add);
        assertTrue(bus.unsubscribe("W1"));
        assertFalse(bus.unsubscribe("W1"));
        assertFalse(bus.isSubscribed("W1"));

        Message message = Message.builder().type("assign").to("W1").build();
        bus.publish(message);
        bus.deliverPending();

        assertTrue(received.isEmpty());
        assertEquals(ErrorKind.RECIPIENT_NOT_FOUND, message.getLastFailure());
    }

    @Test
    void testSubscribeValidation() {
        assertThrows(ValidationException.class, () -> bus.subscribe("", List.of("a"), m -> { }));
        assertThrows(ValidationException.class, () -> bus.subscribe(Message.BROADCAST, List.of("a"), m -> { }));
        assertThrows(ValidationException.class, () -> bus.subscribe("W1", List.of(), m -> { }));
    }

    @Test
    void testMessageCannotBePublishedTwice() {
        bus.subscribe("W1", List.of("assign"), m -> { });
        Message message = Message.builder().type("assign").to("W1").build();
        bus.publish(message);
        bus.deliverPending();

        assertThrows(ValidationException.class, () -> bus.publish(message));
    }

    @Test
    void testMessageBuilderValidation() {
        assertThrows(ValidationException.class, () -> Message.builder().to("W1").build());
        assertThrows(ValidationException.class, () -> Message.builder().type("assign").build());
        assertThrows(ValidationException.class, () -> Message.builder().type("assign").from(" ").to("W1").build());

        Message message = Message.builder().type("assign").to("W1").build();
        assertEquals(Message.SYSTEM, message.getFrom());
        assertEquals(Priority.NORMAL, message.getPriority());
        assertEquals(MessageStatus.PENDING, message.getStatus());
    }

    @Test
    void testHistoryAndStats() {
        bus.subscribe("W1", List.of("assign"), m -> { });
        bus.subscribe("W2", List.of("assign"), m -> { });

        bus.publish(Message.builder().type("assign").from("W2").to("W1").build());
        bus.publish(Message.builder().type("assign").from("W1").to("W2").build());
        bus.publish(Message.builder().type("report").from("W1").to("W2").build());
        bus.deliverPending();

        List<Message> history = bus.getHistory("W1");
        assertEquals(3, history.size());
        assertTrue(bus.getHistory("W3").isEmpty());

        Map<String, MessageTypeStats> stats = bus.getStats();
        assertEquals(2, stats.get("assign").getTotal());
        assertEquals(2, stats.get("assign").getDelivered());
        assertEquals(1, stats.get("report").getTotal());
        assertEquals(1, stats.get("report").getPending());

        assertTrue(bus.getMessage(history.get(0).getId()).isPresent());
        assertFalse(bus.getMessage("missing").isPresent());
    }

    @Test
    void testCleanupHistoryKeepsPendingMessages() {
        MutableClock clock = new MutableClock(Instant.now());
        MessageBus timedBus = new MessageBus(RetryPolicy.Predefined.immediate(3), Duration.ofHours(1), dlq, events,
                                             WorkerRoster.empty(), clock);
        timedBus.subscribe("W1", List.of("assign"), m -> { });

        timedBus.publish(Message.builder().type("assign").to("W1").createdAt(clock.instant()).build());
        timedBus.deliverPending();
        timedBus.publish(Message.builder().type("report").to("W1").createdAt(clock.instant()).build());

        clock.advance(Duration.ofHours(2));
        int removed = timedBus.cleanupHistory();

        // Only the delivered message is old enough and settled
        assertEquals(1, removed);
        assertEquals(1, timedBus.getQueueStatus().getTotalMessages());
        assertTrue(recorded.stream().anyMatch(e -> e.getType() == EventType.HISTORY_CLEANED));
    }

    @Test
    void testCleanupHistoryDeadLettersStaleParkedCopies() {
        MutableClock clock = new MutableClock(Instant.parse("2026-04-01T09:00:00Z"));
        WorkerRoster roster = WorkerRoster.of(List.of(
            WorkerDescriptor.idle("W1", "leader", Set.of()),
            WorkerDescriptor.idle("ghost", "developer", Set.of())));
        MessageBus rosterBus = new MessageBus(RetryPolicy.Predefined.immediate(3), Duration.ofHours(24), dlq,
                                              events, roster, clock);

        for (int i = 0; i < 5; i++) {
            rosterBus.broadcast(Message.builder().type("announce").from("W1").to(Message.BROADCAST)
                .createdAt(clock.instant()).build());
        }
        assertEquals(5, rosterBus.getQueueStatus().getParkedCount());

        // Still inside the retention window
        clock.advance(Duration.ofHours(12));
        assertEquals(0, rosterBus.cleanupHistory());
        assertEquals(5, rosterBus.getQueueStatus().getParkedCount());

        clock.advance(Duration.ofDays(30));
        assertEquals(5, rosterBus.cleanupHistory());

        QueueStatus status = rosterBus.getQueueStatus();
        assertEquals(0, status.getParkedCount());
        assertEquals(0, status.getTotalMessages());
        assertEquals(5, dlq.size());
        DeadLetterEntry entry = dlq.list().get(0);
        assertEquals("ghost", entry.getRecipient());
        assertEquals(ErrorKind.RECIPIENT_NOT_FOUND, entry.getErrorKind());
        assertEquals(MessageStatus.FAILED, entry.getMessage().getStatus());

        // A late subscription finds nothing left to release
        List<Message> received = new CopyOnWriteArrayList<>();
        rosterBus.subscribe("ghost", List.of("announce"), received::add);
        assertEquals(0, rosterBus.deliverPending());
        assertTrue(received.isEmpty());
    }
}
