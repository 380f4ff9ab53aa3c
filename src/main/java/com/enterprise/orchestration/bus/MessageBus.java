package com.enterprise.orchestration.bus;

import com.enterprise.orchestration.core.ErrorKind;
import com.enterprise.orchestration.core.WorkerRoster;
import com.enterprise.orchestration.dlq.DeadLetterEntry;
import com.enterprise.orchestration.dlq.DeadLetterQueue;
import com.enterprise.orchestration.events.EventPublisher;
import com.enterprise.orchestration.events.EventType;
import com.enterprise.orchestration.events.OrchestrationEvent;
import com.enterprise.orchestration.exception.DeliveryException;
import com.enterprise.orchestration.exception.RecipientNotFoundException;
import com.enterprise.orchestration.exception.TypeNotSubscribedException;
import com.enterprise.orchestration.exception.ValidationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Collectors;

/**
 * Typed publish/subscribe delivery with retry and dead-lettering.
 * <p>
 * {@link #publish(Message)} and {@link #broadcast(Message)} only enqueue. Actual delivery
 * happens in {@link #deliverPending()}, which the orchestrator calls on a fixed tick.
 * Messages to the same recipient are delivered in publish order: a message waiting for a
 * retry holds back the messages queued behind it.
 */
public class MessageBus {

    private static final Logger logger = LoggerFactory.getLogger(MessageBus.class);

    public static final String ALL_TYPES = "*";

    private final RetryPolicy retryPolicy;
    private final Duration historyRetention;
    private final DeadLetterQueue deadLetterQueue;
    private final EventPublisher events;
    private final WorkerRoster roster;
    private final Clock clock;

    // Guards every table below; never held while a sink runs
    private final ReentrantLock dataLock = new ReentrantLock();
    // Serializes delivery ticks
    private final ReentrantLock tickLock = new ReentrantLock();

    private final Map<String, Subscription> subscriptions = new LinkedHashMap<>();
    private final Map<String, Deque<Message>> recipientQueues = new LinkedHashMap<>();
    private final Map<String, List<Message>> parked = new LinkedHashMap<>();
    private final List<Message> history = new ArrayList<>();

    public MessageBus(RetryPolicy retryPolicy, Duration historyRetention, DeadLetterQueue deadLetterQueue,
                      EventPublisher events, WorkerRoster roster) {
        this(retryPolicy, historyRetention, deadLetterQueue, events, roster, Clock.systemUTC());
    }

    public MessageBus(RetryPolicy retryPolicy, Duration historyRetention, DeadLetterQueue deadLetterQueue,
                      EventPublisher events, WorkerRoster roster, Clock clock) {
        this.retryPolicy = Objects.requireNonNull(retryPolicy, "Retry policy cannot be null");
        this.historyRetention = Objects.requireNonNull(historyRetention, "History retention cannot be null");
        this.deadLetterQueue = Objects.requireNonNull(deadLetterQueue, "Dead letter queue cannot be null");
        this.events = Objects.requireNonNull(events, "Event publisher cannot be null");
        this.roster = roster != null ? roster : WorkerRoster.empty();
        this.clock = clock;
    }

    /**
     * Registers interest in the given message types, replacing any earlier subscription of the worker.
     * Broadcast copies parked for the worker are queued behind its pending messages.
     *
     * @param workerId     the subscribing worker
     * @param messageTypes types to receive; {@code "*"} receives every type
     * @param sink         callback invoked on delivery
     */
    public void subscribe(String workerId, Collection<String> messageTypes, MessageSink sink) {
        if (workerId == null || workerId.isBlank()) {
            throw new ValidationException("Subscriber id is required");
        }
        if (Message.BROADCAST.equals(workerId)) {
            throw new ValidationException("'" + Message.BROADCAST + "' is not a valid subscriber id");
        }
        if (messageTypes == null || messageTypes.isEmpty()) {
            throw new ValidationException("Subscriber " + workerId + " must name at least one message type");
        }
        Objects.requireNonNull(sink, "Message sink cannot be null");

        int released;
        dataLock.lock();
        try {
            subscriptions.put(workerId, new Subscription(new LinkedHashSet<>(messageTypes), sink));
            List<Message> waiting = parked.remove(workerId);
            released = waiting != null ? waiting.size() : 0;
            if (waiting != null) {
                Deque<Message> queue = recipientQueues.computeIfAbsent(workerId, k -> new ArrayDeque<>());
                queue.addAll(waiting);
            }
        } finally {
            dataLock.unlock();
        }

        logger.info("Worker {} subscribed to {}", workerId, messageTypes);
        if (released > 0) {
            logger.debug("Queued {} parked broadcast messages for {}", released, workerId);
        }
        events.publish(OrchestrationEvent.of(EventType.SUBSCRIBER_ADDED, workerId,
            Map.of("messageTypes", List.copyOf(messageTypes), "released", released)));
    }

    /**
     * Removes the worker's subscription. Messages already queued for it stay queued and
     * fail with {@link ErrorKind#RECIPIENT_NOT_FOUND} until the worker subscribes again.
     *
     * @return true if a subscription was removed
     */
    public boolean unsubscribe(String workerId) {
        boolean removed;
        dataLock.lock();
        try {
            removed = subscriptions.remove(workerId) != null;
        } finally {
            dataLock.unlock();
        }
        if (removed) {
            logger.info("Worker {} unsubscribed", workerId);
            events.publish(OrchestrationEvent.of(EventType.SUBSCRIBER_REMOVED, workerId));
        }
        return removed;
    }

    public boolean isSubscribed(String workerId) {
        dataLock.lock();
        try {
            return subscriptions.containsKey(workerId);
        } finally {
            dataLock.unlock();
        }
    }

    /**
     * Enqueues a message for asynchronous delivery. Never blocks on delivery.
     * A message addressed to {@code "broadcast"} is fanned out through {@link #broadcast(Message)}.
     *
     * @return the id of the queued message
     */
    public String publish(Message message) {
        validate(message);
        if (message.isBroadcast()) {
            broadcast(message);
            return message.getId();
        }

        dataLock.lock();
        try {
            history.add(message);
            recipientQueues.computeIfAbsent(message.getTo(), k -> new ArrayDeque<>()).addLast(message);
        } finally {
            dataLock.unlock();
        }

        logger.debug("Message {} ({}) queued from {} to {}",
                    message.getId(), message.getType(), message.getFrom(), message.getTo());
        events.publish(OrchestrationEvent.of(EventType.MESSAGE_PUBLISHED, message.getId(),
            Map.of("type", message.getType(), "from", message.getFrom(), "to", message.getTo())));
        return message.getId();
    }

    /**
     * Fans out one copy of the message, with a fresh id, to every subscriber and every roster
     * member except the sender. Every copy is recorded in history. Copies for workers without a
     * live subscription are parked and queued once the worker subscribes, for at most the history
     * retention.
     *
     * @return the copies, in recipient order
     */
    public List<Message> broadcast(Message message) {
        validate(message);
        Instant now = clock.instant();

        List<Message> copies = new ArrayList<>();
        int parkedCopies = 0;
        dataLock.lock();
        try {
            Set<String> recipients = new LinkedHashSet<>(subscriptions.keySet());
            recipients.addAll(roster.workerIds());
            recipients.remove(message.getFrom());
            recipients.remove(Message.SYSTEM);

            for (String recipient : recipients) {
                Message copy = message.copyFor(recipient, now);
                history.add(copy);
                if (subscriptions.containsKey(recipient)) {
                    recipientQueues.computeIfAbsent(recipient, k -> new ArrayDeque<>()).addLast(copy);
                } else {
                    parked.computeIfAbsent(recipient, k -> new ArrayList<>()).add(copy);
                    parkedCopies++;
                }
                copies.add(copy);
            }
        } finally {
            dataLock.unlock();
        }

        logger.debug("Broadcast {} from {} fanned out to {} recipients ({} parked)",
                    message.getType(), message.getFrom(), copies.size(), parkedCopies);
        events.publish(OrchestrationEvent.of(EventType.MESSAGE_BROADCAST, message.getId(),
            Map.of("type", message.getType(), "from", message.getFrom(),
                   "recipients", copies.size(), "parked", parkedCopies)));
        return copies;
    }

    /**
     * One delivery tick. Walks every recipient queue in order and attempts each due message.
     * Failed attempts are retried after a linear back-off; a message that reaches the retry bound
     * is marked failed and moved to the dead letter queue.
     *
     * @return the number of messages delivered in this tick
     */
    public int deliverPending() {
        tickLock.lock();
        try {
            Instant now = clock.instant();
            List<PendingDelivery> deliveries = new ArrayList<>();
            List<Message> retried = new ArrayList<>();
            List<DeadLetter> deadLetters = new ArrayList<>();

            dataLock.lock();
            try {
                for (Map.Entry<String, Deque<Message>> entry : recipientQueues.entrySet()) {
                    Deque<Message> queue = entry.getValue();
                    while (!queue.isEmpty()) {
                        Message head = queue.peekFirst();
                        if (!head.isDue(now)) {
                            break;
                        }
                        try {
                            Subscription subscription = resolve(head);
                            head.markDelivered(now);
                            queue.pollFirst();
                            deliveries.add(new PendingDelivery(subscription.sink, head));
                        } catch (DeliveryException e) {
                            int retryCount = head.recordFailure(e.getErrorKind());
                            if (retryPolicy.shouldRetry(head, retryCount)) {
                                head.scheduleRetry(now.plus(retryPolicy.getRetryDelay(head, retryCount)));
                                retried.add(head);
                                break;
                            }
                            head.markFailed();
                            queue.pollFirst();
                            deadLetters.add(new DeadLetter(head, e.getMessage()));
                        }
                    }
                }
                recipientQueues.values().removeIf(Deque::isEmpty);
            } finally {
                dataLock.unlock();
            }

            for (PendingDelivery delivery : deliveries) {
                invokeSafely(delivery);
            }
            for (Message message : retried) {
                logger.debug("Delivery of message {} to {} failed ({}), retry {} of {}",
                            message.getId(), message.getTo(), message.getLastFailure(),
                            message.getRetryCount(), retryPolicy.getMaxRetries());
                events.publish(OrchestrationEvent.of(EventType.MESSAGE_RETRY_SCHEDULED, message.getId(),
                    Map.of("to", message.getTo(), "retryCount", message.getRetryCount(),
                           "errorKind", message.getLastFailure())));
            }
            for (DeadLetter deadLetter : deadLetters) {
                moveToDeadLetterQueue(deadLetter, now);
            }
            return deliveries.size();
        } finally {
            tickLock.unlock();
        }
    }

    /**
     * Messages the worker sent or received, ordered by creation time
     */
    public List<Message> getHistory(String workerId) {
        dataLock.lock();
        try {
            return history.stream()
                .filter(m -> m.involves(workerId))
                .sorted(Comparator.comparing(Message::getCreatedAt))
                .collect(Collectors.toList());
        } finally {
            dataLock.unlock();
        }
    }

    public Optional<Message> getMessage(String messageId) {
        dataLock.lock();
        try {
            return history.stream().filter(m -> m.getId().equals(messageId)).findFirst();
        } finally {
            dataLock.unlock();
        }
    }

    /**
     * Counts of retained messages by type and status
     */
    public Map<String, MessageTypeStats> getStats() {
        dataLock.lock();
        try {
            Map<String, MessageTypeStats> stats = new TreeMap<>();
            for (Message message : history) {
                stats.computeIfAbsent(message.getType(), k -> new MessageTypeStats()).record(message.getStatus());
            }
            return stats;
        } finally {
            dataLock.unlock();
        }
    }

    public QueueStatus getQueueStatus() {
        dataLock.lock();
        try {
            int queued = recipientQueues.values().stream().mapToInt(Deque::size).sum();
            int parkedCount = parked.values().stream().mapToInt(List::size).sum();
            return new QueueStatus(queued, parkedCount, subscriptions.size(), history.size(),
                                   deadLetterQueue.size(), clock.instant());
        } finally {
            dataLock.unlock();
        }
    }

    /**
     * Drops delivered and failed messages older than the history retention.
     * Broadcast copies parked that long for a worker that never subscribed are dead-lettered
     * with {@link ErrorKind#RECIPIENT_NOT_FOUND} first. Queued messages are kept regardless of age.
     *
     * @return the number of messages removed
     */
    public int cleanupHistory() {
        Instant now = clock.instant();
        Instant cutoff = now.minus(historyRetention);
        List<DeadLetter> expiredCopies = new ArrayList<>();
        int removed;
        dataLock.lock();
        try {
            Iterator<Map.Entry<String, List<Message>>> recipients = parked.entrySet().iterator();
            while (recipients.hasNext()) {
                Map.Entry<String, List<Message>> entry = recipients.next();
                entry.getValue().removeIf(copy -> {
                    if (!copy.getCreatedAt().isBefore(cutoff)) {
                        return false;
                    }
                    copy.recordFailure(ErrorKind.RECIPIENT_NOT_FOUND);
                    copy.markFailed();
                    expiredCopies.add(new DeadLetter(copy,
                        "Recipient " + entry.getKey() + " did not subscribe within " + historyRetention));
                    return true;
                });
                if (entry.getValue().isEmpty()) {
                    recipients.remove();
                }
            }

            int before = history.size();
            history.removeIf(m -> m.getStatus() != MessageStatus.PENDING && m.getCreatedAt().isBefore(cutoff));
            removed = before - history.size();
        } finally {
            dataLock.unlock();
        }

        for (DeadLetter deadLetter : expiredCopies) {
            moveToDeadLetterQueue(deadLetter, now);
        }
        if (removed > 0) {
            logger.info("Cleaned up {} messages older than {}", removed, historyRetention);
            events.publish(OrchestrationEvent.of(EventType.HISTORY_CLEANED, null, Map.of("removed", removed)));
        }
        return removed;
    }

    public List<DeadLetterEntry> getDeadLetters() {
        return deadLetterQueue.list();
    }

    /**
     * Drops dead letters older than the queue's retention, measured on this bus's clock
     */
    public int purgeDeadLetters() {
        return deadLetterQueue.purgeExpired(clock.instant());
    }

    public DeadLetterQueue getDeadLetterQueue() {
        return deadLetterQueue;
    }

    private Subscription resolve(Message message) throws DeliveryException {
        Subscription subscription = subscriptions.get(message.getTo());
        if (subscription == null) {
            throw new RecipientNotFoundException(message.getId(), message.getTo());
        }
        if (!subscription.accepts(message.getType())) {
            throw new TypeNotSubscribedException(message.getId(), message.getTo(), message.getType());
        }
        return subscription;
    }

    private void invokeSafely(PendingDelivery delivery) {
        Message message = delivery.message;
        try {
            delivery.sink.onMessage(message);
        } catch (Exception e) {
            logger.warn("Subscriber {} threw while handling message {} ({}): {}",
                       message.getTo(), message.getId(), message.getType(), e.getMessage(), e);
        }
        logger.debug("Message {} delivered to {}", message.getId(), message.getTo());
        events.publish(OrchestrationEvent.of(EventType.MESSAGE_DELIVERED, message.getId(),
            Map.of("type", message.getType(), "to", message.getTo())));
    }

    private void moveToDeadLetterQueue(DeadLetter deadLetter, Instant lastAttempt) {
        Message message = deadLetter.message;
        boolean stored = deadLetterQueue.add(message, deadLetter.reason, lastAttempt);
        logger.warn("Message {} ({}) to {} dead-lettered after {} attempts: {}",
                   message.getId(), message.getType(), message.getTo(), message.getRetryCount(), deadLetter.reason);

        Map<String, Object> attributes = new LinkedHashMap<>();
        attributes.put("type", message.getType());
        attributes.put("to", message.getTo());
        attributes.put("retryCount", message.getRetryCount());
        attributes.put("errorKind", ErrorKind.RETRY_EXHAUSTED);
        attributes.put("lastFailure", message.getLastFailure());
        attributes.put("stored", stored);
        events.publish(OrchestrationEvent.of(EventType.MESSAGE_DEAD_LETTERED, message.getId(), attributes));
    }

    private static void validate(Message message) {
        if (message == null) {
            throw new ValidationException("Message cannot be null");
        }
        if (message.getStatus() != MessageStatus.PENDING || message.getRetryCount() != 0) {
            throw new ValidationException("Message " + message.getId() + " has already been published");
        }
    }

    private static final class Subscription {
        private final Set<String> messageTypes;
        private final MessageSink sink;

        private Subscription(Set<String> messageTypes, MessageSink sink) {
            this.messageTypes = messageTypes;
            this.sink = sink;
        }

        private boolean accepts(String type) {
            return messageTypes.contains(ALL_TYPES) || messageTypes.contains(type);
        }
    }

    private static final class PendingDelivery {
        private final MessageSink sink;
        private final Message message;

        private PendingDelivery(MessageSink sink, Message message) {
            this.sink = sink;
            this.message = message;
        }
    }

    private static final class DeadLetter {
        private final Message message;
        private final String reason;

        private DeadLetter(Message message, String reason) {
            this.message = message;
            this.reason = reason;
        }
    }
}
