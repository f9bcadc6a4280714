package com.hivemind.core.bus;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Consumer;

/**
 * In-memory pub/sub bus for inter-agent communication.
 * <p>
 * Every published message is appended to a bounded history, copied into the mailbox of
 * each subscribed agent except the sender, and handed to every global listener (console
 * relay, UI bridge). Messages with mentions reach only the mentioned agents unless their
 * type is in {@link MessageType#BROADCAST}. Thread-safe for concurrent publish and subscribe.
 */
@Service
public class MessageBus {

    private static final Logger log = LoggerFactory.getLogger(MessageBus.class);

    private final ConcurrentHashMap<String, Mailbox> mailboxes = new ConcurrentHashMap<>();

    /** Global listeners that receive every message. */
    private final CopyOnWriteArrayList<Consumer<Message>> globalListeners = new CopyOnWriteArrayList<>();

    private final Deque<Message> history = new ArrayDeque<>();
    private final int maxHistory;
    private final int mailboxCapacity;
    private final Clock clock;

    public MessageBus(BusProperties properties, Clock clock) {
        this.maxHistory = properties.getHistorySize();
        this.mailboxCapacity = properties.getMailboxCapacity();
        this.clock = clock;
    }

    /**
     * Creates (or replaces) the mailbox for an agent.
     */
    public Mailbox subscribe(String agentId) {
        Mailbox mailbox = new Mailbox(agentId, mailboxCapacity);
        mailboxes.put(agentId, mailbox);
        log.debug("Agent {} subscribed", agentId);
        return mailbox;
    }

    public void unsubscribe(String agentId) {
        mailboxes.remove(agentId);
        log.debug("Agent {} unsubscribed", agentId);
    }

    public boolean isSubscribed(String agentId) {
        return mailboxes.containsKey(agentId);
    }

    /**
     * Registers a listener that receives every message regardless of mentions.
     *
     * @return a {@link Subscription} handle to unsubscribe later
     */
    public Subscription subscribeAll(Consumer<Message> listener) {
        globalListeners.add(listener);
        return () -> globalListeners.remove(listener);
    }

    public Message publish(String sender, String senderRole, MessageType type, String content) {
        return publish(sender, senderRole, type, content, Map.of(), List.of(), Message.DEFAULT_CHANNEL);
    }

    public Message publish(String sender, String senderRole, MessageType type, String content,
                           Map<String, Object> data, List<String> mentions) {
        return publish(sender, senderRole, type, content, data, mentions, Message.DEFAULT_CHANNEL);
    }

    /**
     * Publishes a message to all matching mailboxes and every global listener.
     *
     * @return the created message
     */
    public Message publish(String sender, String senderRole, MessageType type, String content,
                           Map<String, Object> data, List<String> mentions, String channel) {
        Message message = new Message(UUID.randomUUID().toString(), clock.instant(), sender, senderRole,
                type, content, data, mentions, channel);

        // history and mailbox delivery under one lock keep per-mailbox order equal to publish order
        synchronized (history) {
            history.addLast(message);
            while (history.size() > maxHistory) {
                history.removeFirst();
            }
            for (Mailbox mailbox : mailboxes.values()) {
                if (!message.isDeliverableTo(mailbox.getAgentId())) {
                    continue;
                }
                if (!mailbox.offer(message)) {
                    log.warn("Mailbox full for agent {}, dropping {} from {}",
                            mailbox.getAgentId(), type.wireName(), sender);
                }
            }
        }

        for (Consumer<Message> listener : globalListeners) {
            deliverSafely(listener, message);
        }

        log.debug("[{}] {}: {}", sender, type.wireName(), abbreviate(message.content(), 100));
        return message;
    }

    /**
     * Recent history, oldest first, optionally filtered by channel and type.
     *
     * @param channel channel filter, or null for all
     * @param type    type filter, or null for all
     * @param limit   maximum number of messages returned (newest kept)
     */
    public List<Message> history(String channel, MessageType type, int limit) {
        List<Message> matched = new ArrayList<>();
        synchronized (history) {
            for (Message m : history) {
                if (channel != null && !channel.equals(m.channel())) {
                    continue;
                }
                if (type != null && m.type() != type) {
                    continue;
                }
                matched.add(m);
            }
        }
        return tail(matched, limit);
    }

    public List<Message> history() {
        return history(null, null, 50);
    }

    /**
     * Messages relevant to one agent: sent by it, mentioning it, or broadcast to all.
     */
    public List<Message> agentHistory(String agentId, int limit) {
        List<Message> matched = new ArrayList<>();
        synchronized (history) {
            for (Message m : history) {
                if (agentId.equals(m.sender()) || m.mentions(agentId) || m.mentions().isEmpty()) {
                    matched.add(m);
                }
            }
        }
        return tail(matched, limit);
    }

    public int historySize() {
        synchronized (history) {
            return history.size();
        }
    }

    /**
     * Handle for cancelling a global subscription.
     */
    @FunctionalInterface
    public interface Subscription {
        void unsubscribe();
    }

    private static List<Message> tail(List<Message> messages, int limit) {
        if (limit <= 0 || messages.size() <= limit) {
            return List.copyOf(messages);
        }
        return List.copyOf(messages.subList(messages.size() - limit, messages.size()));
    }

    private static String abbreviate(String text, int max) {
        return text.length() <= max ? text : text.substring(0, max);
    }

    private void deliverSafely(Consumer<Message> listener, Message message) {
        try {
            listener.accept(message);
        } catch (Exception e) {
            log.warn("Listener threw exception processing {} from {}: {}",
                    message.type().wireName(), message.sender(), e.getMessage(), e);
        }
    }
}
