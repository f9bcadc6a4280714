package com.hivemind.core.bus;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.LinkedBlockingDeque;
import java.util.function.Predicate;

/**
 * Bounded per-agent inbox. Messages are kept in publish order.
 */
public class Mailbox {

    private final String agentId;
    private final LinkedBlockingDeque<Message> queue;

    public Mailbox(String agentId, int capacity) {
        this.agentId = agentId;
        this.queue = new LinkedBlockingDeque<>(capacity);
    }

    public String getAgentId() {
        return agentId;
    }

    /**
     * @return false when the mailbox is full and the message was dropped
     */
    boolean offer(Message message) {
        return queue.offerLast(message);
    }

    /**
     * Removes and returns every queued message without blocking.
     */
    public List<Message> drain() {
        List<Message> drained = new ArrayList<>();
        queue.drainTo(drained);
        return drained;
    }

    /**
     * Snapshot of the queued messages; nothing is removed.
     */
    public List<Message> peekAll() {
        return List.copyOf(queue);
    }

    /**
     * Drops queued messages matching the filter, keeping the order of the rest.
     *
     * @return how many were dropped
     */
    public int removeIf(Predicate<Message> filter) {
        int before = queue.size();
        queue.removeIf(filter);
        return Math.max(0, before - queue.size());
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }
}
