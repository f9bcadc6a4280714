package com.hivemind.core.bus;

import com.hivemind.support.MutableClock;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Unit tests for {@link MessageBus}.
 */
class MessageBusTest {

    private MessageBus bus;

    @BeforeEach
    void setUp() {
        bus = new MessageBus(new BusProperties(), new MutableClock());
    }

    private static BusProperties props(int history, int capacity) {
        var properties = new BusProperties();
        properties.setHistorySize(history);
        properties.setMailboxCapacity(capacity);
        return properties;
    }

    @Nested
    @DisplayName("delivery")
    class Delivery {

        @Test
        @DisplayName("delivers to every mailbox except the sender's")
        void skipsSender() {
            Mailbox dev = bus.subscribe("developer");
            Mailbox rev = bus.subscribe("reviewer");

            bus.publish("developer", "developer", MessageType.CHAT, "hello");

            assertTrue(dev.isEmpty());
            assertEquals(1, rev.size());
            assertEquals("hello", rev.drain().get(0).content());
        }

        @Test
        @DisplayName("mentions restrict delivery to the mentioned agents")
        void mentionsRestrict() {
            Mailbox dev = bus.subscribe("developer");
            Mailbox rev = bus.subscribe("reviewer");
            Mailbox tester = bus.subscribe("tester");

            bus.publish("orchestrator", "orchestrator", MessageType.CHAT, "review please",
                    Map.of(), List.of("reviewer"));

            assertTrue(dev.isEmpty());
            assertTrue(tester.isEmpty());
            assertEquals(1, rev.size());
        }

        @Test
        @DisplayName("broadcast types ignore mentions")
        void broadcastIgnoresMentions() {
            Mailbox dev = bus.subscribe("developer");
            Mailbox rev = bus.subscribe("reviewer");

            bus.publish("orchestrator", "orchestrator", MessageType.TASK_ASSIGNED, "new task",
                    Map.of("task_id", "abc12345"), List.of("developer"));

            assertEquals(1, dev.size());
            assertEquals(1, rev.size());
        }

        @Test
        @DisplayName("preserves publish order per mailbox")
        void preservesOrder() {
            Mailbox rev = bus.subscribe("reviewer");

            for (int i = 0; i < 10; i++) {
                bus.publish("developer", "developer", MessageType.CHAT, "m" + i);
            }

            List<String> contents = rev.drain().stream().map(Message::content).toList();
            assertEquals(List.of("m0", "m1", "m2", "m3", "m4", "m5", "m6", "m7", "m8", "m9"), contents);
            assertTrue(rev.isEmpty());
        }

        @Test
        @DisplayName("full mailbox drops the message instead of blocking")
        void fullMailboxDrops() {
            bus = new MessageBus(props(500, 2), new MutableClock());
            Mailbox rev = bus.subscribe("reviewer");

            bus.publish("developer", "developer", MessageType.CHAT, "1");
            bus.publish("developer", "developer", MessageType.CHAT, "2");
            bus.publish("developer", "developer", MessageType.CHAT, "3");

            assertEquals(List.of("1", "2"), rev.drain().stream().map(Message::content).toList());
            assertEquals(3, bus.historySize());
        }

        @Test
        @DisplayName("peekAll leaves messages queued")
        void peekKeepsMessages() {
            Mailbox rev = bus.subscribe("reviewer");
            bus.publish("developer", "developer", MessageType.CHAT, "x");

            assertEquals(1, rev.peekAll().size());
            assertEquals(1, rev.size());
        }

        @Test
        @DisplayName("unsubscribed agents receive nothing")
        void unsubscribe() {
            Mailbox rev = bus.subscribe("reviewer");
            bus.unsubscribe("reviewer");

            bus.publish("developer", "developer", MessageType.CHAT, "x");

            assertTrue(rev.isEmpty());
            assertFalse(bus.isSubscribed("reviewer"));
        }
    }

    @Nested
    @DisplayName("global listeners")
    class GlobalListeners {

        @Test
        @DisplayName("receive every message including mention-restricted ones")
        void receiveEverything() {
            List<Message> received = new ArrayList<>();
            bus.subscribeAll(received::add);

            bus.publish("a", "developer", MessageType.CHAT, "one", Map.of(), List.of("b"));
            bus.publish("a", "developer", MessageType.THOUGHT, "two");

            assertEquals(2, received.size());
        }

        @Test
        @DisplayName("a failing listener does not break delivery")
        void failingListener() {
            List<Message> received = new ArrayList<>();
            Mailbox rev = bus.subscribe("reviewer");
            bus.subscribeAll(m -> {
                throw new RuntimeException("boom");
            });
            bus.subscribeAll(received::add);

            bus.publish("developer", "developer", MessageType.CHAT, "x");

            assertEquals(1, received.size());
            assertEquals(1, rev.size());
        }

        @Test
        @DisplayName("unsubscribe stops delivery")
        void unsubscribeListener() {
            List<Message> received = new ArrayList<>();
            var subscription = bus.subscribeAll(received::add);
            subscription.unsubscribe();

            bus.publish("developer", "developer", MessageType.CHAT, "x");

            assertTrue(received.isEmpty());
        }

        @Test
        @DisplayName("concurrent publishers all reach the listener")
        void concurrentPublish() throws Exception {
            int threads = 8;
            int perThread = 50;
            List<Message> received = new CopyOnWriteArrayList<>();
            bus.subscribeAll(received::add);
            CountDownLatch done = new CountDownLatch(threads);

            for (int t = 0; t < threads; t++) {
                String sender = "agent-" + t;
                new Thread(() -> {
                    for (int i = 0; i < perThread; i++) {
                        bus.publish(sender, "developer", MessageType.CHAT, "m" + i);
                    }
                    done.countDown();
                }).start();
            }

            assertTrue(done.await(10, TimeUnit.SECONDS));
            assertEquals(threads * perThread, received.size());
        }
    }

    @Nested
    @DisplayName("history")
    class History {

        @Test
        @DisplayName("drops the oldest messages past the bound")
        void bounded() {
            bus = new MessageBus(props(3, 1000), new MutableClock());

            for (int i = 0; i < 5; i++) {
                bus.publish("a", "developer", MessageType.CHAT, "m" + i);
            }

            assertEquals(List.of("m2", "m3", "m4"),
                    bus.history(null, null, 50).stream().map(Message::content).toList());
        }

        @Test
        @DisplayName("filters by channel and type and keeps the newest")
        void filters() {
            bus.publish("a", "developer", MessageType.CHAT, "c1");
            bus.publish("a", "developer", MessageType.THOUGHT, "t1");
            bus.publish("a", "developer", MessageType.CHAT, "c2", Map.of(), List.of(), "ops");
            bus.publish("a", "developer", MessageType.CHAT, "c3");

            assertEquals(List.of("c1", "c3"),
                    bus.history("general", MessageType.CHAT, 50).stream().map(Message::content).toList());
            assertEquals(List.of("c3"),
                    bus.history(null, MessageType.CHAT, 1).stream().map(Message::content).toList());
        }

        @Test
        @DisplayName("agentHistory includes own, mentioning and broadcast messages")
        void agentHistory() {
            bus.publish("developer", "developer", MessageType.CHAT, "own", Map.of(), List.of("tester"));
            bus.publish("orchestrator", "orchestrator", MessageType.CHAT, "to-dev", Map.of(), List.of("developer"));
            bus.publish("orchestrator", "orchestrator", MessageType.CHAT, "to-rev", Map.of(), List.of("reviewer"));
            bus.publish("orchestrator", "orchestrator", MessageType.CHAT, "all");

            assertEquals(List.of("own", "to-dev", "all"),
                    bus.agentHistory("developer", 20).stream().map(Message::content).toList());
        }
    }
}
