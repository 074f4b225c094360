package com.orderbookserver.server;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import com.orderbookserver.config.ServerConfig;
import com.orderbookserver.disruptor.IntentEventHandler;
import com.orderbookserver.disruptor.IntentPipeline;
import com.orderbookserver.domain.Commodity;
import com.orderbookserver.domain.OrderBookManager;
import com.orderbookserver.engine.MatchingCoordinator;
import com.orderbookserver.fanout.NotificationFanout;
import com.orderbookserver.logging.ExchangeStats;
import com.orderbookserver.matching.FifoMatcher;
import com.orderbookserver.metrics.MetricsRegistry;
import io.prometheus.metrics.model.registry.PrometheusRegistry;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import java.util.function.BooleanSupplier;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(30)
class ExchangeServerTest {

    private ExchangeStats stats;
    private MetricsRegistry metrics;
    private MatchingCoordinator coordinator;
    private NotificationFanout fanout;
    private IntentPipeline pipeline;
    private ExchangeServer server;
    private ListAppender<ILoggingEvent> logLines;
    private Level savedLevel;

    @BeforeEach
    void setUp() {
        Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        savedLevel = root.getLevel();
        root.setLevel(Level.INFO);
        logLines = new ListAppender<>();
        logLines.start();
        root.addAppender(logLines);

        stats = new ExchangeStats();
        metrics = new MetricsRegistry(new PrometheusRegistry());
        coordinator = new MatchingCoordinator(new OrderBookManager(), new FifoMatcher(), stats, metrics);
        fanout = new NotificationFanout(stats, metrics);
        pipeline = new IntentPipeline(64, new IntentEventHandler(coordinator, fanout));
    }

    @AfterEach
    void tearDown() {
        if (server != null) {
            server.close();
        }
        pipeline.close();
        Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
        root.detachAppender(logLines);
        root.setLevel(savedLevel);
    }

    @Test
    void tradesAreBroadcastToEveryConnectedClient() throws Exception {
        InetSocketAddress address = startServer(0);

        try (Client alice = new Client(address);
             Client bob = new Client(address);
             Client john = new Client(address)) {
            awaitSessions(3);

            alice.send("BUY:APPLE");
            assertEquals("ACK:APPLE", alice.readLine());
            alice.send("BUY:APPLE");
            assertEquals("ACK:APPLE", alice.readLine());
            alice.send("BUY:PEAR");
            assertEquals("ACK:PEAR", alice.readLine());

            // first buy then sell
            bob.send("SELL:ONION");
            assertEquals("ACK:ONION", bob.readLine());
            bob.send("SELL:APPLE");
            assertEquals("ACK:APPLE", bob.readLine());
            assertEquals("TRADE:APPLE", bob.readLine());
            assertEquals("TRADE:APPLE", alice.readLine());
            assertEquals("TRADE:APPLE", john.readLine());

            // first sell then buy
            alice.send("BUY:ONION");
            assertEquals("ACK:ONION", alice.readLine());
            assertEquals("TRADE:ONION", alice.readLine());
            assertEquals("TRADE:ONION", bob.readLine());
            assertEquals("TRADE:ONION", john.readLine());

            assertEquals(1, coordinator.depthSnapshot().get(Commodity.APPLE.ordinal()).pendingBuys());
            assertEquals(1, coordinator.depthSnapshot().get(Commodity.PEAR.ordinal()).pendingBuys());
            assertEquals(2, stats.tradesExecuted.get());
        }
    }

    @Test
    void logsTheOperationalLinesOfASession() throws Exception {
        InetSocketAddress address = startServer(0);
        List<String> ports = new ArrayList<>();

        try (Client alice = new Client(address);
             Client bob = new Client(address);
             Client john = new Client(address)) {
            ports.add(String.valueOf(alice.localPort()));
            ports.add(String.valueOf(bob.localPort()));
            ports.add(String.valueOf(john.localPort()));
            awaitSessions(3);

            alice.send("BUY:APPLE");
            assertEquals("ACK:APPLE", alice.readLine());
            alice.send("BUY:PEAR");
            assertEquals("ACK:PEAR", alice.readLine());
            bob.send("SELL:APPLE");
            assertEquals("ACK:APPLE", bob.readLine());
            assertEquals("TRADE:APPLE", john.readLine());
            bob.send("BUY:CARROT");
            assertEquals("Commodity not supported.", bob.readLine());
        }
        awaitSessions(0);
        awaitCondition(() -> messages().stream().filter(m -> m.startsWith("disconnected ")).count() == 3);

        List<String> messages = messages();
        assertEquals("listening on port " + address.getPort(), messages.get(0));
        for (String port : ports) {
            assertTrue(messages.contains("connected 127.0.0.1 " + port), "missing connect for " + port);
            assertTrue(messages.contains("disconnected 127.0.0.1 " + port), "missing disconnect for " + port);
        }

        List<String> orderLines = new ArrayList<>();
        for (String message : messages) {
            if (message.startsWith("new ") || message.startsWith("trade ")) {
                orderLines.add(message);
            }
        }
        assertEquals(List.of(
                "new buy order " + ports.get(0) + " APPLE",
                "new buy order " + ports.get(0) + " PEAR",
                "new sell order " + ports.get(1) + " APPLE",
                "trade APPLE"), orderLines);
        assertFalse(messages.stream().anyMatch(m -> m.contains("CARROT")));
    }

    @Test
    void disconnectedClientDoesNotDisturbTheOthers() throws Exception {
        InetSocketAddress address = startServer(0);

        try (Client bob = new Client(address);
             Client john = new Client(address)) {
            Client alice = new Client(address);
            awaitSessions(3);

            alice.send("BUY:TOMATO");
            assertEquals("ACK:TOMATO", alice.readLine());
            alice.close();
            awaitSessions(2);

            bob.send("SELL:TOMATO");
            assertEquals("ACK:TOMATO", bob.readLine());
            assertEquals("TRADE:TOMATO", bob.readLine());
            assertEquals("TRADE:TOMATO", john.readLine());
        }
    }

    @Test
    void invalidLinesGetAnErrorAndLeaveTheBookAlone() throws Exception {
        InetSocketAddress address = startServer(0);

        try (Client bob = new Client(address)) {
            awaitSessions(1);

            bob.send("asdf:TOMATO");
            assertEquals("Operation not supported.", bob.readLine());
            bob.send("BUY:asdf");
            assertEquals("Commodity not supported.", bob.readLine());
            bob.send("BUY:CARROT");
            assertEquals("Commodity not supported.", bob.readLine());
            bob.send("BUYTOMATO");
            assertEquals("Invalid order command.", bob.readLine());
            bob.send("BUY:TOMATO:APPLE");
            assertEquals("Invalid order command.", bob.readLine());
            bob.send("X".repeat(ExchangeServer.MAX_LINE_LENGTH + 10));
            assertEquals("Invalid order command.", bob.readLine());

            // connection is still usable
            bob.send("BUY:TOMATO");
            assertEquals("ACK:TOMATO", bob.readLine());
        }
        assertEquals(6, stats.ordersRejected.get());
        assertEquals(1, coordinator.depthSnapshot().get(Commodity.TOMATO.ordinal()).pendingBuys());
    }

    @Test
    void fallsBackToEphemeralPortWhenAddressIsTaken() throws Exception {
        try (ServerSocket occupied = new ServerSocket(0, 50, java.net.InetAddress.getByName("127.0.0.1"))) {
            InetSocketAddress address = startServer(occupied.getLocalPort());

            assertNotEquals(occupied.getLocalPort(), address.getPort());
            try (Client client = new Client(address)) {
                client.send("SELL:PEAR");
                assertEquals("ACK:PEAR", client.readLine());
            }
        }
    }

    private InetSocketAddress startServer(int port) {
        ServerConfig config = new ServerConfig("127.0.0.1", port, 0, 0, 64,
                ServerConfig.DEFAULT_OUTBOUND_HIGH_WATER_MARK, 0);
        server = new ExchangeServer(config, pipeline, fanout, stats, metrics);
        return server.start();
    }

    private List<String> messages() {
        List<String> messages = new ArrayList<>();
        synchronized (logLines) {
            for (ILoggingEvent event : logLines.list) {
                if (event.getLevel() == Level.INFO) {
                    messages.add(event.getFormattedMessage());
                }
            }
        }
        return messages;
    }

    private void awaitSessions(int expected) throws InterruptedException {
        awaitCondition(() -> fanout.getSessionCount() == expected);
        assertEquals(expected, fanout.getSessionCount());
    }

    private static void awaitCondition(BooleanSupplier condition) throws InterruptedException {
        long deadline = System.nanoTime() + 5_000_000_000L;
        while (!condition.getAsBoolean() && System.nanoTime() < deadline) {
            Thread.sleep(10);
        }
    }

    private static final class Client implements AutoCloseable {

        private final Socket socket;
        private final BufferedReader reader;
        private final OutputStream out;

        Client(InetSocketAddress address) throws IOException {
            socket = new Socket(address.getAddress(), address.getPort());
            socket.setSoTimeout(5_000);
            reader = new BufferedReader(new InputStreamReader(socket.getInputStream(), StandardCharsets.UTF_8));
            out = socket.getOutputStream();
        }

        void send(String line) throws IOException {
            out.write((line + "\n").getBytes(StandardCharsets.UTF_8));
            out.flush();
        }

        int localPort() {
            return socket.getLocalPort();
        }

        String readLine() throws IOException {
            String line = reader.readLine();
            assertTrue(line != null, "connection closed");
            return line;
        }

        @Override
        public void close() throws IOException {
            socket.close();
        }
    }
}
