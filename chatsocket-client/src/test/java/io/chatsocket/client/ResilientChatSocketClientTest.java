package io.chatsocket.client;

import java.io.IOException;
import java.net.URI;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutionException;
import java.util.stream.Collectors;

import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import io.chatsocket.ChatSocketServer.ServerFrameDto;
import io.chatsocket.client.FakeTransportFactory.FakeTransport;
import io.chatsocket.client.ResilientChatSocketClient.ConnectFailedException;

public class ResilientChatSocketClientTest {
    private static final URI URI_ = URI.create("ws://localhost:8080/chat");

    private final ManualClientScheduler _scheduler = new ManualClientScheduler();
    private final FakeTransportFactory _transports = new FakeTransportFactory();
    private final RecordingListener _listener = new RecordingListener();
    private ResilientChatSocketClient _client;

    @Before
    public void createClient() {
        _client = createClient(ClientOptions.defaults());
    }

    private ResilientChatSocketClient createClient(ClientOptions options) {
        ResilientChatSocketClient client = new ResilientChatSocketClient(URI_, options, _transports, _scheduler);
        client.addListener(_listener);
        return client;
    }

    private FakeTransport connectAndOpen() {
        CompletableFuture<Void> future = _client.connect();
        FakeTransport transport = _transports.last();
        transport.open();
        Assert.assertTrue(future.isDone());
        Assert.assertFalse(future.isCompletedExceptionally());
        return transport;
    }

    private static String failureMessage(CompletableFuture<Void> future) throws InterruptedException {
        Assert.assertTrue("Future should be done", future.isDone());
        try {
            future.get();
            Assert.fail("Future should have failed");
            return null;
        }
        catch (ExecutionException e) {
            Assert.assertTrue(e.getCause() instanceof ConnectFailedException);
            return e.getCause().getMessage();
        }
    }

    // ===== Backoff

    @Test
    public void reconnectDelaysAreCappedExponential() {
        ClientOptions options = ClientOptions.defaults();
        List<Long> delays = new ArrayList<>();
        for (int attempt = 1; attempt <= 7; attempt++) {
            delays.add(ResilientChatSocketClient.computeReconnectDelay(options, attempt));
        }
        Assert.assertEquals(Arrays.asList(1000L, 2000L, 4000L, 8000L, 16000L, 30000L, 30000L), delays);
    }

    @Test
    public void repeatedFailuresBackOffAndGiveUpAfterMaxAttempts() throws InterruptedException {
        CompletableFuture<Void> first = _client.connect();
        _transports.last().serverCloses(1006, "");
        Assert.assertEquals("Connection failed: Unknown reason", failureMessage(first));

        for (int i = 0; i < 10; i++) {
            long delay = _listener.lastReconnectDelay();
            _scheduler.advance(delay - 1);
            Assert.assertEquals("Attempt should not go before its delay", i + 1, _transports.count());
            _scheduler.advance(1);
            Assert.assertEquals(i + 2, _transports.count());
            _transports.last().serverCloses(1006, "");
        }

        Assert.assertEquals(Arrays.asList("1:1000", "2:2000", "3:4000", "4:8000", "5:16000", "6:30000", "7:30000",
                "8:30000", "9:30000", "10:30000"), _listener.reconnecting());
        Assert.assertTrue(_listener._events.contains("error:Max reconnection attempts (10) reached"));
        Assert.assertEquals(ConnectionState.DISCONNECTED, _client.getState());

        // No more attempts
        _scheduler.advance(120_000);
        Assert.assertEquals(11, _transports.count());
        Assert.assertEquals(0, _scheduler.getTimerCount());
    }

    // ===== Connect

    @Test
    public void connectOpensAndEmitsOpen() {
        connectAndOpen();

        Assert.assertEquals(ConnectionState.CONNECTED, _client.getState());
        Assert.assertTrue(_client.isConnected());
        Assert.assertEquals(List.of("open"), _listener._events);
    }

    @Test
    public void connectWhenConnectedIsNoOp() {
        connectAndOpen();

        CompletableFuture<Void> again = _client.connect();

        Assert.assertTrue(again.isDone());
        Assert.assertFalse(again.isCompletedExceptionally());
        Assert.assertEquals(1, _transports.count());
    }

    @Test
    public void connectTimesOut() throws InterruptedException {
        CompletableFuture<Void> future = _client.connect();
        FakeTransport transport = _transports.last();

        _scheduler.advance(4999);
        Assert.assertFalse(future.isDone());
        _scheduler.advance(1);

        Assert.assertEquals("Connection timeout", failureMessage(future));
        Assert.assertEquals(Integer.valueOf(4001), transport.getCloseCode());
        Assert.assertTrue(_listener._events.contains("close:4001:Connection timeout"));
        Assert.assertEquals(ConnectionState.RECONNECTING, _client.getState());
        Assert.assertEquals(1, _client.getReconnectAttempts());

        // A late open from the abandoned transport is ignored
        transport.open();
        Assert.assertEquals(ConnectionState.RECONNECTING, _client.getState());
        Assert.assertFalse(_listener._events.contains("open"));
    }

    @Test
    public void reconnectAfterLossEmitsReconnected() {
        FakeTransport first = connectAndOpen();
        first.serverCloses(1001, "Going away");

        Assert.assertEquals(ConnectionState.RECONNECTING, _client.getState());
        _scheduler.advance(1000);
        Assert.assertEquals(ConnectionState.CONNECTING, _client.getState());
        _transports.last().open();

        Assert.assertEquals(Arrays.asList("open", "close:1001:Going away", "reconnecting:1:1000", "open",
                "reconnected"), _listener._events);
        Assert.assertEquals(0, _client.getReconnectAttempts());
    }

    @Test
    public void longLivedConnectionLossStartsBackoffFromScratch() {
        FakeTransport first = connectAndOpen();
        _scheduler.advance(31_000);
        first.serverSends("{\"type\":\"pong\"}");

        first.serverCloses(1006, "");

        Assert.assertEquals(List.of("1:1000"), _listener.reconnecting());
    }

    @Test
    public void transportErrorClosesAndReconnects() {
        FakeTransport transport = connectAndOpen();

        IOException failure = new IOException("Connection reset");
        transport.fail(failure);

        Assert.assertTrue(_listener._events.contains("error:Transport error"));
        Assert.assertSame(failure, _listener._lastErrorCause);
        Assert.assertTrue(_listener._events.contains("close:1006:Connection reset"));
        // Locally detected error, so we close the still open transport ourselves
        Assert.assertEquals(Integer.valueOf(1011), transport.getCloseCode());
        Assert.assertEquals(ConnectionState.RECONNECTING, _client.getState());
    }

    @Test
    public void transportFactoryExceptionIsTreatedAsLoss() throws InterruptedException {
        ResilientChatSocketClient client = new ResilientChatSocketClient(URI_, ClientOptions.defaults(),
                (uri, listener) -> {
                    throw new IllegalStateException("No container");
                }, _scheduler);
        client.addListener(_listener);

        CompletableFuture<Void> future = client.connect();

        Assert.assertEquals("Connection failed: Could not open transport: No container", failureMessage(future));
        Assert.assertEquals(ConnectionState.RECONNECTING, client.getState());
    }

    // ===== Heartbeat

    @Test
    public void missingPongTimesOutAndReconnects() {
        FakeTransport transport = connectAndOpen();

        _scheduler.advance(30_000);
        Assert.assertEquals(List.of("ping"), transport.getSentTypes());
        _scheduler.advance(4999);
        Assert.assertTrue(_client.isConnected());
        _scheduler.advance(1);

        Assert.assertEquals(Integer.valueOf(4000), transport.getCloseCode());
        Assert.assertEquals("Heartbeat timeout", transport.getCloseReason());
        Assert.assertTrue(_listener._events.contains("close:4000:Heartbeat timeout"));
        Assert.assertEquals(ConnectionState.RECONNECTING, _client.getState());

        _scheduler.advance(1000);
        Assert.assertEquals(2, _transports.count());
    }

    @Test
    public void pongKeepsConnectionAlive() {
        FakeTransport transport = connectAndOpen();

        for (int i = 0; i < 5; i++) {
            _scheduler.advance(30_000);
            transport.serverSends("{\"type\":\"pong\"}");
        }
        _scheduler.advance(10_000);

        Assert.assertTrue(_client.isConnected());
        Assert.assertEquals(5, transport.getSentTypes().size());
        Assert.assertFalse(transport.isClosed());
    }

    @Test
    public void serverPingIsAnsweredWithPong() {
        FakeTransport transport = connectAndOpen();

        transport.serverSends("{\"type\":\"ping\"}");

        Assert.assertEquals(List.of("pong"), transport.getSentTypes());
        Assert.assertEquals(List.of("open"), _listener._events);
    }

    @Test
    public void hiddenClientSuspendsHeartbeat() {
        FakeTransport transport = connectAndOpen();

        _client.setVisible(false);
        _scheduler.advance(120_000);
        Assert.assertTrue(transport.getSent().isEmpty());
        Assert.assertTrue(_client.isConnected());

        // Visible again: checks health right away
        _client.setVisible(true);
        Assert.assertEquals(List.of("ping"), transport.getSentTypes());
    }

    @Test
    public void becomingVisibleReconnectsRightAway() {
        FakeTransport first = connectAndOpen();
        first.serverCloses(1006, "");
        _scheduler.advance(1000);
        _transports.last().serverCloses(1006, "");
        Assert.assertEquals(2, _transports.count());
        Assert.assertEquals(ConnectionState.RECONNECTING, _client.getState());

        // Pending backoff is 2000 ms, but we go right away
        _client.setVisible(true);
        Assert.assertEquals(3, _transports.count());
        Assert.assertEquals(ConnectionState.CONNECTING, _client.getState());

        // .. and the pending attempt is cancelled
        _transports.last().open();
        _scheduler.advance(2000);
        Assert.assertEquals(3, _transports.count());
    }

    // ===== Messages

    @Test
    public void sessionIdFromConnectionEstablishedIsUsed() {
        FakeTransport transport = connectAndOpen();

        transport.serverSends("{\"type\":\"connection_established\",\"sessionId\":\"abc\",\"content\":\"Connected\"}");
        _client.sendUserMessage("Hello");

        Assert.assertEquals("abc", _client.getSessionId());
        Assert.assertTrue(_listener._events.contains("message:connection_established"));
        Map<String, Object> sent = transport.getSentFrames().get(0);
        Assert.assertEquals("user_message", sent.get("type"));
        Assert.assertEquals("Hello", sent.get("content"));
        Assert.assertEquals("abc", sent.get("sessionId"));
    }

    @Test
    public void serverFramesAreDelivered() {
        FakeTransport transport = connectAndOpen();

        transport.serverSends("{\"type\":\"stream_start\",\"sessionId\":\"abc\"}");
        transport.serverSends("{\"type\":\"stream_chunk\",\"sessionId\":\"abc\",\"content\":\"Hi\"}");
        transport.serverSends("{\"type\":\"stream_end\",\"sessionId\":\"abc\",\"someday\":\"new field\"}");

        Assert.assertEquals(Arrays.asList("message:stream_start", "message:stream_chunk", "message:stream_end"),
                _listener._events.subList(1, 4));
        Assert.assertEquals("Hi", _listener._frames.get(1).content);
    }

    @Test
    public void unparseableFrameIsReportedAndConnectionKept() {
        FakeTransport transport = connectAndOpen();

        transport.serverSends("not json");

        Assert.assertTrue(_listener._events.contains("error:Failed to parse message"));
        Assert.assertTrue(_client.isConnected());
    }

    @Test
    public void queueDropsOldestAndFlushesInOrder() {
        for (int i = 0; i < 60; i++) {
            _client.sendUserMessage("m" + i);
        }
        Assert.assertEquals(50, _client.getQueuedMessageCount());

        FakeTransport transport = connectAndOpen();

        List<Map<String, Object>> sent = transport.getSentFrames();
        Assert.assertEquals(50, sent.size());
        Assert.assertEquals("m10", sent.get(0).get("content"));
        Assert.assertEquals("m59", sent.get(49).get("content"));
        Assert.assertEquals("", sent.get(0).get("sessionId"));
        Assert.assertEquals(0, _client.getQueuedMessageCount());
    }

    @Test
    public void flushFailureKeepsOrder() {
        _client.sendUserMessage("first");
        _client.sendUserMessage("second");
        _client.connect();
        FakeTransport transport = _transports.last();
        transport.setFailSends(true);

        transport.open();

        Assert.assertTrue(_listener._events.contains("error:Failed to flush message queue"));
        Assert.assertEquals(2, _client.getQueuedMessageCount());

        // Sending when there is a backlog queues behind it, and flushes the lot
        transport.setFailSends(false);
        _client.sendUserMessage("third");

        Assert.assertEquals(Arrays.asList("first", "second", "third"), transport.getSentFrames().stream()
                .map(frame -> (String) frame.get("content"))
                .collect(Collectors.toList()));
        Assert.assertEquals(0, _client.getQueuedMessageCount());
    }

    @Test
    public void failedDirectSendIsQueued() {
        FakeTransport transport = connectAndOpen();
        transport.setFailSends(true);

        _client.sendUserMessage("Hello");

        Assert.assertTrue(_listener._events.contains("error:Failed to send message"));
        Assert.assertEquals(1, _client.getQueuedMessageCount());

        // Flushed on the next connection
        transport.serverCloses(1006, "");
        _scheduler.advance(1000);
        FakeTransport next = _transports.last();
        next.open();
        Assert.assertEquals(List.of("user_message"), next.getSentTypes());
    }

    // ===== Disconnect and destroy

    @Test
    public void disconnectClosesNormallyAndStopsReconnecting() {
        FakeTransport transport = connectAndOpen();

        _client.disconnect();

        Assert.assertEquals(Integer.valueOf(1000), transport.getCloseCode());
        Assert.assertEquals("Client disconnecting", transport.getCloseReason());
        Assert.assertEquals(Arrays.asList("open", "close:1000:Client disconnecting"), _listener._events);
        Assert.assertEquals(ConnectionState.DISCONNECTED, _client.getState());

        // The close from the server side of the transport is of no interest any more
        transport.serverCloses(1000, "Client disconnecting");
        _scheduler.advance(120_000);
        Assert.assertEquals(1, _transports.count());
        Assert.assertEquals(2, _listener._events.size());
    }

    @Test
    public void disconnectWhileConnectingFailsConnect() throws InterruptedException {
        CompletableFuture<Void> future = _client.connect();

        _client.disconnect();

        Assert.assertEquals("Client disconnecting", failureMessage(future));
        Assert.assertEquals(0, _scheduler.getTimerCount());
    }

    @Test
    public void connectAfterDisconnectEnablesReconnect() {
        connectAndOpen();
        _client.disconnect();

        FakeTransport second = connectAndOpen();
        second.serverCloses(1006, "");

        Assert.assertEquals(ConnectionState.RECONNECTING, _client.getState());
    }

    @Test
    public void noReconnectWhenDisabled() {
        _client = createClient(ClientOptions.builder().reconnect(false).build());
        FakeTransport transport = connectAndOpen();

        transport.serverCloses(1012, "Service restart");

        Assert.assertEquals(ConnectionState.DISCONNECTED, _client.getState());
        _scheduler.advance(120_000);
        Assert.assertEquals(1, _transports.count());
    }

    @Test
    public void destroyClearsEverything() throws InterruptedException {
        _client.sendUserMessage("queued");
        FakeTransport transport = connectAndOpen();
        transport.setFailSends(true);
        _client.sendUserMessage("failing");

        _client.destroy();

        Assert.assertEquals(Integer.valueOf(1000), transport.getCloseCode());
        Assert.assertEquals(0, _client.getQueuedMessageCount());
        // Not our scheduler, so not shut down
        Assert.assertFalse(_scheduler.isShutdown());

        int eventsBefore = _listener._events.size();
        CompletableFuture<Void> future = _client.connect();
        Assert.assertTrue(future.isCompletedExceptionally());
        _client.sendUserMessage("ignored");
        Assert.assertEquals(0, _client.getQueuedMessageCount());
        Assert.assertEquals(eventsBefore, _listener._events.size());
    }

    @Test
    public void throwingListenerDoesNotDisturbOthers() {
        _client.removeListener(_listener);
        _client.addListener(new ChatSocketClientListener() {
            @Override
            public void onOpen() {
                throw new IllegalStateException("Bad listener");
            }
        });
        _client.addListener(_listener);

        connectAndOpen();

        Assert.assertEquals(List.of("open"), _listener._events);
    }

    static class RecordingListener implements ChatSocketClientListener {
        private final List<String> _events = new CopyOnWriteArrayList<>();
        private final List<ServerFrameDto> _frames = new CopyOnWriteArrayList<>();
        private volatile Throwable _lastErrorCause;
        private volatile long _lastReconnectDelay;

        @Override
        public void onOpen() {
            _events.add("open");
        }

        @Override
        public void onReconnected() {
            _events.add("reconnected");
        }

        @Override
        public void onClose(int code, String reason) {
            _events.add("close:" + code + ":" + reason);
        }

        @Override
        public void onError(String message, Throwable cause) {
            _events.add("error:" + message);
            _lastErrorCause = cause;
        }

        @Override
        public void onReconnecting(int attempt, long delayMillis) {
            _events.add("reconnecting:" + attempt + ":" + delayMillis);
            _lastReconnectDelay = delayMillis;
        }

        @Override
        public void onMessage(ServerFrameDto frame) {
            _events.add("message:" + frame.type);
            _frames.add(frame);
        }

        long lastReconnectDelay() {
            return _lastReconnectDelay;
        }

        List<String> reconnecting() {
            return _events.stream()
                    .filter(e -> e.startsWith("reconnecting:"))
                    .map(e -> e.substring("reconnecting:".length()))
                    .collect(Collectors.toList());
        }
    }
}
