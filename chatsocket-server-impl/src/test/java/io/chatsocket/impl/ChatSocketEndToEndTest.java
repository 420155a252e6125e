package io.chatsocket.impl;

import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;

import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import io.chatsocket.ChatSocketServer.ChatSocketCloseCodes;
import io.chatsocket.ChatSocketServer.ClientFrameDto;
import io.chatsocket.ChatSocketServer.ConnectionEvent;
import io.chatsocket.ChatSocketServer.ConnectionEvent.ConnectionEventType;
import io.chatsocket.ChatSocketServer.ServerFrameDto;
import io.chatsocket.SessionStore.ChatMessage;
import io.chatsocket.SessionStore.Role;
import io.chatsocket.client.ChatSocketClientListener;
import io.chatsocket.client.ClientOptions;
import io.chatsocket.client.ResilientChatSocketClient;

/**
 * Runs the {@link ResilientChatSocketClient} against the ChatSocket endpoint in an embedded Jetty.
 */
public class ChatSocketEndToEndTest {
    private static final long TIMEOUT_SECONDS = 10;

    private InMemorySessionStore _sessionStore;
    private ChatSocketTestServer _server;
    private ResilientChatSocketClient _client;
    private final RecordingListener _listener = new RecordingListener();
    private final List<ConnectionEvent> _connectionEvents = new CopyOnWriteArrayList<>();

    @Before
    public void startServer() throws Exception {
        _sessionStore = new InMemorySessionStore(SessionStoreConfig.defaults());
        _server = new ChatSocketTestServer(_sessionStore, new SimulatedModelClient(5, 0));
        _server.start();
        _server.getChatSocketServer().addConnectionEventListener(_connectionEvents::add);
    }

    @After
    public void stopAll() {
        if (_client != null) {
            _client.destroy();
        }
        _server.stop();
    }

    private void connect(ClientOptions options) throws Exception {
        _client = ResilientChatSocketClient.create(_server.getUri(), options);
        _client.addListener(_listener);
        _client.connect().get(TIMEOUT_SECONDS, TimeUnit.SECONDS);
    }

    private List<ChatMessage> awaitMessages(String sessionId, int count) throws InterruptedException {
        long deadline = System.currentTimeMillis() + TIMEOUT_SECONDS * 1000;
        List<ChatMessage> messages = _sessionStore.getMessages(sessionId);
        while ((messages.size() < count) && (System.currentTimeMillis() < deadline)) {
            Thread.sleep(10);
            messages = _sessionStore.getMessages(sessionId);
        }
        Assert.assertEquals(count, messages.size());
        return messages;
    }

    private static ClientOptions noReconnect() {
        return ClientOptions.builder().reconnect(false).build();
    }

    @Test
    public void connectGivesSessionIdAndStoreSession() throws Exception {
        connect(noReconnect());

        ServerFrameDto established = _listener.next("connection_established");
        Assert.assertEquals("Connected to server", established.content);
        Assert.assertNotNull(established.sessionId);
        Assert.assertEquals(established.sessionId, _client.getSessionId());
        Assert.assertTrue(_sessionStore.getSession(established.sessionId).isPresent());
        Assert.assertTrue(_server.getChatSocketServer().getConnectionRegistry().getConnection(established.sessionId)
                .isPresent());
    }

    @Test
    public void userMessageIsStreamedBackAndStored() throws Exception {
        connect(noReconnect());
        String sessionId = _listener.next("connection_established").sessionId;

        _client.sendUserMessage("Hello");

        Assert.assertEquals(sessionId, _listener.next("stream_start").sessionId);
        StringBuilder response = new StringBuilder();
        ServerFrameDto frame = _listener.next();
        while ("stream_chunk".equals(frame.type)) {
            Assert.assertEquals(sessionId, frame.sessionId);
            response.append(frame.content);
            frame = _listener.next();
        }
        Assert.assertEquals("stream_end", frame.type);
        Assert.assertEquals(sessionId, frame.sessionId);
        Assert.assertEquals("Mock response to: \"Hello\"", response.toString());

        // The assistant message is stored right after stream_end goes out.
        List<ChatMessage> messages = awaitMessages(sessionId, 2);
        Assert.assertEquals(Role.USER, messages.get(0).getRole());
        Assert.assertEquals("Hello", messages.get(0).getContent());
        Assert.assertEquals(Role.ASSISTANT, messages.get(1).getRole());
        Assert.assertEquals("Mock response to: \"Hello\"", messages.get(1).getContent());
    }

    @Test
    public void messagesFromOneConnectionAreAnsweredInOrder() throws Exception {
        connect(noReconnect());
        String sessionId = _listener.next("connection_established").sessionId;

        _client.sendUserMessage("One");
        _client.sendUserMessage("Two");

        Assert.assertEquals("Mock response to: \"One\"", _listener.collectStream());
        Assert.assertEquals("Mock response to: \"Two\"", _listener.collectStream());
        List<ChatMessage> messages = awaitMessages(sessionId, 4);
        Assert.assertEquals("Two", messages.get(2).getContent());
    }

    @Test
    public void invalidFramesGetErrorAndConnectionStaysOpen() throws Exception {
        connect(noReconnect());
        _listener.next("connection_established");

        ClientFrameDto unknown = new ClientFrameDto();
        unknown.type = "subscribe";
        _client.send(unknown);
        Assert.assertEquals("Unknown message type: subscribe", _listener.next("error").error);

        _client.send(ClientFrameDto.userMessage("   ", null));
        Assert.assertEquals("Invalid message: Message content cannot be empty", _listener.next("error").error);

        // Still usable
        _client.sendUserMessage("Still there?");
        Assert.assertEquals("Mock response to: \"Still there?\"", _listener.collectStream());
        Assert.assertTrue(_client.isConnected());
    }

    @Test
    public void heartbeatIsAnsweredByServer() throws Exception {
        connect(ClientOptions.builder()
                .reconnect(false)
                .heartbeatInterval(50)
                .heartbeatTimeout(2000)
                .build());
        _listener.next("connection_established");

        // Plenty of heartbeats go by, each needing a pong to not time out.
        Thread.sleep(500);

        Assert.assertTrue(_client.isConnected());
        Assert.assertTrue(_listener._closeCodes.isEmpty());
    }

    @Test
    public void disconnectIsSeenByServer() throws Exception {
        connect(noReconnect());
        String sessionId = _listener.next("connection_established").sessionId;

        _client.disconnect();

        Assert.assertEquals(Integer.valueOf(1000), _listener._closeCodes.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        long deadline = System.currentTimeMillis() + TIMEOUT_SECONDS * 1000;
        while (_server.getChatSocketServer().getConnectionRegistry().getConnection(sessionId).isPresent()
                && (System.currentTimeMillis() < deadline)) {
            Thread.sleep(10);
        }
        Assert.assertFalse(_server.getChatSocketServer().getConnectionRegistry().getConnection(sessionId)
                .isPresent());
        // The conversation stays in the store.
        Assert.assertTrue(_sessionStore.getSession(sessionId).isPresent());

        while ((_connectionEvents.size() < 2) && (System.currentTimeMillis() < deadline)) {
            Thread.sleep(10);
        }
        Assert.assertEquals(ConnectionEventType.ESTABLISHED, _connectionEvents.get(0).getType());
        ConnectionEvent closed = _connectionEvents.get(1);
        Assert.assertEquals(ConnectionEventType.CLOSED, closed.getType());
        Assert.assertEquals(sessionId, closed.getSessionId());
        Assert.assertEquals(Integer.valueOf(1000), closed.getCloseCode().orElse(null));
    }

    @Test
    public void serverStopClosesWithServiceRestart() throws Exception {
        connect(noReconnect());
        _listener.next("connection_established");

        _server.getChatSocketServer().stop(1000);

        Assert.assertEquals(Integer.valueOf(ChatSocketCloseCodes.SERVICE_RESTART.getCode()),
                _listener._closeCodes.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS));
        Assert.assertEquals(0, _server.getChatSocketServer().getConnectionRegistry().count());
    }

    static class RecordingListener implements ChatSocketClientListener {
        private final BlockingQueue<ServerFrameDto> _frames = new LinkedBlockingQueue<>();
        private final BlockingQueue<Integer> _closeCodes = new LinkedBlockingQueue<>();

        @Override
        public void onMessage(ServerFrameDto frame) {
            _frames.add(frame);
        }

        @Override
        public void onClose(int code, String reason) {
            _closeCodes.add(code);
        }

        ServerFrameDto next() throws InterruptedException {
            ServerFrameDto frame = _frames.poll(TIMEOUT_SECONDS, TimeUnit.SECONDS);
            Assert.assertNotNull("Timed out waiting for frame from server", frame);
            return frame;
        }

        ServerFrameDto next(String expectedType) throws InterruptedException {
            ServerFrameDto frame = next();
            Assert.assertEquals("Unexpected frame: error [" + frame.error + "]", expectedType, frame.type);
            return frame;
        }

        /**
         * Reads stream_start, the chunks, and stream_end, returning the concatenated chunks.
         */
        String collectStream() throws InterruptedException {
            next("stream_start");
            StringBuilder buf = new StringBuilder();
            while (true) {
                ServerFrameDto frame = next();
                if ("stream_end".equals(frame.type)) {
                    return buf.toString();
                }
                Assert.assertEquals("stream_chunk", frame.type);
                buf.append(frame.content);
            }
        }
    }
}
