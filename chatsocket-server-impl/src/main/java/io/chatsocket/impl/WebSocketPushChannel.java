package io.chatsocket.impl;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import jakarta.websocket.CloseReason;
import jakarta.websocket.CloseReason.CloseCode;
import jakarta.websocket.RemoteEndpoint.Basic;
import jakarta.websocket.Session;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chatsocket.ConnectionRegistry.PushChannel;

/**
 * {@link PushChannel} over a JSR 356 WebSocket {@link Session}. The {@link Basic BasicRemote} does not allow concurrent
 * sends, so all sends are serialized on a per-channel lock - pongs from the receiving thread and stream frames from the
 * lane thread may otherwise collide.
 */
class WebSocketPushChannel implements PushChannel {
    private static final Logger log = LoggerFactory.getLogger(WebSocketPushChannel.class);

    private final Session _webSocketSession;
    private final Basic _webSocketBasicRemote;
    private final Object _webSocketSendSyncObject = new Object();

    WebSocketPushChannel(Session webSocketSession) {
        _webSocketSession = webSocketSession;
        _webSocketBasicRemote = webSocketSession.getBasicRemote();
    }

    @Override
    public boolean isOpen() {
        return _webSocketSession.isOpen();
    }

    @Override
    public void sendText(String text) throws IOException {
        synchronized (_webSocketSendSyncObject) {
            _webSocketBasicRemote.sendText(text);
        }
    }

    @Override
    public void close(CloseCode closeCode, String reason) {
        closeWebSocket(_webSocketSession, closeCode, reason);
    }

    static void closeWebSocket(Session webSocketSession, CloseCode closeCode, String reasonPhrase) {
        log.info("Closing WebSocket SessionId [" + webSocketSession.getId() + "]: code: [" + closeCode
                + "(" + closeCode.getCode() + ")], reason:[" + reasonPhrase + "]");
        try {
            // The close frame's reason can max be 123 bytes.
            while (reasonPhrase != null
                    && reasonPhrase.getBytes(StandardCharsets.UTF_8).length > ChatSocketStatics.MAX_CLOSE_REASON_BYTES) {
                reasonPhrase = reasonPhrase.substring(0, reasonPhrase.length() - 1);
            }
            webSocketSession.close(new CloseReason(closeCode, reasonPhrase));
        }
        catch (IOException e) {
            log.warn("Got Exception when trying to close WebSocket SessionId [" + webSocketSession.getId()
                    + "], ignoring.", e);
        }
    }

    @Override
    public String toString() {
        return "WebSocketPushChannel{webSocketSessionId=" + _webSocketSession.getId() + '}';
    }
}
