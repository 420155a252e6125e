package io.chatsocket.impl;

import java.net.URI;

import org.eclipse.jetty.server.Server;
import org.eclipse.jetty.server.ServerConnector;
import org.eclipse.jetty.servlet.ServletContextHandler;
import org.eclipse.jetty.websocket.jakarta.server.config.JakartaWebSocketServletContainerInitializer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.chatsocket.ModelClient;
import io.chatsocket.SessionStore;

/**
 * Embedded Jetty with the ChatSocket endpoint on "/chat", listening on a random port.
 */
class ChatSocketTestServer {
    private static final Logger log = LoggerFactory.getLogger(ChatSocketTestServer.class);

    static final String WEBSOCKET_PATH = "/chat";

    private final Server _server;
    private final ServerConnector _connector;
    private volatile DefaultChatSocketServer _chatSocketServer;

    ChatSocketTestServer(SessionStore sessionStore, ModelClient modelClient) {
        _server = new Server();
        _connector = new ServerConnector(_server);
        _connector.setHost("localhost");
        _connector.setPort(0);
        _server.addConnector(_connector);

        ServletContextHandler context = new ServletContextHandler(ServletContextHandler.NO_SESSIONS);
        context.setContextPath("/");
        JakartaWebSocketServletContainerInitializer.configure(context, (servletContext, serverContainer) -> {
            _chatSocketServer = DefaultChatSocketServer.createChatSocketServer(serverContainer, WEBSOCKET_PATH,
                    sessionStore, modelClient);
        });
        _server.setHandler(context);
    }

    void start() throws Exception {
        _server.start();
        log.info("ChatSocketTestServer started at [" + getUri() + "].");
    }

    URI getUri() {
        return URI.create("ws://localhost:" + _connector.getLocalPort() + WEBSOCKET_PATH);
    }

    DefaultChatSocketServer getChatSocketServer() {
        return _chatSocketServer;
    }

    void stop() {
        try {
            if (_chatSocketServer != null) {
                _chatSocketServer.stop(1000);
            }
            _server.stop();
        }
        catch (Exception e) {
            log.warn("Got problems stopping ChatSocketTestServer.", e);
        }
    }
}
