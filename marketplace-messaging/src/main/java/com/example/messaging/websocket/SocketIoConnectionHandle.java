package com.example.messaging.websocket;

import com.corundumstudio.socketio.SocketIOClient;
import com.example.messaging.service.presence.ConnectionHandle;
import java.util.Objects;

/**
 * Presence handle backed by a Socket.IO client session.
 */
public final class SocketIoConnectionHandle implements ConnectionHandle {

    private final SocketIOClient client;

    public SocketIoConnectionHandle(SocketIOClient client) {
        this.client = client;
    }

    @Override
    public String id() {
        return client.getSessionId().toString();
    }

    @Override
    public void push(String event, Object payload) {
        if (!client.isChannelOpen()) {
            throw new IllegalStateException("Socket " + id() + " is closed");
        }
        client.sendEvent(event, payload);
    }

    @Override
    public boolean equals(Object other) {
        return other instanceof SocketIoConnectionHandle handle && Objects.equals(id(), handle.id());
    }

    @Override
    public int hashCode() {
        return id().hashCode();
    }

    @Override
    public String toString() {
        return "socket:" + id();
    }
}
