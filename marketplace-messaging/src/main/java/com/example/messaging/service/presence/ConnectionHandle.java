package com.example.messaging.service.presence;

/**
 * One live client connection. Implementations compare equal by {@link #id()}.
 */
public interface ConnectionHandle {

    String id();

    /**
     * Queues an event for the client without waiting for it to be written.
     *
     * @throws IllegalStateException when the connection is already closed
     */
    void push(String event, Object payload);
}
