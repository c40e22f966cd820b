package com.example.messaging.event;

/**
 * In-process subscriber to messaging events. Called on the publishing thread, so implementations hand off
 * anything slow.
 */
public interface ChatEventListener {

    default void onLifecycleEvent(ChatEvent event) {
    }

    default void onMessageEvent(ChatMessageEvent event) {
    }
}
