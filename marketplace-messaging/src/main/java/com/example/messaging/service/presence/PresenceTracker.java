package com.example.messaging.service.presence;

import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.locks.ReentrantLock;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

/**
 * Which users have at least one live connection in this process. A user is online while any of their
 * connections is registered, so closing one tab does not take them offline.
 *
 * <p>Changes for one user are serialized through a transition lock held until the listeners return, so
 * listeners see that user's online and offline transitions in the order they happened.
 */
@Slf4j
@Component
public class PresenceTracker {

    private static final int TRANSITION_STRIPES = 64;

    private final Object monitor = new Object();
    private final ReentrantLock[] transitionLocks = new ReentrantLock[TRANSITION_STRIPES];
    private final Map<String, Set<ConnectionHandle>> connections = new HashMap<>();
    private final List<PresenceListener> listeners = new CopyOnWriteArrayList<>();

    public PresenceTracker() {
        for (int i = 0; i < TRANSITION_STRIPES; i++) {
            transitionLocks[i] = new ReentrantLock();
        }
    }

    public void addListener(PresenceListener listener) {
        listeners.add(listener);
    }

    public void markOnline(String userId, ConnectionHandle handle) {
        ReentrantLock transition = transitionLock(userId);
        transition.lock();
        try {
            boolean cameOnline;
            synchronized (monitor) {
                Set<ConnectionHandle> handles = connections.computeIfAbsent(userId, key -> new LinkedHashSet<>());
                cameOnline = handles.isEmpty();
                handles.add(handle);
            }
            log.debug("Connection {} registered for user {}", handle.id(), userId);
            if (cameOnline) {
                listeners.forEach(listener -> notifySafely(() -> listener.userOnline(userId)));
            }
        } finally {
            transition.unlock();
        }
    }

    /**
     * Removes one connection. Unknown handles are ignored.
     *
     * @return {@code true} when this was the user's last connection
     */
    public boolean markOffline(String userId, ConnectionHandle handle) {
        ReentrantLock transition = transitionLock(userId);
        transition.lock();
        try {
            boolean wentOffline = false;
            synchronized (monitor) {
                Set<ConnectionHandle> handles = connections.get(userId);
                if (handles != null && handles.remove(handle) && handles.isEmpty()) {
                    connections.remove(userId);
                    wentOffline = true;
                }
            }
            log.debug("Connection {} removed for user {}", handle.id(), userId);
            if (wentOffline) {
                listeners.forEach(listener -> notifySafely(() -> listener.userOffline(userId)));
            }
            return wentOffline;
        } finally {
            transition.unlock();
        }
    }

    public boolean isOnline(String userId) {
        synchronized (monitor) {
            return connections.containsKey(userId);
        }
    }

    public Set<ConnectionHandle> connections(String userId) {
        synchronized (monitor) {
            Set<ConnectionHandle> handles = connections.get(userId);
            return handles == null ? Set.of() : Set.copyOf(handles);
        }
    }

    public int onlineUserCount() {
        synchronized (monitor) {
            return connections.size();
        }
    }

    private ReentrantLock transitionLock(String userId) {
        return transitionLocks[Math.floorMod(userId.hashCode(), TRANSITION_STRIPES)];
    }

    private void notifySafely(Runnable notification) {
        try {
            notification.run();
        } catch (RuntimeException ex) {
            log.warn("Presence listener failed", ex);
        }
    }
}
