package com.example.messaging.service;

import java.util.function.Supplier;

/**
 * Mutual exclusion keyed by name. Appends to one conversation run one at a time; different keys do not
 * wait for each other.
 */
public interface ConversationLocks {

    <T> T withLock(String key, Supplier<T> action);
}
