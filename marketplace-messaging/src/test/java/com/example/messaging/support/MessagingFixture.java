package com.example.messaging.support;

import com.example.messaging.config.MessagingProperties;
import com.example.messaging.service.ConversationStore;
import com.example.messaging.service.LocalConversationLocks;
import com.example.messaging.service.MessageStore;
import com.example.messaging.service.RedisKeyFactory;
import com.example.messaging.service.moderation.ContentFilterEngine;
import com.example.messaging.service.moderation.FilterRuleRegistry;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import java.time.Instant;
import org.springframework.core.io.DefaultResourceLoader;

/**
 * The store layer wired over in-memory repositories, the shipped rule set and a controllable clock.
 */
public class MessagingFixture {

    public final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    public final MessagingProperties properties = new MessagingProperties();
    public final InMemoryConversationRepository conversations = new InMemoryConversationRepository();
    public final InMemoryMessageRepository messages = new InMemoryMessageRepository();
    public final InMemoryCustomFilterRuleStore customRules = new InMemoryCustomFilterRuleStore();
    public final LocalConversationLocks locks = new LocalConversationLocks();
    public final RedisKeyFactory keyFactory = new RedisKeyFactory(properties);
    public final FilterRuleRegistry ruleRegistry;
    public final ContentFilterEngine contentFilter;
    public final ConversationStore conversationStore;
    public final MessageStore messageStore;

    public MessagingFixture() {
        ruleRegistry = new FilterRuleRegistry(properties, objectMapper(), new DefaultResourceLoader(), customRules);
        ruleRegistry.reload();
        contentFilter = new ContentFilterEngine(ruleRegistry);
        conversationStore = new ConversationStore(conversations, locks, keyFactory, clock);
        messageStore = new MessageStore(messages, conversationStore, contentFilter, locks, keyFactory, clock);
    }

    public static ObjectMapper objectMapper() {
        return new ObjectMapper().registerModule(new JavaTimeModule());
    }
}
