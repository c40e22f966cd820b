package com.example.messaging.service.moderation;

import java.util.List;

/**
 * Persistence for rules added at runtime. Base rules ship with the application and are never stored here.
 */
public interface CustomFilterRuleStore {

    List<FilterRule> findAll();

    void save(FilterRule rule);

    boolean delete(String ruleId);
}
