package com.example.messaging.service.moderation;

import com.example.messaging.config.MessagingProperties;
import com.example.messaging.service.exception.ServiceException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.extern.slf4j.Slf4j;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Holds the active rule set: base rules read from the rule document, followed by custom rules in the order
 * they were added. Readers always see a complete snapshot.
 */
@Slf4j
@Component
public class FilterRuleRegistry {

    private static final TypeReference<List<FilterRule>> RULE_LIST = new TypeReference<>() {};

    private final MessagingProperties properties;
    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;
    private final CustomFilterRuleStore customRuleStore;

    private volatile List<FilterRule> baseRules = List.of();
    private volatile List<FilterRule> customRules = List.of();

    public FilterRuleRegistry(
            MessagingProperties properties,
            ObjectMapper objectMapper,
            ResourceLoader resourceLoader,
            CustomFilterRuleStore customRuleStore) {
        this.properties = properties;
        this.objectMapper = objectMapper;
        this.resourceLoader = resourceLoader;
        this.customRuleStore = customRuleStore;
    }

    @PostConstruct
    public void reload() {
        String location = properties.getFilter().getRulesLocation();
        Resource resource = resourceLoader.getResource(location);
        try (InputStream in = resource.getInputStream()) {
            List<FilterRule> loaded = readRules(objectMapper, in);
            loaded.forEach(FilterRuleRegistry::validate);
            baseRules = List.copyOf(loaded);
        } catch (IOException ex) {
            throw new IllegalStateException("Unable to read filter rules from " + location, ex);
        }
        customRules = List.copyOf(customRuleStore.findAll());
        log.info("Loaded {} base and {} custom content filter rules", baseRules.size(), customRules.size());
    }

    public List<FilterRule> activeRules() {
        List<FilterRule> base = baseRules;
        List<FilterRule> custom = customRules;
        List<FilterRule> rules = new ArrayList<>(base.size() + custom.size());
        base.stream().filter(FilterRule::isActive).forEach(rules::add);
        custom.stream().filter(FilterRule::isActive).forEach(rules::add);
        return List.copyOf(rules);
    }

    public synchronized FilterRule addCustomRule(FilterRule rule) {
        FilterRule custom = rule.toBuilder()
                .id(FilterRule.CUSTOM_PREFIX + UUID.randomUUID().toString().replace("-", ""))
                .build();
        validate(custom);
        customRuleStore.save(custom);
        List<FilterRule> updated = new ArrayList<>(customRules);
        updated.add(custom);
        customRules = List.copyOf(updated);
        log.info("Added custom filter rule {} ({}, {})", custom.getId(), custom.getCategory(), custom.getSeverity());
        return custom;
    }

    public synchronized boolean removeCustomRule(String ruleId) {
        if (!StringUtils.hasText(ruleId) || !ruleId.startsWith(FilterRule.CUSTOM_PREFIX)) {
            return false;
        }
        boolean known = customRules.stream().anyMatch(rule -> rule.getId().equals(ruleId));
        if (!known) {
            return false;
        }
        customRuleStore.delete(ruleId);
        customRules = customRules.stream()
                .filter(rule -> !rule.getId().equals(ruleId))
                .toList();
        log.info("Removed custom filter rule {}", ruleId);
        return true;
    }

    public static List<FilterRule> readRules(ObjectMapper objectMapper, InputStream in) throws IOException {
        List<FilterRule> rules = objectMapper.readValue(in, RULE_LIST);
        return rules != null ? rules : List.of();
    }

    static void validate(FilterRule rule) {
        if (!StringUtils.hasText(rule.getPattern())) {
            throw invalid("Filter rule pattern is required");
        }
        if (rule.getCategory() == null || rule.getSeverity() == null || rule.getAction() == null) {
            throw invalid("Filter rule category, severity and action are required");
        }
        try {
            Pattern.compile(rule.getPattern());
        } catch (PatternSyntaxException ex) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Invalid filter pattern: " + ex.getDescription(),
                    "INVALID_RULE", ex);
        }
    }

    private static ServiceException invalid(String message) {
        return new ServiceException(HttpStatus.BAD_REQUEST, message, "INVALID_RULE");
    }
}
