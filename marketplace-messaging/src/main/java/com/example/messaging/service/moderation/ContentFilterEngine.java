package com.example.messaging.service.moderation;

import com.example.messaging.service.exception.ServiceException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import java.util.regex.PatternSyntaxException;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Screens message text for attempts to move the conversation off the platform.
 *
 * <p>Rules run in order against the running text, so a redaction made by an earlier rule is what later
 * rules see. Evaluation has no side effects: the same text and rule set always produce the same verdict.
 */
@Component
@RequiredArgsConstructor
public class ContentFilterEngine {

    private final FilterRuleRegistry ruleRegistry;

    private final Map<String, Pattern> compiledPatterns = new ConcurrentHashMap<>();

    public FilterVerdict evaluate(String text) {
        return evaluate(text, ruleRegistry.activeRules());
    }

    public FilterVerdict evaluate(String text, List<FilterRule> rules) {
        if (text == null || text.isEmpty() || rules == null || rules.isEmpty()) {
            return FilterVerdict.clean(text == null ? "" : text);
        }

        String filtered = text;
        List<FilterViolation> violations = new ArrayList<>();
        boolean blocked = false;

        for (FilterRule rule : rules) {
            if (!rule.isActive()) {
                continue;
            }
            Matcher matcher = compile(rule).matcher(filtered);
            boolean matched = false;
            while (matcher.find()) {
                matched = true;
                violations.add(FilterViolation.builder()
                        .ruleId(rule.getId())
                        .category(rule.getCategory())
                        .match(matcher.group())
                        .position(matcher.start())
                        .severity(rule.getSeverity())
                        .action(rule.getAction())
                        .build());
                if (rule.getSeverity() == FilterSeverity.HIGH && !rule.redacts()) {
                    blocked = true;
                }
            }
            if (matched && rule.redacts()) {
                filtered = matcher.replaceAll(Matcher.quoteReplacement(rule.effectiveReplacement()));
            }
        }

        return FilterVerdict.builder()
                .originalText(text)
                .filteredText(filtered)
                .violations(List.copyOf(violations))
                .blocked(blocked)
                .requiresReview(!violations.isEmpty())
                .build();
    }

    public ViolationStats statistics(Collection<String> texts) {
        return statistics(texts, ruleRegistry.activeRules());
    }

    public ViolationStats statistics(Collection<String> texts, List<FilterRule> rules) {
        long total = 0;
        Map<FilterCategory, Long> byCategory = new EnumMap<>(FilterCategory.class);
        Map<FilterSeverity, Long> bySeverity = new EnumMap<>(FilterSeverity.class);
        for (String text : texts) {
            FilterVerdict verdict = evaluate(text, rules);
            if (verdict.getViolations().isEmpty()) {
                continue;
            }
            total++;
            for (FilterViolation violation : verdict.getViolations()) {
                byCategory.merge(violation.getCategory(), 1L, Long::sum);
                bySeverity.merge(violation.getSeverity(), 1L, Long::sum);
            }
        }
        return ViolationStats.builder()
                .total(total)
                .byCategory(byCategory)
                .bySeverity(bySeverity)
                .build();
    }

    /**
     * Compiles the rule's pattern, rejecting sources {@link Pattern} cannot parse.
     */
    public Pattern compile(FilterRule rule) {
        String key = (rule.isCaseInsensitive() ? "i:" : "s:") + rule.getPattern();
        return compiledPatterns.computeIfAbsent(key, ignored -> {
            try {
                int flags = rule.isCaseInsensitive() ? Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE : 0;
                return Pattern.compile(rule.getPattern(), flags);
            } catch (PatternSyntaxException ex) {
                throw new ServiceException(
                        HttpStatus.BAD_REQUEST, "Invalid filter pattern for rule " + rule.getId(), "INVALID_RULE", ex);
            }
        });
    }
}
