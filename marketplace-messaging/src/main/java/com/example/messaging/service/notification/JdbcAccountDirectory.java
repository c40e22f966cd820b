package com.example.messaging.service.notification;

import com.example.messaging.domain.NotificationCategory;
import java.util.List;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class JdbcAccountDirectory implements AccountDirectory {

    static final String UNKNOWN_USER = "Someone";

    private final JdbcTemplate jdbcTemplate;

    @Override
    public String resolveDisplayName(String userId) {
        List<String> names = jdbcTemplate.queryForList(
                "select coalesce(nullif(trim(name), ''), email) from users where cast(id as varchar) = ?",
                String.class, userId);
        return names.isEmpty() || names.get(0) == null ? UNKNOWN_USER : names.get(0);
    }

    @Override
    public Optional<String> resolveEmail(String userId) {
        List<String> emails = jdbcTemplate.queryForList(
                "select email from users where cast(id as varchar) = ?", String.class, userId);
        return emails.stream().filter(email -> email != null && !email.isBlank()).findFirst();
    }

    @Override
    public boolean getNotificationPreference(String userId, NotificationCategory category) {
        List<Boolean> values = jdbcTemplate.queryForList(
                "select " + column(category) + " from user_preferences where cast(user_id as varchar) = ?", Boolean.class, userId);
        if (values.isEmpty() || values.get(0) == null) {
            return category != NotificationCategory.DAILY_DIGEST;
        }
        return values.get(0);
    }

    private static String column(NotificationCategory category) {
        return switch (category) {
            case MESSAGES -> "message_email_notifications";
            case PAYMENTS -> "payment_email_notifications";
            case DAILY_DIGEST -> "daily_digest";
        };
    }
}
