package com.example.messaging.service.notification;

import com.example.messaging.config.MessagingProperties;
import com.example.messaging.domain.ChatMessage;
import com.example.messaging.domain.NotificationCategory;
import com.example.messaging.service.MessageStore;
import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;

/**
 * Sends the once-a-day summary of unread messages to users who opted in. Checked periodically; a run
 * happens on the first check inside the configured hour, at most once per local date.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DigestScheduler {

    private final MessageStore messageStore;
    private final AccountDirectory accountDirectory;
    private final NotificationTemplates templates;
    private final Notifier notifier;
    private final DigestStateStore stateStore;
    private final MessagingProperties properties;
    private final Clock clock;

    @Scheduled(fixedDelayString = "#{T(java.time.Duration).parse('${messaging.digest.check-interval:PT1H}').toMillis()}")
    public void checkAndSend() {
        MessagingProperties.Digest digest = properties.getDigest();
        if (!digest.isEnabled()) {
            return;
        }
        ZonedDateTime now = ZonedDateTime.now(clock.withZone(zone()));
        if (now.getHour() != digest.getHour()) {
            return;
        }
        LocalDate today = now.toLocalDate();
        Optional<LocalDate> last = stateStore.lastDigestDate();
        if (last.isPresent() && !last.get().isBefore(today)) {
            log.debug("Daily digest for {} already sent", today);
            return;
        }
        try {
            int sent = sendDigest(now.toInstant());
            stateStore.recordDigestDate(today);
            log.info("Daily digest for {} sent to {} recipients", today, sent);
        } catch (RuntimeException ex) {
            log.error("Daily digest for {} failed", today, ex);
        }
    }

    /**
     * Runs an aggregation now. The recorded digest date is left alone, so the scheduled run still happens.
     *
     * @return number of digests sent
     */
    public int triggerNow() {
        int sent = sendDigest(clock.instant());
        log.info("Manually triggered digest sent to {} recipients", sent);
        return sent;
    }

    private int sendDigest(Instant now) {
        List<ChatMessage> unread = messageStore.unreadSince(now.minus(properties.getDigest().getLookback()));
        Map<String, List<ChatMessage>> byRecipient = new LinkedHashMap<>();
        for (ChatMessage message : unread) {
            byRecipient.computeIfAbsent(message.getReceiverId(), key -> new ArrayList<>()).add(message);
        }

        int sent = 0;
        for (Map.Entry<String, List<ChatMessage>> entry : byRecipient.entrySet()) {
            if (sendTo(entry.getKey(), entry.getValue())) {
                sent++;
            }
        }
        return sent;
    }

    private boolean sendTo(String recipientId, List<ChatMessage> messages) {
        try {
            if (!accountDirectory.getNotificationPreference(recipientId, NotificationCategory.DAILY_DIGEST)) {
                return false;
            }
            String email = accountDirectory.resolveEmail(recipientId).orElse(null);
            if (email == null) {
                return false;
            }
            Set<String> senders = new TreeSet<>();
            messages.forEach(message -> senders.add(accountDirectory.resolveDisplayName(message.getSenderId())));
            EmailContent content = templates.dailyDigest(accountDirectory.resolveDisplayName(recipientId), messages.size(), senders);
            notifier.send(email, content.subject(), content.html());
            return true;
        } catch (RuntimeException ex) {
            log.warn("Daily digest to {} failed: {}", recipientId, ex.getMessage(), ex);
            return false;
        }
    }

    private ZoneId zone() {
        String zone = properties.getDigest().getZone();
        return StringUtils.hasText(zone) ? ZoneId.of(zone) : clock.getZone();
    }
}
