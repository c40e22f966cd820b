package com.example.messaging.service.notification;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import com.example.messaging.config.MessagingProperties;
import com.example.messaging.domain.NotificationCategory;
import com.example.messaging.service.presence.PresenceTracker;
import com.example.messaging.support.FakeConnectionHandle;
import com.example.messaging.support.InMemoryNotificationLogRepository;
import com.example.messaging.support.MutableClock;
import com.example.messaging.support.StubAccountDirectory;
import java.time.Duration;
import java.time.Instant;
import java.util.Optional;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class NotificationThrottlerTest {

    private final MutableClock clock = new MutableClock(Instant.parse("2024-05-01T10:00:00Z"));
    private final PresenceTracker presence = new PresenceTracker();
    private final StubAccountDirectory directory = new StubAccountDirectory();
    private final InMemoryNotificationLogRepository log = new InMemoryNotificationLogRepository();
    private NotificationThrottler throttler;

    @BeforeEach
    void setUp() {
        directory.user("u2", "Dana", "dana@example.com");
        throttler = new NotificationThrottler(presence, directory, log, new MessagingProperties(), clock);
    }

    @Test
    void offlineRecipientWithEmailIsNotified() {
        assertThat(throttler.shouldNotify("u2", "c1")).isTrue();
    }

    @Test
    void onlineRecipientIsNeverEmailed() {
        presence.markOnline("u2", new FakeConnectionHandle("tab"));

        assertThat(throttler.shouldNotify("u2", "c1")).isFalse();
    }

    @Test
    void oneEmailPerConversationPerHour() {
        throttler.recordSent("dana@example.com", "c1");

        clock.advance(Duration.ofMinutes(59));
        assertThat(throttler.shouldNotify("u2", "c1")).isFalse();
        assertThat(throttler.shouldNotify("u2", "c2")).isTrue();

        clock.advance(Duration.ofMinutes(2));
        assertThat(throttler.shouldNotify("u2", "c1")).isTrue();
    }

    @Test
    void respectsCategoryOptOut() {
        directory.preference("u2", NotificationCategory.PAYMENTS, false);

        assertThat(throttler.shouldNotify("u2", "c1", NotificationCategory.PAYMENTS)).isFalse();
        assertThat(throttler.shouldNotify("u2", "c1", NotificationCategory.MESSAGES)).isTrue();
    }

    @Test
    void recipientWithoutEmailIsSkipped() {
        assertThat(throttler.shouldNotify("no-email", "c1")).isFalse();
    }

    @Test
    void unreadablePreferencesCountAsEnabled() {
        AccountDirectory broken = mock(AccountDirectory.class);
        when(broken.getNotificationPreference(any(), any())).thenThrow(new IllegalStateException("db down"));
        when(broken.resolveEmail("u2")).thenReturn(Optional.of("dana@example.com"));
        NotificationThrottler lenient = new NotificationThrottler(presence, broken, log, new MessagingProperties(), clock);

        assertThat(lenient.shouldNotify("u2", "c1")).isTrue();
    }
}
