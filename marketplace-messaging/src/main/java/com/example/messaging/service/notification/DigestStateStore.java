package com.example.messaging.service.notification;

import java.time.LocalDate;
import java.util.Optional;

/**
 * Remembers the date of the last scheduled digest so a restart on the same day does not send it twice.
 */
public interface DigestStateStore {

    Optional<LocalDate> lastDigestDate();

    void recordDigestDate(LocalDate date);
}
