package com.example.messaging.service.notification;

import com.example.messaging.service.RedisKeyFactory;
import java.time.LocalDate;
import java.util.Optional;
import lombok.RequiredArgsConstructor;
import org.redisson.api.RBucket;
import org.redisson.api.RedissonClient;
import org.redisson.client.codec.StringCodec;
import org.springframework.stereotype.Component;

@Component
@RequiredArgsConstructor
public class RedissonDigestStateStore implements DigestStateStore {

    private final RedissonClient redissonClient;
    private final RedisKeyFactory keyFactory;

    @Override
    public Optional<LocalDate> lastDigestDate() {
        String value = bucket().get();
        return value == null ? Optional.empty() : Optional.of(LocalDate.parse(value));
    }

    @Override
    public void recordDigestDate(LocalDate date) {
        bucket().set(date.toString());
    }

    private RBucket<String> bucket() {
        return redissonClient.getBucket(keyFactory.digestDateKey(), StringCodec.INSTANCE);
    }
}
