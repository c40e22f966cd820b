package com.example.messaging.config;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import java.time.Duration;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.NestedConfigurationProperty;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "messaging")
public class MessagingProperties {

    @NestedConfigurationProperty
    private final Redis redis = new Redis();

    @NestedConfigurationProperty
    private final Kafka kafka = new Kafka();

    @NestedConfigurationProperty
    private final Locks locks = new Locks();

    @NestedConfigurationProperty
    private final Delivery delivery = new Delivery();

    @NestedConfigurationProperty
    private final Notification notification = new Notification();

    @NestedConfigurationProperty
    private final Digest digest = new Digest();

    @NestedConfigurationProperty
    private final Filter filter = new Filter();

    @NestedConfigurationProperty
    private final SocketIo socketio = new SocketIo();

    @NestedConfigurationProperty
    private final Uploads uploads = new Uploads();

    public Redis getRedis() {
        return redis;
    }

    public Kafka getKafka() {
        return kafka;
    }

    public Locks getLocks() {
        return locks;
    }

    public Delivery getDelivery() {
        return delivery;
    }

    public Notification getNotification() {
        return notification;
    }

    public Digest getDigest() {
        return digest;
    }

    public Filter getFilter() {
        return filter;
    }

    public SocketIo getSocketio() {
        return socketio;
    }

    public Uploads getUploads() {
        return uploads;
    }

    @Validated
    public static class Redis {

        /**
         * Prefix applied to all Redis keys controlled by the messaging module.
         */
        private String keyPrefix = "messaging";

        public String getKeyPrefix() {
            return keyPrefix;
        }

        public void setKeyPrefix(String keyPrefix) {
            this.keyPrefix = keyPrefix;
        }
    }

    @Validated
    public static class Kafka {

        /**
         * Kafka topic for conversation, read-receipt and presence events.
         */
        private String lifecycleTopic = "messaging.lifecycle";

        /**
         * Kafka topic for persisted messages.
         */
        private String messageTopic = "messaging.messages";

        public String getLifecycleTopic() {
            return lifecycleTopic;
        }

        public void setLifecycleTopic(String lifecycleTopic) {
            this.lifecycleTopic = lifecycleTopic;
        }

        public String getMessageTopic() {
            return messageTopic;
        }

        public void setMessageTopic(String messageTopic) {
            this.messageTopic = messageTopic;
        }
    }

    @Validated
    public static class Locks {

        /**
         * {@code redisson} serializes appends across processes, {@code local} only within this JVM.
         */
        private String provider = "redisson";

        public String getProvider() {
            return provider;
        }

        public void setProvider(String provider) {
            this.provider = provider;
        }
    }

    @Validated
    public static class Delivery {

        /**
         * Threads pushing persisted messages to live connections.
         */
        @Min(1)
        private int poolSize = 4;

        /**
         * Deliveries waiting for a free thread before new ones are rejected.
         */
        @Min(1)
        private int queueCapacity = 10_000;

        public int getPoolSize() {
            return poolSize;
        }

        public void setPoolSize(int poolSize) {
            this.poolSize = poolSize;
        }

        public int getQueueCapacity() {
            return queueCapacity;
        }

        public void setQueueCapacity(int queueCapacity) {
            this.queueCapacity = queueCapacity;
        }
    }

    @Validated
    public static class Notification {

        private boolean enabled = true;

        /**
         * At most one email per recipient and conversation inside this rolling window.
         */
        private Duration window = Duration.ofHours(1);

        /**
         * Characters of message content quoted in the email.
         */
        @Min(20)
        private int previewLength = 200;

        @NotBlank
        private String frontendUrl = "http://localhost:5173";

        @NotBlank
        private String fromAddress = "Marketplace <notifications@example.com>";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public Duration getWindow() {
            return window;
        }

        public void setWindow(Duration window) {
            this.window = window;
        }

        public int getPreviewLength() {
            return previewLength;
        }

        public void setPreviewLength(int previewLength) {
            this.previewLength = previewLength;
        }

        public String getFrontendUrl() {
            return frontendUrl;
        }

        public void setFrontendUrl(String frontendUrl) {
            this.frontendUrl = frontendUrl;
        }

        public String getFromAddress() {
            return fromAddress;
        }

        public void setFromAddress(String fromAddress) {
            this.fromAddress = fromAddress;
        }
    }

    @Validated
    public static class Digest {

        private boolean enabled = true;

        /**
         * Local hour of day (0-23) at which the digest goes out.
         */
        @Min(0)
        @Max(23)
        private int hour = 9;

        /**
         * Zone used to decide the local hour and date. Defaults to the system zone.
         */
        private String zone;

        private Duration checkInterval = Duration.ofHours(1);

        /**
         * Unread messages older than this are left out of the digest.
         */
        private Duration lookback = Duration.ofHours(24);

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public int getHour() {
            return hour;
        }

        public void setHour(int hour) {
            this.hour = hour;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public Duration getCheckInterval() {
            return checkInterval;
        }

        public void setCheckInterval(Duration checkInterval) {
            this.checkInterval = checkInterval;
        }

        public Duration getLookback() {
            return lookback;
        }

        public void setLookback(Duration lookback) {
            this.lookback = lookback;
        }
    }

    @Validated
    public static class Filter {

        @NotBlank
        private String rulesLocation = "classpath:filter-rules.json";

        public String getRulesLocation() {
            return rulesLocation;
        }

        public void setRulesLocation(String rulesLocation) {
            this.rulesLocation = rulesLocation;
        }
    }

    @Validated
    public static class SocketIo {

        private String host = "0.0.0.0";

        private int port = 9094;

        /**
         * Heartbeat interval. Clients that miss {@link #pingTimeout} are disconnected.
         */
        private Duration pingInterval = Duration.ofSeconds(25);

        private Duration pingTimeout = Duration.ofSeconds(60);

        public String getHost() {
            return host;
        }

        public void setHost(String host) {
            this.host = host;
        }

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public Duration getPingInterval() {
            return pingInterval;
        }

        public void setPingInterval(Duration pingInterval) {
            this.pingInterval = pingInterval;
        }

        public Duration getPingTimeout() {
            return pingTimeout;
        }

        public void setPingTimeout(Duration pingTimeout) {
            this.pingTimeout = pingTimeout;
        }
    }

    @Validated
    public static class Uploads {

        @NotBlank
        private String directory = "uploads";

        private long maxFileSize = 50_000_000L;

        @NotBlank
        private String publicBaseUrl = "/uploads";

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public long getMaxFileSize() {
            return maxFileSize;
        }

        public void setMaxFileSize(long maxFileSize) {
            this.maxFileSize = maxFileSize;
        }

        public String getPublicBaseUrl() {
            return publicBaseUrl;
        }

        public void setPublicBaseUrl(String publicBaseUrl) {
            this.publicBaseUrl = publicBaseUrl;
        }
    }
}
