package com.example.messaging.config;

import com.corundumstudio.socketio.Configuration;
import com.corundumstudio.socketio.SocketIOServer;
import com.corundumstudio.socketio.Transport;
import com.corundumstudio.socketio.protocol.JacksonJsonSupport;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;
import jakarta.annotation.PreDestroy;
import java.util.List;
import org.springframework.beans.factory.DisposableBean;
import org.springframework.context.annotation.Bean;

@org.springframework.context.annotation.Configuration
public class SocketIoConfig implements DisposableBean {

    private SocketIOServer server;

    @Bean
    public SocketIOServer socketIOServer(
            MessagingProperties properties,
            MessagingSecurityProperties securityProperties,
            ObjectMapper objectMapper) {
        MessagingProperties.SocketIo socketIo = properties.getSocketio();
        Configuration configuration = new Configuration();
        configuration.setHostname(socketIo.getHost());
        configuration.setPort(socketIo.getPort());
        configuration.setPingInterval((int) socketIo.getPingInterval().toMillis());
        configuration.setPingTimeout((int) socketIo.getPingTimeout().toMillis());
        configuration.setAllowCustomRequests(true);
        List<String> origins = securityProperties.getAllowedOrigins();
        // null lets the server echo the caller's origin back
        configuration.setOrigin(origins != null && origins.size() == 1 ? origins.get(0) : null);
        configuration.setTransports(Transport.WEBSOCKET, Transport.POLLING);
        configuration.setJsonSupport(new SharedMapperJsonSupport(objectMapper));

        server = new SocketIOServer(configuration);
        server.start();
        return server;
    }

    @PreDestroy
    @Override
    public void destroy() {
        if (server != null) {
            server.stop();
        }
    }

    /**
     * Makes Socket.IO payloads serialize times the same way as the HTTP API.
     */
    static class SharedMapperJsonSupport extends JacksonJsonSupport {

        SharedMapperJsonSupport(ObjectMapper baseMapper) {
            super(new JavaTimeModule());
            if (!baseMapper.isEnabled(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)) {
                this.objectMapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
            }
            this.objectMapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
            this.objectMapper.setTimeZone(baseMapper.getSerializationConfig().getTimeZone());
        }
    }
}
