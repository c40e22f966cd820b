package com.example.messaging.config;

import com.example.messaging.service.notification.LoggingNotifier;
import com.example.messaging.service.notification.MailNotifier;
import com.example.messaging.service.notification.Notifier;
import org.springframework.boot.autoconfigure.condition.ConditionalOnMissingBean;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.mail.javamail.JavaMailSender;

@Configuration
public class NotificationConfig {

    @Bean
    @ConditionalOnProperty(prefix = "spring.mail", name = "host")
    public Notifier mailNotifier(JavaMailSender mailSender, MessagingProperties properties) {
        return new MailNotifier(mailSender, properties);
    }

    @Bean
    @ConditionalOnMissingBean(Notifier.class)
    public Notifier loggingNotifier() {
        return new LoggingNotifier();
    }
}
