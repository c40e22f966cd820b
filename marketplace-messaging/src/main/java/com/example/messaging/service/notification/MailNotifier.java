package com.example.messaging.service.notification;

import com.example.messaging.config.MessagingProperties;
import com.example.messaging.service.exception.NotificationSendException;
import jakarta.mail.MessagingException;
import jakarta.mail.internet.MimeMessage;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.mail.MailException;
import org.springframework.mail.javamail.JavaMailSender;
import org.springframework.mail.javamail.MimeMessageHelper;

@Slf4j
@RequiredArgsConstructor
public class MailNotifier implements Notifier {

    private final JavaMailSender mailSender;
    private final MessagingProperties properties;

    @Override
    public void send(String to, String subject, String html) {
        try {
            MimeMessage mime = mailSender.createMimeMessage();
            MimeMessageHelper helper = new MimeMessageHelper(mime, "UTF-8");
            helper.setFrom(properties.getNotification().getFromAddress());
            helper.setTo(to);
            helper.setSubject(subject);
            helper.setText(html, true);
            mailSender.send(mime);
            log.debug("Sent \"{}\" to {}", subject, to);
        } catch (MessagingException | MailException ex) {
            throw new NotificationSendException("Failed to send email to " + to, ex);
        }
    }
}
