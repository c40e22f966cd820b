package com.example.messaging.service.notification;

import com.example.messaging.config.MessagingProperties;
import java.util.Collection;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;
import org.springframework.util.StringUtils;
import org.springframework.web.util.HtmlUtils;

/**
 * Renders notification emails. All user supplied text is HTML-escaped.
 */
@Component
@RequiredArgsConstructor
public class NotificationTemplates {

    private final MessagingProperties properties;

    public EmailContent newMessage(String recipientName, String senderName, String content, String projectTitle,
            String conversationId) {
        String link = properties.getNotification().getFrontendUrl() + "/messages?conversation=" + conversationId;
        StringBuilder html = new StringBuilder()
                .append("<p>Hi ").append(escape(recipientName)).append(",</p>")
                .append("<p><strong>").append(escape(senderName)).append("</strong> sent you a message");
        if (StringUtils.hasText(projectTitle)) {
            html.append(" about <em>").append(escape(projectTitle)).append("</em>");
        }
        html.append(":</p>")
                .append("<blockquote>").append(escape(preview(content))).append("</blockquote>")
                .append("<p><a href=\"").append(escape(link)).append("\">Reply on the platform</a></p>");
        return new EmailContent("New message from " + senderName, html.toString());
    }

    public EmailContent dailyDigest(String recipientName, long unreadCount, Collection<String> senderNames) {
        String link = properties.getNotification().getFrontendUrl() + "/messages";
        StringBuilder html = new StringBuilder()
                .append("<p>Hi ").append(escape(recipientName)).append(",</p>")
                .append("<p>You have ").append(unreadCount).append(" unread message")
                .append(unreadCount == 1 ? "" : "s").append(" from:</p><ul>");
        senderNames.forEach(name -> html.append("<li>").append(escape(name)).append("</li>"));
        html.append("</ul><p><a href=\"").append(escape(link)).append("\">Open your inbox</a></p>");
        String subject = "Daily Summary: %d unread message%s".formatted(unreadCount, unreadCount == 1 ? "" : "s");
        return new EmailContent(subject, html.toString());
    }

    String preview(String content) {
        int limit = properties.getNotification().getPreviewLength();
        if (content == null) {
            return "";
        }
        if (content.length() <= limit) {
            return content;
        }
        return content.substring(0, limit) + "...";
    }

    private static String escape(String value) {
        return value == null ? "" : HtmlUtils.htmlEscape(value);
    }
}
