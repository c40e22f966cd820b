package com.example.messaging.service.attachment;

import com.example.messaging.config.MessagingProperties;
import com.example.messaging.domain.AuthenticatedPrincipal;
import com.example.messaging.domain.ChatMessage;
import com.example.messaging.domain.ChatMessageType;
import com.example.messaging.service.ConversationStore;
import com.example.messaging.service.MessageDraft;
import com.example.messaging.service.MessagingService;
import com.example.messaging.service.exception.ServiceException;
import com.example.messaging.service.exception.UnauthorizedException;
import java.util.LinkedHashMap;
import java.util.Map;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

/**
 * Shares a file in a conversation: stores it, then sends a FILE message pointing at it.
 */
@Service
@RequiredArgsConstructor
public class AttachmentService {

    private final BlobStore blobStore;
    private final ConversationStore conversationStore;
    private final MessagingService messagingService;
    private final MessagingProperties properties;

    public ChatMessage sendFile(AuthenticatedPrincipal principal, String conversationId, String receiverId,
            byte[] content, String fileName, String contentType) {
        if (content == null || content.length == 0) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "No file provided", "INVALID_FILE");
        }
        if (content.length > properties.getUploads().getMaxFileSize()) {
            throw new ServiceException(HttpStatus.PAYLOAD_TOO_LARGE, "File exceeds the upload limit", "FILE_TOO_LARGE");
        }
        if (!conversationStore.get(conversationId).hasParticipant(principal.getUserId())) {
            throw new UnauthorizedException("User %s is not a participant of conversation %s"
                    .formatted(principal.getUserId(), conversationId));
        }
        String name = StringUtils.hasText(fileName) ? fileName : "file";
        StoredBlob blob = blobStore.store(principal.getUserId(), content, name, contentType);

        Map<String, Object> metadata = new LinkedHashMap<>();
        metadata.put("fileId", blob.id());
        metadata.put("fileName", blob.fileName());
        metadata.put("fileType", blob.contentType());
        metadata.put("fileSize", blob.size());
        metadata.put("url", blob.url());

        return messagingService.sendMessage(principal, MessageDraft.builder()
                .conversationId(conversationId)
                .receiverId(receiverId)
                .type(ChatMessageType.FILE)
                .content("Shared file: " + name)
                .metadata(metadata)
                .build());
    }
}
