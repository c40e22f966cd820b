package com.example.messaging.service.attachment;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.example.messaging.domain.AuthenticatedPrincipal;
import com.example.messaging.domain.ChatMessage;
import com.example.messaging.domain.ChatMessageType;
import com.example.messaging.domain.Conversation;
import com.example.messaging.domain.ParticipantType;
import com.example.messaging.event.ChatEventPublisher;
import com.example.messaging.service.MessagingService;
import com.example.messaging.service.exception.ServiceException;
import com.example.messaging.service.exception.UnauthorizedException;
import com.example.messaging.support.MessagingFixture;
import java.nio.file.Path;
import java.util.List;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.http.HttpStatus;

class AttachmentServiceTest {

    private static final AuthenticatedPrincipal CLIENT = new AuthenticatedPrincipal("client", ParticipantType.CLIENT);

    @TempDir
    Path uploads;

    private MessagingFixture fixture;
    private AttachmentService attachments;
    private Conversation conversation;

    @BeforeEach
    void setUp() {
        fixture = new MessagingFixture();
        fixture.properties.getUploads().setDirectory(uploads.toString());
        fixture.properties.getUploads().setMaxFileSize(16);
        MessagingService messaging = new MessagingService(fixture.conversationStore, fixture.messageStore,
                mock(ChatEventPublisher.class), fixture.clock);
        attachments = new AttachmentService(new LocalDiskBlobStore(fixture.properties), fixture.conversationStore,
                messaging, fixture.properties);
        conversation = fixture.conversationStore.findOrCreate(List.of("client", "talent"), null, null).conversation();
    }

    @Test
    void sharedFileBecomesFileMessage() {
        ChatMessage message = attachments.sendFile(CLIENT, conversation.getId(), null, new byte[] {1, 2, 3},
                "brief.pdf", "application/pdf");

        assertThat(message.getType()).isEqualTo(ChatMessageType.FILE);
        assertThat(message.getContent()).isEqualTo("Shared file: brief.pdf");
        assertThat(message.getReceiverId()).isEqualTo("talent");
        assertThat(message.getMetadata())
                .containsEntry("fileName", "brief.pdf")
                .containsEntry("fileType", "application/pdf")
                .containsEntry("fileSize", 3L)
                .containsKeys("fileId", "url");
    }

    @Test
    void rejectsEmptyAndOversizedFiles() {
        assertThatThrownBy(() -> attachments.sendFile(CLIENT, conversation.getId(), null, new byte[0], "a.txt", null))
                .isInstanceOfSatisfying(ServiceException.class,
                        ex -> assertThat(ex.getStatus()).isEqualTo(HttpStatus.BAD_REQUEST));
        assertThatThrownBy(() -> attachments.sendFile(CLIENT, conversation.getId(), null, new byte[17], "a.txt", null))
                .isInstanceOfSatisfying(ServiceException.class,
                        ex -> assertThat(ex.getStatus()).isEqualTo(HttpStatus.PAYLOAD_TOO_LARGE));
    }

    @Test
    void outsidersCannotUpload() {
        AuthenticatedPrincipal outsider = new AuthenticatedPrincipal("outsider", ParticipantType.TALENT);

        assertThatThrownBy(() -> attachments.sendFile(outsider, conversation.getId(), null, new byte[] {1}, "a.txt", null))
                .isInstanceOf(UnauthorizedException.class);
        assertThat(fixture.messages.size()).isZero();
    }
}
