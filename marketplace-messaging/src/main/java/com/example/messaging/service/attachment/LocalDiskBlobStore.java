package com.example.messaging.service.attachment;

import com.example.messaging.config.MessagingProperties;
import com.example.messaging.service.exception.ServiceException;
import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.UUID;
import lombok.extern.slf4j.Slf4j;
import org.springframework.http.HttpStatus;
import org.springframework.stereotype.Component;

/**
 * Writes files under the configured upload directory, one sub-directory per uploader.
 */
@Slf4j
@Component
public class LocalDiskBlobStore implements BlobStore {

    private final Path root;
    private final String publicBaseUrl;

    public LocalDiskBlobStore(MessagingProperties properties) {
        this.root = Paths.get(properties.getUploads().getDirectory()).toAbsolutePath().normalize();
        this.publicBaseUrl = properties.getUploads().getPublicBaseUrl();
    }

    @Override
    public StoredBlob store(String ownerId, byte[] content, String fileName, String contentType) {
        String id = UUID.randomUUID().toString();
        String safeName = sanitize(fileName);
        Path directory = root.resolve(sanitize(ownerId));
        Path target = directory.resolve(id + "_" + safeName).normalize();
        if (!target.startsWith(root)) {
            throw new ServiceException(HttpStatus.BAD_REQUEST, "Invalid file name", "INVALID_FILE");
        }
        try {
            Files.createDirectories(directory);
            Files.write(target, content);
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to store upload " + safeName, ex);
        }
        log.info("Stored upload {} ({} bytes) for {}", id, content.length, ownerId);
        String url = publicBaseUrl + "/" + root.relativize(target).toString().replace('\\', '/');
        return new StoredBlob(id, fileName, contentType, content.length, url);
    }

    static String sanitize(String name) {
        String cleaned = name == null ? "" : name.replaceAll("[^A-Za-z0-9._-]", "_");
        if (cleaned.isEmpty() || cleaned.chars().allMatch(c -> c == '.')) {
            return "file";
        }
        return cleaned;
    }
}
