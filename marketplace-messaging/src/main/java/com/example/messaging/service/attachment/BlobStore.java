package com.example.messaging.service.attachment;

/**
 * Storage for files shared in conversations.
 */
public interface BlobStore {

    StoredBlob store(String ownerId, byte[] content, String fileName, String contentType);
}
