package com.example.messaging.service.attachment;

public record StoredBlob(String id, String fileName, String contentType, long size, String url) {
}
