package com.example.messaging.service.moderation;

public enum FilterCategory {
    EMAIL,
    PHONE,
    SOCIAL_HANDLE,
    EXTERNAL_PLATFORM,
    URL,
    SOLICITATION
}
