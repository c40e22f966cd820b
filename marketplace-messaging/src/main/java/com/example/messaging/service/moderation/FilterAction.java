package com.example.messaging.service.moderation;

public enum FilterAction {
    /**
     * Replace every match with the rule's replacement and flag the message for review.
     */
    REDACT_AND_FLAG,
    /**
     * Leave the text untouched and flag the message. A high severity match blocks the message.
     */
    FLAG_ONLY
}
