package com.example.messaging.domain;

public enum ParticipantType {
    CLIENT,
    TALENT,
    ADMIN
}
