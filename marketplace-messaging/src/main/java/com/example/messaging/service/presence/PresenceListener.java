package com.example.messaging.service.presence;

public interface PresenceListener {

    void userOnline(String userId);

    void userOffline(String userId);
}
