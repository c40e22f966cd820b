package com.example.messaging.domain;

import java.io.Serializable;
import lombok.Value;

/**
 * Identity of the caller, produced by a single trusted verification of its token.
 */
@Value
public class AuthenticatedPrincipal implements Serializable {

    String userId;
    ParticipantType type;

    public boolean isAdmin() {
        return type == ParticipantType.ADMIN;
    }
}
