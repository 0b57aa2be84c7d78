package com.p14n.pgtopics.app;

import com.p14n.pgtopics.data.EventPayload;

/**
 * Sample payload. The user id doubles as the idempotency key.
 */
public record UserCreated(String userId, String name) implements EventPayload {

    @Override
    public String eventId() {
        return "user_created_" + userId;
    }
}
