package com.flagship.bookstore.domain.author;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.util.Map;
import java.util.UUID;

@Value
public class AuthorUpdated implements DomainEvent {
    UUID authorId;
    String name;
    Map<String, String> biographies;

    public static final String EVENT_TYPE = "AuthorUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
