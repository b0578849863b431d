package com.flagship.bookstore.domain.publisher;

import com.flagship.bookstore.domain.DomainEvent;
import lombok.Value;

import java.util.UUID;

@Value
public class PublisherUpdated implements DomainEvent {
    UUID publisherId;
    String name;

    public static final String EVENT_TYPE = "PublisherUpdated";

    @Override
    public String getEventType() {
        return EVENT_TYPE;
    }
}
