package com.flagship.bookstore.catalog.publisher;

import com.flagship.bookstore.catalog.AggregateCommandExecutor;
import com.flagship.bookstore.catalog.CommandResult;
import com.flagship.bookstore.catalog.publisher.dto.PublisherRequest;
import com.flagship.bookstore.domain.publisher.Publisher;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class PublisherCommandService {

    private final AggregateCommandExecutor executor;
    private final Clock clock;

    public CommandResult create(PublisherRequest request) {
        UUID id = UUID.randomUUID();
        return executor.start(Publisher.TYPE, id, Publisher.create(id, request.getName()));
    }

    public CommandResult update(UUID id, Long expectedVersion, PublisherRequest request) {
        return executor.execute(Publisher.TYPE, id, expectedVersion, publisher -> publisher.update(request.getName()));
    }

    public CommandResult delete(UUID id, Long expectedVersion) {
        return executor.execute(Publisher.TYPE, id, expectedVersion, publisher -> publisher.softDelete(clock.instant()));
    }

    public CommandResult restore(UUID id, Long expectedVersion) {
        return executor.execute(Publisher.TYPE, id, expectedVersion, publisher -> publisher.restore(clock.instant()));
    }
}
