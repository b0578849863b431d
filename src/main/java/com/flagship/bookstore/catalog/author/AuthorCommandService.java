package com.flagship.bookstore.catalog.author;

import com.flagship.bookstore.catalog.AggregateCommandExecutor;
import com.flagship.bookstore.catalog.CommandResult;
import com.flagship.bookstore.catalog.author.dto.AuthorRequest;
import com.flagship.bookstore.domain.author.Author;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class AuthorCommandService {

    private final AggregateCommandExecutor executor;
    private final Clock clock;

    public CommandResult create(AuthorRequest request) {
        UUID id = UUID.randomUUID();
        return executor.start(Author.TYPE, id, Author.create(id, request.getName(), request.biographiesOrEmpty()));
    }

    public CommandResult update(UUID id, Long expectedVersion, AuthorRequest request) {
        return executor.execute(Author.TYPE, id, expectedVersion,
                author -> author.update(request.getName(), request.biographiesOrEmpty()));
    }

    public CommandResult delete(UUID id, Long expectedVersion) {
        return executor.execute(Author.TYPE, id, expectedVersion, author -> author.softDelete(clock.instant()));
    }

    public CommandResult restore(UUID id, Long expectedVersion) {
        return executor.execute(Author.TYPE, id, expectedVersion, author -> author.restore(clock.instant()));
    }
}
