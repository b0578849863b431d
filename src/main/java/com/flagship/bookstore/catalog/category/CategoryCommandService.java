package com.flagship.bookstore.catalog.category;

import com.flagship.bookstore.catalog.AggregateCommandExecutor;
import com.flagship.bookstore.catalog.CommandResult;
import com.flagship.bookstore.catalog.category.dto.CategoryRequest;
import com.flagship.bookstore.domain.category.Category;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.util.UUID;

@Service
@RequiredArgsConstructor
public class CategoryCommandService {

    private final AggregateCommandExecutor executor;
    private final Clock clock;

    public CommandResult create(CategoryRequest request) {
        UUID id = UUID.randomUUID();
        return executor.start(Category.TYPE, id, Category.create(id, request.getNames()));
    }

    public CommandResult update(UUID id, Long expectedVersion, CategoryRequest request) {
        return executor.execute(Category.TYPE, id, expectedVersion, category -> category.update(request.getNames()));
    }

    public CommandResult delete(UUID id, Long expectedVersion) {
        return executor.execute(Category.TYPE, id, expectedVersion, category -> category.softDelete(clock.instant()));
    }

    public CommandResult restore(UUID id, Long expectedVersion) {
        return executor.execute(Category.TYPE, id, expectedVersion, category -> category.restore(clock.instant()));
    }
}
