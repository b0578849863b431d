package com.flagship.bookstore.catalog.book;

import com.flagship.bookstore.catalog.AggregateCommandExecutor;
import com.flagship.bookstore.catalog.CommandResult;
import com.flagship.bookstore.catalog.book.dto.BookRequest;
import com.flagship.bookstore.catalog.book.dto.ScheduleSaleRequest;
import com.flagship.bookstore.domain.book.Book;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.util.UUID;

/**
 * Book commands. Each one loads the book stream, lets the aggregate decide and appends
 * the resulting event at the loaded version.
 */
@Service
@RequiredArgsConstructor
public class BookCommandService {

    private final AggregateCommandExecutor executor;
    private final Clock clock;

    public CommandResult create(BookRequest request) {
        UUID id = UUID.randomUUID();
        return executor.start(Book.TYPE, id, Book.create(id, request.toDetails(), LocalDate.now(clock)));
    }

    public CommandResult update(UUID id, Long expectedVersion, BookRequest request) {
        return executor.execute(Book.TYPE, id, expectedVersion, 
                book -> book.update(request.toDetails(), LocalDate.now(clock)));
    }

    public CommandResult delete(UUID id, Long expectedVersion) {
        return executor.execute(Book.TYPE, id, expectedVersion, book -> book.softDelete(clock.instant()));
    }

    public CommandResult restore(UUID id, Long expectedVersion) {
        return executor.execute(Book.TYPE, id, expectedVersion, book -> book.restore(clock.instant()));
    }

    public CommandResult updateCover(UUID id, Long expectedVersion, String coverImageUrl) {
        return executor.execute(Book.TYPE, id, expectedVersion, book -> book.updateCover(coverImageUrl));
    }

    public CommandResult scheduleSale(UUID id, Long expectedVersion, ScheduleSaleRequest request) {
        return executor.execute(Book.TYPE, id, expectedVersion,
                book -> book.scheduleSale(request.getPercentage(), request.getStart(), request.getEnd()));
    }

    public CommandResult cancelSale(UUID id, Long expectedVersion, Instant saleStart) {
        return executor.execute(Book.TYPE, id, expectedVersion, book -> book.cancelSale(saleStart));
    }
}
