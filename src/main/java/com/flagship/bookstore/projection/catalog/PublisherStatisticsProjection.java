package com.flagship.bookstore.projection.catalog;

import com.flagship.bookstore.domain.book.BookDetails;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Books per publisher. A book has at most one publisher, so an update that changes it
 * decrements the old publisher and increments the new one.
 */
@Component
public class PublisherStatisticsProjection extends BookCountProjection<PublisherStatisticsDocument> {

    @Override
    public Class<PublisherStatisticsDocument> documentType() {
        return PublisherStatisticsDocument.class;
    }

    @Override
    protected Collection<UUID> linkedIds(BookDetails details) {
        return details.getPublisherId() == null ? List.of() : List.of(details.getPublisherId());
    }

    @Override
    protected Collection<UUID> linkedIds(BookSearchDocument book) {
        return book.getPublisherId() == null ? List.of() : List.of(book.getPublisherId());
    }

    @Override
    protected PublisherStatisticsDocument create(UUID publisherId, long version, Instant lastModified,
                                                 Map<UUID, Long> bookVersions, Set<UUID> bookIds) {
        return PublisherStatisticsDocument.builder()
                .id(publisherId)
                .version(version)
                .lastModified(lastModified)
                .bookCount(bookIds.size())
                .bookVersions(bookVersions)
                .bookIds(bookIds)
                .build();
    }
}
