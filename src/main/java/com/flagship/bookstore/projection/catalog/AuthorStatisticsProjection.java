package com.flagship.bookstore.projection.catalog;

import com.flagship.bookstore.domain.book.BookDetails;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

@Component
public class AuthorStatisticsProjection extends BookCountProjection<AuthorStatisticsDocument> {

    @Override
    public Class<AuthorStatisticsDocument> documentType() {
        return AuthorStatisticsDocument.class;
    }

    @Override
    protected Collection<UUID> linkedIds(BookDetails details) {
        return details.getAuthorIds();
    }

    @Override
    protected Collection<UUID> linkedIds(BookSearchDocument book) {
        return book.getAuthorIds() == null ? List.of() : book.getAuthorIds();
    }

    @Override
    protected AuthorStatisticsDocument create(UUID authorId, long version, Instant lastModified,
                                              Map<UUID, Long> bookVersions, Set<UUID> bookIds) {
        return AuthorStatisticsDocument.builder()
                .id(authorId)
                .version(version)
                .lastModified(lastModified)
                .bookCount(bookIds.size())
                .bookVersions(bookVersions)
                .bookIds(bookIds)
                .build();
    }
}
