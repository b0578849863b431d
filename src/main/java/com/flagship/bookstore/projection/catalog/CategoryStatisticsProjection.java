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
public class CategoryStatisticsProjection extends BookCountProjection<CategoryStatisticsDocument> {

    @Override
    public Class<CategoryStatisticsDocument> documentType() {
        return CategoryStatisticsDocument.class;
    }

    @Override
    protected Collection<UUID> linkedIds(BookDetails details) {
        return details.getCategoryIds();
    }

    @Override
    protected Collection<UUID> linkedIds(BookSearchDocument book) {
        return book.getCategoryIds() == null ? List.of() : book.getCategoryIds();
    }

    @Override
    protected CategoryStatisticsDocument create(UUID categoryId, long version, Instant lastModified,
                                                Map<UUID, Long> bookVersions, Set<UUID> bookIds) {
        return CategoryStatisticsDocument.builder()
                .id(categoryId)
                .version(version)
                .lastModified(lastModified)
                .bookCount(bookIds.size())
                .bookVersions(bookVersions)
                .bookIds(bookIds)
                .build();
    }
}
