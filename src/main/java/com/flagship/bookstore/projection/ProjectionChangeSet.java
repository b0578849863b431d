package com.flagship.bookstore.projection;

import lombok.Value;

import java.util.ArrayList;
import java.util.List;

/**
 * Documents changed by one committed projection run, partitioned by raw change kind.
 */
@Value
public class ProjectionChangeSet {
    List<ProjectionDocument> inserted;
    List<ProjectionDocument> updated;
    List<ProjectionDocument> deleted;

    public static ProjectionChangeSet of(List<? extends ProjectionDocument> inserted,
                                         List<? extends ProjectionDocument> updated,
                                         List<? extends ProjectionDocument> deleted) {
        return new ProjectionChangeSet(List.copyOf(inserted), List.copyOf(updated), List.copyOf(deleted));
    }

    public boolean isEmpty() {
        return inserted.isEmpty() && updated.isEmpty() && deleted.isEmpty();
    }

    public int size() {
        return inserted.size() + updated.size() + deleted.size();
    }

    /**
     * All changes in order: inserts, then updates, then deletes.
     */
    public List<DocumentChange> changes() {
        List<DocumentChange> changes = new ArrayList<>(size());
        inserted.forEach(d -> changes.add(new DocumentChange(d, ChangeKind.INSERT)));
        updated.forEach(d -> changes.add(new DocumentChange(d, ChangeKind.UPDATE)));
        deleted.forEach(d -> changes.add(new DocumentChange(d, ChangeKind.DELETE)));
        return changes;
    }
}
