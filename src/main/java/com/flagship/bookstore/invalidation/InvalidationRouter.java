package com.flagship.bookstore.invalidation;

import com.flagship.bookstore.observability.PipelineMetrics;
import com.flagship.bookstore.projection.ChangeKind;
import com.flagship.bookstore.projection.DocumentChange;
import com.flagship.bookstore.projection.ProjectionChangeSet;
import com.flagship.bookstore.projection.ProjectionCommitListener;
import com.flagship.bookstore.projection.ProjectionDocument;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Optional;

/**
 * Commit listener that invalidates cache tags and emits notifications for changed documents.
 *
 * For each document of the change set:
 * 1. Resolve the effective change kind (an update that soft-deletes is a delete)
 * 2. Dispatch to the handler registered for the document's type
 *
 * A document that fails is logged and counted; the rest of the batch is still handled.
 * A document type without a handler is logged and skipped.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class InvalidationRouter implements ProjectionCommitListener {

    private final InvalidationHandlerRegistry registry;
    private final PipelineMetrics metrics;

    @Override
    public void afterCommit(ProjectionChangeSet changes) {
        for (DocumentChange change : changes.changes()) {
            ProjectionDocument document = change.getDocument();
            String documentType = document.getClass().getSimpleName();
            ChangeKind kind = ChangeKind.effective(change.getKind(), document.isDeleted());
            try {
                if (route(document, kind)) {
                    metrics.recordInvalidatedDocument(documentType, kind.name(), true);
                }
            } catch (Exception e) {
                log.error("Invalidation failed: documentType={}, documentId={}, changeKind={}, error={}",
                        documentType, document.getId(), kind, e.getMessage(), e);
                metrics.recordInvalidatedDocument(documentType, kind.name(), false);
            }
        }
    }

    private boolean route(ProjectionDocument document, ChangeKind kind) {
        Optional<InvalidationHandler<?>> handler = registry.find(document.getClass());
        if (handler.isEmpty()) {
            log.warn("Cache invalidation not implemented for document type {}: documentId={}",
                    document.getClass().getSimpleName(), document.getId());
            return false;
        }
        handler.get().handleChange(document, kind);
        return true;
    }
}
