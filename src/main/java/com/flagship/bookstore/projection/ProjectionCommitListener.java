package com.flagship.bookstore.projection;

/**
 * Called by the projection worker after a batch of document changes has been saved.
 */
public interface ProjectionCommitListener {

    void afterCommit(ProjectionChangeSet changes);
}
