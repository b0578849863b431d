package com.flagship.bookstore.projection;

import com.flagship.bookstore.eventstore.StoredEvent;

import java.util.Set;
import java.util.UUID;

/**
 * Base class for projections that build one document per stream of a given aggregate type.
 *
 * Events at or below the document's version are skipped. An event that would leave a
 * hole in the version sequence fails the fold, so the batch is retried once the
 * missing event has been folded.
 */
public abstract class SingleStreamProjection<D extends ProjectionDocument> implements Projection<D> {

    private final String streamType;

    protected SingleStreamProjection(String streamType) {
        this.streamType = streamType;
    }

    @Override
    public Set<UUID> identify(StoredEvent event, ProjectionLookup lookup) {
        return streamType.equals(event.getStreamType()) ? Set.of(event.getStreamId()) : Set.of();
    }

    @Override
    public final D fold(UUID documentId, D current, StoredEvent event, ProjectionLookup lookup) {
        long currentVersion = current == null ? 0 : current.getVersion();
        if (event.getVersion() <= currentVersion) {
            return current;
        }
        if (event.getVersion() != currentVersion + 1) {
            throw new IllegalStateException(String.format(
                    "Version gap in %s stream %s: document at %d, event at %d",
                    streamType, event.getStreamId(), currentVersion, event.getVersion()));
        }
        return apply(current, event, lookup);
    }

    /**
     * Applies the next event of the stream.
     *
     * @param current the document, null only for the first event of the stream
     */
    protected abstract D apply(D current, StoredEvent event, ProjectionLookup lookup);

    /**
     * Every event after the first needs an existing document.
     */
    protected D requireExisting(D current, StoredEvent event) {
        if (current == null) {
            throw new IllegalStateException(String.format(
                    "%s %s has no document to apply %s to", streamType, event.getStreamId(), event.getEventType()));
        }
        return current;
    }

    protected IllegalArgumentException unsupported(StoredEvent event) {
        return new IllegalArgumentException(String.format(
                "%s cannot fold %s", getClass().getSimpleName(), event.getEventType()));
    }
}
