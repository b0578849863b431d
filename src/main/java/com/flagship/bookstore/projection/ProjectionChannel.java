package com.flagship.bookstore.projection;

import com.flagship.bookstore.eventstore.StreamAppended;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.LinkedBlockingQueue;

/**
 * Queue connecting the write path to the projection worker.
 *
 * The event store offers a {@link StreamAppended} message after every successful
 * append; the worker drains them. Writers never wait for projections.
 */
@Component
@Slf4j
public class ProjectionChannel {

    private final BlockingQueue<StreamAppended> queue = new LinkedBlockingQueue<>();

    public void publish(StreamAppended appended) {
        queue.add(appended);
        log.debug("Queued projection update: streamId={}, events={}, attempt={}",
                appended.getStreamId(), appended.getEvents().size(), appended.getAttempt());
    }

    /**
     * Removes up to {@code max} pending messages in arrival order.
     */
    public List<StreamAppended> take(int max) {
        List<StreamAppended> batch = new ArrayList<>();
        queue.drainTo(batch, max);
        return batch;
    }

    public int size() {
        return queue.size();
    }

    public boolean isEmpty() {
        return queue.isEmpty();
    }
}
