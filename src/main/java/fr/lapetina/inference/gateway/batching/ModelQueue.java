package fr.lapetina.inference.gateway.batching;

import fr.lapetina.inference.gateway.domain.model.QueuedRequest;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;

/**
 * FIFO of pending requests for one model.
 *
 * Writers take the queue's own lock, so activity on one model never blocks
 * another. {@link #size()} and {@link #oldestEnqueuedAt()} read a volatile
 * snapshot without locking and may lag the queue slightly.
 */
public final class ModelQueue {

    private final String modelId;
    private final ReentrantLock lock = new ReentrantLock();
    private final ArrayDeque<QueuedRequest> pending = new ArrayDeque<>();

    private volatile int size;
    private volatile Instant oldestEnqueuedAt;

    public ModelQueue(String modelId) {
        this.modelId = modelId;
    }

    public String getModelId() {
        return modelId;
    }

    /**
     * Appends a request at the tail.
     *
     * @return queue length after the append
     */
    public int offer(QueuedRequest request) {
        lock.lock();
        try {
            pending.addLast(request);
            if (pending.size() == 1) {
                oldestEnqueuedAt = request.enqueuedAt();
            }
            size = pending.size();
            return size;
        } finally {
            lock.unlock();
        }
    }

    public List<QueuedRequest> poll(int maxSize) {
        return poll(maxSize, dropped -> { });
    }

    /**
     * Removes up to {@code maxSize} unresolved requests from the head.
     * Requests resolved while queued (cancelled) are dropped on the way and
     * handed to {@code onDropped}.
     */
    public List<QueuedRequest> poll(int maxSize, Consumer<QueuedRequest> onDropped) {
        if (maxSize < 1) {
            throw new IllegalArgumentException("maxSize must be >= 1, got " + maxSize);
        }
        lock.lock();
        try {
            List<QueuedRequest> taken = new ArrayList<>(Math.min(maxSize, pending.size()));
            while (taken.size() < maxSize && !pending.isEmpty()) {
                QueuedRequest head = pending.pollFirst();
                if (head.isResolved()) {
                    onDropped.accept(head);
                } else {
                    taken.add(head);
                }
            }
            refreshSnapshot();
            return taken;
        } finally {
            lock.unlock();
        }
    }

    public boolean remove(QueuedRequest request) {
        lock.lock();
        try {
            boolean removed = pending.remove(request);
            if (removed) {
                refreshSnapshot();
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes every request enqueued at or before {@code cutoff}. Since the queue
     * is in enqueue order, these form a prefix.
     */
    public List<QueuedRequest> pollEnqueuedBefore(Instant cutoff) {
        lock.lock();
        try {
            List<QueuedRequest> expired = new ArrayList<>();
            Iterator<QueuedRequest> it = pending.iterator();
            while (it.hasNext()) {
                QueuedRequest head = it.next();
                if (head.enqueuedAt().isAfter(cutoff)) {
                    break;
                }
                it.remove();
                expired.add(head);
            }
            if (!expired.isEmpty()) {
                refreshSnapshot();
            }
            return expired;
        } finally {
            lock.unlock();
        }
    }

    private void refreshSnapshot() {
        QueuedRequest head = pending.peekFirst();
        oldestEnqueuedAt = head != null ? head.enqueuedAt() : null;
        size = pending.size();
    }

    public int size() {
        return size;
    }

    public boolean isEmpty() {
        return size == 0;
    }

    public Optional<Instant> oldestEnqueuedAt() {
        return Optional.ofNullable(oldestEnqueuedAt);
    }

    public Optional<Duration> oldestAge(Instant now) {
        Instant oldest = oldestEnqueuedAt;
        return oldest == null ? Optional.empty() : Optional.of(Duration.between(oldest, now));
    }

    @Override
    public String toString() {
        return "ModelQueue{" +
                "model=" + modelId +
                ", size=" + size +
                ", oldestEnqueuedAt=" + oldestEnqueuedAt +
                '}';
    }
}
