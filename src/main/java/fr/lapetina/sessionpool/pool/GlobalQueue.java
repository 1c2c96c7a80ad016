package fr.lapetina.sessionpool.pool;

import fr.lapetina.sessionpool.domain.model.GenerationRequest;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Deque;
import java.util.Iterator;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Predicate;

/**
 * FIFO of requests no worker could take at submission time.
 *
 * Guarded by its own lock. When the pool lock is also needed it must be taken first.
 * Queue positions of waiting requests are kept 1-based and contiguous.
 */
public final class GlobalQueue {

    private final ReentrantLock lock = new ReentrantLock();
    private final Deque<GenerationRequest> queue = new ArrayDeque<>();

    /**
     * Appends at the tail.
     *
     * @return 1-based position of the request
     */
    public int append(GenerationRequest request) {
        lock.lock();
        try {
            queue.addLast(request);
            int position = queue.size();
            request.assign(null, position);
            return position;
        } finally {
            lock.unlock();
        }
    }

    public void appendAll(Collection<GenerationRequest> requests) {
        if (requests.isEmpty()) {
            return;
        }
        lock.lock();
        try {
            for (GenerationRequest request : requests) {
                queue.addLast(request);
                request.assign(null, queue.size());
            }
        } finally {
            lock.unlock();
        }
    }

    public boolean remove(GenerationRequest request) {
        lock.lock();
        try {
            boolean removed = queue.remove(request);
            if (removed) {
                renumber();
            }
            return removed;
        } finally {
            lock.unlock();
        }
    }

    /**
     * Offers requests from the head to the consumer, removing each one it accepts.
     * Stops at the first request the consumer refuses.
     *
     * @return number of requests left in the queue
     */
    public int drain(Predicate<GenerationRequest> consumer) {
        lock.lock();
        try {
            boolean changed = false;
            Iterator<GenerationRequest> it = queue.iterator();
            while (it.hasNext()) {
                GenerationRequest head = it.next();
                if (!consumer.test(head)) {
                    break;
                }
                it.remove();
                changed = true;
            }
            if (changed) {
                renumber();
            }
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Removes and returns every queued request.
     */
    public List<GenerationRequest> clear() {
        lock.lock();
        try {
            List<GenerationRequest> drained = new ArrayList<>(queue);
            queue.clear();
            return drained;
        } finally {
            lock.unlock();
        }
    }

    public int size() {
        lock.lock();
        try {
            return queue.size();
        } finally {
            lock.unlock();
        }
    }

    public boolean isEmpty() {
        return size() == 0;
    }

    public List<GenerationRequest> snapshot() {
        lock.lock();
        try {
            return List.copyOf(queue);
        } finally {
            lock.unlock();
        }
    }

    private void renumber() {
        int position = 1;
        for (GenerationRequest request : queue) {
            request.updateQueuePosition(position++);
        }
    }
}
