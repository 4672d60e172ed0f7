package au.org.ala.raster.util;

import java.util.concurrent.LinkedBlockingQueue;

/**
 * Bounded work queue for a {@link java.util.concurrent.ThreadPoolExecutor}.
 * The executor hands new tasks to {@link #offer(Object)}, which here blocks
 * until there is room instead of rejecting the task, so whoever submits work
 * is held back while the workers catch up.
 */
public class LimitedQueue<E> extends LinkedBlockingQueue<E> {

    private static final long serialVersionUID = 1L;

    public LimitedQueue(int maxSize) {
        super(maxSize);
    }

    @Override
    public boolean offer(E e) {
        try {
            put(e);
            return true;
        } catch (InterruptedException ie) {
            Thread.currentThread().interrupt();
        }
        return false;
    }
}
