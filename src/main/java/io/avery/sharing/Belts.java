package io.avery.sharing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.Objects;
import java.util.concurrent.Executor;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Factories for cold {@link Belt.Source sources}, and for the buffering wrapper that {@link Shares#share share}
 * fuses with.
 */
public class Belts {
    private static final Logger logger = LoggerFactory.getLogger(Belts.class);

    private Belts() {} // Utility

    /**
     * The name of the system property that overrides {@link #DEFAULT_BUFFER_CAPACITY}.
     */
    public static final String DEFAULT_BUFFER_PROPERTY = "io.avery.sharing.defaultBuffer";

    /**
     * The buffer capacity used where none is given: 64, unless overridden by the system property
     * {@value #DEFAULT_BUFFER_PROPERTY}, which must be a positive integer.
     */
    public static final int DEFAULT_BUFFER_CAPACITY = defaultBufferCapacity();

    // Capacity markers; real capacities are never negative
    static final int UNSPECIFIED = -2;
    static final int DEFAULT = -1;

    private static int defaultBufferCapacity() {
        String value = System.getProperty(DEFAULT_BUFFER_PROPERTY);
        if (value == null) {
            return 64;
        }
        int capacity;
        try {
            capacity = Integer.parseInt(value.trim());
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException(DEFAULT_BUFFER_PROPERTY + " must be an integer, but was '" + value + "'", e);
        }
        if (capacity < 1) {
            throw new IllegalArgumentException(DEFAULT_BUFFER_PROPERTY + " must be positive, but was " + capacity);
        }
        logger.debug("Default buffer capacity set to {} by {}", capacity, DEFAULT_BUFFER_PROPERTY);
        return capacity;
    }

    /**
     * A source that drains its {@code upstream} on a separate thread, through a buffer. When drained directly, the
     * upstream runs on the {@link #executor executor} (or a new thread), offering into a queue of
     * {@link #capacity capacity} elements with the {@link #onBufferOverflow overflow} policy, while the draining
     * thread takes from the queue. If the upstream fails, the draining thread throws an {@link UpstreamException}
     * once it has taken everything buffered before the failure.
     *
     * <p>Wrapping a {@code BufferedSource} with {@link #buffer buffer} or {@link #runOn runOn} does not add a second
     * stage, but fuses the configurations. {@link Shares#share share} and {@link Shares#stateify stateify} fuse with it
     * too, using its buffer as the shared source's extra capacity and its executor for the producer.
     *
     * @param <T> the element type
     */
    public static final class BufferedSource<T> implements Belt.Source<T> {
        final Belt.Source<? extends T> upstream;
        final int capacity;
        final BufferOverflow onBufferOverflow;
        final Executor executor;

        BufferedSource(Belt.Source<? extends T> upstream, int capacity, BufferOverflow onBufferOverflow, Executor executor) {
            this.upstream = upstream;
            this.capacity = capacity;
            this.onBufferOverflow = onBufferOverflow;
            this.executor = executor;
        }

        /**
         * Returns the wrapped source.
         *
         * @return the wrapped source
         */
        public Belt.Source<? extends T> upstream() {
            return upstream;
        }

        /**
         * Returns the buffer capacity used when this source is drained directly.
         *
         * @return the buffer capacity
         */
        public int capacity() {
            return capacity < 0 ? DEFAULT_BUFFER_CAPACITY : capacity;
        }

        /**
         * Returns the policy applied when the buffer is full.
         *
         * @return the overflow policy
         */
        public BufferOverflow onBufferOverflow() {
            return onBufferOverflow;
        }

        /**
         * Returns the executor the upstream runs on, or {@code null} if it runs on a new thread.
         *
         * @return the executor, or {@code null}
         */
        public Executor executor() {
            return executor;
        }

        @Override
        public boolean drainToSink(Belt.StepSink<? super T> sink) throws Exception {
            Objects.requireNonNull(sink);
            var queue = new BufferQueue<T>(capacity(), onBufferOverflow);
            try (var scope = new SharingScope("buffer", SharingScope.daemonThreadFactory("buffer"))) {
                Executor upstreamExecutor = executor != null ? executor : scope.executor;
                scope.fork(() -> {
                    try {
                        upstream.drainToSink(queue);
                        queue.complete(null);
                    } catch (Throwable e) {
                        queue.complete(e);
                    }
                    return null;
                }, upstreamExecutor);

                for (T e; (e = queue.poll()) != null; ) {
                    if (!sink.offer(e)) {
                        queue.close();
                        return false;
                    }
                }
                return true;
            } finally {
                queue.close();
            }
        }

        @Override
        public void close() throws Exception {
            upstream.close();
        }

        @Override
        public String toString() {
            return "BufferedSource[capacity=" + (capacity == UNSPECIFIED ? "unspecified" : capacity == DEFAULT ? "default" : capacity)
                + ", onBufferOverflow=" + onBufferOverflow + ", executor=" + executor + "]";
        }
    }

    // Single-producer, single-consumer queue between a buffered upstream and its draining thread
    static final class BufferQueue<T> implements Belt.StepSink<T> {
        final int limit;
        final BufferOverflow onBufferOverflow;
        final ReentrantLock lock = new ReentrantLock();
        final Condition readable = lock.newCondition();
        final Condition writable = lock.newCondition();
        final Deque<T> queue = new ArrayDeque<>();
        boolean done = false;
        boolean closed = false;
        Throwable failure = null;

        BufferQueue(int capacity, BufferOverflow onBufferOverflow) {
            // Nowhere to keep a dropped-into element at capacity 0, so dropping policies conflate
            this.limit = onBufferOverflow == BufferOverflow.SUSPEND ? capacity : Math.max(capacity, 1);
            this.onBufferOverflow = onBufferOverflow;
        }

        @Override
        public boolean offer(T input) throws InterruptedException {
            Objects.requireNonNull(input);
            lock.lockInterruptibly();
            try {
                if (closed) {
                    return false;
                }
                if (onBufferOverflow == BufferOverflow.DROP_LATEST) {
                    if (queue.size() < limit) {
                        queue.offer(input);
                        readable.signal();
                    }
                    return true;
                }
                if (onBufferOverflow == BufferOverflow.DROP_OLDEST) {
                    if (queue.size() >= limit) {
                        queue.poll();
                    }
                    queue.offer(input);
                    readable.signal();
                    return true;
                }
                // SUSPEND: the element is handed over, then we wait for room (at capacity 0, for it to be taken)
                queue.offer(input);
                readable.signal();
                while (queue.size() > limit && !closed) {
                    writable.await();
                }
                return !closed;
            } finally {
                lock.unlock();
            }
        }

        T poll() throws InterruptedException, UpstreamException {
            lock.lockInterruptibly();
            try {
                while (queue.isEmpty() && !done) {
                    readable.await();
                }
                T head = queue.poll();
                if (head != null) {
                    writable.signal();
                    return head;
                }
                if (failure != null) {
                    throw new UpstreamException(failure);
                }
                return null;
            } finally {
                lock.unlock();
            }
        }

        void complete(Throwable error) {
            lock.lock();
            try {
                if (!done) {
                    done = true;
                    failure = error;
                    readable.signal();
                }
            } finally {
                lock.unlock();
            }
        }

        void close() {
            lock.lock();
            try {
                closed = true;
                writable.signal();
            } finally {
                lock.unlock();
            }
        }
    }

    /**
     * Returns a source that drains the given {@code source} through a buffer of the
     * {@link #DEFAULT_BUFFER_CAPACITY default capacity}, blocking the upstream while the buffer is full. If the source
     * is already buffered, its capacity is kept.
     *
     * @param source the source to buffer
     * @return a buffered source
     * @param <T> the element type
     * @throws NullPointerException if source is null
     */
    public static <T> BufferedSource<T> buffer(Belt.Source<? extends T> source) {
        return fuse(source, DEFAULT, BufferOverflow.SUSPEND, null);
    }

    /**
     * Returns a source that drains the given {@code source} through a buffer of the given capacity, blocking the
     * upstream while the buffer is full. If the source is already buffered with the same policy, the capacities add
     * up.
     *
     * @param source the source to buffer
     * @param capacity the buffer capacity; 0 hands each element over directly
     * @return a buffered source
     * @param <T> the element type
     * @throws NullPointerException if source is null
     * @throws IllegalArgumentException if capacity is negative
     */
    public static <T> BufferedSource<T> buffer(Belt.Source<? extends T> source, int capacity) {
        return buffer(source, capacity, BufferOverflow.SUSPEND);
    }

    /**
     * Returns a source that drains the given {@code source} through a buffer of the given capacity and overflow
     * policy. A {@code DROP_*} policy replaces the capacity and policy of an already buffered source; {@code SUSPEND}
     * adds to its capacity.
     *
     * @param source the source to buffer
     * @param capacity the buffer capacity
     * @param onBufferOverflow the policy applied when the buffer is full
     * @return a buffered source
     * @param <T> the element type
     * @throws NullPointerException if source or onBufferOverflow is null
     * @throws IllegalArgumentException if capacity is negative
     */
    public static <T> BufferedSource<T> buffer(Belt.Source<? extends T> source, int capacity,
                                               BufferOverflow onBufferOverflow) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity cannot be negative, but was " + capacity);
        }
        return fuse(source, capacity, onBufferOverflow, null);
    }

    /**
     * Returns a source that drains the given {@code source} on the given executor, through a buffer of the
     * {@link #DEFAULT_BUFFER_CAPACITY default capacity}. If the source is already buffered, its configuration is
     * kept, and the executor only applies if it had none.
     *
     * @param source the source to run elsewhere
     * @param executor the executor to drain the source on
     * @return a buffered source
     * @param <T> the element type
     * @throws NullPointerException if source or executor is null
     */
    public static <T> BufferedSource<T> runOn(Belt.Source<? extends T> source, Executor executor) {
        Objects.requireNonNull(executor);
        return fuse(source, UNSPECIFIED, BufferOverflow.SUSPEND, executor);
    }

    private static <T> BufferedSource<T> fuse(Belt.Source<? extends T> source, int capacity,
                                              BufferOverflow onBufferOverflow, Executor executor) {
        Objects.requireNonNull(source);
        Objects.requireNonNull(onBufferOverflow);
        if (!(source instanceof BufferedSource)) {
            return new BufferedSource<>(source, capacity, onBufferOverflow, executor);
        }
        BufferedSource<? extends T> inner = (BufferedSource<? extends T>) source;
        int newCapacity;
        BufferOverflow newOverflow;
        if (onBufferOverflow != BufferOverflow.SUSPEND) {
            newCapacity = capacity;
            newOverflow = onBufferOverflow;
        } else {
            newCapacity = addCapacities(inner.capacity, capacity);
            newOverflow = inner.onBufferOverflow;
        }
        Executor newExecutor = inner.executor != null ? inner.executor : executor;
        return new BufferedSource<>(inner.upstream, newCapacity, newOverflow, newExecutor);
    }

    private static int addCapacities(int inner, int outer) {
        if (inner == UNSPECIFIED) {
            return outer;
        }
        if (outer == UNSPECIFIED) {
            return inner;
        }
        if (inner == DEFAULT) {
            return outer;
        }
        if (outer == DEFAULT) {
            return inner;
        }
        int sum = inner + outer;
        return sum >= 0 ? sum : Integer.MAX_VALUE; // Overflow
    }

    /**
     * Returns a source that yields the elements from the given {@code stream}, and closes the stream when closed.
     * When the source is first drained, it will push as many elements as possible from the stream to the sink.
     * Subsequent attempts to drain the source will short-circuit. If the stream ever yields {@code null}, the source
     * will throw a {@link NullPointerException}.
     *
     * @param stream the stream to yield from
     * @return a source that yields the elements from the given {@code stream}
     * @param <T> the element type
     */
    public static <T> Belt.Source<T> streamSource(Stream<? extends T> stream) {
        Objects.requireNonNull(stream);

        class StreamSource implements Belt.Source<T> {
            boolean called = false;

            @Override
            public boolean drainToSink(Belt.StepSink<? super T> sink) throws Exception {
                if (called) {
                    return true;
                }
                called = true;

                try {
                    return stream.allMatch(el -> {
                        Objects.requireNonNull(el);
                        try {
                            return sink.offer(el);
                        } catch (Error | RuntimeException e) {
                            throw e;
                        } catch (Exception e) {
                            if (e instanceof InterruptedException) {
                                Thread.currentThread().interrupt();
                            }
                            throw new WrappingException(e);
                        }
                    });
                } catch (WrappingException e) {
                    if (e.getCause() instanceof InterruptedException) {
                        Thread.interrupted();
                    }
                    throw e.getCause();
                }
            }

            @Override
            public void close() {
                stream.close();
            }
        }

        return new StreamSource();
    }

    /**
     * Returns a source that yields the elements from the given {@code iterator}. Each time the source is polled, it
     * will advance the iterator, until the iterator is depleted. If the iterator ever yields {@code null}, the source
     * will throw a {@link NullPointerException}.
     *
     * @param iterator the iterator to yield from
     * @return a source that yields the elements from the given {@code iterator}
     * @param <T> the element type
     */
    public static <T> Belt.StepSource<T> iteratorSource(Iterator<T> iterator) {
        Objects.requireNonNull(iterator);

        class IteratorSource implements Belt.StepSource<T> {
            @Override
            public T poll() {
                return iterator.hasNext() ? Objects.requireNonNull(iterator.next()) : null;
            }
        }

        return new IteratorSource();
    }

    private static class WrappingException extends RuntimeException {
        WrappingException(Exception e) {
            super(e);
        }

        @Override
        public synchronized Exception getCause() {
            return (Exception) super.getCause();
        }
    }
}
