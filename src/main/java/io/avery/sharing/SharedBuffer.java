package io.avery.sharing;

import java.time.Clock;
import java.time.Instant;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

/**
 * The lock-based implementation of {@link Sharing.MutableSharedSource}.
 *
 * <p>Every offered element gets the next absolute index. The ring holds the range {@code [head, queueEnd)}:
 * <pre>
 *   head          replayIndex                  bufferEnd           queueEnd
 *    |  not yet seen by |  replay cache (also may |  parked offer of  |
 *    |  slow subscribers|  be unseen)             |  blocked emitter  |
 * </pre>
 * where {@code head = min(replayIndex, minCollectorIndex)}. A blocked emitter parks its element in the queue region
 * until enough subscribers advance; with no buffer at all ({@code replay + extra == 0}), subscribers take the parked
 * element directly (rendezvous).
 *
 * <p>All state is guarded by {@code lock}. Blocking is done by awaiting a condition, which releases the lock, so
 * subscribers can always advance a blocked emitter. Emitters additionally pass through a fair {@code emitLock}, so at
 * most one emitter is ever parked and emitters proceed in arrival order.
 *
 * @param <T> the element type
 */
class SharedBuffer<T> implements Sharing.MutableSharedSource<T> {
    final int replay;
    final int bufferCapacity;
    final BufferOverflow onBufferOverflow;

    final ReentrantLock emitLock = new ReentrantLock(true);
    final ReentrantLock lock = new ReentrantLock();
    final Condition valueAvailable = lock.newCondition();
    final Condition spaceAvailable = lock.newCondition();
    final ReplayBuffer ring = new ReplayBuffer();
    final Set<Slot> slots = new LinkedHashSet<>();
    StateBuffer<Integer> subscriptionCount = null;
    Sharing.StateSource<Integer> subscriptionCountView = null;
    long replayIndex = 0;
    long minCollectorIndex = 0;
    int bufferSize = 0;
    int queueSize = 0;

    SharedBuffer(int replay, int extraBufferCapacity, BufferOverflow onBufferOverflow) {
        if (replay < 0) {
            throw new IllegalArgumentException("replay cannot be negative, but was " + replay);
        }
        if (extraBufferCapacity < 0) {
            throw new IllegalArgumentException("extraBufferCapacity cannot be negative, but was " + extraBufferCapacity);
        }
        Objects.requireNonNull(onBufferOverflow);
        if (onBufferOverflow != BufferOverflow.SUSPEND && replay == 0 && extraBufferCapacity == 0) {
            throw new IllegalArgumentException("replay or extraBufferCapacity must be positive with " + onBufferOverflow);
        }
        this.replay = replay;
        int capacity = replay + extraBufferCapacity;
        this.bufferCapacity = capacity < 0 ? Integer.MAX_VALUE : capacity; // Overflow
        this.onBufferOverflow = onBufferOverflow;
    }

    /**
     * Returns the clock that timed polls use to compare against their deadline.
     *
     * @return the clock used for timed polls
     */
    protected Clock clock() { return Clock.systemUTC(); }

    // A parked offer. Guarded by lock.
    static final class Emitter {
        final Object value;
        boolean resumed = false;

        Emitter(Object value) {
            this.value = value;
        }
    }

    // A subscriber cursor. Guarded by lock.
    final class Slot implements Sharing.Subscription<T> {
        long index;
        boolean closed = false;

        Slot(long index) {
            this.index = index;
        }

        @Override
        public T poll() throws InterruptedException {
            return take(this, Instant.MAX);
        }

        @Override
        public T pollUntil(Instant deadline) throws InterruptedException {
            return take(this, Objects.requireNonNull(deadline));
        }

        @Override
        public void close() {
            unsubscribe(this);
        }
    }

    // --- Subscriber side ---

    @Override
    public Sharing.Subscription<T> subscribe() {
        lock.lock();
        try {
            long index = replayIndex;
            if (index < minCollectorIndex) {
                minCollectorIndex = index;
            }
            Slot slot = new Slot(index);
            slots.add(slot);
            publishCountLocked();
            return slot;
        } finally {
            lock.unlock();
        }
    }

    void unsubscribe(Slot slot) {
        lock.lock();
        try {
            if (slot.closed) {
                return;
            }
            slot.closed = true;
            slots.remove(slot);
            updateCollectorIndexLocked(slot.index);
            publishCountLocked();
            valueAvailable.signalAll();
        } finally {
            lock.unlock();
        }
    }

    @SuppressWarnings("unchecked")
    T take(Slot slot, Instant deadline) throws InterruptedException {
        lock.lockInterruptibly();
        try {
            for (;;) {
                if (slot.closed) {
                    return null;
                }
                long index = tryPeekLocked(slot);
                if (index >= 0) {
                    Object value = ring.get(index);
                    if (value instanceof Emitter) {
                        value = ((Emitter) value).value;
                    }
                    long oldIndex = slot.index;
                    slot.index = index + 1;
                    updateCollectorIndexLocked(oldIndex);
                    return (T) value;
                }
                if (!awaitValue(deadline)) {
                    return null;
                }
            }
        } finally {
            lock.unlock();
        }
    }

    private boolean awaitValue(Instant deadline) throws InterruptedException {
        //assert lock.isHeldByCurrentThread();
        if (deadline == Instant.MAX) {
            valueAvailable.await();
            return true;
        }
        long nanosRemaining;
        Instant now = clock().instant();
        try {
            nanosRemaining = ChronoUnit.NANOS.between(now, deadline);
        } catch (ArithmeticException e) {
            nanosRemaining = now.isBefore(deadline) ? Long.MAX_VALUE : 0;
        }
        if (nanosRemaining <= 0) {
            return false;
        }
        valueAvailable.awaitNanos(nanosRemaining);
        return true;
    }

    private long tryPeekLocked(Slot slot) {
        long index = slot.index;
        if (index < bufferEndIndex()) {
            return index;
        }
        if (bufferCapacity > 0) {
            return -1; // With a buffer, parked elements are only seen once their emitter resumes
        }
        if (index > head() || queueSize == 0) {
            return -1;
        }
        return index; // Rendezvous with the parked emitter
    }

    // --- Emitter side ---

    @Override
    public boolean offer(T input) throws InterruptedException {
        Objects.requireNonNull(input);
        if (onBufferOverflow != BufferOverflow.SUSPEND) {
            lock.lockInterruptibly();
            try {
                return tryOfferLocked(input);
            } finally {
                lock.unlock();
            }
        }
        emitLock.lockInterruptibly();
        try {
            lock.lockInterruptibly();
            try {
                if (tryOfferLocked(input)) {
                    return true;
                }
                Emitter emitter = new Emitter(input);
                enqueueLocked(emitter);
                queueSize++;
                if (bufferCapacity == 0) {
                    valueAvailable.signalAll();
                }
                try {
                    while (!emitter.resumed) {
                        spaceAvailable.await();
                    }
                } catch (InterruptedException e) {
                    if (!emitter.resumed && !cancelEmitterLocked(emitter)) {
                        throw e;
                    }
                    // Already delivered - keep the interrupt for the next blocking call
                    Thread.currentThread().interrupt();
                }
                return true;
            } finally {
                lock.unlock();
            }
        } finally {
            emitLock.unlock();
        }
    }

    @Override
    public boolean tryOffer(T input) {
        Objects.requireNonNull(input);
        if (onBufferOverflow == BufferOverflow.SUSPEND && !emitLock.tryLock()) {
            return false; // Another emitter is parked or about to park
        }
        try {
            lock.lock();
            try {
                return tryOfferLocked(input);
            } finally {
                lock.unlock();
            }
        } finally {
            if (onBufferOverflow == BufferOverflow.SUSPEND) {
                emitLock.unlock();
            }
        }
    }

    boolean tryOfferLocked(Object value) {
        //assert lock.isHeldByCurrentThread();
        if (slots.isEmpty()) {
            return tryOfferNoSubscribersLocked(value);
        }
        // Only when the slowest subscriber still needs the replay cache is the buffer really full
        if (bufferSize >= bufferCapacity && minCollectorIndex <= replayIndex) {
            switch (onBufferOverflow) {
                case SUSPEND:
                    return false;
                case DROP_LATEST:
                    return true;
                case DROP_OLDEST:
                    break;
            }
        }
        enqueueLocked(value);
        bufferSize++;
        if (bufferSize > bufferCapacity) {
            dropOldestLocked();
        }
        if (replaySize() > replay) {
            updateBufferLocked(replayIndex + 1, minCollectorIndex, bufferEndIndex(), queueEndIndex());
        }
        valueAvailable.signalAll();
        return true;
    }

    private boolean tryOfferNoSubscribersLocked(Object value) {
        if (replay == 0) {
            return true; // Nobody to deliver to, nothing to replay
        }
        enqueueLocked(value);
        bufferSize++;
        if (bufferSize > replay) {
            dropOldestLocked();
        }
        minCollectorIndex = head() + bufferSize;
        return true;
    }

    // Returns true if the parked element was already taken by a subscriber and so must stay
    private boolean cancelEmitterLocked(Emitter emitter) {
        long index = bufferEndIndex(); // The one parked emitter always sits right after the buffer
        for (Slot slot : slots) {
            if (slot.index > index) {
                // Taken at rendezvous by at least one subscriber: the rest must see it too
                ring.set(index, emitter.value);
                emitter.resumed = true;
                updateBufferLocked(Math.max(replayIndex, index + 1 - replay), minCollectorIndex, index + 1, index + 1);
                return true;
            }
        }
        ring.set(index, null);
        queueSize--;
        return false;
    }

    @Override
    public void resetBuffer() {
        lock.lock();
        try {
            long bufferEnd = bufferEndIndex();
            updateBufferLocked(bufferEnd, minCollectorIndex, bufferEnd, queueEndIndex());
        } finally {
            lock.unlock();
        }
    }

    /**
     * Resets the replay cache to hold just the given element. Under {@link BufferOverflow#SUSPEND SUSPEND}, the element
     * goes in even if slow subscribers keep the buffer full, unless an emitter is parked; the buffer then exceeds its
     * capacity until those subscribers catch up.
     *
     * @param resetValue the element to leave in the replay cache
     */
    void resetBuffer(T resetValue) {
        Objects.requireNonNull(resetValue);
        lock.lock();
        try {
            long bufferEnd = bufferEndIndex();
            updateBufferLocked(bufferEnd, minCollectorIndex, bufferEnd, queueEndIndex());
            if (!tryOfferLocked(resetValue) && queueSize == 0) {
                enqueueLocked(resetValue);
                bufferSize++;
                valueAvailable.signalAll();
            }
        } finally {
            lock.unlock();
        }
    }

    // --- Queries ---

    @Override
    @SuppressWarnings("unchecked")
    public List<T> replayCache() {
        lock.lock();
        try {
            List<T> cache = new ArrayList<>(replaySize());
            for (long i = replayIndex, end = bufferEndIndex(); i < end; i++) {
                cache.add((T) ring.get(i));
            }
            return cache;
        } finally {
            lock.unlock();
        }
    }

    @Override
    public Sharing.StateSource<Integer> subscriptionCount() {
        lock.lock();
        try {
            if (subscriptionCount == null) {
                subscriptionCount = new StateBuffer<>(slots.size());
                subscriptionCountView = Shares.asState(subscriptionCount);
            }
            return subscriptionCountView;
        } finally {
            lock.unlock();
        }
    }

    private void publishCountLocked() {
        // Published under our lock, so every count a reader sees matches a real subscriber set
        if (subscriptionCount != null) {
            subscriptionCount.setValue(slots.size());
        }
    }

    // --- Index bookkeeping ---

    long head() { return Math.min(minCollectorIndex, replayIndex); }
    int replaySize() { return (int) (head() + bufferSize - replayIndex); }
    long bufferEndIndex() { return head() + bufferSize; }
    long queueEndIndex() { return head() + bufferSize + queueSize; }

    private void enqueueLocked(Object item) {
        int size = bufferSize + queueSize;
        long head = head();
        ring.reserve(head, size);
        ring.set(head + size, item);
    }

    private void dropOldestLocked() {
        long head = head();
        ring.set(head, null);
        bufferSize--;
        long newHead = head + 1;
        if (replayIndex < newHead) {
            replayIndex = newHead;
        }
        if (minCollectorIndex < newHead) {
            // Slow subscribers silently skip the evicted element
            for (Slot slot : slots) {
                if (slot.index < newHead) {
                    slot.index = newHead;
                }
            }
            minCollectorIndex = newHead;
        }
    }

    // Called after a subscriber moved from (or was removed at) oldIndex. Frees slots nobody needs anymore and resumes
    // a parked emitter if that made room.
    private void updateCollectorIndexLocked(long oldIndex) {
        if (oldIndex > minCollectorIndex) {
            return; // Was not the slowest
        }
        long head = head();
        long newMinCollectorIndex = head + bufferSize;
        if (bufferCapacity == 0 && queueSize > 0) {
            newMinCollectorIndex++; // A rendezvous subscriber may be past the parked element
        }
        for (Slot slot : slots) {
            if (slot.index < newMinCollectorIndex) {
                newMinCollectorIndex = slot.index;
            }
        }
        if (newMinCollectorIndex <= minCollectorIndex) {
            return;
        }
        long newBufferEndIndex = bufferEndIndex();
        long newQueueEndIndex = newBufferEndIndex + queueSize;
        long maxResumeCount = slots.isEmpty()
            ? queueSize
            : Math.min(queueSize, bufferCapacity - (newBufferEndIndex - newMinCollectorIndex));
        boolean resumed = false;
        if (maxResumeCount > 0) {
            Emitter emitter = (Emitter) ring.get(newBufferEndIndex);
            ring.set(newBufferEndIndex, emitter.value);
            emitter.resumed = true;
            newBufferEndIndex++;
            resumed = true;
        }
        if (slots.isEmpty()) {
            newMinCollectorIndex = newBufferEndIndex;
        }
        int newBufferSize = (int) (newBufferEndIndex - head);
        long newReplayIndex = Math.max(replayIndex, newBufferEndIndex - Math.min(replay, newBufferSize));
        updateBufferLocked(newReplayIndex, newMinCollectorIndex, newBufferEndIndex, newQueueEndIndex);
        if (resumed) {
            spaceAvailable.signalAll();
            valueAvailable.signalAll();
        }
    }

    private void updateBufferLocked(long newReplayIndex, long newMinCollectorIndex, long newBufferEndIndex,
                                    long newQueueEndIndex) {
        long oldHead = head();
        long newHead = Math.min(newMinCollectorIndex, newReplayIndex);
        for (long i = oldHead; i < newHead; i++) {
            ring.set(i, null);
        }
        replayIndex = newReplayIndex;
        minCollectorIndex = newMinCollectorIndex;
        bufferSize = (int) (newBufferEndIndex - newHead);
        queueSize = (int) (newQueueEndIndex - newBufferEndIndex);
    }
}
