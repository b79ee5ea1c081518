package io.avery.sharing;

import java.time.Instant;
import java.util.List;

/**
 * Interfaces for "hot" sources that broadcast to any number of subscribers at once.
 *
 * <ul>
 *     <li>{@link SharedSource SharedSource} - a source whose elements are delivered to every current subscriber, with
 *     the most recent elements replayed to late subscribers
 *     <li>{@link StateSource StateSource} - a shared source that always holds exactly one current value
 *     <li>{@link MutableSharedSource MutableSharedSource} and {@link MutableStateSource MutableStateSource} - the
 *     variants that can be offered to directly
 * </ul>
 *
 * <p>Mutable variants are created with the factories in {@link Shares}, and are usually handed out through a
 * read-only view ({@link Shares#asShared}, {@link Shares#asState}).
 */
public class Sharing {
    private Sharing() {}

    /**
     * One subscriber's view of a {@link SharedSource SharedSource}. Each subscription keeps its own cursor, so
     * subscriptions never interfere with one another. Elements are yielded in the order they were offered to the
     * shared source, without gaps, except where the shared source's {@link BufferOverflow#DROP_OLDEST DROP_OLDEST}
     * policy evicted elements this subscription had not yet seen.
     *
     * <p>A subscription never drains on its own. {@link #poll poll} returns {@code null} only after the subscription
     * is {@link #close closed}.
     *
     * @param <T> the element type
     */
    public interface Subscription<T> extends Belt.StepSource<T> {
        /**
         * Returns the next element, blocking while this subscription has seen every element offered so far.
         *
         * @return the next element, or {@code null} if this subscription is closed
         * @throws InterruptedException if interrupted while waiting
         */
        @Override
        T poll() throws InterruptedException;

        /**
         * Returns the next element, blocking while this subscription has seen every element offered so far, but not
         * past the given deadline.
         *
         * @param deadline the instant to stop waiting at
         * @return the next element, or {@code null} if the deadline passed or this subscription is closed
         * @throws InterruptedException if interrupted while waiting
         * @throws NullPointerException if deadline is null
         */
        T pollUntil(Instant deadline) throws InterruptedException;

        /**
         * Unsubscribes. Buffered elements that only this subscription was holding back are released, and a thread
         * blocked in {@code poll} returns {@code null}. Closing twice has no further effect.
         */
        @Override
        void close();
    }

    /**
     * A source that broadcasts each element to all of its current subscribers. A new subscriber first receives the
     * replay cache: up to {@code replay} of the most recently offered elements.
     *
     * <p>Draining a shared source {@link #subscribe subscribes} to it for the duration of the drain. Since a shared
     * source never completes, the drain only ends when the sink cancels or the draining thread is interrupted.
     *
     * @param <T> the element type
     */
    public interface SharedSource<T> extends Belt.Source<T> {
        /**
         * Registers a new subscriber. The returned subscription starts with the current replay cache.
         *
         * @return a new subscription
         */
        Subscription<T> subscribe();

        /**
         * Returns a snapshot of the elements a new subscriber would be replayed right now, oldest first.
         *
         * @return a snapshot of the replay cache
         */
        List<T> replayCache();

        /**
         * Returns the number of live subscriptions, as a state that changes exactly when subscriptions are registered
         * or closed.
         *
         * @return the subscription count state
         */
        StateSource<Integer> subscriptionCount();

        @Override
        default boolean drainToSink(Belt.StepSink<? super T> sink) throws Exception {
            try (var subscription = subscribe()) {
                for (T e; (e = subscription.poll()) != null; ) {
                    if (!sink.offer(e)) {
                        return false;
                    }
                }
                return true;
            }
        }
    }

    /**
     * A {@link SharedSource SharedSource} that can be offered to. Elements offered while nobody is subscribed are
     * only kept in the replay cache.
     *
     * @param <T> the element type
     */
    public interface MutableSharedSource<T> extends SharedSource<T>, Belt.StepSink<T> {
        /**
         * Offers an element to all current subscribers. When the buffer is full, the behavior depends on the
         * {@link BufferOverflow} policy: {@code SUSPEND} blocks until the slowest subscriber frees a slot (blocked
         * offers proceed in the order they arrived), the {@code DROP_*} policies never block.
         *
         * @param input the element
         * @return {@code true}, as a shared source never cancels
         * @throws InterruptedException if interrupted while blocked; the element is then not offered
         * @throws NullPointerException if input is null
         */
        @Override
        boolean offer(T input) throws InterruptedException;

        /**
         * Offers an element without blocking.
         *
         * @param input the element
         * @return {@code false} if the element would have blocked under {@link BufferOverflow#SUSPEND SUSPEND}, else
         * {@code true}
         * @throws NullPointerException if input is null
         */
        boolean tryOffer(T input);

        /**
         * Clears the replay cache. Subscribers that have not yet received buffered elements still receive them; new
         * subscribers replay nothing.
         */
        void resetBuffer();
    }

    /**
     * A {@link SharedSource SharedSource} that holds a single current {@link #value value}, replays it to each new
     * subscriber, and conflates: a slow subscriber skips straight to the latest value. Consecutive equal values are
     * delivered once.
     *
     * @param <T> the value type
     */
    public interface StateSource<T> extends SharedSource<T> {
        /**
         * Returns the current value, without blocking.
         *
         * @return the current value
         */
        T value();
    }

    /**
     * A {@link StateSource StateSource} whose value can be set.
     *
     * @param <T> the value type
     */
    public interface MutableStateSource<T> extends StateSource<T>, MutableSharedSource<T> {
        /**
         * Sets the current value. Does nothing if the value {@link Object#equals equals} the current value.
         *
         * @param value the new value
         * @throws NullPointerException if value is null
         */
        void setValue(T value);

        /**
         * Atomically sets the current value to {@code update} if it equals {@code expect}.
         *
         * @param expect the expected current value
         * @param update the new value
         * @return {@code true} if the current value was equal to {@code expect}
         * @throws NullPointerException if either argument is null
         */
        boolean compareAndSet(T expect, T update);

        /**
         * Sets the current value to the value the state was created with.
         */
        @Override
        void resetBuffer();

        /**
         * Sets the current value to {@code resetValue}. There is always a current value, so resetting a state cannot
         * empty it.
         *
         * @param resetValue the value to reset to
         * @throws NullPointerException if resetValue is null
         */
        void resetBuffer(T resetValue);
    }
}
