package io.avery.sharing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.concurrent.Callable;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.function.Consumer;

/**
 * Entry points for turning cold {@link Belt.Source sources} into hot {@link Sharing.SharedSource shared sources}, and
 * factories for the {@link Sharing} types.
 *
 * <p>{@link #share share} and {@link #stateify stateify} run a sharing session in a {@link SharingScope}: a
 * coordinator task that starts and stops a producer task, as directed by a {@link SharingStarted} policy. The producer
 * drains the upstream into a shared source, which subscribers read from. The session ends when the scope shuts down.
 *
 * <p>Example:
 * <pre>{@code
 * try (var scope = new SharingScope()) {
 *     Sharing.SharedSource<String> prices = Shares.share(
 *         Belts.buffer(pollPrices(), 16),
 *         scope,
 *         1,
 *         SharingStarted.whileSubscribed(Duration.ofSeconds(5))
 *     );
 *     try (var subscription = prices.subscribe()) {
 *         System.out.println(subscription.poll());
 *     }
 * }
 * }</pre>
 */
public class Shares {
    private static final Logger logger = LoggerFactory.getLogger(Shares.class);

    private Shares() {} // Utility

    // --- Factories ---

    /**
     * Returns a new mutable shared source.
     *
     * @param replay the number of most recent elements replayed to new subscribers
     * @param extraBufferCapacity the number of elements buffered beyond {@code replay}, so that emitters do not block
     *                            on slow subscribers
     * @param onBufferOverflow the policy applied when the buffer of {@code replay + extraBufferCapacity} is full
     * @return a new mutable shared source
     * @param <T> the element type
     * @throws IllegalArgumentException if replay or extraBufferCapacity is negative, or if both are zero with a policy
     * other than {@link BufferOverflow#SUSPEND SUSPEND}
     * @throws NullPointerException if onBufferOverflow is null
     */
    public static <T> Sharing.MutableSharedSource<T> mutableShared(int replay, int extraBufferCapacity,
                                                                   BufferOverflow onBufferOverflow) {
        return new SharedBuffer<>(replay, extraBufferCapacity, onBufferOverflow);
    }

    /**
     * Returns a new mutable shared source with no extra buffer, that blocks emitters on slow subscribers.
     *
     * @param replay the number of most recent elements replayed to new subscribers
     * @return a new mutable shared source
     * @param <T> the element type
     * @throws IllegalArgumentException if replay is negative
     */
    public static <T> Sharing.MutableSharedSource<T> mutableShared(int replay) {
        return new SharedBuffer<>(replay, 0, BufferOverflow.SUSPEND);
    }

    /**
     * Returns a new mutable state with the given initial value.
     *
     * @param initialValue the initial value
     * @return a new mutable state
     * @param <T> the value type
     * @throws NullPointerException if initialValue is null
     */
    public static <T> Sharing.MutableStateSource<T> mutableState(T initialValue) {
        return new StateBuffer<>(initialValue);
    }

    // --- Read-only views ---

    /**
     * Returns a read-only view of the given shared source. The view cannot be cast back to a mutable type.
     *
     * @param shared the shared source
     * @return a read-only view
     * @param <T> the element type
     * @throws NullPointerException if shared is null
     */
    public static <T> Sharing.SharedSource<T> asShared(Sharing.SharedSource<T> shared) {
        return new ReadonlyShared<>(shared);
    }

    /**
     * Returns a read-only view of the given state. The view cannot be cast back to a mutable type.
     *
     * @param state the state
     * @return a read-only view
     * @param <T> the value type
     * @throws NullPointerException if state is null
     */
    public static <T> Sharing.StateSource<T> asState(Sharing.StateSource<T> state) {
        return new ReadonlyState<>(state);
    }

    static class ReadonlyShared<T> implements Sharing.SharedSource<T> {
        final Sharing.SharedSource<T> delegate;

        ReadonlyShared(Sharing.SharedSource<T> delegate) {
            this.delegate = Objects.requireNonNull(delegate);
        }

        @Override
        public Sharing.Subscription<T> subscribe() {
            return delegate.subscribe();
        }

        @Override
        public List<T> replayCache() {
            return delegate.replayCache();
        }

        @Override
        public Sharing.StateSource<Integer> subscriptionCount() {
            return delegate.subscriptionCount();
        }

        @Override
        public boolean drainToSink(Belt.StepSink<? super T> sink) throws Exception {
            return delegate.drainToSink(sink);
        }

        @Override
        public String toString() {
            return delegate.toString();
        }
    }

    static final class ReadonlyState<T> extends ReadonlyShared<T> implements Sharing.StateSource<T> {
        ReadonlyState(Sharing.StateSource<T> delegate) {
            super(delegate);
        }

        @Override
        public T value() {
            return ((Sharing.StateSource<T>) delegate).value();
        }
    }

    // --- Sharing ---

    /**
     * Shares the given upstream in the scope, {@link SharingStarted#EAGERLY eagerly}.
     *
     * @see #share(Belt.Source, SharingScope, int, SharingStarted, Object)
     */
    public static <T> Sharing.SharedSource<T> share(Belt.Source<? extends T> upstream, SharingScope scope, int replay) {
        return share(upstream, scope, replay, SharingStarted.EAGERLY, null);
    }

    /**
     * Shares the given upstream in the scope, with no initial value.
     *
     * @see #share(Belt.Source, SharingScope, int, SharingStarted, Object)
     */
    public static <T> Sharing.SharedSource<T> share(Belt.Source<? extends T> upstream, SharingScope scope, int replay,
                                                    SharingStarted started) {
        return share(upstream, scope, replay, started, null);
    }

    /**
     * Returns a shared source that broadcasts the elements of the given cold upstream to all of its subscribers. The
     * upstream is drained by a producer task in the scope, which the {@code started} policy starts and stops. The
     * sharing session ends when the scope shuts down, after which the shared source stays subscribable but idle.
     *
     * <p>If the upstream is a {@link Belts.BufferedSource BufferedSource}, its buffer becomes the shared source's extra
     * buffer, and its executor runs the producer. Otherwise, the shared source buffers
     * {@link Belts#DEFAULT_BUFFER_CAPACITY} elements beyond {@code replay}, blocks the producer on slow subscribers,
     * and the producer runs on a new thread of the scope.
     *
     * <p>If an upstream failure escapes the producer, the scope records it and shuts down.
     *
     * @param upstream the cold source to share
     * @param scope the scope to run the sharing session in
     * @param replay the number of most recent elements replayed to new subscribers
     * @param started the policy that starts and stops the producer
     * @param initialValue an element to seed the replay cache with, which resetting the buffer restores; can be null
     * @return a read-only shared source
     * @param <T> the element type
     * @throws NullPointerException if upstream, scope or started is null
     * @throws IllegalArgumentException if replay is negative, if an initialValue is given with a replay of zero, or if
     * the upstream is buffered with a dropping policy and a capacity of zero while replay is zero
     * @throws IllegalStateException if the scope is closed
     */
    public static <T> Sharing.SharedSource<T> share(Belt.Source<? extends T> upstream, SharingScope scope, int replay,
                                                    SharingStarted started, T initialValue) {
        Objects.requireNonNull(upstream);
        Objects.requireNonNull(scope);
        Objects.requireNonNull(started);
        if (replay < 0) {
            throw new IllegalArgumentException("replay cannot be negative, but was " + replay);
        }
        if (initialValue != null && replay == 0) {
            throw new IllegalArgumentException("initialValue requires a positive replay");
        }
        SharingConfig<T> config = SharingConfig.of(upstream);
        var shared = new SharedBuffer<T>(replay, config.extraBufferCapacity, config.onBufferOverflow);
        if (initialValue != null) {
            shared.tryOffer(initialValue);
        }
        launch(scope, config, shared, started, initialValue);
        return asShared(shared);
    }

    /**
     * Returns a state that holds the latest element of the given cold upstream, starting from
     * {@code initialValue}. The upstream is drained by a producer task in the scope, which the {@code started} policy
     * starts and stops. Resetting the buffer restores the initial value.
     *
     * <p>A {@link Belts.BufferedSource BufferedSource} upstream is unwrapped, and its executor runs the producer; its
     * buffer configuration is ignored, as a state conflates.
     *
     * @param upstream the cold source to share
     * @param scope the scope to run the sharing session in
     * @param started the policy that starts and stops the producer
     * @param initialValue the initial value
     * @return a read-only state
     * @param <T> the value type
     * @throws NullPointerException if any argument is null
     * @throws IllegalStateException if the scope is closed
     */
    public static <T> Sharing.StateSource<T> stateify(Belt.Source<? extends T> upstream, SharingScope scope,
                                                      SharingStarted started, T initialValue) {
        Objects.requireNonNull(upstream);
        Objects.requireNonNull(scope);
        Objects.requireNonNull(started);
        SharingConfig<T> config = SharingConfig.of(upstream);
        var state = new StateBuffer<T>(initialValue);
        launch(scope, config, state, started, initialValue);
        return asState(state);
    }

    /**
     * Starts draining the given cold upstream in the scope immediately, and blocks until its first element arrives.
     * Returns a state seeded with that element, and updated with each later element, for as long as the scope is
     * open.
     *
     * @param upstream the cold source to share
     * @param scope the scope to run the producer in
     * @return a read-only state
     * @param <T> the value type
     * @throws InterruptedException if interrupted while waiting for the first element
     * @throws UpstreamException if the upstream fails before yielding an element
     * @throws NoSuchElementException if the upstream completes without yielding an element
     * @throws CancellationException if the scope shuts down before the first element arrives
     * @throws NullPointerException if upstream or scope is null
     * @throws IllegalStateException if the scope is closed
     */
    public static <T> Sharing.StateSource<T> stateify(Belt.Source<? extends T> upstream, SharingScope scope)
        throws InterruptedException, UpstreamException {
        Objects.requireNonNull(upstream);
        Objects.requireNonNull(scope);
        SharingConfig<T> config = SharingConfig.of(upstream);
        CompletableFuture<Sharing.StateSource<T>> result = new CompletableFuture<>();

        class FirstThenUpdate implements Belt.StepSink<T> {
            StateBuffer<T> state = null;

            @Override
            public boolean offer(T input) {
                if (state == null) {
                    state = new StateBuffer<>(input);
                    result.complete(asState(state));
                } else {
                    state.setValue(input);
                }
                return true;
            }
        }

        var task = fork(scope, () -> {
            try {
                config.upstream.drainToSink(new FirstThenUpdate());
            } catch (Throwable e) {
                if (scope.isShutdown() && SharingScope.isInterruption(e)) {
                    result.completeExceptionally(new CancellationException("Scope shut down before the first element"));
                } else {
                    result.completeExceptionally(e);
                }
                throw e;
            }
            result.completeExceptionally(new NoSuchElementException("Upstream completed without an element"));
            return null;
        }, config.executor);
        task.done.thenRun(() -> result.completeExceptionally(new CancellationException("Scope shut down before the first element")));

        try {
            return result.get();
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof NoSuchElementException) {
                throw new NoSuchElementException(cause.getMessage());
            }
            throw new UpstreamException(cause);
        }
    }

    private static <T> void launch(SharingScope scope, SharingConfig<T> config, SharedBuffer<T> shared,
                                   SharingStarted started, T initialValue) {
        var coordinator = new SharingCoordinator<>(scope, config.upstream, shared, started, config.executor, initialValue);
        scope.fork(coordinator);
        logger.debug("Launched sharing session in {} with {}", scope, started);
    }

    private static SharingScope.Task fork(SharingScope scope, Callable<?> task, Executor executor) {
        return executor != null ? scope.fork(task, executor) : scope.fork(task);
    }

    /**
     * The upstream and buffering that a sharing session uses, after fusing with a {@link Belts.BufferedSource}.
     */
    static final class SharingConfig<T> {
        final Belt.Source<? extends T> upstream;
        final int extraBufferCapacity;
        final BufferOverflow onBufferOverflow;
        final Executor executor;

        SharingConfig(Belt.Source<? extends T> upstream, int extraBufferCapacity, BufferOverflow onBufferOverflow,
                      Executor executor) {
            this.upstream = upstream;
            this.extraBufferCapacity = extraBufferCapacity;
            this.onBufferOverflow = onBufferOverflow;
            this.executor = executor;
        }

        static <T> SharingConfig<T> of(Belt.Source<? extends T> upstream) {
            if (!(upstream instanceof Belts.BufferedSource)) {
                return new SharingConfig<>(upstream, Belts.DEFAULT_BUFFER_CAPACITY, BufferOverflow.SUSPEND, null);
            }
            Belts.BufferedSource<? extends T> buffered = (Belts.BufferedSource<? extends T>) upstream;
            return new SharingConfig<>(buffered.upstream, buffered.capacity(), buffered.onBufferOverflow, buffered.executor);
        }
    }

    // --- Subscription hooks ---

    /**
     * Returns a shared source whose subscriptions run the given {@code action} right after registering with the given
     * shared source. Elements the action passes to its argument are yielded by that subscription only, before any
     * shared elements. Since the subscription is already registered, nothing offered to the shared source after the
     * action starts is missed.
     *
     * <p>If the action throws, the subscription is closed and the exception is rethrown from {@code subscribe}.
     *
     * @param shared the shared source
     * @param action the action to run on each new subscription
     * @return a shared source that runs the action on each new subscription
     * @param <T> the element type
     * @throws NullPointerException if shared or action is null
     */
    public static <T> Sharing.SharedSource<T> onSubscription(Sharing.SharedSource<T> shared,
                                                             Consumer<? super Consumer<T>> action) {
        Objects.requireNonNull(shared);
        Objects.requireNonNull(action);

        class PrefixedSubscription implements Sharing.Subscription<T> {
            final Sharing.Subscription<T> subscription;
            final Deque<T> prefix = new ArrayDeque<>();

            PrefixedSubscription(Sharing.Subscription<T> subscription) {
                this.subscription = subscription;
            }

            @Override
            public T poll() throws InterruptedException {
                T head = prefix.poll();
                return head != null ? head : subscription.poll();
            }

            @Override
            public T pollUntil(Instant deadline) throws InterruptedException {
                Objects.requireNonNull(deadline);
                T head = prefix.poll();
                return head != null ? head : subscription.pollUntil(deadline);
            }

            @Override
            public void close() {
                prefix.clear();
                subscription.close();
            }
        }

        class OnSubscription extends ReadonlyShared<T> {
            OnSubscription() {
                super(shared);
            }

            @Override
            public Sharing.Subscription<T> subscribe() {
                var subscription = new PrefixedSubscription(shared.subscribe());
                try {
                    action.accept((Consumer<T>) e -> subscription.prefix.offer(Objects.requireNonNull(e)));
                } catch (Error | RuntimeException e) {
                    subscription.close();
                    throw e;
                }
                return subscription;
            }

            @Override
            public boolean drainToSink(Belt.StepSink<? super T> sink) throws Exception {
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

        return new OnSubscription();
    }
}
