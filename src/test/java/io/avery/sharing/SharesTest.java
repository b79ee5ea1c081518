package io.avery.sharing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Duration;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.concurrent.CancellationException;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import java.util.stream.Stream;

import static io.avery.sharing.SharedBufferTest.await;
import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Timeout(20)
class SharesTest {
    private static final int N = 200;

    // The emitter blocks until every subscriber has taken the element that did not fit, so it can run at most one
    // element ahead of a full buffer
    private void checkBuffer(int capacity, int replay, Function<Belt.Source<Integer>, Belt.Source<Integer>> op)
        throws Exception {
        AtomicInteger emitted = new AtomicInteger();
        Belt.Source<Integer> upstream = sink -> {
            for (int i = 0; i < N; i++) {
                if (!sink.offer(i)) {
                    return false;
                }
                emitted.incrementAndGet();
            }
            return sink.offer(-1);
        };

        try (var scope = new SharingScope()) {
            var shared = Shares.share(op.apply(upstream), scope, replay, SharingStarted.LAZILY);
            var buffer = (SharedBuffer<?>) ((Shares.ReadonlyShared<Integer>) shared).delegate;
            assertThat(buffer.bufferCapacity).isEqualTo(capacity);

            try (var subscription = shared.subscribe()) {
                int expected = 0;
                for (Integer i; (i = subscription.poll()) >= 0; expected++) {
                    assertThat(i).isEqualTo(expected);
                    assertThat(emitted.get() - (expected + 1)).isLessThanOrEqualTo(capacity + 1);
                    if (expected % 50 == 0) {
                        Thread.sleep(20); // Let the emitter run ahead until it blocks
                    }
                }
                assertThat(expected).isEqualTo(N);
            }
        }
    }

    @Test
    void replay0DefaultBuffer() throws Exception {
        checkBuffer(64, 0, Function.identity());
    }

    @Test
    void replay1DefaultBuffer() throws Exception {
        checkBuffer(65, 1, Function.identity());
    }

    @Test
    void replay100DefaultBuffer() throws Exception {
        checkBuffer(164, 100, Function.identity());
    }

    @Test
    void defaultBufferKeepsDefault() throws Exception {
        checkBuffer(64, 0, Belts::buffer);
    }

    @Test
    void overrideDefaultBuffer0() throws Exception {
        checkBuffer(0, 0, upstream -> Belts.buffer(upstream, 0));
    }

    @Test
    void overrideDefaultBuffer10() throws Exception {
        checkBuffer(10, 0, upstream -> Belts.buffer(upstream, 10));
    }

    @Test
    void bufferReplaySum() throws Exception {
        checkBuffer(41, 11, upstream -> Belts.buffer(Belts.buffer(upstream, 10), 20));
    }

    @Test
    void lazilyNeverStartsWithoutSubscribers() throws Exception {
        AtomicInteger starts = new AtomicInteger();
        Belt.Source<Integer> upstream = sink -> {
            starts.incrementAndGet();
            return sink.offer(1);
        };
        try (var scope = new SharingScope()) {
            var shared = Shares.share(upstream, scope, 1, SharingStarted.LAZILY);
            Thread.sleep(100);

            assertThat(starts).hasValue(0);
            assertThat(shared.replayCache()).isEmpty();
        }
    }

    @Test
    void eagerlyFillsReplayAndShutdownResetsIt() throws Exception {
        var scope = new SharingScope();
        var shared = Shares.share(Belts.streamSource(Stream.of(1, 2, 3)), scope, 3);
        await(() -> shared.replayCache().size() == 3);
        assertThat(shared.replayCache()).containsExactly(1, 2, 3);
        assertThat(shared).isNotInstanceOf(Sharing.MutableSharedSource.class);

        scope.close();

        assertThat(shared.replayCache()).isEmpty();
        assertThat(scope.exception()).isEmpty();
    }

    @Test
    void whileSubscribedRestartsUpstreamAfterReset() throws Exception {
        AtomicInteger starts = new AtomicInteger();
        Belt.Source<Integer> upstream = sink -> {
            starts.incrementAndGet();
            for (int i = 0; ; i++) {
                if (!sink.offer(i)) {
                    return false;
                }
                Thread.sleep(1);
            }
        };
        try (var scope = new SharingScope()) {
            var shared = Shares.share(upstream, scope, 1, SharingStarted.whileSubscribed(Duration.ZERO, Duration.ZERO));
            try (var subscription = shared.subscribe()) {
                assertThat(subscription.poll()).isEqualTo(0);
                assertThat(subscription.poll()).isEqualTo(1);
            }
            await(() -> shared.replayCache().isEmpty());
            assertThat(starts).hasValue(1);

            try (var subscription = shared.subscribe()) {
                assertThat(subscription.poll()).isEqualTo(0);
            }
            assertThat(starts).hasValue(2);
            scope.throwIfFailed();
        }
    }

    @Test
    void upstreamFailureShutsDownScope() throws Exception {
        Belt.Source<Integer> upstream = sink -> {
            throw new IllegalStateException("upstream broke");
        };
        try (var scope = new SharingScope()) {
            Shares.share(upstream, scope, 0);
            await(scope::isShutdown);

            assertThat(scope.exception()).containsInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void sharedInitialValueIsReplayedAndRestoredOnReset() throws Exception {
        try (var scope = new SharingScope()) {
            var shared = Shares.share(Belts.streamSource(Stream.of("a")), scope, 1,
                SharingStarted.whileSubscribed(Duration.ZERO, Duration.ZERO), "init");
            assertThat(shared.replayCache()).containsExactly("init");

            try (var subscription = shared.subscribe()) {
                assertThat(subscription.poll()).isEqualTo("init");
                assertThat(subscription.poll()).isEqualTo("a");
            }
            await(() -> shared.replayCache().equals(List.of("init")));
        }
        assertThatThrownBy(() -> {
            try (var scope = new SharingScope()) {
                Shares.share(Belts.streamSource(Stream.of("a")), scope, 0, SharingStarted.EAGERLY, "init");
            }
        }).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void resetWithInitialValueDropsOlderReplay() throws Exception {
        var scope = new SharingScope();
        var shared = Shares.share(Belts.streamSource(Stream.of("a", "b")), scope, 2,
            SharingStarted.whileSubscribed(Duration.ZERO, Duration.ZERO), "init");

        try (var subscription = shared.subscribe()) {
            assertThat(subscription.poll()).isEqualTo("init");
            assertThat(subscription.poll()).isEqualTo("a");
            assertThat(subscription.poll()).isEqualTo("b");
        }
        await(() -> shared.replayCache().equals(List.of("init")));
        try (var subscription = shared.subscribe()) {
            assertThat(subscription.poll()).isEqualTo("init");
        }

        scope.close();
        assertThat(shared.replayCache()).containsExactly("init");
    }

    @Test
    void stopKeepsReplayCache() throws Exception {
        AtomicInteger emitted = new AtomicInteger();
        Belt.Source<Integer> upstream = sink -> {
            for (int i = 0; ; i++) {
                if (!sink.offer(i)) {
                    return false;
                }
                emitted.set(i + 1);
                Thread.sleep(1);
            }
        };
        try (var scope = new SharingScope()) {
            var shared = Shares.share(upstream, scope, 3, SharingStarted.WHILE_SUBSCRIBED);
            try (var subscription = shared.subscribe()) {
                for (int i = 0; i < 5; i++) {
                    assertThat(subscription.poll()).isEqualTo(i);
                }
            }
            Thread.sleep(200);
            int stoppedAt = emitted.get();
            Thread.sleep(100);

            assertThat(emitted).hasValue(stoppedAt);
            assertThat(shared.replayCache()).containsExactly(stoppedAt - 3, stoppedAt - 2, stoppedAt - 1);
            scope.throwIfFailed();
        }
    }

    @Test
    void stateifyWaitsForFirstValueThenFollowsUpstream() throws Exception {
        try (var scope = new SharingScope()) {
            var state = Shares.stateify(Belts.streamSource(Stream.of(1, 2, 3)), scope);

            assertThat(state.value()).isBetween(1, 3);
            await(() -> state.value() == 3);
            assertThat(state).isNotInstanceOf(Sharing.MutableStateSource.class);
        }
    }

    @Test
    void stateifyReportsFailureBeforeFirstValue() {
        Belt.Source<Integer> upstream = sink -> {
            throw new IllegalStateException("no value for you");
        };
        try (var scope = new SharingScope()) {
            assertThatThrownBy(() -> Shares.stateify(upstream, scope))
                .isInstanceOf(UpstreamException.class)
                .hasCauseInstanceOf(IllegalStateException.class);
        }
    }

    @Test
    void stateifyReportsShutdownWhileUpstreamRunsAsCancellation() throws Exception {
        CountDownLatch upstreamStarted = new CountDownLatch(1);
        Belt.Source<Integer> upstream = sink -> {
            upstreamStarted.countDown();
            Thread.sleep(60_000);
            return sink.offer(1);
        };
        try (var scope = new SharingScope()) {
            CompletableFuture<Throwable> thrown = new CompletableFuture<>();
            Thread caller = new Thread(() -> {
                try {
                    Shares.stateify(upstream, scope);
                    thrown.complete(null);
                } catch (Throwable e) {
                    thrown.complete(e);
                }
            });
            caller.start();
            upstreamStarted.await();
            scope.shutdown();
            caller.join();

            assertThat(thrown.get()).isInstanceOf(CancellationException.class);
            assertThat(scope.exception()).isEmpty();
        }
    }

    @Test
    void stateifyReportsEmptyUpstream() {
        try (var scope = new SharingScope()) {
            assertThatThrownBy(() -> Shares.stateify(Belts.streamSource(Stream.empty()), scope))
                .isInstanceOf(NoSuchElementException.class);
            assertThat(scope.exception()).isEmpty();
        }
    }

    @Test
    void stateifyWithInitialValueStartsPerPolicy() throws Exception {
        try (var scope = new SharingScope()) {
            var state = Shares.stateify(Belts.streamSource(Stream.of(42)), scope, SharingStarted.LAZILY, 0);
            Thread.sleep(50);
            assertThat(state.value()).isZero();

            try (var subscription = state.subscribe()) {
                Integer first = subscription.poll();
                if (first == 0) {
                    first = subscription.poll();
                }
                assertThat(first).isEqualTo(42);
            }
            assertThat(state.value()).isEqualTo(42);
        }
    }

    @Test
    void producerRunsOnFusedExecutor() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> new Thread(r, "producer-thread"));
        try (var scope = new SharingScope()) {
            Belt.Source<String> upstream = sink -> sink.offer(Thread.currentThread().getName());
            var shared = Shares.share(Belts.runOn(upstream, executor), scope, 1);

            await(() -> !shared.replayCache().isEmpty());
            assertThat(shared.replayCache()).containsExactly("producer-thread");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void onSubscriptionDeliversActionOutputFirst() throws Exception {
        var shared = Shares.<String>mutableShared(0, 4, BufferOverflow.SUSPEND);
        var greeted = Shares.onSubscription(shared, emit -> emit.accept("hello"));

        try (var subscription = greeted.subscribe()) {
            assertThat(shared.subscriptionCount().value()).isEqualTo(1);
            shared.offer("world");
            assertThat(subscription.poll()).isEqualTo("hello");
            assertThat(subscription.poll()).isEqualTo("world");
        }
        assertThat(shared.subscriptionCount().value()).isZero();
    }

    @Test
    void failingSubscriptionActionUnsubscribes() {
        var shared = Shares.<String>mutableShared(1);
        var failing = Shares.onSubscription(shared, emit -> {
            throw new IllegalStateException("rejected");
        });

        assertThatThrownBy(failing::subscribe).isInstanceOf(IllegalStateException.class);
        assertThat(shared.subscriptionCount().value()).isZero();
    }
}
