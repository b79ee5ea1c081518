package io.avery.sharing;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.stream.Collectors;
import java.util.stream.IntStream;
import java.util.stream.Stream;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

@Timeout(10)
class BeltsTest {

    @Test
    void bufferedSourceDeliversEverythingInOrder() throws Exception {
        var source = Belts.buffer(Belts.streamSource(IntStream.range(0, 500).boxed()), 8);

        List<Integer> drained = source.collect(Collectors.toList());

        assertThat(drained).containsExactlyElementsOf(IntStream.range(0, 500).boxed().collect(Collectors.toList()));
    }

    @Test
    void rendezvousBufferDeliversEverything() throws Exception {
        var source = Belts.buffer(Belts.iteratorSource(List.of("a", "b", "c").iterator()), 0);

        assertThat(source.collect(Collectors.toList())).containsExactly("a", "b", "c");
    }

    @Test
    void upstreamFailureSurfacesAfterEarlierElements() {
        Belt.Source<Integer> failing = sink -> {
            sink.offer(1);
            sink.offer(2);
            throw new IllegalStateException("upstream broke");
        };
        List<Integer> drained = new ArrayList<>();

        assertThatThrownBy(() -> Belts.buffer(failing).forEach(drained::add))
            .isInstanceOf(UpstreamException.class)
            .hasCauseInstanceOf(IllegalStateException.class);
        assertThat(drained).containsExactly(1, 2);
    }

    @Test
    void cancellingSinkStopsUpstream() throws Exception {
        var source = Belts.buffer(Belts.streamSource(Stream.iterate(0, i -> i + 1)), 4);
        List<Integer> drained = new ArrayList<>();

        boolean completed = source.drainToSink(e -> {
            drained.add(e);
            return drained.size() < 10;
        });

        assertThat(completed).isFalse();
        assertThat(drained).containsExactly(0, 1, 2, 3, 4, 5, 6, 7, 8, 9);
    }

    @Test
    void runsUpstreamOnGivenExecutor() throws Exception {
        ExecutorService executor = Executors.newSingleThreadExecutor(r -> new Thread(r, "upstream-thread"));
        try {
            Belt.Source<String> names = sink -> sink.offer(Thread.currentThread().getName());
            var source = Belts.runOn(names, executor);

            assertThat(source.collect(Collectors.toList())).containsExactly("upstream-thread");
        } finally {
            executor.shutdown();
        }
    }

    @Test
    void consecutiveSuspendingBuffersAddUp() {
        Belt.Source<Integer> upstream = Belts.streamSource(Stream.of(1));

        var fused = Belts.buffer(Belts.buffer(upstream, 10), 20);

        assertThat(fused.upstream()).isSameAs(upstream);
        assertThat(fused.capacity()).isEqualTo(30);
        assertThat(fused.onBufferOverflow()).isEqualTo(BufferOverflow.SUSPEND);
    }

    @Test
    void defaultCapacityYieldsToExplicitOne() {
        Belt.Source<Integer> upstream = Belts.streamSource(Stream.of(1));

        assertThat(Belts.buffer(Belts.buffer(upstream), 5).capacity()).isEqualTo(5);
        assertThat(Belts.buffer(Belts.buffer(upstream, 5)).capacity()).isEqualTo(5);
        assertThat(Belts.buffer(Belts.buffer(upstream)).capacity()).isEqualTo(Belts.DEFAULT_BUFFER_CAPACITY);
        assertThat(Belts.DEFAULT_BUFFER_CAPACITY).isEqualTo(64);
    }

    @Test
    void droppingPolicyReplacesPreviousCapacity() {
        Belt.Source<Integer> upstream = Belts.streamSource(Stream.of(1));

        var fused = Belts.buffer(Belts.buffer(upstream, 10), 3, BufferOverflow.DROP_OLDEST);

        assertThat(fused.capacity()).isEqualTo(3);
        assertThat(fused.onBufferOverflow()).isEqualTo(BufferOverflow.DROP_OLDEST);
    }

    @Test
    void innermostExecutorWins() {
        Belt.Source<Integer> upstream = Belts.streamSource(Stream.of(1));
        Executor inner = Runnable::run;
        Executor outer = r -> new Thread(r).start();

        var fused = Belts.runOn(Belts.runOn(upstream, inner), outer);
        var late = Belts.runOn(Belts.buffer(upstream, 2), outer);

        assertThat(fused.executor()).isSameAs(inner);
        assertThat(fused.capacity()).isEqualTo(Belts.DEFAULT_BUFFER_CAPACITY);
        assertThat(late.executor()).isSameAs(outer);
        assertThat(late.capacity()).isEqualTo(2);
    }

    @Test
    void rejectsNegativeCapacity() {
        assertThatThrownBy(() -> Belts.buffer(Belts.streamSource(Stream.of(1)), -1))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void streamSourceDrainsOnlyOnce() throws Exception {
        var source = Belts.streamSource(Stream.of(1, 2, 3));

        assertThat(source.collect(Collectors.toList())).containsExactly(1, 2, 3);
        assertThat(source.collect(Collectors.toList())).isEmpty();
    }
}
