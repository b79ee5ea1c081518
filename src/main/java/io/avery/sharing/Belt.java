package io.avery.sharing;

import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collector;
import java.util.stream.Stream;

/**
 * The minimal sequence vocabulary that sharing is built on. A {@link Source Source} is a "cold" sequence: each
 * drain runs its production logic again. A {@link StepSink StepSink} accepts elements one at a time, and is what a
 * shared source presents to the producer that feeds it.
 *
 * <p>Elements are never {@code null}. A {@code null} from {@link StepSource#poll poll} means the source drained.
 */
public class Belt {
    private Belt() {}

    /**
     * A sequence of output elements that can be drained to a sink.
     *
     * <p>This is a functional interface whose functional method is {@link #drainToSink(StepSink)}.
     *
     * @param <Out> the output element type
     */
    @FunctionalInterface
    public interface Source<Out> extends AutoCloseable {
        /**
         * Offers as many elements as possible from this source to the sink. This proceeds until either an exception is
         * thrown, this source is drained, or the sink cancels. Returns {@code false} if the sink definitely cancelled,
         * meaning a call to {@link StepSink#offer offer} returned {@code false}; else returns {@code true}.
         *
         * <p>A source that is draining on a thread that gets interrupted should stop and throw
         * {@link InterruptedException}, as that is how a sharing coordinator stops its producer.
         *
         * @param sink the sink to drain to
         * @return {@code false} if the sink cancelled
         * @throws Exception if unable to drain
         */
        boolean drainToSink(StepSink<? super Out> sink) throws Exception;

        /**
         * Relinquishes any underlying resources held by this source.
         *
         * @implNote The default implementation does nothing.
         *
         * @throws Exception if unable to close
         */
        default void close() throws Exception { }

        /**
         * Performs the given action for each remaining element of the source.
         *
         * @param action the action to be performed for each element
         * @throws Exception if unable to drain
         */
        default void forEach(Consumer<? super Out> action) throws Exception {
            Objects.requireNonNull(action);

            class ConsumerSink implements StepSink<Out> {
                @Override
                public boolean offer(Out input) {
                    action.accept(input);
                    return true;
                }
            }

            drainToSink(new ConsumerSink());
        }

        /**
         * Performs a mutable reduction operation on the remaining elements of this source using a {@code Collector}.
         * Only meaningful for sources that eventually drain; a shared source never does.
         *
         * @see Stream#collect(Collector)
         *
         * @param collector the {@code Collector} describing the reduction
         * @return the result of the reduction
         * @param <A> the intermediate accumulation type of the {@code Collector}
         * @param <R> the type of the result
         * @throws Exception if unable to drain
         */
        default <A, R> R collect(Collector<? super Out, A, R> collector) throws Exception {
            var accumulator = collector.accumulator();
            var finisher = collector.finisher();
            A acc = collector.supplier().get();

            class CollectorSink implements StepSink<Out> {
                @Override
                public boolean offer(Out input) {
                    accumulator.accept(acc, input);
                    return true;
                }
            }

            drainToSink(new CollectorSink());
            return finisher.apply(acc);
        }
    }

    /**
     * A {@link Source Source} that can yield output elements one at a time.
     *
     * <p>This is a functional interface whose functional method is {@link #poll()}.
     *
     * @param <Out> the output element type
     */
    @FunctionalInterface
    public interface StepSource<Out> extends Source<Out> {
        /**
         * Polls this source for the next element. Returns {@code null} if this source is drained.
         *
         * @implSpec Once this method returns {@code null}, subsequent calls should also return {@code null}.
         *
         * @return the next element from this source, or {@code null} if this source is drained
         * @throws Exception if unable to poll
         */
        Out poll() throws Exception;

        /**
         * {@inheritDoc}
         *
         * @implSpec The implementation loops, polling from this source and offering to the sink, until either this
         * source drains or the sink cancels.
         */
        @Override
        default boolean drainToSink(StepSink<? super Out> sink) throws Exception {
            for (Out e; (e = poll()) != null; ) {
                if (!sink.offer(e)) {
                    return false;
                }
            }
            return true;
        }
    }

    /**
     * Accepts input elements one at a time.
     *
     * <p>This is a functional interface whose functional method is {@link #offer(Object)}.
     *
     * @param <In> the input element type
     */
    @FunctionalInterface
    public interface StepSink<In> {
        /**
         * Offers the input element to this sink for processing. Returns {@code false} if this sink cancelled during or
         * prior to this call, in which case the element may not have been fully processed.
         *
         * @implSpec Once this method returns {@code false}, subsequent calls should also discard the input element and
         * return {@code false}.
         *
         * @param input the input element
         * @return {@code false} if this sink cancelled, else {@code true}
         * @throws Exception if unable to offer
         */
        boolean offer(In input) throws Exception;
    }
}
