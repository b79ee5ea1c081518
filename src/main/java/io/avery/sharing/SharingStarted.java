package io.avery.sharing;

import java.time.DateTimeException;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * A policy that decides when the producer behind a shared source runs. A policy transforms the shared source's
 * {@link Sharing.SharedSource#subscriptionCount subscription count} into a source of {@link SharingCommand commands}.
 * The sharing coordinator drains that source with "latest wins" semantics, and ignores repeated commands.
 *
 * <p>Built-in policies:
 * <ul>
 *     <li>{@link #EAGERLY} - start immediately, never stop
 *     <li>{@link #LAZILY} - start when the first subscriber appears, never stop
 *     <li>{@link #whileSubscribed(Duration, Duration)} - run while there are subscribers, optionally lingering and
 *     expiring the replay cache after the last one leaves
 * </ul>
 */
@FunctionalInterface
public interface SharingStarted {
    /**
     * Starts sharing immediately, and never stops.
     */
    SharingStarted EAGERLY = new Eagerly();

    /**
     * Starts sharing when the first subscriber appears, and never stops.
     */
    SharingStarted LAZILY = new Lazily();

    /**
     * Starts sharing when the first subscriber appears, stops immediately when the last subscriber disappears, and
     * keeps the replay cache forever.
     */
    SharingStarted WHILE_SUBSCRIBED = new WhileSubscribed(Duration.ZERO, WhileSubscribed.FOREVER);

    /**
     * Returns a policy that starts sharing when the first subscriber appears, stops once there have been no
     * subscribers for {@code stopTimeout}, and resets the buffer after a further {@code replayExpiration}.
     *
     * <p>A zero {@code replayExpiration} resets the buffer as part of stopping. A {@code replayExpiration} of
     * {@code Duration.ofMillis(Long.MAX_VALUE)} never resets the buffer.
     *
     * @param stopTimeout how long to keep sharing after the subscriber count drops to zero
     * @param replayExpiration how long to keep the replay cache after sharing stopped
     * @return a policy that runs sharing while there are subscribers
     * @throws NullPointerException if either argument is null
     * @throws IllegalArgumentException if either argument is negative
     */
    static SharingStarted whileSubscribed(Duration stopTimeout, Duration replayExpiration) {
        return new WhileSubscribed(stopTimeout, replayExpiration);
    }

    /**
     * Returns a policy that starts sharing when the first subscriber appears, stops once there have been no
     * subscribers for {@code stopTimeout}, and keeps the replay cache forever.
     *
     * @param stopTimeout how long to keep sharing after the subscriber count drops to zero
     * @return a policy that runs sharing while there are subscribers
     * @throws NullPointerException if stopTimeout is null
     * @throws IllegalArgumentException if stopTimeout is negative
     */
    static SharingStarted whileSubscribed(Duration stopTimeout) {
        return new WhileSubscribed(stopTimeout, WhileSubscribed.FOREVER);
    }

    /**
     * Transforms the subscription count of a shared source into commands for its producer. The returned source is
     * drained on the sharing coordinator's thread, and is interrupted when sharing ends.
     *
     * @param subscriptionCount the subscription count of the shared source
     * @return the source of commands
     */
    Belt.Source<SharingCommand> commandSource(Sharing.StateSource<Integer> subscriptionCount);

    final class Eagerly implements SharingStarted {
        private Eagerly() {}

        @Override
        public Belt.Source<SharingCommand> commandSource(Sharing.StateSource<Integer> subscriptionCount) {
            return sink -> sink.offer(SharingCommand.START);
        }

        @Override
        public String toString() {
            return "SharingStarted.Eagerly";
        }
    }

    final class Lazily implements SharingStarted {
        private Lazily() {}

        @Override
        public Belt.Source<SharingCommand> commandSource(Sharing.StateSource<Integer> subscriptionCount) {
            return sink -> {
                try (var counts = subscriptionCount.subscribe()) {
                    for (Integer count; (count = counts.poll()) != null; ) {
                        if (count > 0) {
                            return sink.offer(SharingCommand.START);
                        }
                    }
                    return true;
                }
            };
        }

        @Override
        public String toString() {
            return "SharingStarted.Lazily";
        }
    }

    final class WhileSubscribed implements SharingStarted {
        static final Duration FOREVER = Duration.ofMillis(Long.MAX_VALUE);

        final Duration stopTimeout;
        final Duration replayExpiration;

        WhileSubscribed(Duration stopTimeout, Duration replayExpiration) {
            Objects.requireNonNull(stopTimeout);
            Objects.requireNonNull(replayExpiration);
            if (stopTimeout.isNegative()) {
                throw new IllegalArgumentException("stopTimeout cannot be negative");
            }
            if (replayExpiration.isNegative()) {
                throw new IllegalArgumentException("replayExpiration cannot be negative");
            }
            this.stopTimeout = stopTimeout;
            this.replayExpiration = replayExpiration;
        }

        @Override
        public Belt.Source<SharingCommand> commandSource(Sharing.StateSource<Integer> subscriptionCount) {
            class Commands implements Belt.Source<SharingCommand> {
                SharingCommand last = null;

                @Override
                public boolean drainToSink(Belt.StepSink<? super SharingCommand> sink) throws Exception {
                    try (var counts = subscriptionCount.subscribe()) {
                        // At most one of these is pending; a newer count supersedes both
                        Instant stopDeadline = null;
                        Instant resetDeadline = null;
                        for (;;) {
                            Instant deadline = stopDeadline != null ? stopDeadline
                                : resetDeadline != null ? resetDeadline
                                : Instant.MAX;
                            Integer count = counts.pollUntil(deadline);
                            if (count != null) {
                                stopDeadline = null;
                                resetDeadline = null;
                                if (count > 0) {
                                    if (!emit(sink, SharingCommand.START)) {
                                        return false;
                                    }
                                } else {
                                    stopDeadline = deadlineAfter(stopTimeout);
                                }
                            } else if (stopDeadline != null) {
                                stopDeadline = null;
                                if (replayExpiration.isZero()) {
                                    if (!emit(sink, SharingCommand.STOP_AND_RESET_BUFFER)) {
                                        return false;
                                    }
                                } else {
                                    if (!emit(sink, SharingCommand.STOP)) {
                                        return false;
                                    }
                                    resetDeadline = replayExpiration.equals(FOREVER) ? null : deadlineAfter(replayExpiration);
                                }
                            } else if (resetDeadline != null) {
                                resetDeadline = null;
                                if (!emit(sink, SharingCommand.STOP_AND_RESET_BUFFER)) {
                                    return false;
                                }
                            } else {
                                return true; // Count subscription closed
                            }
                        }
                    }
                }

                private boolean emit(Belt.StepSink<? super SharingCommand> sink, SharingCommand command)
                    throws Exception {
                    // Nothing to stop before the first start, and no repeats
                    if ((last == null && command != SharingCommand.START) || command == last) {
                        return true;
                    }
                    last = command;
                    return sink.offer(command);
                }
            }

            return new Commands();
        }

        private Instant deadlineAfter(Duration duration) {
            try {
                return Instant.now().plus(duration);
            } catch (DateTimeException | ArithmeticException e) {
                return Instant.MAX;
            }
        }

        @Override
        public boolean equals(Object o) {
            return o instanceof WhileSubscribed
                && stopTimeout.equals(((WhileSubscribed) o).stopTimeout)
                && replayExpiration.equals(((WhileSubscribed) o).replayExpiration);
        }

        @Override
        public int hashCode() {
            return 31 * stopTimeout.hashCode() + replayExpiration.hashCode();
        }

        @Override
        public String toString() {
            List<String> params = new ArrayList<>(2);
            if (!stopTimeout.isZero()) {
                params.add("stopTimeout=" + stopTimeout);
            }
            if (!replayExpiration.equals(FOREVER)) {
                params.add("replayExpiration=" + replayExpiration);
            }
            return "SharingStarted.WhileSubscribed(" + String.join(", ", params) + ")";
        }
    }
}
