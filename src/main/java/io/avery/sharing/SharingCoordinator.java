package io.avery.sharing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.concurrent.Callable;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.Executor;

/**
 * The task that runs a sharing session. It drains the {@link SharingStarted policy}'s commands, starting and stopping
 * a producer task that drains the upstream into the shared source. A new command first cancels the running producer
 * and waits for it to finish, so at most one producer ever offers to the shared source.
 *
 * <p>The session lasts until the scope shuts down, even when the policy's commands run out. Ending the session
 * cancels the producer and resets the shared source's buffer. Resetting a session that has an initial value leaves
 * just the initial value in the replay cache, rather than emptying it.
 */
final class SharingCoordinator<T> implements Callable<Void> {
    private static final Logger logger = LoggerFactory.getLogger(SharingCoordinator.class);

    final SharingScope scope;
    final Belt.Source<? extends T> upstream;
    final SharedBuffer<T> shared;
    final SharingStarted started;
    final Executor executor;
    final T initialValue;

    // Only touched by the coordinator thread
    SharingScope.Task producer = null;
    SharingCommand last = null;

    SharingCoordinator(SharingScope scope, Belt.Source<? extends T> upstream, SharedBuffer<T> shared,
                       SharingStarted started, Executor executor, T initialValue) {
        this.scope = scope;
        this.upstream = upstream;
        this.shared = shared;
        this.started = started;
        this.executor = executor;
        this.initialValue = initialValue;
    }

    @Override
    public Void call() throws Exception {
        logger.debug("Sharing {} with {}", upstream, started);
        try {
            try (var commands = started.commandSource(shared.subscriptionCount())) {
                commands.drainToSink(this::apply);
            }
            logger.debug("Commands from {} ran out; sharing stays up until {} shuts down", started, scope);
            new CountDownLatch(1).await();
            return null;
        } finally {
            if (producer != null) {
                producer.cancelAndJoinUninterruptibly();
                producer = null;
            }
            resetBuffer();
            logger.debug("Sharing of {} ended", upstream);
        }
    }

    private boolean apply(SharingCommand command) throws InterruptedException {
        if (command == last) {
            return true;
        }
        last = command;
        logger.debug("Applying {} to sharing of {}", command, upstream);
        if (producer != null) {
            producer.cancel();
            producer.join();
            producer = null;
        }
        switch (command) {
            case START:
                Callable<Void> produce = this::produce;
                producer = executor != null ? scope.fork(produce, executor) : scope.fork(produce);
                break;
            case STOP:
                break;
            case STOP_AND_RESET_BUFFER:
                resetBuffer();
                break;
        }
        return true;
    }

    private void resetBuffer() {
        if (initialValue == null) {
            shared.resetBuffer();
        } else {
            shared.resetBuffer(initialValue);
        }
    }

    private Void produce() throws Exception {
        upstream.drainToSink(shared);
        logger.debug("Upstream {} completed", upstream);
        return null;
    }
}
