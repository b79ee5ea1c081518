package io.avery.sharing;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.invoke.MethodHandles;
import java.lang.invoke.VarHandle;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.Phaser;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Consumer;
import java.util.function.Function;

/**
 * A scope that owns the tasks of one or more sharing sessions. Tasks {@link #fork forked} in the scope run on their
 * own thread (or on a given executor), and are interrupted when the scope is {@link #shutdown shut down}, including by
 * closing it. The first task that fails with anything other than an interrupt the scope itself caused, shuts the
 * scope down; that failure is kept, and later failures are suppressed onto it.
 *
 * <p>Closing a scope shuts it down, then waits for all of its tasks to finish. Like a {@code StructuredTaskScope},
 * a scope is meant to be opened and closed by the same thread, in a try-with-resources statement.
 */
public class SharingScope implements AutoCloseable {
    private static final Logger logger = LoggerFactory.getLogger(SharingScope.class);
    private static final AtomicInteger SCOPE_NUMBER = new AtomicInteger();

    final String name;
    final Executor executor;
    final Consumer<? super Throwable> exceptionHandler;
    final Phaser phaser;
    final Thread owner;
    final Set<Task> tasks = ConcurrentHashMap.newKeySet();
    volatile boolean isShutdown = false;
    volatile Throwable error;

    static final VarHandle ERROR;
    static {
        try {
            ERROR = MethodHandles.lookup().findVarHandle(SharingScope.class, "error", Throwable.class);
        } catch (Exception e) {
            throw new ExceptionInInitializerError(e);
        }
    }

    /**
     * Constructs a new unnamed {@code SharingScope} that runs each task on a new daemon thread.
     */
    public SharingScope() {
        this(null, daemonThreadFactory("sharing-" + SCOPE_NUMBER.incrementAndGet()), null);
    }

    /**
     * Constructs a new {@code SharingScope} with the given name, that runs each task on a new thread from the given
     * factory.
     *
     * @param name the name of the scope, used in log messages; can be null
     * @param factory the thread factory
     * @throws NullPointerException if factory is null
     */
    public SharingScope(String name, ThreadFactory factory) {
        this(name, factory, null);
    }

    /**
     * Constructs a new {@code SharingScope} with the given name, that runs each task on a new thread from the given
     * factory, and passes task failures to the {@code exceptionHandler}. The handler is called at most once per failed
     * task, on the thread of that task, before the scope shuts down.
     *
     * @param name the name of the scope, used in log messages; can be null
     * @param factory the thread factory
     * @param exceptionHandler the exception handler; can be null
     * @throws NullPointerException if factory is null
     */
    public SharingScope(String name, ThreadFactory factory, Consumer<? super Throwable> exceptionHandler) {
        Objects.requireNonNull(factory);
        this.name = name;
        this.executor = task -> {
            Thread thread = factory.newThread(task);
            if (thread == null) {
                throw new RejectedExecutionException("Thread factory returned null");
            }
            thread.start();
        };
        this.exceptionHandler = exceptionHandler;
        this.phaser = new Phaser(1);
        this.owner = Thread.currentThread();
    }

    /**
     * A handle on a forked task. Cancelling a task interrupts it if it is running, and keeps it from running if it has
     * not started. A cancelled task that exits by throwing is not treated as failed.
     */
    public final class Task {
        final AtomicBoolean interruptLock = new AtomicBoolean(false);
        final CompletableFuture<Void> done = new CompletableFuture<>();
        volatile Thread thread = null;
        volatile boolean cancelled = false;

        private Task() {}

        /**
         * Interrupts this task if it is running, or keeps it from running if it has not started. Does not wait.
         */
        public void cancel() {
            cancelled = true;
            interrupt();
        }

        /**
         * Waits for this task to finish, whether normally, abruptly, or by not running at all.
         *
         * @throws InterruptedException if interrupted while waiting
         */
        public void join() throws InterruptedException {
            try {
                done.get();
            } catch (ExecutionException e) {
                throw new AssertionError(e); // Never completed exceptionally
            }
        }

        /**
         * Returns {@code true} if this task has finished, or will never run.
         *
         * @return {@code true} if this task has finished
         */
        public boolean isDone() {
            return done.isDone();
        }

        /**
         * Returns {@code true} if this task was {@link #cancel cancelled}, or skipped because the scope shut down.
         *
         * @return {@code true} if this task was cancelled
         */
        public boolean isCancelled() {
            return cancelled;
        }

        void cancelAndJoinUninterruptibly() {
            cancel();
            boolean interrupted = false;
            for (;;) {
                try {
                    join();
                    break;
                } catch (InterruptedException e) {
                    interrupted = true;
                }
            }
            if (interrupted) {
                Thread.currentThread().interrupt();
            }
        }

        private void interrupt() {
            // Unlike a StructuredTaskScope we may not own the thread, and a pooled thread could be about to pick up
            // another task. The small lock momentarily blocks the task from exiting while we interrupt it.
            if (interruptLock.compareAndSet(false, true)) {
                try {
                    Thread t = thread;
                    if (t != null) {
                        t.interrupt();
                    }
                } finally {
                    interruptLock.set(false);
                }
            }
        }
    }

    /**
     * Starts a new task in this scope, on a new thread.
     *
     * @param task the task to run
     * @return a handle on the task
     * @throws IllegalStateException if this scope is closed
     * @throws NullPointerException if task is null
     */
    public Task fork(Callable<?> task) {
        return fork(task, executor);
    }

    /**
     * Starts a new task in this scope, on the given executor. The executor should run the task eventually, or
     * {@link #close close} will not return.
     *
     * @param task the task to run
     * @param executor the executor to run the task on
     * @return a handle on the task
     * @throws IllegalStateException if this scope is closed
     * @throws NullPointerException if task or executor is null
     */
    public Task fork(Callable<?> task, Executor executor) {
        Objects.requireNonNull(task);
        Objects.requireNonNull(executor);
        if (phaser.register() < 0) {
            throw new IllegalStateException("SharingScope is closed");
        }
        Task handle = new Task();
        tasks.add(handle);
        try {
            executor.execute(() -> run(handle, task));
        } catch (Error | RuntimeException e) {
            // Task was not forked
            tasks.remove(handle);
            handle.done.complete(null);
            phaser.arriveAndDeregister();
            throw e;
        }
        return handle;
    }

    private void run(Task handle, Callable<?> task) {
        handle.thread = Thread.currentThread();
        try {
            if (isShutdown || handle.cancelled) {
                handle.cancelled = true;
                return;
            }
            task.call();
        } catch (Throwable e) {
            if ((handle.cancelled || isShutdown) && isInterruption(e)) {
                logger.debug("Task in {} ended by cancellation", this);
            } else {
                handleFailure(e);
            }
        } finally {
            while (!handle.interruptLock.compareAndSet(false, true)) {
                Thread.onSpinWait();
            }
            handle.thread = null;
            if (handle.cancelled || isShutdown) {
                Thread.interrupted(); // Do not leak our interrupt to whatever the thread runs next
            }
            tasks.remove(handle);
            handle.done.complete(null);
            phaser.arriveAndDeregister();
        }
    }

    static boolean isInterruption(Throwable e) {
        for (Throwable t = e; t != null; t = t.getCause()) {
            if (t instanceof InterruptedException) {
                return true;
            }
        }
        return false;
    }

    private void handleFailure(Throwable e) {
        if (!ERROR.compareAndSet(this, null, e)) {
            error.addSuppressed(e);
        }
        logger.warn("Task failed in {}, shutting down", this, e);
        if (exceptionHandler != null) {
            exceptionHandler.accept(e);
        }
        shutdown();
    }

    /**
     * Interrupts all running tasks, and keeps tasks that have not started from running. New tasks can still be forked,
     * but will not run. Can be called from any thread, and more than once.
     */
    public void shutdown() {
        if (isShutdown) {
            return;
        }
        isShutdown = true;
        logger.debug("Shutting down {} with {} task(s)", this, tasks.size());
        tasks.forEach(Task::interrupt);
    }

    /**
     * Returns {@code true} if this scope is shut down.
     *
     * @return {@code true} if this scope is shut down
     */
    public boolean isShutdown() {
        return isShutdown;
    }

    /**
     * Waits for all tasks forked so far to finish. Sharing sessions keep a task running for as long as the scope is
     * open, so this method only returns early for scopes with nothing but finite tasks, or after a failure shut the
     * scope down.
     *
     * @throws InterruptedException if interrupted while waiting
     * @throws IllegalStateException if this scope is closed, or not called by the owner
     */
    public void join() throws InterruptedException {
        ensureOwner();
        int phase = phaser.arrive();
        if (phase < 0) {
            throw new IllegalStateException("SharingScope is closed");
        }
        phaser.awaitAdvanceInterruptibly(phase);
    }

    /**
     * Returns the first failure of any task in this scope, if there was one.
     *
     * @return the first failure, if any
     */
    public Optional<Throwable> exception() {
        return Optional.ofNullable(error);
    }

    /**
     * Throws an {@link ExecutionException} wrapping the first failure of any task in this scope, if there was one.
     *
     * @throws ExecutionException if a task failed
     */
    public void throwIfFailed() throws ExecutionException {
        throwIfFailed(ExecutionException::new);
    }

    /**
     * Throws the exception produced by the given function from the first failure of any task in this scope, if there
     * was one.
     *
     * @param esf the exception supplying function
     * @param <X> the type of the exception thrown
     * @throws X if a task failed
     * @throws NullPointerException if esf is null, or returns null
     */
    public <X extends Throwable> void throwIfFailed(Function<Throwable, ? extends X> esf) throws X {
        Objects.requireNonNull(esf);
        Throwable err = error;
        if (err != null) {
            X ex = esf.apply(err);
            Objects.requireNonNull(ex, "esf returned null");
            throw ex;
        }
    }

    /**
     * Shuts down this scope, then waits for all of its tasks to finish. Tasks that do not respond to interrupts will
     * delay this method. Closing twice has no further effect.
     *
     * @throws IllegalStateException if not called by the owner
     */
    @Override
    public void close() {
        ensureOwner();
        int phase = phaser.arriveAndDeregister();
        if (phase < 0) {
            return;
        }
        shutdown();
        phaser.awaitAdvance(phase); // Phaser is terminated upon return
        logger.debug("Closed {}", this);
    }

    private void ensureOwner() {
        if (Thread.currentThread() != owner) {
            throw new IllegalStateException("Current thread not owner");
        }
    }

    /**
     * Returns a thread factory that creates daemon threads named {@code prefix-N}.
     *
     * @param prefix the thread name prefix
     * @return a thread factory for daemon threads
     */
    public static ThreadFactory daemonThreadFactory(String prefix) {
        Objects.requireNonNull(prefix);
        AtomicInteger threadNumber = new AtomicInteger();
        return task -> {
            Thread thread = new Thread(task, prefix + "-" + threadNumber.incrementAndGet());
            thread.setDaemon(true);
            return thread;
        };
    }

    @Override
    public String toString() {
        return name == null ? "SharingScope@" + Integer.toHexString(hashCode()) : "SharingScope[" + name + "]";
    }
}
