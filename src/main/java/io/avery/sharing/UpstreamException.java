package io.avery.sharing;

/**
 * Exception thrown when a consumer waits on elements that an upstream {@link Belt.Source Source}, running on another
 * thread, failed to produce. This happens when draining a {@link Belts#buffer buffered} source, or when
 * {@link Shares#stateify(Belt.Source, SharingScope) stateifying} a source that fails before its first element. The
 * upstream failure can be inspected using the {@link Throwable#getCause()} method.
 */
public class UpstreamException extends Exception {
    /**
     * Constructs an {@code UpstreamException} with the specified detail message and cause.
     *
     * @param message the detail message
     * @param cause the cause (which is saved for later retrieval by the {@link Throwable#getCause()} method)
     */
    public UpstreamException(String message, Throwable cause) {
        super(message, cause);
    }

    /**
     * Constructs an {@code UpstreamException} with the specified cause. The detail message is set to
     * {@code (cause == null ? null : cause.toString())}.
     *
     * @param cause the cause (which is saved for later retrieval by the {@link Throwable#getCause()} method)
     */
    public UpstreamException(Throwable cause) {
        super(cause);
    }
}
