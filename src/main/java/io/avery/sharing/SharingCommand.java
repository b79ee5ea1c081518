package io.avery.sharing;

/**
 * Commands that a {@link SharingStarted} policy issues to control the producer behind a shared source.
 */
public enum SharingCommand {
    /**
     * Start draining the upstream source into the shared buffer.
     */
    START,
    
    /**
     * Stop draining the upstream source. Buffered elements are kept.
     */
    STOP,
    
    /**
     * Stop draining the upstream source, then {@link Sharing.MutableSharedSource#resetBuffer reset} the buffer.
     */
    STOP_AND_RESET_BUFFER
}
