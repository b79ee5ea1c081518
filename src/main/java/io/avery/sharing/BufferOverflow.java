package io.avery.sharing;

/**
 * What a buffer does when an offered element does not fit.
 */
public enum BufferOverflow {
    /**
     * Block the offering thread until the slowest subscriber frees a slot.
     */
    SUSPEND,
    
    /**
     * Evict the oldest buffered element to make room. Subscribers that had not yet seen the evicted element skip it
     * without notice.
     */
    DROP_OLDEST,
    
    /**
     * Discard the offered element, leaving the buffer unchanged.
     */
    DROP_LATEST
}
