package io.avery.sharing;

/**
 * A growable ring of slots addressed by absolute element index. The owner decides which range of indices is live;
 * this class only maps indices to slots and grows when the live range no longer fits.
 *
 * <p>Not thread-safe. Callers synchronize externally.
 */
final class ReplayBuffer {
    private static final Object[] EMPTY = new Object[0];

    private Object[] slots = EMPTY;

    Object get(long index) {
        return slots[(int) index & (slots.length - 1)];
    }

    void set(long index, Object item) {
        slots[(int) index & (slots.length - 1)] = item;
    }

    /**
     * Ensures the slot after the live range {@code [head, head + size)} can be written without overwriting a live
     * slot, growing (and re-laying out the live range) if needed.
     */
    void reserve(long head, int size) {
        if (size < slots.length) {
            return;
        }
        if (size == Integer.MAX_VALUE >>> 1) {
            throw new IllegalStateException("Buffer size limit exceeded");
        }
        // Capacity stays a power of two, so indices can be masked
        Object[] next = new Object[slots.length == 0 ? 2 : slots.length * 2];
        for (int i = 0; i < size; i++) {
            long index = head + i;
            next[(int) index & (next.length - 1)] = get(index);
        }
        slots = next;
    }

    int capacity() {
        return slots.length;
    }
}
