package io.avery.sharing;

import java.util.Objects;

/**
 * The implementation of {@link Sharing.MutableStateSource}: a {@link SharedBuffer} with a replay of one, no extra
 * capacity, and {@link BufferOverflow#DROP_OLDEST DROP_OLDEST} overflow, that refuses values equal to the current one.
 *
 * @param <T> the value type
 */
class StateBuffer<T> extends SharedBuffer<T> implements Sharing.MutableStateSource<T> {
    final T resetValue;
    volatile T value;

    StateBuffer(T initialValue) {
        super(1, 0, BufferOverflow.DROP_OLDEST);
        this.resetValue = Objects.requireNonNull(initialValue);
        this.value = initialValue;
        lock.lock();
        try {
            tryOfferLocked(initialValue);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public T value() {
        return value;
    }

    @Override
    public void setValue(T newValue) {
        Objects.requireNonNull(newValue);
        lock.lock();
        try {
            updateLocked(newValue);
        } finally {
            lock.unlock();
        }
    }

    @Override
    public boolean compareAndSet(T expect, T update) {
        Objects.requireNonNull(expect);
        Objects.requireNonNull(update);
        lock.lock();
        try {
            if (!expect.equals(value)) {
                return false;
            }
            updateLocked(update);
            return true;
        } finally {
            lock.unlock();
        }
    }

    private void updateLocked(T newValue) {
        if (newValue.equals(value)) {
            return;
        }
        value = newValue;
        tryOfferLocked(newValue); // Conflating, never refuses
    }

    /**
     * Same as {@link #setValue setValue}; never blocks.
     */
    @Override
    public boolean offer(T input) {
        setValue(input);
        return true;
    }

    @Override
    public boolean tryOffer(T input) {
        setValue(input);
        return true;
    }

    @Override
    public void resetBuffer() {
        setValue(resetValue);
    }

    @Override
    public void resetBuffer(T resetValue) {
        setValue(resetValue);
    }

    @Override
    public String toString() {
        return "StateSource(" + value + ")";
    }
}
