package io.avery.sharing;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class ReplayBufferTest {

    @Test
    void growsByDoublingAndKeepsLiveRange() {
        ReplayBuffer ring = new ReplayBuffer();
        for (int i = 0; i < 5; i++) {
            ring.reserve(0, i);
            ring.set(i, "e" + i);
        }

        assertThat(ring.capacity()).isEqualTo(8);
        for (int i = 0; i < 5; i++) {
            assertThat(ring.get(i)).isEqualTo("e" + i);
        }
    }

    @Test
    void keepsLiveRangeThatWrapsAround() {
        ReplayBuffer ring = new ReplayBuffer();
        ring.reserve(0, 0);
        ring.reserve(0, 1);
        // Capacity 2; live range [5, 7) wraps
        ring.set(5, "a");
        ring.set(6, "b");
        ring.reserve(5, 2);
        ring.set(7, "c");

        assertThat(ring.capacity()).isEqualTo(4);
        assertThat(ring.get(5)).isEqualTo("a");
        assertThat(ring.get(6)).isEqualTo("b");
        assertThat(ring.get(7)).isEqualTo("c");
    }

    @Test
    void doesNotGrowWhileThereIsRoom() {
        ReplayBuffer ring = new ReplayBuffer();
        ring.reserve(0, 0);
        int capacity = ring.capacity();
        ring.set(0, "x");
        ring.reserve(0, 1);

        assertThat(ring.capacity()).isEqualTo(capacity);
    }
}
