package com.pulsesentinel.core.support;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for {@link BoundedHistory}.
 */
class BoundedHistoryTest {

    @Test
    @DisplayName("Should drop the oldest items beyond capacity")
    void shouldDropOldest() {
        BoundedHistory<Integer> history = new BoundedHistory<>(3);
        for (int i = 1; i <= 5; i++) {
            history.append(i);
        }

        assertThat(history.size()).isEqualTo(3);
        assertThat(history.toList()).containsExactly(3, 4, 5);
        assertThat(history.latest()).contains(5);
    }

    @Test
    @DisplayName("Should return newest-first and oldest-first windows")
    void shouldReturnWindows() {
        BoundedHistory<Integer> history = new BoundedHistory<>(10);
        List.of(1, 2, 3, 4).forEach(history::append);

        assertThat(history.newestFirst(2)).containsExactly(4, 3);
        assertThat(history.tail(2)).containsExactly(3, 4);
        assertThat(history.tail(100)).containsExactly(1, 2, 3, 4);
        assertThat(history.tail(0)).isEmpty();
    }

    @Test
    @DisplayName("Should trim a restored collection to capacity")
    void shouldTrimOnReplace() {
        BoundedHistory<Integer> history = new BoundedHistory<>(2);
        history.replaceAll(List.of(1, 2, 3));

        assertThat(history.toList()).containsExactly(2, 3);
    }

    @Test
    @DisplayName("Should reject non-positive capacity")
    void shouldRejectBadCapacity() {
        assertThatThrownBy(() -> new BoundedHistory<>(0))
                .isInstanceOf(IllegalArgumentException.class);
    }
}
