package io.github.samzhu.metering.dto;

import static org.assertj.core.api.Assertions.assertThat;

import java.time.Instant;

import org.junit.jupiter.api.Test;

class EventIntervalTest {

    private static final Instant T0 = Instant.parse("2024-07-02T10:40:00Z");

    @Test
    void mergeShouldTakeComponentWiseBounds() {
        EventInterval a = new EventInterval(T0.plusSeconds(10), T0.plusSeconds(20));
        EventInterval b = new EventInterval(T0, T0.plusSeconds(15));

        assertThat(a.merge(b)).isEqualTo(new EventInterval(T0, T0.plusSeconds(20)));
        assertThat(b.merge(a)).isEqualTo(a.merge(b));
    }

    @Test
    void emptyShouldBeIdentity() {
        EventInterval a = EventInterval.of(T0);

        assertThat(a.merge(EventInterval.empty())).isEqualTo(a);
        assertThat(EventInterval.empty().merge(a)).isEqualTo(a);
        assertThat(EventInterval.empty().isEmpty()).isTrue();
    }
}
