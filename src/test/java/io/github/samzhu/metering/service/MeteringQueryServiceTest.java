package io.github.samzhu.metering.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.metering.dto.EventFilter;
import io.github.samzhu.metering.dto.ResourceVolume;
import io.github.samzhu.metering.dto.Sample;
import io.github.samzhu.metering.storage.StorageConnection;

class MeteringQueryServiceTest {

    private StorageConnection storageConnection;
    private MeteringQueryService queryService;

    @BeforeEach
    void setUp() {
        storageConnection = mock(StorageConnection.class);
        queryService = new MeteringQueryService(storageConnection);
    }

    @Test
    void rawEventStreamShouldBeClosed() {
        // Given
        AtomicBoolean closed = new AtomicBoolean();
        Sample sample = new Sample("openstack", "u1", "p1", "r1", "instance", "gauge", 1,
            Instant.parse("2024-07-02T10:40:00Z"), Map.of());
        when(storageConnection.getRawEvents(any())).thenReturn(Stream.of(sample).onClose(() -> closed.set(true)));

        // When
        List<Sample> events = queryService.listRawEvents(EventFilter.builder().user("u1").build());

        // Then
        assertThat(events).containsExactly(sample);
        assertThat(closed).isTrue();
    }

    @Test
    void shouldPickRequestedResourceVolume() {
        when(storageConnection.getVolumeSum(any())).thenReturn(List.of(new ResourceVolume("r1", 4.0)));

        Double volume = queryService.getResourceVolumeSum(EventFilter.builder().resource("r1").meter("instance").build());

        assertThat(volume).isEqualTo(4.0);
    }

    @Test
    void missingResourceVolumeShouldBeNull() {
        when(storageConnection.getVolumeMax(any())).thenReturn(List.of());

        Double volume = queryService.getResourceVolumeMax(EventFilter.builder().resource("r1").meter("instance").build());

        assertThat(volume).isNull();
    }
}
