package io.github.samzhu.metering.storage.memory;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import io.github.samzhu.metering.dto.EventFilter;
import io.github.samzhu.metering.dto.EventInterval;
import io.github.samzhu.metering.dto.Meter;
import io.github.samzhu.metering.dto.ResourceInfo;
import io.github.samzhu.metering.dto.ResourceVolume;
import io.github.samzhu.metering.dto.Sample;
import io.github.samzhu.metering.storage.MissingMeterException;

class InMemoryStorageConnectionTest {

    private static final Instant T0 = Instant.parse("2024-07-02T10:40:00Z");
    private static final Instant RECEIVED = Instant.parse("2024-07-02T12:00:00Z");

    private InMemoryStorageConnection connection;

    @BeforeEach
    void setUp() {
        connection = new InMemoryStorageConnection(2, Clock.fixed(RECEIVED, ZoneOffset.UTC));
    }

    private static Sample sample(String user, String project, String resource, String meter,
                                 double volume, Instant timestamp) {
        return new Sample("openstack", user, project, resource, meter, "cumulative", volume, timestamp,
            Map.of("display_name", resource));
    }

    /** 三筆樣本：(u1,p1,r1,T0)、(u1,p1,r1,T0+1s)、(u2,p1,r2,T0)，皆為 instance、volume 1。 */
    private void recordScenario() {
        connection.recordMeteringData(sample("u1", "p1", "r1", "instance", 1, T0));
        connection.recordMeteringData(sample("u1", "p1", "r1", "instance", 1, T0.plusSeconds(1)));
        connection.recordMeteringData(sample("u2", "p1", "r2", "instance", 1, T0));
    }

    @Test
    void shouldListUsersSorted() {
        // Given
        recordScenario();

        // When & Then
        assertThat(connection.getUsers(null)).containsExactly("u1", "u2");
        assertThat(connection.getUsers("openstack")).containsExactly("u1", "u2");
        assertThat(connection.getUsers("other")).isEmpty();
        assertThat(connection.getProjects(null)).containsExactly("p1");
    }

    @Test
    void shouldListResourcesByProject() {
        recordScenario();

        List<ResourceInfo> resources = connection.getResources(null, "p1", null, null, null);

        assertThat(resources).extracting(ResourceInfo::resourceId).containsExactly("r1", "r2");
    }

    @Test
    void shouldListResourcesByUser() {
        recordScenario();

        List<ResourceInfo> resources = connection.getResources("u2", null, null, null, null);

        assertThat(resources).extracting(ResourceInfo::resourceId).containsExactly("r2");
    }

    @Test
    void timeBoundedResourceListingShouldUseRawLog() {
        // Given: r1 在 T0+1s 也有樣本，r2 只有 T0
        recordScenario();

        // When
        List<ResourceInfo> resources = connection.getResources(null, null, null, T0.plusSeconds(1), null);

        // Then
        assertThat(resources).extracting(ResourceInfo::resourceId).containsExactly("r1");
    }

    @Test
    void shouldSumVolumePerResource() {
        recordScenario();

        List<ResourceVolume> volumes = connection.getVolumeSum(
            EventFilter.builder().resource("r1").meter("instance").build());

        assertThat(volumes).containsExactly(new ResourceVolume("r1", 2.0));
    }

    @Test
    void shouldGroupVolumesByResourceForProject() {
        recordScenario();
        connection.recordMeteringData(sample("u2", "p1", "r2", "instance", 5, T0.plusSeconds(2)));

        List<ResourceVolume> max = connection.getVolumeMax(
            EventFilter.builder().project("p1").meter("instance").build());

        assertThat(max).containsExactlyInAnyOrder(new ResourceVolume("r1", 1.0), new ResourceVolume("r2", 5.0));
    }

    @Test
    void shouldComputeEventInterval() {
        recordScenario();

        EventInterval interval = connection.getEventInterval(
            EventFilter.builder().resource("r1").meter("instance").build());

        assertThat(interval).isEqualTo(new EventInterval(T0, T0.plusSeconds(1)));
    }

    @Test
    void intervalWithoutMatchesShouldBeEmpty() {
        recordScenario();

        EventInterval interval = connection.getEventInterval(
            EventFilter.builder().resource("r1").meter("disk.read.bytes").build());

        assertThat(interval.min()).isNull();
        assertThat(interval.max()).isNull();
    }

    @Test
    void aggregatesShouldRequireMeter() {
        recordScenario();
        EventFilter filter = EventFilter.builder().resource("r1").build();

        assertThatThrownBy(() -> connection.getVolumeSum(filter)).isInstanceOf(MissingMeterException.class);
        assertThatThrownBy(() -> connection.getVolumeMax(filter)).isInstanceOf(MissingMeterException.class);
        assertThatThrownBy(() -> connection.getEventInterval(filter)).isInstanceOf(MissingMeterException.class);
    }

    @Test
    void rawEventsShouldNotRequireMeter() {
        recordScenario();

        try (Stream<Sample> events = connection.getRawEvents(EventFilter.builder().user("u1").build())) {
            assertThat(events.toList())
                .extracting(Sample::timestamp)
                .containsExactly(T0, T0.plusSeconds(1));
        }
    }

    @Test
    void rawEventsShouldHonourHalfOpenRange() {
        recordScenario();
        EventFilter filter = EventFilter.builder().meter("instance").start(T0).end(T0.plusSeconds(1)).build();

        try (Stream<Sample> events = connection.getRawEvents(filter)) {
            assertThat(events.toList()).extracting(Sample::resourceId).containsExactly("r1", "r2");
        }
    }

    @Test
    void resourceShouldKeepLatestMetadataAndAccumulateMeters() {
        // Given: 同一資源先後回報兩種計量，metadata 不同
        connection.recordMeteringData(new Sample("openstack", "u1", "p1", "r1", "instance", "gauge", 1, T0,
            Map.of("display_name", "old", "flavor", "m1.small")));
        connection.recordMeteringData(new Sample("openstack", "u1", "p1", "r1", "cpu", "cumulative", 40, T0.plusSeconds(5),
            Map.of("display_name", "new")));

        // When
        ResourceInfo resource = connection.getResources(null, null, null, null, null).get(0);

        // Then: metadata 整份覆寫，meter 累積
        assertThat(resource.metadata()).isEqualTo(Map.of("display_name", "new"));
        assertThat(resource.timestamp()).isEqualTo(T0.plusSeconds(5));
        assertThat(resource.receivedTimestamp()).isEqualTo(RECEIVED);
        assertThat(resource.meter()).containsExactlyInAnyOrder(
            new Meter("instance", "gauge"), new Meter("cpu", "cumulative"));
    }

    @Test
    void repeatedSourceShouldBeRecordedOnce() {
        recordScenario();
        connection.recordMeteringData(new Sample("ceilometer", "u1", "p1", "r1", "instance", "cumulative", 1, T0, null));

        assertThat(connection.getUsers("openstack")).containsExactly("u1", "u2");
        assertThat(connection.getUsers("ceilometer")).containsExactly("u1");
    }

    @Test
    void concurrentWritesShouldNotLoseMeters() throws Exception {
        // Given
        ExecutorService pool = Executors.newFixedThreadPool(8);

        // When: 同一資源並行寫入不同計量
        for (int i = 0; i < 50; i++) {
            String meter = "meter-" + i;
            pool.submit(() -> connection.recordMeteringData(sample("u1", "p1", "r1", meter, 1, T0)));
        }
        pool.shutdown();
        assertThat(pool.awaitTermination(10, TimeUnit.SECONDS)).isTrue();

        // Then
        ResourceInfo resource = connection.getResources(null, null, null, null, null).get(0);
        assertThat(resource.meter()).hasSize(50);
        try (Stream<Sample> events = connection.getRawEvents(EventFilter.builder().build())) {
            assertThat(events.count()).isEqualTo(50);
        }
    }

    @Test
    void clearShouldRemoveEverything() {
        recordScenario();

        connection.clear();

        assertThat(connection.getUsers(null)).isEmpty();
        assertThat(connection.getResources(null, null, null, null, null)).isEmpty();
    }
}
