package io.github.samzhu.metering.storage.memory;

import java.time.Clock;
import java.time.Instant;
import java.util.Comparator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.ConcurrentMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.util.StringUtils;

import io.github.samzhu.metering.aggregate.MapReduce;
import io.github.samzhu.metering.aggregate.PartitionedMapReduce;
import io.github.samzhu.metering.aggregate.TimestampBounds;
import io.github.samzhu.metering.aggregate.VolumeMax;
import io.github.samzhu.metering.aggregate.VolumeSum;
import io.github.samzhu.metering.document.MeterRecord;
import io.github.samzhu.metering.document.ResourceRecord;
import io.github.samzhu.metering.dto.EventFilter;
import io.github.samzhu.metering.dto.EventInterval;
import io.github.samzhu.metering.dto.Meter;
import io.github.samzhu.metering.dto.ResourceInfo;
import io.github.samzhu.metering.dto.ResourceVolume;
import io.github.samzhu.metering.dto.Sample;
import io.github.samzhu.metering.storage.QueryTranslator;
import io.github.samzhu.metering.storage.SampleQuery;
import io.github.samzhu.metering.storage.StorageConnection;

/**
 * 記憶體儲存引擎，連線字串 scheme 為 {@code memory}。
 *
 * <p>資料結構：
 * <ul>
 *   <li>user / project 登錄 - {@code ConcurrentMap<id, Set<source>>}</li>
 *   <li>resource 登錄 - {@code ConcurrentMap<id, ResourceRecord>}，以 {@code compute} 做單一 key 的原子 upsert</li>
 *   <li>原始日誌 - {@link ConcurrentLinkedQueue}，依插入順序附加，每筆附上內部序號</li>
 * </ul>
 *
 * <p>聚合透過 {@link PartitionedMapReduce} 執行，逐段讀取原始日誌而不一次載入所有符合的樣本。
 * 適用於測試與本機執行；資料不會持久化。
 */
public class InMemoryStorageConnection implements StorageConnection {

    private static final Logger log = LoggerFactory.getLogger(InMemoryStorageConnection.class);

    private final ConcurrentMap<String, Set<String>> users = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, Set<String>> projects = new ConcurrentHashMap<>();
    private final ConcurrentMap<String, ResourceRecord> resources = new ConcurrentHashMap<>();
    private final Queue<MeterRecord> meters = new ConcurrentLinkedQueue<>();
    private final AtomicLong sequence = new AtomicLong();

    private final PartitionedMapReduce executor;
    private final Clock clock;

    public InMemoryStorageConnection(int partitionSize) {
        this(partitionSize, Clock.systemUTC());
    }

    public InMemoryStorageConnection(int partitionSize, Clock clock) {
        this.executor = new PartitionedMapReduce(partitionSize);
        this.clock = clock;
        log.info("InMemoryStorageConnection initialized: partitionSize={}", partitionSize);
    }

    @Override
    public void recordMeteringData(Sample sample) {
        users.computeIfAbsent(sample.userId(), key -> ConcurrentHashMap.newKeySet()).add(sample.source());
        projects.computeIfAbsent(sample.projectId(), key -> ConcurrentHashMap.newKeySet()).add(sample.source());

        Instant receivedTimestamp = clock.instant();
        Meter meter = new Meter(sample.counterName(), sample.counterType());
        resources.compute(sample.resourceId(), (id, existing) -> {
            Set<Meter> seen = new LinkedHashSet<>();
            if (existing != null) {
                seen.addAll(existing.meter());
            }
            seen.add(meter);
            return new ResourceRecord(
                id,
                sample.projectId(),
                sample.userId(),
                sample.timestamp(),
                receivedTimestamp,
                sample.resourceMetadata(),
                sample.source(),
                Set.copyOf(seen));
        });

        meters.add(MeterRecord.from(sample).withId(Long.toString(sequence.incrementAndGet())));

        log.debug("Sample recorded: resourceId={}, counterName={}, source={}",
            sample.resourceId(), sample.counterName(), sample.source());
    }

    @Override
    public List<String> getUsers(String source) {
        return listKeys(users, source);
    }

    @Override
    public List<String> getProjects(String source) {
        return listKeys(projects, source);
    }

    private static List<String> listKeys(Map<String, Set<String>> registry, String source) {
        return registry.entrySet().stream()
            .filter(entry -> !StringUtils.hasText(source) || entry.getValue().contains(source))
            .map(Map.Entry::getKey)
            .sorted()
            .toList();
    }

    @Override
    public List<ResourceInfo> getResources(String user, String project, String source, Instant start, Instant end) {
        Stream<ResourceRecord> matching;
        if (start != null || end != null) {
            SampleQuery query = QueryTranslator.translateResourceQuery(user, project, source, start, end);
            Set<String> resourceIds = samples(query)
                .map(Sample::resourceId)
                .collect(Collectors.toSet());
            matching = resourceIds.stream()
                .map(resources::get)
                .filter(Objects::nonNull);
        } else {
            matching = resources.values().stream()
                .filter(record -> !StringUtils.hasText(user) || user.equals(record.userId()))
                .filter(record -> !StringUtils.hasText(project) || project.equals(record.projectId()))
                .filter(record -> !StringUtils.hasText(source) || source.equals(record.source()));
        }
        return matching
            .sorted(Comparator.comparing(ResourceRecord::id))
            .map(ResourceRecord::toResourceInfo)
            .toList();
    }

    @Override
    public Stream<Sample> getRawEvents(EventFilter filter) {
        SampleQuery query = QueryTranslator.translate(filter, false);
        return samples(query);
    }

    @Override
    public List<ResourceVolume> getVolumeSum(EventFilter filter) {
        return volumes(filter, VolumeSum.INSTANCE);
    }

    @Override
    public List<ResourceVolume> getVolumeMax(EventFilter filter) {
        return volumes(filter, VolumeMax.INSTANCE);
    }

    private List<ResourceVolume> volumes(EventFilter filter, MapReduce<String, Double> mapReduce) {
        SampleQuery query = QueryTranslator.translate(filter);
        Map<String, Double> result = executor.execute(samples(query).iterator(), mapReduce);
        return result.entrySet().stream()
            .map(entry -> new ResourceVolume(entry.getKey(), entry.getValue()))
            .toList();
    }

    @Override
    public EventInterval getEventInterval(EventFilter filter) {
        SampleQuery query = QueryTranslator.translate(filter);
        Map<String, EventInterval> result = executor.execute(samples(query).iterator(), TimestampBounds.INSTANCE);
        return result.getOrDefault(TimestampBounds.KEY, EventInterval.empty());
    }

    private Stream<Sample> samples(SampleQuery query) {
        return meters.stream()
            .map(MeterRecord::toSample)
            .filter(query::matches);
    }

    /**
     * 清除所有資料，供測試使用。
     */
    public void clear() {
        users.clear();
        projects.clear();
        resources.clear();
        meters.clear();
        log.debug("In-memory storage cleared");
    }
}
