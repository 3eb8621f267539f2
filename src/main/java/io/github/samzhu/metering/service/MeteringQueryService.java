package io.github.samzhu.metering.service;

import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import io.github.samzhu.metering.dto.EventFilter;
import io.github.samzhu.metering.dto.EventInterval;
import io.github.samzhu.metering.dto.ResourceInfo;
import io.github.samzhu.metering.dto.ResourceVolume;
import io.github.samzhu.metering.dto.Sample;
import io.github.samzhu.metering.storage.StorageConnection;

/**
 * 計量資料查詢服務。
 *
 * <p>REST API 與 {@link StorageConnection} 之間的薄層：
 * <ul>
 *   <li>清單查詢直接轉交儲存層</li>
 *   <li>原始事件在此收集成清單，串流一定會被關閉</li>
 *   <li>單一資源的 volume 聚合由分組結果中取出該資源的值</li>
 * </ul>
 */
@Service
public class MeteringQueryService {

    private static final Logger log = LoggerFactory.getLogger(MeteringQueryService.class);

    private final StorageConnection storageConnection;

    public MeteringQueryService(StorageConnection storageConnection) {
        this.storageConnection = storageConnection;
    }

    public List<String> listUsers(String source) {
        List<String> users = storageConnection.getUsers(source);
        log.debug("Listed users: source={}, count={}", source, users.size());
        return users;
    }

    public List<String> listProjects(String source) {
        List<String> projects = storageConnection.getProjects(source);
        log.debug("Listed projects: source={}, count={}", source, projects.size());
        return projects;
    }

    /**
     * 查詢資源清單。
     *
     * <p>有指定時間範圍時，只回傳在範圍內有樣本的資源。
     */
    public List<ResourceInfo> listResources(String user, String project, String source, Instant start, Instant end) {
        List<ResourceInfo> resources = storageConnection.getResources(user, project, source, start, end);
        log.debug("Listed resources: user={}, project={}, source={}, start={}, end={}, count={}",
            user, project, source, start, end, resources.size());
        return resources;
    }

    /**
     * 查詢符合條件的原始樣本。
     *
     * @param filter 過濾條件，不要求指定 meter
     * @return 依儲存順序排列的樣本
     */
    public List<Sample> listRawEvents(EventFilter filter) {
        try (Stream<Sample> events = storageConnection.getRawEvents(filter)) {
            List<Sample> result = events.toList();
            log.debug("Listed raw events: filter={}, count={}", filter, result.size());
            return result;
        }
    }

    public List<ResourceVolume> getVolumeSum(EventFilter filter) {
        return storageConnection.getVolumeSum(filter);
    }

    public List<ResourceVolume> getVolumeMax(EventFilter filter) {
        return storageConnection.getVolumeMax(filter);
    }

    /**
     * 單一資源的 volume 總和。
     *
     * @return 總和；沒有符合的樣本時為 null
     */
    public Double getResourceVolumeSum(EventFilter filter) {
        return volumeOf(filter.resource(), storageConnection.getVolumeSum(filter));
    }

    /**
     * 單一資源的 volume 最大值。
     *
     * @return 最大值；沒有符合的樣本時為 null
     */
    public Double getResourceVolumeMax(EventFilter filter) {
        return volumeOf(filter.resource(), storageConnection.getVolumeMax(filter));
    }

    private static Double volumeOf(String resourceId, List<ResourceVolume> volumes) {
        return volumes.stream()
            .filter(volume -> volume.resourceId().equals(resourceId))
            .map(ResourceVolume::value)
            .findFirst()
            .orElse(null);
    }

    public EventInterval getEventInterval(EventFilter filter) {
        EventInterval interval = storageConnection.getEventInterval(filter);
        log.debug("Event interval: filter={}, min={}, max={}", filter, interval.min(), interval.max());
        return interval;
    }
}
