package io.github.samzhu.metering.document;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import io.github.samzhu.metering.dto.Meter;
import io.github.samzhu.metering.dto.ResourceInfo;

/**
 * 資源登錄文件，保存每個資源的最新狀態。
 *
 * <p>每收到一筆樣本即 upsert：
 * <ul>
 *   <li>{@code projectId}、{@code userId}、{@code timestamp}、{@code metadata}、{@code source}
 *       以最近一次樣本覆寫（last-write-wins，metadata 不合併）</li>
 *   <li>{@code receivedTimestamp} 為本服務處理樣本的時間，而非樣本自己的時間戳記</li>
 *   <li>{@code meter} 以 {@code $addToSet} 累加，計量停止回報也不會移除</li>
 * </ul>
 *
 * <p>文件 ID：直接使用 {@code resourceId}
 *
 * <p>索引：{@code (userId, source)} 與 {@code (projectId, source)} 各一，
 * 由 {@link io.github.samzhu.metering.storage.mongodb.MongoStorageConnection#ensureIndexes()} 建立。
 */
@Document(collection = "resource")
public record ResourceRecord(
    @Id String id,
    String projectId,
    String userId,
    Instant timestamp,
    Instant receivedTimestamp,
    Map<String, Object> metadata,
    String source,
    Set<Meter> meter
) {

    /**
     * 轉換為對外的資源資訊，主鍵改名為 {@code resourceId}。
     *
     * @return 對外的資源資訊
     */
    public ResourceInfo toResourceInfo() {
        return new ResourceInfo(
            id,
            projectId,
            userId,
            timestamp,
            receivedTimestamp,
            metadata,
            meter != null ? Set.copyOf(meter) : Set.of(),
            source);
    }
}
