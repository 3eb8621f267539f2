package io.github.samzhu.metering.document;

import java.time.Instant;
import java.util.Map;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import io.github.samzhu.metering.dto.Sample;

/**
 * 原始計量日誌文件，每筆樣本一份，只新增不修改。
 *
 * <p>此集合是聚合計算與重新處理的唯一依據。
 *
 * <p>文件 ID 由 MongoDB 自動產生（ObjectId），屬於儲存層內部細節，
 * 透過 {@link #toSample()} 轉回 {@link Sample} 時會被丟棄。
 *
 * <p>索引：{@code (resourceId, userId, counterName, timestamp, source)} 與
 * {@code (resourceId, projectId, counterName, timestamp, source)} 各一。
 */
@Document(collection = "meter")
public record MeterRecord(
    @Id String id,
    String source,
    String userId,
    String projectId,
    String resourceId,
    String counterName,
    String counterType,
    double counterVolume,
    Instant timestamp,
    Map<String, Object> resourceMetadata
) {

    /**
     * 由樣本建立新的日誌文件。
     *
     * <p>ID 設為 null，由 MongoDB 自動產生 ObjectId。
     *
     * @param sample 計量樣本
     * @return 新的 MeterRecord 實例
     */
    public static MeterRecord from(Sample sample) {
        return new MeterRecord(
            null,
            sample.source(),
            sample.userId(),
            sample.projectId(),
            sample.resourceId(),
            sample.counterName(),
            sample.counterType(),
            sample.counterVolume(),
            sample.timestamp(),
            sample.resourceMetadata());
    }

    /**
     * 附上儲存層識別碼的複本（Spring Data 對不可變實體使用的 wither）。
     */
    public MeterRecord withId(String id) {
        return new MeterRecord(
            id,
            source,
            userId,
            projectId,
            resourceId,
            counterName,
            counterType,
            counterVolume,
            timestamp,
            resourceMetadata);
    }

    public Sample toSample() {
        return new Sample(
            source,
            userId,
            projectId,
            resourceId,
            counterName,
            counterType,
            counterVolume,
            timestamp,
            resourceMetadata);
    }
}
