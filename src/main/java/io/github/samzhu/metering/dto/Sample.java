package io.github.samzhu.metering.dto;

import java.time.Instant;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 計量樣本（counter sample），原始日誌中的一筆資料。
 *
 * <p>由上游收集管線解碼並驗證後傳入，本服務不再做任何驗證。
 * 欄位名稱在 JSON 中採用 snake_case，與收集管線發送的訊息格式一致：
 * <ul>
 *   <li>{@code source} - 回報資料的來源識別碼</li>
 *   <li>{@code user_id} / {@code project_id} - 資源擁有者</li>
 *   <li>{@code resource_id} - 被計量的資源</li>
 *   <li>{@code counter_name} / {@code counter_type} - 計量名稱與型別（如 instance / cumulative）</li>
 *   <li>{@code counter_volume} - 計量值</li>
 *   <li>{@code timestamp} - 樣本本身的時間戳記</li>
 *   <li>{@code resource_metadata} - 資源的任意 key/value 描述</li>
 * </ul>
 *
 * <p>Record 本身不可變：{@code resourceMetadata} 在建構時做深層複製，
 * 呼叫端之後修改自己的 Map 不會影響已寫入的樣本。
 *
 * @see ResourceMetadata
 */
public record Sample(
    String source,
    @JsonProperty("user_id") String userId,
    @JsonProperty("project_id") String projectId,
    @JsonProperty("resource_id") String resourceId,
    @JsonProperty("counter_name") String counterName,
    @JsonProperty("counter_type") String counterType,
    @JsonProperty("counter_volume") double counterVolume,
    Instant timestamp,
    @JsonProperty("resource_metadata") Map<String, Object> resourceMetadata
) {
    public Sample {
        resourceMetadata = ResourceMetadata.copyOf(resourceMetadata);
    }
}
