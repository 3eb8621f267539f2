package io.github.samzhu.metering.dto;

import java.time.Instant;
import java.util.Map;
import java.util.Set;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 資源清單查詢回傳給呼叫端的資源資訊。
 *
 * <p>對應 resource registry 的最新狀態，但以 {@code resource_id} 取代儲存層內部的主鍵欄位，
 * 儲存層自己的識別碼不會外流。
 *
 * @param resourceId 資源 ID
 * @param projectId 最近一次樣本的專案 ID
 * @param userId 最近一次樣本的用戶 ID
 * @param timestamp 最近一次樣本的時間戳記
 * @param receivedTimestamp 最近一次樣本被處理的時間
 * @param metadata 最近一次樣本的 metadata（整份覆寫，不合併）
 * @param meter 曾回報過的計量種類
 * @param source 最近一次樣本的來源
 */
public record ResourceInfo(
    @JsonProperty("resource_id") String resourceId,
    @JsonProperty("project_id") String projectId,
    @JsonProperty("user_id") String userId,
    Instant timestamp,
    @JsonProperty("received_timestamp") Instant receivedTimestamp,
    Map<String, Object> metadata,
    Set<Meter> meter,
    String source
) {
}
