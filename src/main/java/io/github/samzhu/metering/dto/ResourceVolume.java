package io.github.samzhu.metering.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 單一資源的聚合結果（volume sum 或 volume max）。
 *
 * @param resourceId 資源 ID
 * @param value 聚合後的計量值
 */
public record ResourceVolume(
    @JsonProperty("resource_id") String resourceId,
    double value
) {
}
