package io.github.samzhu.metering.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * 資源曾回報過的計量種類，{@code (counter_name, counter_type)} 組合。
 *
 * @param counterName 計量名稱
 * @param counterType 計量型別（gauge / delta / cumulative）
 */
public record Meter(
    @JsonProperty("counter_name") String counterName,
    @JsonProperty("counter_type") String counterType
) {
}
