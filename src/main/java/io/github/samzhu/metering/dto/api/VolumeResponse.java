package io.github.samzhu.metering.dto.api;

/**
 * 單一資源的 volume 聚合回應；沒有符合的樣本時 {@code volume} 為 null。
 */
public record VolumeResponse(Double volume) {
}
