package io.github.samzhu.metering.dto.api;

import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonProperty;

import io.github.samzhu.metering.dto.EventInterval;

/**
 * 事件時間區間回應。
 *
 * @param startTimestamp 最早事件時間
 * @param endTimestamp 最晚事件時間
 * @param duration 兩者相差秒數；沒有事件時三個欄位皆為 null
 */
public record DurationResponse(
    @JsonProperty("start_timestamp") Instant startTimestamp,
    @JsonProperty("end_timestamp") Instant endTimestamp,
    Double duration
) {
    public static DurationResponse from(EventInterval interval) {
        if (interval.min() == null || interval.max() == null) {
            return new DurationResponse(interval.min(), interval.max(), null);
        }
        double seconds = Duration.between(interval.min(), interval.max()).toNanos() / 1e9;
        return new DurationResponse(interval.min(), interval.max(), seconds);
    }
}
