package io.github.samzhu.metering.dto;

import java.time.Instant;

/**
 * 符合條件的樣本中最早與最晚的時間戳記。
 *
 * <p>沒有任何樣本符合時，{@code min} 與 {@code max} 皆為 {@code null}。
 *
 * @param min 最早時間戳記
 * @param max 最晚時間戳記
 */
public record EventInterval(Instant min, Instant max) {

    private static final EventInterval EMPTY = new EventInterval(null, null);

    public static EventInterval empty() {
        return EMPTY;
    }

    /**
     * 單一時間點的區間，map 階段每筆樣本各產生一個。
     */
    public static EventInterval of(Instant timestamp) {
        return new EventInterval(timestamp, timestamp);
    }

    public boolean isEmpty() {
        return min == null && max == null;
    }

    /**
     * 逐欄位取 min/max 合併兩個區間，滿足結合律與交換律。
     *
     * @param other 另一個區間
     * @return 合併後的區間
     */
    public EventInterval merge(EventInterval other) {
        if (other.isEmpty()) {
            return this;
        }
        if (isEmpty()) {
            return other;
        }
        Instant lower = other.min.isBefore(min) ? other.min : min;
        Instant upper = other.max.isAfter(max) ? other.max : max;
        return new EventInterval(lower, upper);
    }
}
