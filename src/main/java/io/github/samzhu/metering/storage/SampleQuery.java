package io.github.samzhu.metering.storage;

import java.time.Instant;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import io.github.samzhu.metering.dto.Sample;

/**
 * 由 {@link QueryTranslator} 產生、與儲存引擎無關的原始日誌查詢。
 *
 * <p>由等值條件與一個選填的半開時間區間 {@code [start, end)} 組成，所有條件以 AND 結合。
 * 沒有任何條件時比對全部樣本。
 *
 * @param equalities 欄位等值條件
 * @param start 選填，區間起點（含）
 * @param end 選填，區間終點（不含）
 */
public record SampleQuery(
    Map<SampleField, String> equalities,
    Instant start,
    Instant end
) {
    public SampleQuery {
        equalities = equalities.isEmpty()
            ? Collections.emptyMap()
            : Collections.unmodifiableMap(new EnumMap<>(equalities));
    }

    public boolean hasTimeRange() {
        return start != null || end != null;
    }

    public boolean isEmpty() {
        return equalities.isEmpty() && !hasTimeRange();
    }

    /**
     * 判斷樣本是否符合此查詢，供記憶體儲存引擎使用。
     *
     * @param sample 計量樣本
     * @return 所有條件皆符合時回傳 true
     */
    public boolean matches(Sample sample) {
        for (Map.Entry<SampleField, String> entry : equalities.entrySet()) {
            if (!entry.getValue().equals(entry.getKey().valueOf(sample))) {
                return false;
            }
        }
        Instant timestamp = sample.timestamp();
        if (start != null && (timestamp == null || timestamp.isBefore(start))) {
            return false;
        }
        if (end != null && (timestamp == null || !timestamp.isBefore(end))) {
            return false;
        }
        return true;
    }
}
