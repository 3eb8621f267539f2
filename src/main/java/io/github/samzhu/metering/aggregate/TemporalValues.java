package io.github.samzhu.metering.aggregate;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.time.format.DateTimeParseException;
import java.util.Date;

/**
 * 將儲存層聚合結果中的時間值轉換為 {@link Instant}。
 *
 * <p>儲存引擎的聚合層回傳的時間型別不一定與寫入時相同（例如 MongoDB 回傳 {@link Date}），
 * 在比較 min/max 之前必須先經過此轉換。
 */
public final class TemporalValues {

    private TemporalValues() {
    }

    /**
     * 轉換時間值。
     *
     * @param value {@link Instant}、{@link Date}、{@link OffsetDateTime}、{@link ZonedDateTime}、
     *              epoch 毫秒（{@link Number}）或 ISO-8601 字串；可為 {@code null}
     * @return 對應的 Instant；輸入為 {@code null} 時回傳 {@code null}
     * @throws IllegalArgumentException 無法辨識的型別或格式
     */
    public static Instant toInstant(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Instant instant) {
            return instant;
        }
        if (value instanceof Date date) {
            return date.toInstant();
        }
        if (value instanceof OffsetDateTime offsetDateTime) {
            return offsetDateTime.toInstant();
        }
        if (value instanceof ZonedDateTime zonedDateTime) {
            return zonedDateTime.toInstant();
        }
        if (value instanceof Number number) {
            return Instant.ofEpochMilli(number.longValue());
        }
        if (value instanceof CharSequence text) {
            try {
                return Instant.parse(text);
            } catch (DateTimeParseException e) {
                throw new IllegalArgumentException("Unrecognized timestamp value: " + text, e);
            }
        }
        throw new IllegalArgumentException("Unsupported timestamp type: " + value.getClass().getName());
    }
}
