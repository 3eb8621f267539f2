package io.github.samzhu.metering.storage;

import java.time.Instant;
import java.util.EnumMap;
import java.util.Map;

import org.springframework.util.StringUtils;

import io.github.samzhu.metering.dto.EventFilter;

/**
 * 將 {@link EventFilter} 轉換為 {@link SampleQuery}。
 *
 * <p>依序疊加條件，每個條件只在對應欄位有值時加入：
 * <ol>
 *   <li>擁有者 - {@code user} 優先；有 {@code user} 時忽略 {@code project}</li>
 *   <li>{@code meter} - {@code requireMeter} 為 true 時必填</li>
 *   <li>時間區間 - {@code [start, end)}，兩端各自選填</li>
 *   <li>{@code resource}</li>
 *   <li>{@code source}</li>
 * </ol>
 *
 * <p>純函式，無副作用。
 */
public final class QueryTranslator {

    private QueryTranslator() {
    }

    /**
     * 轉換查詢條件。
     *
     * @param filter 查詢條件
     * @param requireMeter 是否要求 meter 必填
     * @return 原始日誌查詢
     * @throws MissingMeterException {@code requireMeter} 為 true 且未指定 meter
     */
    public static SampleQuery translate(EventFilter filter, boolean requireMeter) {
        Map<SampleField, String> equalities = new EnumMap<>(SampleField.class);

        if (StringUtils.hasText(filter.user())) {
            equalities.put(SampleField.USER_ID, filter.user());
        } else if (StringUtils.hasText(filter.project())) {
            equalities.put(SampleField.PROJECT_ID, filter.project());
        }

        if (StringUtils.hasText(filter.meter())) {
            equalities.put(SampleField.COUNTER_NAME, filter.meter());
        } else if (requireMeter) {
            throw new MissingMeterException();
        }

        if (StringUtils.hasText(filter.resource())) {
            equalities.put(SampleField.RESOURCE_ID, filter.resource());
        }
        if (StringUtils.hasText(filter.source())) {
            equalities.put(SampleField.SOURCE, filter.source());
        }

        return new SampleQuery(equalities, filter.start(), filter.end());
    }

    /**
     * 轉換查詢條件，meter 必填。
     *
     * @param filter 查詢條件
     * @return 原始日誌查詢
     */
    public static SampleQuery translate(EventFilter filter) {
        return translate(filter, true);
    }

    /**
     * 資源清單使用的查詢。
     *
     * <p>與 {@link #translate(EventFilter, boolean)} 不同，{@code user} 與 {@code project} 同時生效，
     * 且不涉及 meter。
     *
     * @return 原始日誌查詢
     */
    public static SampleQuery translateResourceQuery(String user, String project, String source,
                                                     Instant start, Instant end) {
        Map<SampleField, String> equalities = new EnumMap<>(SampleField.class);
        if (StringUtils.hasText(user)) {
            equalities.put(SampleField.USER_ID, user);
        }
        if (StringUtils.hasText(project)) {
            equalities.put(SampleField.PROJECT_ID, project);
        }
        if (StringUtils.hasText(source)) {
            equalities.put(SampleField.SOURCE, source);
        }
        return new SampleQuery(equalities, start, end);
    }
}
