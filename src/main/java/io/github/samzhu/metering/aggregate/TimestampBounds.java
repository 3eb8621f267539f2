package io.github.samzhu.metering.aggregate;

import io.github.samzhu.metering.dto.EventInterval;
import io.github.samzhu.metering.dto.Sample;

/**
 * 所有樣本共用固定 key {@value #KEY}，以 {@link EventInterval#merge(EventInterval)} 取最早與最晚時間。
 */
public final class TimestampBounds implements MapReduce<String, EventInterval> {

    public static final String KEY = "timestamp";

    public static final TimestampBounds INSTANCE = new TimestampBounds();

    private TimestampBounds() {
    }

    @Override
    public void map(Sample sample, Emitter<String, EventInterval> emitter) {
        if (sample.timestamp() != null) {
            emitter.emit(KEY, EventInterval.of(sample.timestamp()));
        }
    }

    @Override
    public EventInterval combine(EventInterval left, EventInterval right) {
        return left.merge(right);
    }
}
