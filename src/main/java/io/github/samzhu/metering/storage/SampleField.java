package io.github.samzhu.metering.storage;

import java.util.function.Function;

import io.github.samzhu.metering.dto.Sample;

/**
 * 可做等值比對的樣本欄位。
 *
 * <p>同時保存儲存層的欄位名稱（MongoDB 查詢使用）與對應的存取方法（記憶體比對使用），
 * 讓兩種儲存引擎對同一個 {@link SampleQuery} 有一致的解讀。
 */
public enum SampleField {

    USER_ID("userId", Sample::userId),
    PROJECT_ID("projectId", Sample::projectId),
    COUNTER_NAME("counterName", Sample::counterName),
    RESOURCE_ID("resourceId", Sample::resourceId),
    SOURCE("source", Sample::source);

    /** 時間區間比對的欄位名稱。 */
    public static final String TIMESTAMP = "timestamp";

    private final String fieldName;
    private final Function<Sample, String> accessor;

    SampleField(String fieldName, Function<Sample, String> accessor) {
        this.fieldName = fieldName;
        this.accessor = accessor;
    }

    public String fieldName() {
        return fieldName;
    }

    public String valueOf(Sample sample) {
        return accessor.apply(sample);
    }
}
