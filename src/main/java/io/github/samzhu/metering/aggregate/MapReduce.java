package io.github.samzhu.metering.aggregate;

import io.github.samzhu.metering.dto.Sample;

/**
 * 兩階段聚合的定義：map 階段對每筆樣本發出 (key, value)，reduce 階段合併相同 key 的值。
 *
 * <p>{@link #combine(Object, Object)} 必須滿足結合律與交換律，
 * 因為執行器可以把輸入任意切分、各自 reduce 後再以任意順序、分多輪合併。
 *
 * @param <K> 分組鍵型別
 * @param <V> 聚合值型別
 * @see PartitionedMapReduce
 */
public interface MapReduce<K, V> {

    /**
     * map 階段：處理一筆樣本，可發出零或多組 (key, value)。
     *
     * @param sample 計量樣本
     * @param emitter 輸出
     */
    void map(Sample sample, Emitter<K, V> emitter);

    /**
     * reduce 階段：合併同一個 key 的兩個值。
     *
     * @param left 值
     * @param right 值
     * @return 合併結果
     */
    V combine(V left, V right);

    /**
     * map 階段的輸出。
     */
    @FunctionalInterface
    interface Emitter<K, V> {
        void emit(K key, V value);
    }
}
