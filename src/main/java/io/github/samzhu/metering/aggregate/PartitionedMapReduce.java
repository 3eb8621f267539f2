package io.github.samzhu.metering.aggregate;

import java.util.HashMap;
import java.util.Iterator;
import java.util.Map;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import io.github.samzhu.metering.dto.Sample;

/**
 * 以「切分 → 各自 reduce → 合併」方式在程序內執行 {@link MapReduce}。
 *
 * <p>輸入以 {@code partitionSize} 筆為一個分區逐段讀取，每個分區先在本地完成 reduce，
 * 再把部分結果合併進總結果。任何時刻只保留一個分區的部分結果與總結果，
 * 記憶體用量與分組鍵數量成正比，而非與樣本數量成正比。
 */
public class PartitionedMapReduce {

    private static final Logger log = LoggerFactory.getLogger(PartitionedMapReduce.class);

    private final int partitionSize;

    public PartitionedMapReduce(int partitionSize) {
        if (partitionSize <= 0) {
            throw new IllegalArgumentException("Partition size must be positive: " + partitionSize);
        }
        this.partitionSize = partitionSize;
    }

    /**
     * 執行聚合。
     *
     * @param samples 已過濾的樣本，只走訪一次
     * @param mapReduce 聚合定義
     * @return 每個 key 的聚合結果
     */
    public <K, V> Map<K, V> execute(Iterator<Sample> samples, MapReduce<K, V> mapReduce) {
        Map<K, V> result = new HashMap<>();
        Map<K, V> partition = new HashMap<>();
        MapReduce.Emitter<K, V> emitter = (key, value) -> partition.merge(key, value, mapReduce::combine);

        int partitions = 0;
        int count = 0;
        while (samples.hasNext()) {
            mapReduce.map(samples.next(), emitter);
            if (++count % partitionSize == 0) {
                mergeInto(result, partition, mapReduce);
                partitions++;
            }
        }
        if (!partition.isEmpty()) {
            mergeInto(result, partition, mapReduce);
            partitions++;
        }

        log.debug("{} executed: {} samples in {} partitions, {} keys",
            mapReduce.getClass().getSimpleName(), count, partitions, result.size());
        return result;
    }

    private static <K, V> void mergeInto(Map<K, V> result, Map<K, V> partition, MapReduce<K, V> mapReduce) {
        partition.forEach((key, value) -> result.merge(key, value, mapReduce::combine));
        partition.clear();
    }
}
