package io.github.samzhu.metering.aggregate;

import io.github.samzhu.metering.dto.Sample;

/**
 * 依資源取 counter_volume 最大值。
 */
public final class VolumeMax implements MapReduce<String, Double> {

    public static final VolumeMax INSTANCE = new VolumeMax();

    private VolumeMax() {
    }

    @Override
    public void map(Sample sample, Emitter<String, Double> emitter) {
        emitter.emit(sample.resourceId(), sample.counterVolume());
    }

    @Override
    public Double combine(Double left, Double right) {
        return Math.max(left, right);
    }
}
