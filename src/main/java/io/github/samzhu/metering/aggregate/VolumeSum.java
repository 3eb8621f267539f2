package io.github.samzhu.metering.aggregate;

import io.github.samzhu.metering.dto.Sample;

/**
 * 依資源加總 counter_volume。
 */
public final class VolumeSum implements MapReduce<String, Double> {

    public static final VolumeSum INSTANCE = new VolumeSum();

    private VolumeSum() {
    }

    @Override
    public void map(Sample sample, Emitter<String, Double> emitter) {
        emitter.emit(sample.resourceId(), sample.counterVolume());
    }

    @Override
    public Double combine(Double left, Double right) {
        return left + right;
    }
}
