package io.github.samzhu.metering.dto.api;

import java.util.List;

import io.github.samzhu.metering.dto.ResourceVolume;

/**
 * 依資源分組的 volume 聚合回應。
 */
public record VolumeListResponse(List<ResourceVolume> volumes) {
}
