package io.github.samzhu.metering.dto.api;

import java.util.List;

import io.github.samzhu.metering.dto.ResourceInfo;

/**
 * 資源清單回應。
 */
public record ResourceListResponse(List<ResourceInfo> resources) {
}
