package io.github.samzhu.metering.dto.api;

import java.util.List;

import io.github.samzhu.metering.dto.Sample;

/**
 * 原始計量事件回應。
 */
public record EventListResponse(List<Sample> events) {
}
