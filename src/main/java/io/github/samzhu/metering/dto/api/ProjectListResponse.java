package io.github.samzhu.metering.dto.api;

import java.util.List;

/**
 * 專案 ID 列表，依字典序排序。
 */
public record ProjectListResponse(List<String> projects) {
}
