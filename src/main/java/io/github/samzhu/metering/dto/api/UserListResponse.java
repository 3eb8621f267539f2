package io.github.samzhu.metering.dto.api;

import java.util.List;

/**
 * 用戶 ID 列表，依字典序排序。
 */
public record UserListResponse(List<String> users) {
}
