package io.github.samzhu.metering.dto.api;

/**
 * API 錯誤回應。
 *
 * @param status HTTP 狀態碼
 * @param message 錯誤訊息
 */
public record ApiErrorResponse(int status, String message) {
}
