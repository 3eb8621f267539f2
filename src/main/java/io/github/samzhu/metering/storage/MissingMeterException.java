package io.github.samzhu.metering.storage;

/**
 * 查詢條件缺少必填的 meter 時拋出。
 *
 * <p>由 {@link QueryTranslator} 在存取儲存層之前拋出，因此不會執行任何部分查詢。
 */
public class MissingMeterException extends IllegalArgumentException {

    public MissingMeterException() {
        super("Missing required meter specifier");
    }
}
