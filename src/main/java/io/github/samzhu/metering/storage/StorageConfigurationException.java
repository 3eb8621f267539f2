package io.github.samzhu.metering.storage;

/**
 * 儲存層組態錯誤。
 *
 * <p>連線字串格式錯誤、不支援的儲存類型、無法連線或認證失敗時拋出。
 * 屬於啟動時的致命錯誤，本層不重試。
 */
public class StorageConfigurationException extends RuntimeException {

    public StorageConfigurationException(String message) {
        super(message);
    }

    public StorageConfigurationException(String message, Throwable cause) {
        super(message, cause);
    }
}
