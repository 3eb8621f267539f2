package io.github.samzhu.metering.config;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.github.samzhu.metering.storage.ConnectionDescriptor;
import io.github.samzhu.metering.storage.StorageConfigurationException;
import io.github.samzhu.metering.storage.StorageConnection;
import io.github.samzhu.metering.storage.memory.InMemoryStorageConnection;
import io.github.samzhu.metering.storage.mongodb.MongoConnectionFactory;

/**
 * 儲存引擎配置。
 *
 * <p>解析 {@code metering.storage.connection}，依 scheme 選擇儲存引擎：
 * <ul>
 *   <li>{@code mongodb} - {@link io.github.samzhu.metering.storage.mongodb.MongoStorageConnection}，
 *       啟動時完成連線、認證與索引建立</li>
 *   <li>{@code memory} - {@link InMemoryStorageConnection}</li>
 * </ul>
 *
 * <p>Spring Boot 的 MongoDB auto-configuration 在 application.yaml 中排除，
 * MongoClient 由此處的啟動流程建立，關閉時隨 {@link StorageConnection#close()} 釋放。
 * 任何錯誤都會讓應用程式啟動失敗。
 */
@Configuration
public class StorageConnectionConfig {

    private static final Logger log = LoggerFactory.getLogger(StorageConnectionConfig.class);

    @Bean(destroyMethod = "close")
    public StorageConnection storageConnection(MeteringProperties properties) {
        ConnectionDescriptor descriptor = ConnectionDescriptor.parse(properties.storage().connection());
        log.info("Opening storage connection: {}", descriptor);

        return switch (descriptor.dbtype()) {
            case "mongodb" -> MongoConnectionFactory.connect(descriptor);
            case "memory" -> new InMemoryStorageConnection(properties.aggregation().partitionSize());
            default -> throw new StorageConfigurationException("Unsupported storage type: " + descriptor.dbtype());
        };
    }
}
