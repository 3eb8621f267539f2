package io.github.samzhu.metering.storage.mongodb;

import java.time.Clock;
import java.util.List;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.convert.MappingMongoConverter;

import com.mongodb.MongoClientSettings;
import com.mongodb.MongoCredential;
import com.mongodb.ServerAddress;
import com.mongodb.client.MongoClient;
import com.mongodb.client.MongoClients;

import io.github.samzhu.metering.storage.ConnectionDescriptor;
import io.github.samzhu.metering.storage.StorageConfigurationException;

/**
 * MongoDB 連線啟動流程。
 *
 * <ol>
 *   <li>依 {@link ConnectionDescriptor} 建立 {@link MongoClient}；有帳密時附上以目標資料庫為認證來源的
 *       {@link MongoCredential}</li>
 *   <li>送出 {@code ping} 強制建立連線並完成認證，失敗即為致命錯誤</li>
 *   <li>建立 {@link MongoTemplate} 並確保索引存在</li>
 * </ol>
 *
 * <p>本層不重試，重試策略屬於呼叫端（部署/編排層）。
 */
public final class MongoConnectionFactory {

    private static final Logger log = LoggerFactory.getLogger(MongoConnectionFactory.class);

    /** MongoDB 不允許 Map key 含 {@code .}，寫入時以此字元取代，讀取時還原。 */
    static final String MAP_KEY_DOT_REPLACEMENT = "\uFF0E";

    private MongoConnectionFactory() {
    }

    /**
     * 連線、認證並建立索引。
     *
     * @param descriptor 連線描述
     * @return 可用的 MongoDB 儲存連線
     * @throws StorageConfigurationException 無法連線、認證失敗或索引建立失敗
     */
    public static MongoStorageConnection connect(ConnectionDescriptor descriptor) {
        log.info("Connecting to MongoDB on {}:{}", descriptor.host(), descriptor.port());

        MongoClientSettings.Builder settings = MongoClientSettings.builder()
            .applyToClusterSettings(cluster ->
                cluster.hosts(List.of(new ServerAddress(descriptor.host(), descriptor.port()))));
        if (descriptor.hasCredentials()) {
            settings.credential(MongoCredential.createCredential(
                descriptor.username(), descriptor.dbname(), descriptor.password().toCharArray()));
        }

        MongoClient client = MongoClients.create(settings.build());
        MongoStorageConnection connection;
        try {
            client.getDatabase(descriptor.dbname()).runCommand(new Document("ping", 1));

            MongoTemplate mongoTemplate = new MongoTemplate(client, descriptor.dbname());
            if (mongoTemplate.getConverter() instanceof MappingMongoConverter converter) {
                converter.setMapKeyDotReplacement(MAP_KEY_DOT_REPLACEMENT);
            }

            connection = new MongoStorageConnection(mongoTemplate, client, Clock.systemUTC());
            connection.ensureIndexes();
        } catch (RuntimeException e) {
            // 啟動失敗時一律釋放 client
            client.close();
            throw new StorageConfigurationException(
                "Unable to connect to MongoDB at " + descriptor + ": " + e.getMessage(), e);
        }
        log.info("MongoDB storage ready: database={}", descriptor.dbname());
        return connection;
    }
}
