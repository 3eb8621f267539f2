package io.github.samzhu.metering.storage.mongodb;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Stream;

import org.bson.Document;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.data.domain.Sort;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.aggregation.Aggregation;
import org.springframework.data.mongodb.core.aggregation.AggregationOperation;
import org.springframework.data.mongodb.core.aggregation.AggregationResults;
import org.springframework.data.mongodb.core.aggregation.GroupOperation;
import org.springframework.data.mongodb.core.index.Index;
import org.springframework.data.mongodb.core.index.IndexOperations;
import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import com.mongodb.client.MongoClient;

import io.github.samzhu.metering.aggregate.TemporalValues;
import io.github.samzhu.metering.document.MeterRecord;
import io.github.samzhu.metering.document.ProjectRecord;
import io.github.samzhu.metering.document.ResourceRecord;
import io.github.samzhu.metering.document.UserRecord;
import io.github.samzhu.metering.dto.EventFilter;
import io.github.samzhu.metering.dto.EventInterval;
import io.github.samzhu.metering.dto.Meter;
import io.github.samzhu.metering.dto.ResourceInfo;
import io.github.samzhu.metering.dto.ResourceVolume;
import io.github.samzhu.metering.dto.Sample;
import io.github.samzhu.metering.storage.QueryTranslator;
import io.github.samzhu.metering.storage.SampleQuery;
import io.github.samzhu.metering.storage.StorageConnection;

/**
 * MongoDB 儲存引擎，連線字串 scheme 為 {@code mongodb}。
 *
 * <p>資料庫集合 (Collections)：
 * <ul>
 *   <li>{@code user} - 用戶登錄 ({@link UserRecord})</li>
 *   <li>{@code project} - 專案登錄 ({@link ProjectRecord})</li>
 *   <li>{@code resource} - 資源登錄 ({@link ResourceRecord})</li>
 *   <li>{@code meter} - 原始計量日誌 ({@link MeterRecord})</li>
 * </ul>
 *
 * <p>寫入使用 MongoTemplate upsert（{@code $set} + {@code $addToSet}），每份文件的更新是原子的。
 * 聚合以 aggregation pipeline（{@code $match} → {@code $group}）在伺服器端執行，
 * 不會把符合條件的樣本載入本程序。
 *
 * @see MongoConnectionFactory
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/template-update.html">Spring Data MongoDB Update Operations</a>
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/aggregation-framework.html">Aggregation Framework Support</a>
 */
public class MongoStorageConnection implements StorageConnection {

    private static final Logger log = LoggerFactory.getLogger(MongoStorageConnection.class);

    private final MongoTemplate mongoTemplate;
    private final MongoClient mongoClient;
    private final Clock clock;

    MongoStorageConnection(MongoTemplate mongoTemplate, MongoClient mongoClient, Clock clock) {
        this.mongoTemplate = mongoTemplate;
        this.mongoClient = mongoClient;
        this.clock = clock;
    }

    /**
     * 建立查詢所需的複合索引，可在每次啟動時重複呼叫。
     *
     * <p>user_id 與 project_id 在查詢中通常互斥，單一包含兩者的索引對只用其中一個的查詢沒有效果，
     * 因此兩個擁有者維度各建一組。
     */
    public void ensureIndexes() {
        IndexOperations resourceIndexes = mongoTemplate.indexOps(ResourceRecord.class);
        IndexOperations meterIndexes = mongoTemplate.indexOps(MeterRecord.class);

        for (String owner : List.of("userId", "projectId")) {
            resourceIndexes.ensureIndex(new Index()
                .on(owner, Sort.Direction.ASC)
                .on("source", Sort.Direction.ASC)
                .named("resource_" + owner + "_idx"));
            meterIndexes.ensureIndex(new Index()
                .on("resourceId", Sort.Direction.ASC)
                .on(owner, Sort.Direction.ASC)
                .on("counterName", Sort.Direction.ASC)
                .on("timestamp", Sort.Direction.ASC)
                .on("source", Sort.Direction.ASC)
                .named("meter_" + owner + "_idx"));
        }
        log.info("MongoDB indexes ensured on collections: resource, meter");
    }

    @Override
    public void recordMeteringData(Sample sample) {
        mongoTemplate.upsert(byId(sample.userId()),
            new Update().addToSet("source", sample.source()),
            UserRecord.class);
        mongoTemplate.upsert(byId(sample.projectId()),
            new Update().addToSet("source", sample.source()),
            ProjectRecord.class);

        Update resourceUpdate = new Update()
            .set("projectId", sample.projectId())
            .set("userId", sample.userId())
            .set("timestamp", sample.timestamp())
            .set("receivedTimestamp", clock.instant())
            .set("metadata", sample.resourceMetadata())
            .set("source", sample.source())
            .addToSet("meter", new Meter(sample.counterName(), sample.counterType()));
        mongoTemplate.upsert(byId(sample.resourceId()), resourceUpdate, ResourceRecord.class);

        mongoTemplate.insert(MeterRecord.from(sample));

        log.debug("Sample recorded: resourceId={}, counterName={}, source={}",
            sample.resourceId(), sample.counterName(), sample.source());
    }

    @Override
    public List<String> getUsers(String source) {
        List<String> users = mongoTemplate.findDistinct(bySource(source), "_id", UserRecord.class, String.class);
        return users.stream().sorted().toList();
    }

    @Override
    public List<String> getProjects(String source) {
        List<String> projects = mongoTemplate.findDistinct(bySource(source), "_id", ProjectRecord.class, String.class);
        return projects.stream().sorted().toList();
    }

    @Override
    public List<ResourceInfo> getResources(String user, String project, String source, Instant start, Instant end) {
        SampleQuery sampleQuery = QueryTranslator.translateResourceQuery(user, project, source, start, end);

        Query query;
        if (sampleQuery.hasTimeRange()) {
            // 登錄只有最新狀態，時間條件必須先從原始日誌找出資源 ID
            List<String> resourceIds = mongoTemplate.findDistinct(
                MongoQueries.toQuery(sampleQuery), "resourceId", MeterRecord.class, String.class);
            log.debug("Resources with samples in [{}, {}): {}", start, end, resourceIds.size());
            query = Query.query(Criteria.where("_id").in(resourceIds));
        } else {
            query = MongoQueries.toQuery(sampleQuery);
        }

        return mongoTemplate.find(query.with(Sort.by("_id")), ResourceRecord.class).stream()
            .map(ResourceRecord::toResourceInfo)
            .toList();
    }

    @Override
    public Stream<Sample> getRawEvents(EventFilter filter) {
        Query query = MongoQueries.toQuery(QueryTranslator.translate(filter, false));
        return mongoTemplate.stream(query, MeterRecord.class).map(MeterRecord::toSample);
    }

    @Override
    public List<ResourceVolume> getVolumeSum(EventFilter filter) {
        return volumes(filter, Aggregation.group("resourceId").sum("counterVolume").as("value"));
    }

    @Override
    public List<ResourceVolume> getVolumeMax(EventFilter filter) {
        return volumes(filter, Aggregation.group("resourceId").max("counterVolume").as("value"));
    }

    private List<ResourceVolume> volumes(EventFilter filter, GroupOperation group) {
        List<Document> results = aggregate(QueryTranslator.translate(filter), group);
        return results.stream()
            .map(doc -> new ResourceVolume(doc.getString("_id"), ((Number) doc.get("value")).doubleValue()))
            .toList();
    }

    @Override
    public EventInterval getEventInterval(EventFilter filter) {
        List<Document> results = aggregate(QueryTranslator.translate(filter),
            Aggregation.group().min("timestamp").as("min").max("timestamp").as("max"));
        if (results.isEmpty()) {
            return EventInterval.empty();
        }
        Document answer = results.get(0);
        return new EventInterval(
            TemporalValues.toInstant(answer.get("min")),
            TemporalValues.toInstant(answer.get("max")));
    }

    private List<Document> aggregate(SampleQuery sampleQuery, GroupOperation group) {
        List<AggregationOperation> operations = new ArrayList<>();
        MongoQueries.toCriteria(sampleQuery).ifPresent(criteria -> operations.add(Aggregation.match(criteria)));
        operations.add(group);

        long startTime = System.currentTimeMillis();
        AggregationResults<Document> results =
            mongoTemplate.aggregate(Aggregation.newAggregation(operations), MeterRecord.class, Document.class);
        log.debug("Aggregation on meter completed: {} groups in {}ms",
            results.getMappedResults().size(), System.currentTimeMillis() - startTime);
        return results.getMappedResults();
    }

    private static Query byId(String id) {
        return Query.query(Criteria.where("_id").is(id));
    }

    private static Query bySource(String source) {
        Query query = new Query();
        if (source != null && !source.isEmpty()) {
            query.addCriteria(Criteria.where("source").is(source));
        }
        return query;
    }

    @Override
    public void close() {
        if (mongoClient != null) {
            log.info("Closing MongoDB connection");
            mongoClient.close();
        }
    }
}
