package io.github.samzhu.metering.storage;

import java.time.Instant;
import java.util.List;
import java.util.stream.Stream;

import org.springframework.lang.Nullable;

import io.github.samzhu.metering.dto.EventFilter;
import io.github.samzhu.metering.dto.EventInterval;
import io.github.samzhu.metering.dto.ResourceInfo;
import io.github.samzhu.metering.dto.ResourceVolume;
import io.github.samzhu.metering.dto.Sample;

/**
 * 計量資料儲存介面。
 *
 * <p>定義儲存引擎需要提供的能力：可建立索引的文件集合、upsert、distinct 值查詢，
 * 以及兩階段（map → reduce）聚合。目前有兩個實作：
 * <ul>
 *   <li>{@link io.github.samzhu.metering.storage.mongodb.MongoStorageConnection} - MongoDB</li>
 *   <li>{@link io.github.samzhu.metering.storage.memory.InMemoryStorageConnection} - 記憶體，供測試與本機執行</li>
 * </ul>
 *
 * <p>實作必須可由多個執行緒同時呼叫；單一文件的更新為原子操作，
 * 跨集合不提供交易保證。所有儲存層例外原封不動拋給呼叫端，不在此層重試。
 *
 * @see ConnectionDescriptor
 */
public interface StorageConnection extends AutoCloseable {

    /**
     * 寫入一筆計量樣本。
     *
     * <p>依序更新 user、project、resource 登錄，最後附加到原始日誌。
     * 四個步驟沒有兩階段提交：若在附加原始日誌前中斷，登錄會暗示一筆日誌中不存在的樣本。
     *
     * @param sample 已驗證的計量樣本
     */
    void recordMeteringData(Sample sample);

    /**
     * 列出用戶 ID，依字典序遞增排序且不重複。
     *
     * @param source 選填，只列出此來源曾回報過的用戶
     * @return 用戶 ID 列表
     */
    List<String> getUsers(@Nullable String source);

    /**
     * 列出專案 ID，依字典序遞增排序且不重複。
     *
     * @param source 選填，只列出此來源曾回報過的專案
     * @return 專案 ID 列表
     */
    List<String> getProjects(@Nullable String source);

    /**
     * 列出資源資訊。
     *
     * <p>未指定時間區間時直接查詢 resource 登錄；指定時間區間時，
     * 先從原始日誌找出區間內有樣本的資源 ID，再回到登錄取出這些資源。
     *
     * @param user 選填，擁有者用戶
     * @param project 選填，擁有者專案
     * @param source 選填，來源
     * @param start 選填，區間起點（含）
     * @param end 選填，區間終點（不含）
     * @return 資源資訊列表
     */
    List<ResourceInfo> getResources(@Nullable String user, @Nullable String project, @Nullable String source,
                                    @Nullable Instant start, @Nullable Instant end);

    /**
     * 查詢原始樣本，meter 為選填。
     *
     * <p>回傳的 Stream 只能走訪一次，使用完畢必須關閉以釋放底層 cursor。
     *
     * @param filter 查詢條件
     * @return 原始樣本 Stream，不含儲存層內部識別碼
     */
    Stream<Sample> getRawEvents(EventFilter filter);

    /**
     * 依資源加總 counter_volume，meter 必填。
     *
     * @param filter 查詢條件
     * @return 每個資源一筆結果，順序不保證
     * @throws MissingMeterException 未指定 meter
     */
    List<ResourceVolume> getVolumeSum(EventFilter filter);

    /**
     * 依資源取 counter_volume 最大值，meter 必填。
     *
     * @param filter 查詢條件
     * @return 每個資源一筆結果，順序不保證
     * @throws MissingMeterException 未指定 meter
     */
    List<ResourceVolume> getVolumeMax(EventFilter filter);

    /**
     * 取得符合條件樣本的最早與最晚時間戳記，meter 必填。
     *
     * @param filter 查詢條件
     * @return 時間區間；沒有樣本時為 {@link EventInterval#empty()}
     * @throws MissingMeterException 未指定 meter
     */
    EventInterval getEventInterval(EventFilter filter);

    /**
     * 釋放底層連線。
     */
    @Override
    default void close() {
    }
}
