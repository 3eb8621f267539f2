package io.github.samzhu.metering;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;

/**
 * Metering Service - 計量資料儲存與查詢服務。
 *
 * <p>此服務作為計量收集管線的下游消費者，負責：
 * <ul>
 *   <li>接收已驗證的計量樣本（counter samples）</li>
 *   <li>維護 user / project / resource 登錄，讓清單查詢不需掃描原始日誌</li>
 *   <li>保存原始計量日誌，作為聚合與重新處理的依據</li>
 *   <li>提供依條件過濾的 volume sum / volume max / 時間區間聚合</li>
 *   <li>提供 REST API v1 查詢</li>
 * </ul>
 *
 * <p>架構流程：
 * <pre>
 * Collector → Message Broker → Metering Consumer → Storage (MongoDB)
 *                                     ↓
 *                               user     (用戶登錄)
 *                               project  (專案登錄)
 *                               resource (資源最新狀態)
 *                               meter    (原始計量日誌)
 * </pre>
 *
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/">Spring Cloud Stream</a>
 */
@SpringBootApplication
public class MeteringApplication {

    private static final Logger log = LoggerFactory.getLogger(MeteringApplication.class);

    public static void main(String[] args) {
        log.info("Starting Metering Service - Storage and Query Engine");
        SpringApplication.run(MeteringApplication.class, args);
    }
}
