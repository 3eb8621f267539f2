package io.github.samzhu.metering.function;

import java.util.function.Consumer;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.cloud.function.cloudevent.CloudEventMessageUtils;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.messaging.Message;

import io.github.samzhu.metering.dto.Sample;
import io.github.samzhu.metering.storage.StorageConnection;

/**
 * 計量樣本消費者函式配置。
 *
 * <p>使用 Spring Cloud Function 程式設計模型，消費收集管線送出的計量樣本。
 * 樣本可以是 CloudEvents（Structured Mode 或 Binary Mode），也可以是單純的 JSON；
 * 兩種情況下 payload 都會轉換為 {@link Sample}。
 *
 * <p>Binding name: {@code meteringDataConsumer-in-0}
 *
 * @see <a href="https://docs.spring.io/spring-cloud-stream/reference/spring-cloud-stream/producing-and-consuming-messages.html">Spring Cloud Stream Function Model</a>
 */
@Configuration
public class MeteringDataFunction {

    private static final Logger log = LoggerFactory.getLogger(MeteringDataFunction.class);

    private final StorageConnection storageConnection;

    public MeteringDataFunction(StorageConnection storageConnection) {
        this.storageConnection = storageConnection;
    }

    /**
     * 計量樣本消費者 Bean。
     *
     * <p>每筆樣本寫入 user / project / resource 登錄與原始日誌。
     *
     * <p>錯誤處理：記錄後重新拋出，交由 binder 的重試與 DLQ 設定決定訊息去向，
     * 寫入失敗的樣本不會被確認。
     *
     * @return 計量樣本消費者
     */
    @Bean
    public Consumer<Message<Sample>> meteringDataConsumer() {
        return message -> {
            Sample sample = message.getPayload();
            try {
                log.debug("Sample received: id={}, type={}, source={}, counterName={}",
                    CloudEventMessageUtils.getId(message),
                    CloudEventMessageUtils.getType(message),
                    CloudEventMessageUtils.getSource(message),
                    sample.counterName());

                storageConnection.recordMeteringData(sample);

                log.debug("Sample stored: resourceId={}, counterName={}, volume={}",
                    sample.resourceId(), sample.counterName(), sample.counterVolume());
            } catch (RuntimeException e) {
                log.error("Failed to store sample: id={}, resourceId={}, error={}",
                    CloudEventMessageUtils.getId(message), sample.resourceId(), e.getMessage(), e);
                throw e;
            }
        };
    }
}
