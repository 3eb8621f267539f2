package io.github.samzhu.metering.config;

import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import io.cloudevents.spring.messaging.CloudEventMessageConverter;

/**
 * CloudEvents 訊息轉換器配置。
 *
 * <p>收集管線可以用 <b>Structured Mode</b>（{@code application/cloudevents+json}）發送樣本，
 * 整個 CloudEvent（attributes 與 data）封裝在 JSON body 中。
 *
 * <p>註冊 {@link CloudEventMessageConverter} 後，Spring Cloud Stream 會把：
 * <ul>
 *   <li>CloudEvent attributes (id, type, source, time) → Message Headers</li>
 *   <li>CloudEvent data → Message Payload（反序列化為 {@link io.github.samzhu.metering.dto.Sample}）</li>
 * </ul>
 *
 * <p>需要 {@code cloudevents-json-jackson} 依賴，透過 Java ServiceLoader 提供 JSON 格式支援。
 *
 * @see <a href="https://cloudevents.github.io/sdk-java/spring.html">CloudEvents Java SDK - Spring Integration</a>
 */
@Configuration
public class CloudEventsConfig {

    @Bean
    public CloudEventMessageConverter cloudEventMessageConverter() {
        return new CloudEventMessageConverter();
    }
}
