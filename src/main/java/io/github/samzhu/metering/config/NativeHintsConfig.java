package io.github.samzhu.metering.config;

import org.springframework.aot.hint.MemberCategory;
import org.springframework.aot.hint.RuntimeHints;
import org.springframework.aot.hint.RuntimeHintsRegistrar;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.ImportRuntimeHints;

import io.github.samzhu.metering.document.MeterRecord;
import io.github.samzhu.metering.document.ProjectRecord;
import io.github.samzhu.metering.document.ResourceRecord;
import io.github.samzhu.metering.document.UserRecord;
import io.github.samzhu.metering.dto.EventInterval;
import io.github.samzhu.metering.dto.Meter;
import io.github.samzhu.metering.dto.ResourceInfo;
import io.github.samzhu.metering.dto.ResourceVolume;
import io.github.samzhu.metering.dto.Sample;
import io.github.samzhu.metering.dto.api.ApiErrorResponse;
import io.github.samzhu.metering.dto.api.DurationResponse;
import io.github.samzhu.metering.dto.api.EventListResponse;
import io.github.samzhu.metering.dto.api.ProjectListResponse;
import io.github.samzhu.metering.dto.api.ResourceListResponse;
import io.github.samzhu.metering.dto.api.UserListResponse;
import io.github.samzhu.metering.dto.api.VolumeListResponse;
import io.github.samzhu.metering.dto.api.VolumeResponse;

/**
 * GraalVM Native Image 執行時期提示配置。
 *
 * <p>Native Image 在編譯時期做靜態分析，無法偵測 Jackson 與 Spring Data 的反射存取，
 * 因此在此註冊需要反射的 record：
 * <ul>
 *   <li>{@link Sample} - 從訊息代理接收的計量樣本</li>
 *   <li>Document 類別 - Spring Data MongoDB 映射使用</li>
 *   <li>API 回應類別 - Jackson 序列化使用</li>
 * </ul>
 *
 * @see <a href="https://docs.spring.io/spring-boot/reference/native-image/introducing-graalvm-native-images.html">Spring Boot Native Image Support</a>
 */
@Configuration
@ImportRuntimeHints(NativeHintsConfig.MeteringRuntimeHints.class)
public class NativeHintsConfig {

    static class MeteringRuntimeHints implements RuntimeHintsRegistrar {

        @Override
        public void registerHints(RuntimeHints hints, ClassLoader classLoader) {
            // 訊息與查詢結果
            hints.reflection()
                .registerType(Sample.class, MemberCategory.values())
                .registerType(Meter.class, MemberCategory.values())
                .registerType(ResourceInfo.class, MemberCategory.values())
                .registerType(ResourceVolume.class, MemberCategory.values())
                .registerType(EventInterval.class, MemberCategory.values());

            // Document 類別
            hints.reflection()
                .registerType(UserRecord.class, MemberCategory.values())
                .registerType(ProjectRecord.class, MemberCategory.values())
                .registerType(ResourceRecord.class, MemberCategory.values())
                .registerType(MeterRecord.class, MemberCategory.values());

            // API 回應
            hints.reflection()
                .registerType(UserListResponse.class, MemberCategory.values())
                .registerType(ProjectListResponse.class, MemberCategory.values())
                .registerType(ResourceListResponse.class, MemberCategory.values())
                .registerType(EventListResponse.class, MemberCategory.values())
                .registerType(VolumeResponse.class, MemberCategory.values())
                .registerType(VolumeListResponse.class, MemberCategory.values())
                .registerType(DurationResponse.class, MemberCategory.values())
                .registerType(ApiErrorResponse.class, MemberCategory.values());
        }
    }
}
