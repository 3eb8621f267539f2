package io.github.samzhu.metering.config;

import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * 應用程式主要配置類別。
 *
 * <p>啟用 {@link MeteringProperties} 的型別安全配置綁定，
 * 使服務可以透過 constructor injection 取得配置值。
 *
 * @see MeteringProperties
 */
@Configuration
@EnableConfigurationProperties(MeteringProperties.class)
public class AppConfig {
}
