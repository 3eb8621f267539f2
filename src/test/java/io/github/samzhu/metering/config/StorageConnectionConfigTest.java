package io.github.samzhu.metering.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import org.junit.jupiter.api.Test;

import io.github.samzhu.metering.config.MeteringProperties.AggregationConfig;
import io.github.samzhu.metering.config.MeteringProperties.StorageConfig;
import io.github.samzhu.metering.storage.StorageConfigurationException;
import io.github.samzhu.metering.storage.StorageConnection;
import io.github.samzhu.metering.storage.memory.InMemoryStorageConnection;

class StorageConnectionConfigTest {

    private final StorageConnectionConfig config = new StorageConnectionConfig();

    @Test
    void memorySchemeShouldSelectInMemoryEngine() {
        // Given
        MeteringProperties properties = new MeteringProperties(
            new StorageConfig("memory://localhost/metering"), new AggregationConfig(50));

        // When
        try (StorageConnection connection = config.storageConnection(properties)) {
            // Then
            assertThat(connection).isInstanceOf(InMemoryStorageConnection.class);
        }
    }

    @Test
    void unsupportedSchemeShouldFailStartup() {
        MeteringProperties properties = new MeteringProperties(
            new StorageConfig("postgresql://localhost/metering"), null);

        assertThatThrownBy(() -> config.storageConnection(properties))
            .isInstanceOf(StorageConfigurationException.class)
            .hasMessageContaining("postgresql");
    }

    @Test
    void propertiesShouldFallBackToDefaults() {
        MeteringProperties properties = new MeteringProperties(null, null);

        assertThat(properties.storage().connection()).isEqualTo("mongodb://localhost:27017/metering");
        assertThat(properties.aggregation().partitionSize()).isEqualTo(1000);
    }
}
