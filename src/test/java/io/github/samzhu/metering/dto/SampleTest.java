package io.github.samzhu.metering.dto;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.Test;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

class SampleTest {

    @Test
    void metadataShouldBeDeepCopied() {
        // Given: 含巢狀結構的 metadata
        List<Object> tags = new ArrayList<>(List.of("a"));
        Map<String, Object> nested = new HashMap<>(Map.of("tags", tags));
        Map<String, Object> metadata = new HashMap<>();
        metadata.put("display_name", "vm-1");
        metadata.put("properties", nested);

        // When
        Sample sample = new Sample("openstack", "u1", "p1", "r1", "instance", "gauge", 1,
            Instant.parse("2024-07-02T10:40:00Z"), metadata);
        metadata.put("display_name", "changed");
        tags.add("b");

        // Then: 呼叫端的修改不影響樣本
        assertThat(sample.resourceMetadata()).containsEntry("display_name", "vm-1");
        @SuppressWarnings("unchecked")
        Map<String, Object> copied = (Map<String, Object>) sample.resourceMetadata().get("properties");
        assertThat((List<Object>) copied.get("tags")).containsExactly("a");
        assertThatThrownBy(() -> sample.resourceMetadata().put("x", 1))
            .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    void nestedMapKeysShouldBecomeStrings() {
        // Given: 巢狀 Map 的 key 不是字串
        Map<String, Object> metadata = Map.of("ports", Map.of(8080, "http"));

        // When
        Sample sample = new Sample("openstack", "u1", "p1", "r1", "instance", "gauge", 1, null, metadata);

        // Then
        assertThat(sample.resourceMetadata().get("ports")).isEqualTo(Map.of("8080", "http"));
    }

    @Test
    void nullMetadataShouldBecomeEmpty() {
        Sample sample = new Sample("openstack", "u1", "p1", "r1", "instance", "gauge", 1, null, null);

        assertThat(sample.resourceMetadata()).isEmpty();
    }

    @Test
    void shouldDeserializeSnakeCaseJson() throws Exception {
        // Given
        ObjectMapper objectMapper = new ObjectMapper().registerModule(new JavaTimeModule());
        String json = """
            {
              "source": "openstack",
              "user_id": "u1",
              "project_id": "p1",
              "resource_id": "r1",
              "counter_name": "instance",
              "counter_type": "cumulative",
              "counter_volume": 2.5,
              "timestamp": "2024-07-02T10:40:00Z",
              "resource_metadata": {"display_name": "vm-1", "image.ref": null}
            }
            """;

        // When
        Sample sample = objectMapper.readValue(json, Sample.class);

        // Then
        assertThat(sample.userId()).isEqualTo("u1");
        assertThat(sample.projectId()).isEqualTo("p1");
        assertThat(sample.resourceId()).isEqualTo("r1");
        assertThat(sample.counterName()).isEqualTo("instance");
        assertThat(sample.counterVolume()).isEqualTo(2.5);
        assertThat(sample.timestamp()).isEqualTo(Instant.parse("2024-07-02T10:40:00Z"));
        assertThat(sample.resourceMetadata()).containsEntry("display_name", "vm-1").containsKey("image.ref");
    }
}
