package io.github.samzhu.metering.dto;

import java.time.Instant;

/**
 * 查詢條件，描述要納入計算的樣本範圍。
 *
 * <p>所有欄位皆為選填，{@code null} 或空字串代表「不限制」而非「比對空值」：
 * <ul>
 *   <li>{@code user} / {@code project} - 擁有者；兩者同時指定時僅 {@code user} 生效</li>
 *   <li>{@code meter} - 計量名稱（counter_name），聚合查詢必填</li>
 *   <li>{@code resource} - 資源 ID</li>
 *   <li>{@code source} - 來源 ID</li>
 *   <li>{@code start} / {@code end} - 時間區間 {@code [start, end)}，兩端各自選填</li>
 * </ul>
 *
 * <p>此物件僅存在於查詢期間，不會被持久化。
 *
 * @see io.github.samzhu.metering.storage.QueryTranslator
 */
public record EventFilter(
    String user,
    String project,
    String meter,
    String resource,
    String source,
    Instant start,
    Instant end
) {

    public static Builder builder() {
        return new Builder();
    }

    /**
     * {@link EventFilter} 建構器，API 層與測試用來逐步組合條件。
     */
    public static class Builder {
        private String user;
        private String project;
        private String meter;
        private String resource;
        private String source;
        private Instant start;
        private Instant end;

        public Builder user(String user) {
            this.user = user;
            return this;
        }

        public Builder project(String project) {
            this.project = project;
            return this;
        }

        public Builder meter(String meter) {
            this.meter = meter;
            return this;
        }

        public Builder resource(String resource) {
            this.resource = resource;
            return this;
        }

        public Builder source(String source) {
            this.source = source;
            return this;
        }

        public Builder start(Instant start) {
            this.start = start;
            return this;
        }

        public Builder end(Instant end) {
            this.end = end;
            return this;
        }

        public EventFilter build() {
            return new EventFilter(user, project, meter, resource, source, start, end);
        }
    }
}
