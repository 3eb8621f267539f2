package io.github.samzhu.metering.storage.mongodb;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.springframework.data.mongodb.core.query.Criteria;
import org.springframework.data.mongodb.core.query.Query;

import io.github.samzhu.metering.storage.SampleField;
import io.github.samzhu.metering.storage.SampleQuery;

/**
 * 將 {@link SampleQuery} 轉為 Spring Data MongoDB 的查詢物件。
 *
 * <p>等值條件轉為 {@code {field: value}}，時間區間轉為 {@code {timestamp: {$gte: start, $lt: end}}}；
 * 沒有條件的欄位不會出現在查詢中。
 *
 * @see <a href="https://docs.spring.io/spring-data/mongodb/reference/mongodb/template-query-operations.html">Querying Documents</a>
 */
final class MongoQueries {

    private MongoQueries() {
    }

    static List<Criteria> criteria(SampleQuery sampleQuery) {
        List<Criteria> criteria = new ArrayList<>();
        sampleQuery.equalities().forEach((field, value) ->
            criteria.add(Criteria.where(field.fieldName()).is(value)));

        if (sampleQuery.hasTimeRange()) {
            Criteria range = Criteria.where(SampleField.TIMESTAMP);
            if (sampleQuery.start() != null) {
                range.gte(sampleQuery.start());
            }
            if (sampleQuery.end() != null) {
                range.lt(sampleQuery.end());
            }
            criteria.add(range);
        }
        return criteria;
    }

    /**
     * 供 find / distinct / stream 使用的查詢。
     */
    static Query toQuery(SampleQuery sampleQuery) {
        Query query = new Query();
        criteria(sampleQuery).forEach(query::addCriteria);
        return query;
    }

    /**
     * 供 aggregation {@code $match} 使用的條件；沒有任何條件時回傳 empty，呼叫端省略 {@code $match}。
     */
    static Optional<Criteria> toCriteria(SampleQuery sampleQuery) {
        List<Criteria> criteria = criteria(sampleQuery);
        if (criteria.isEmpty()) {
            return Optional.empty();
        }
        if (criteria.size() == 1) {
            return Optional.of(criteria.get(0));
        }
        return Optional.of(new Criteria().andOperator(criteria));
    }
}
