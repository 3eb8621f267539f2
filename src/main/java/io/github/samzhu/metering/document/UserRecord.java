package io.github.samzhu.metering.document;

import java.util.Set;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 用戶登錄文件。
 *
 * <p>記錄曾經為此用戶回報資料的所有來源，讓用戶清單查詢不需要掃描原始日誌。
 *
 * <p>文件 ID：直接使用 {@code userId}
 *
 * <p>{@code source} 只增不減，透過 {@code $addToSet} 維護，重複寫入同一來源不會產生重複項目。
 */
@Document(collection = "user")
public record UserRecord(
    @Id String id,
    Set<String> source
) {
}
