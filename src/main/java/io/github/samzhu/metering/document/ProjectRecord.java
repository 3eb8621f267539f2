package io.github.samzhu.metering.document;

import java.util.Set;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

/**
 * 專案登錄文件，結構與 {@link UserRecord} 相同。
 *
 * <p>文件 ID：直接使用 {@code projectId}
 */
@Document(collection = "project")
public record ProjectRecord(
    @Id String id,
    Set<String> source
) {
}
