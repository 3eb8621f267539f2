package io.github.samzhu.metering.dto;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * 資源 metadata 的深層複製工具。
 *
 * <p>Metadata 可能包含巢狀的 Map 與 List，淺層複製仍會與呼叫端共用內層物件，
 * 因此逐層複製並包裝為不可修改的集合。允許 {@code null} 值（{@code Map.copyOf} 不允許）。
 */
public final class ResourceMetadata {

    private ResourceMetadata() {
    }

    /**
     * 深層複製 metadata。
     *
     * @param metadata 原始 metadata，可為 {@code null}
     * @return 不可修改的複本；輸入為 {@code null} 時回傳空 Map
     */
    public static Map<String, Object> copyOf(Map<?, ?> metadata) {
        if (metadata == null) {
            return Collections.emptyMap();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        metadata.forEach((key, value) -> copy.put(String.valueOf(key), copyValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object copyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            return copyOf(map);
        }
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(item -> copy.add(copyValue(item)));
            return Collections.unmodifiableList(copy);
        }
        return value;
    }
}
