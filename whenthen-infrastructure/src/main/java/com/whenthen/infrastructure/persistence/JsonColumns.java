package com.whenthen.infrastructure.persistence;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * JsonColumns - JSON 列与领域对象的互转
 * <p>
 * JSON 列在数据对象上以 Map / List&lt;Map&gt; 表示，由 JacksonTypeHandler 读写；
 * 枚举按编码序列化，时间按 ISO-8601 字符串序列化。
 * </p>
 */
public final class JsonColumns {

    private static final ObjectMapper MAPPER = new ObjectMapper()
            .registerModule(new JavaTimeModule())
            .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
            .disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);

    private static final TypeReference<Map<String, Object>> MAP_TYPE = new TypeReference<>() {
    };

    private JsonColumns() {
    }

    public static Map<String, Object> toMap(Object value) {
        if (value == null) {
            return null;
        }
        return MAPPER.convertValue(value, MAP_TYPE);
    }

    public static List<Map<String, Object>> toMaps(List<?> values) {
        if (values == null) {
            return new ArrayList<>();
        }
        return values.stream().map(JsonColumns::toMap).collect(Collectors.toList());
    }

    public static <T> T fromMap(Map<String, Object> map, Class<T> type) {
        if (map == null) {
            return null;
        }
        return MAPPER.convertValue(map, type);
    }

    public static <T> List<T> fromMaps(List<Map<String, Object>> maps, Class<T> type) {
        if (maps == null) {
            return new ArrayList<>();
        }
        return maps.stream().map(m -> fromMap(m, type)).collect(Collectors.toCollection(ArrayList::new));
    }
}
