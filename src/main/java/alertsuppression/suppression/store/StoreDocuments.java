package alertsuppression.suppression.store;

import org.apache.commons.collections4.CollectionUtils;
import org.apache.commons.lang3.StringUtils;

import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.format.DateTimeParseException;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * 存储文档字段转换
 */
final class StoreDocuments {

    private StoreDocuments() {
    }

    static Instant parseTimestamp(String value) {
        if (StringUtils.isBlank(value)) {
            return null;
        }
        try {
            return Instant.parse(value);
        } catch (DateTimeParseException e) {
            // 带时区偏移的格式，如 2025-07-18T10:00:00+08:00
            return OffsetDateTime.parse(value).toInstant();
        }
    }

    static Set<String> toStringSet(Collection<?> values) {
        if (CollectionUtils.isEmpty(values)) {
            return Collections.emptySet();
        }
        Set<String> result = new LinkedHashSet<>();
        for (Object value : values) {
            if (value != null) {
                result.add(value.toString());
            }
        }
        return result;
    }
}
