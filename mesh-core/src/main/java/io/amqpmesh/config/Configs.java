package io.amqpmesh.config;

import io.amqpmesh.MeshConfigurationException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

final class Configs {

    private Configs() {
    }

    static List<String> copyList(Collection<String> values, String name) {
        List<String> copy = new ArrayList<>(values.size());
        for (String value : values) {
            if (value == null) {
                throw new MeshConfigurationException(name + " must not contain null entries");
            }
            copy.add(value);
        }
        return Collections.unmodifiableList(copy);
    }

    /**
     * Copies nested maps and lists so later mutation of the source cannot leak into the config.
     */
    static Map<String, Object> deepCopy(Map<String, ?> source) {
        Map<String, Object> copy = new LinkedHashMap<>();
        source.forEach((key, value) -> {
            if (key != null) {
                copy.put(key, deepCopyValue(value));
            }
        });
        return Collections.unmodifiableMap(copy);
    }

    private static Object deepCopyValue(Object value) {
        if (value instanceof Map<?, ?> map) {
            Map<String, Object> nested = new LinkedHashMap<>();
            map.forEach((key, val) -> {
                if (key != null) {
                    nested.put(key.toString(), deepCopyValue(val));
                }
            });
            return Collections.unmodifiableMap(nested);
        }
        if (value instanceof Collection<?> collection) {
            List<Object> nested = new ArrayList<>(collection.size());
            for (Object element : collection) {
                nested.add(deepCopyValue(element));
            }
            return Collections.unmodifiableList(nested);
        }
        if (value instanceof byte[] bytes) {
            return bytes.clone();
        }
        return value;
    }
}
