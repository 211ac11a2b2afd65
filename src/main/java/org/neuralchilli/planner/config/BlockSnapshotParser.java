package org.neuralchilli.planner.config;

import jakarta.enterprise.context.ApplicationScoped;
import org.neuralchilli.planner.domain.Block;
import org.neuralchilli.planner.domain.BlockProperty;
import org.neuralchilli.planner.domain.BlockRef;
import org.neuralchilli.planner.domain.PropertyType;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

import java.io.InputStream;
import java.util.*;
import java.util.function.Supplier;

/**
 * Parses YAML block snapshots into {@link Block} records.
 *
 * <pre>
 * blocks:
 *   - id: 10
 *     parent: 1
 *     children: [11, 12]
 *     text: "Write report #Task"
 *     refs:
 *       - id: 100
 *         to: 9000
 *         type: 2
 *         alias: Task
 *         data:
 *           Status: Doing
 *           Depends on: [20]
 *     properties:
 *       - name: _mlo_task_meta
 *         type: json
 *         value: {priority: {importance: 80}}
 * </pre>
 *
 * Property lists may be written either as a list of {@code name/type/value}
 * entries or as a plain map, in which case the type is inferred from the value.
 */
@ApplicationScoped
public class BlockSnapshotParser {

    /**
     * Parse a snapshot from a YAML string
     */
    public List<Block> parse(String yamlContent) {
        return parseDocument(load(() -> new Yaml().load(yamlContent)));
    }

    /**
     * Parse a snapshot from an InputStream
     */
    public List<Block> parse(InputStream inputStream) {
        return parseDocument(load(() -> new Yaml().load(inputStream)));
    }

    private Object load(Supplier<Object> loader) {
        try {
            return loader.get();
        } catch (YAMLException e) {
            throw new SnapshotFormatException("Snapshot is not valid YAML: " + e.getMessage(), e);
        }
    }

    private List<Block> parseDocument(Object document) {
        if (document == null) {
            return List.of();
        }

        Object blocks = document;
        if (document instanceof Map) {
            blocks = ((Map<?, ?>) document).get("blocks");
            if (blocks == null) {
                return List.of();
            }
        }
        if (!(blocks instanceof List)) {
            throw new SnapshotFormatException("Snapshot must be a list of blocks or a map with a 'blocks' list");
        }

        List<Block> result = new ArrayList<>();
        Set<Long> seen = new HashSet<>();
        for (Object entry : (List<?>) blocks) {
            Block block = parseBlock(asMap(entry, "block"));
            if (!seen.add(block.id())) {
                throw new SnapshotFormatException("Duplicate block id: " + block.id());
            }
            result.add(block);
        }
        return result;
    }

    private Block parseBlock(Map<?, ?> data) {
        long id = getLong(data, "id");
        Long parent = data.get("parent") == null ? null : getLong(data, "parent");

        return Block.builder(id)
                .parent(parent)
                .children(getLongList(data, "children"))
                .text(getString(data, "text"))
                .refs(parseRefs(data.get("refs"), id))
                .properties(parseProperties(data.get("properties")))
                .build();
    }

    private List<BlockRef> parseRefs(Object value, long blockId) {
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new SnapshotFormatException("Block " + blockId + ": 'refs' must be a list");
        }

        List<BlockRef> refs = new ArrayList<>();
        for (Object entry : (List<?>) value) {
            Map<?, ?> ref = asMap(entry, "ref");
            refs.add(new BlockRef(
                    getLong(ref, "id"),
                    getLong(ref, "to"),
                    ref.get("type") == null ? BlockRef.TAG_REF_TYPE : (int) getLong(ref, "type"),
                    getString(ref, "alias"),
                    parseProperties(ref.get("data"))
            ));
        }
        return refs;
    }

    private List<BlockProperty> parseProperties(Object value) {
        if (value == null) {
            return List.of();
        }

        List<BlockProperty> properties = new ArrayList<>();
        if (value instanceof Map) {
            ((Map<?, ?>) value).forEach((name, propertyValue) ->
                    properties.add(BlockProperty.of(String.valueOf(name), inferType(propertyValue), propertyValue)));
            return properties;
        }
        if (!(value instanceof List)) {
            throw new SnapshotFormatException("Properties must be a list or a map, got: " + value);
        }

        for (Object entry : (List<?>) value) {
            Map<?, ?> property = asMap(entry, "property");
            String name = getString(property, "name");
            if (name == null || name.isBlank()) {
                throw new SnapshotFormatException("Property is missing its name: " + property);
            }
            Object propertyValue = property.get("value");
            properties.add(BlockProperty.of(name, parseType(property.get("type"), propertyValue), propertyValue));
        }
        return properties;
    }

    private PropertyType parseType(Object type, Object value) {
        if (type == null) {
            return inferType(value);
        }
        if (type instanceof Number) {
            return PropertyType.fromCode(((Number) type).intValue());
        }
        try {
            return PropertyType.fromString(type.toString());
        } catch (IllegalArgumentException e) {
            throw new SnapshotFormatException(e.getMessage(), e);
        }
    }

    private PropertyType inferType(Object value) {
        if (value instanceof Boolean) {
            return PropertyType.BOOLEAN;
        }
        if (value instanceof Number) {
            return PropertyType.NUMBER;
        }
        if (value instanceof Date) {
            return PropertyType.DATE_TIME;
        }
        if (value instanceof List) {
            return PropertyType.BLOCK_REFS;
        }
        if (value instanceof Map) {
            return PropertyType.JSON;
        }
        return PropertyType.TEXT;
    }

    // Helper methods for type-safe extraction

    private Map<?, ?> asMap(Object value, String what) {
        if (!(value instanceof Map)) {
            throw new SnapshotFormatException("Expected a " + what + " mapping, got: " + value);
        }
        return (Map<?, ?>) value;
    }

    private String getString(Map<?, ?> map, String key) {
        Object value = map.get(key);
        return value == null ? null : value.toString();
    }

    private long getLong(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            throw new SnapshotFormatException("Missing required field: " + key + " in " + map);
        }
        if (value instanceof Number) {
            return ((Number) value).longValue();
        }
        try {
            return Long.parseLong(value.toString().trim());
        } catch (NumberFormatException e) {
            throw new SnapshotFormatException("Field '" + key + "' is not a number: " + value, e);
        }
    }

    private List<Long> getLongList(Map<?, ?> map, String key) {
        Object value = map.get(key);
        if (value == null) {
            return List.of();
        }
        if (!(value instanceof List)) {
            throw new SnapshotFormatException("Field '" + key + "' must be a list, got: " + value);
        }

        List<Long> result = new ArrayList<>();
        for (Object item : (List<?>) value) {
            if (item instanceof Number) {
                result.add(((Number) item).longValue());
            } else {
                throw new SnapshotFormatException("Field '" + key + "' must hold block ids, got: " + item);
            }
        }
        return result;
    }
}
