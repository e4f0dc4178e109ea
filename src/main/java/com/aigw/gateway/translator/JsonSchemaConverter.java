package com.aigw.gateway.translator;

import com.aigw.gateway.exception.TranslationException;
import com.alibaba.fastjson2.JSONArray;
import com.alibaba.fastjson2.JSONObject;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * JSON Schema → Gemini Schema 转换
 * <p>
 * 两步：先展开 $ref（只接受 #/ 开头的本地引用），再裁剪为 Gemini 支持的字段子集。
 * allOf 只允许一个元素，anyOf 中的 null 分支与 ["T","null"] 形式的 type 都折叠为 nullable
 */
public final class JsonSchemaConverter {

    static final int MAX_DEPTH = 100;

    private static final String REF = "$ref";

    private static final Set<String> ALLOWED_KEYS = Set.of(
            "anyOf", "default", "description", "enum", "example", "format", "items",
            "maxItems", "maxLength", "maxProperties", "maximum", "minItems", "minLength",
            "minProperties", "minimum", "nullable", "pattern", "properties",
            "propertyOrdering", "required", "title", "type");

    private JsonSchemaConverter() {}

    public static JSONObject toGeminiSchema(Map<String, Object> schema) {
        if (schema == null) {
            throw invalid("schema cannot be null");
        }
        Object dereferenced = dereference(schema);
        if (!(dereferenced instanceof Map<?, ?> map)) {
            throw invalid("dereferenced schema is not an object, got " + typeName(dereferenced));
        }
        return toGapic(asObject(map));
    }

    // ==================== $ref 展开 ====================

    static Object dereference(Map<String, Object> schema) {
        // 被引用的顶层容器（如 $defs）原样保留，不参与展开
        Set<String> skipKeys = new HashSet<>(collectSkipKeys(schema, schema, new HashSet<>(), 0));
        return dereference(schema, schema, skipKeys, new HashSet<>(), 0);
    }

    private static Object dereference(Object node, Map<String, Object> root, Set<String> skipKeys,
                                      Set<String> resolving, int depth) {
        checkDepth(depth);
        if (node instanceof Map<?, ?> raw) {
            Map<String, Object> map = asObject(raw);
            if (map.containsKey(REF) && !skipKeys.contains(REF)) {
                String refPath = refPath(map.get(REF));
                if (!resolving.add(refPath)) {
                    throw invalid("circular reference detected: " + refPath);
                }
                try {
                    Object target = retrieveRef(refPath, root);
                    return dereference(target, root, skipKeys, resolving, depth + 1);
                } finally {
                    resolving.remove(refPath);
                }
            }
            JSONObject out = new JSONObject(map.size());
            for (Map.Entry<String, Object> entry : map.entrySet()) {
                Object value = entry.getValue();
                if (skipKeys.contains(entry.getKey()) || !(value instanceof Map || value instanceof List)) {
                    out.put(entry.getKey(), value);
                } else {
                    out.put(entry.getKey(), dereference(value, root, skipKeys, resolving, depth + 1));
                }
            }
            return out;
        }
        if (node instanceof List<?> list) {
            JSONArray out = new JSONArray(list.size());
            for (Object element : list) {
                out.add(dereference(element, root, skipKeys, resolving, depth + 1));
            }
            return out;
        }
        return node;
    }

    private static List<String> collectSkipKeys(Object node, Map<String, Object> root, Set<String> resolving, int depth) {
        checkDepth(depth);
        List<String> keys = new ArrayList<>();
        if (node instanceof Map<?, ?> raw) {
            for (Map.Entry<String, Object> entry : asObject(raw).entrySet()) {
                Object value = entry.getValue();
                if (REF.equals(entry.getKey())) {
                    String refPath = refPath(value);
                    if (!resolving.add(refPath)) {
                        throw invalid("circular reference detected: " + refPath);
                    }
                    try {
                        Object target = retrieveRef(refPath, root);
                        String[] components = refPath.split("/");
                        if (components.length > 1) {
                            keys.add(components[1]);
                        }
                        keys.addAll(collectSkipKeys(target, root, resolving, depth + 1));
                    } finally {
                        resolving.remove(refPath);
                    }
                } else if (value instanceof Map || value instanceof List) {
                    keys.addAll(collectSkipKeys(value, root, resolving, depth + 1));
                }
            }
        } else if (node instanceof List<?> list) {
            for (Object element : list) {
                keys.addAll(collectSkipKeys(element, root, resolving, depth + 1));
            }
        }
        return keys;
    }

    /**
     * 按 #/a/b/c 路径取出被引用的子 schema
     */
    static Object retrieveRef(String path, Map<String, Object> root) {
        if (path == null || path.isEmpty()) {
            throw invalid("ref path cannot be empty");
        }
        if (!path.startsWith("#/")) {
            throw invalid("ref paths must start with '#/', got: " + path);
        }
        String[] components = path.substring(2).split("/", -1);
        Map<String, Object> current = root;
        for (int i = 0; i < components.length; i++) {
            String component = components[i];
            if (component.isEmpty()) {
                throw invalid("ref path contains empty component at position " + (i + 1));
            }
            if (component.contains("..") || component.contains("./")) {
                throw invalid("ref path contains invalid characters: " + component);
            }
            if (!current.containsKey(component)) {
                throw invalid("reference '" + path + "' not found: component '" + component + "' does not exist");
            }
            Object value = current.get(component);
            if (i == components.length - 1) {
                return value;
            }
            if (!(value instanceof Map<?, ?> next)) {
                throw invalid("reference '" + path + "' invalid: intermediate component '" + component
                        + "' is not a map (got " + typeName(value) + ")");
            }
            current = asObject(next);
        }
        throw invalid("unexpected end of ref path traversal for: " + path);
    }

    // ==================== 字段裁剪 ====================

    private static JSONObject toGapic(Map<String, Object> schema) {
        if (schema.containsKey("allOf")) {
            return convertAllOf(schema.get("allOf"));
        }
        JSONObject converted = new JSONObject();
        for (Map.Entry<String, Object> entry : schema.entrySet()) {
            String key = entry.getKey();
            Object value = entry.getValue();
            switch (key) {
                case "$defs" -> {
                    // 已在展开阶段使用
                }
                case "items" -> {
                    if (!(value instanceof Map<?, ?> items)) {
                        throw invalid("'items' must be a dict, got " + typeName(value));
                    }
                    converted.put("items", toGapic(asObject(items)));
                }
                case "properties" -> {
                    if (!(value instanceof Map<?, ?> properties)) {
                        throw invalid("'properties' must be a dict, got " + typeName(value));
                    }
                    JSONObject convertedProperties = new JSONObject();
                    for (Map.Entry<String, Object> property : asObject(properties).entrySet()) {
                        if (!(property.getValue() instanceof Map<?, ?> propertySchema)) {
                            throw invalid("property '" + property.getKey() + "' must be a dict, got "
                                    + typeName(property.getValue()));
                        }
                        convertedProperties.put(property.getKey(), toGapic(asObject(propertySchema)));
                    }
                    converted.put("properties", convertedProperties);
                }
                case "type" -> converted.putAll(convertType(value));
                case "anyOf" -> converted.putAll(convertAnyOf(value));
                default -> {
                    if (ALLOWED_KEYS.contains(key)) {
                        converted.put(key, value);
                    }
                }
            }
        }
        return converted;
    }

    private static JSONObject convertType(Object value) {
        if (value instanceof String type) {
            return JSONObject.of("type", type);
        }
        if (value instanceof List<?> types) {
            if (types.size() != 2) {
                throw invalid("if type is a list, length must be 2, got " + types.size());
            }
            boolean hasNull = false;
            Object nonNullType = null;
            for (Object t : types) {
                if ("null".equals(t)) {
                    hasNull = true;
                } else {
                    nonNullType = t;
                }
            }
            if (!hasNull || nonNullType == null) {
                throw invalid("if type is a list, it must contain one non-null type and 'null'");
            }
            if (nonNullType instanceof Map) {
                throw invalid("unexpected map type in type array");
            }
            return JSONObject.of("type", String.valueOf(nonNullType), "nullable", true);
        }
        throw invalid("'type' must be a list or string, got " + typeName(value));
    }

    private static JSONObject convertAllOf(Object value) {
        if (!(value instanceof List<?> allOf)) {
            throw invalid("'allOf' must be a list, got " + typeName(value));
        }
        if (allOf.isEmpty()) {
            throw invalid("'allOf' cannot be empty");
        }
        if (allOf.size() > 1) {
            throw invalid("only one value for 'allOf' key is supported, got " + allOf.size());
        }
        if (!(allOf.get(0) instanceof Map<?, ?> subSchema)) {
            throw invalid("item in 'allOf' must be an object, got " + typeName(allOf.get(0)));
        }
        return toGapic(asObject(subSchema));
    }

    private static JSONObject convertAnyOf(Object value) {
        if (!(value instanceof List<?> anyOf)) {
            throw invalid("'anyOf' must be a list, got " + typeName(value));
        }
        if (anyOf.isEmpty()) {
            throw invalid("'anyOf' cannot be empty");
        }
        JSONObject result = new JSONObject();
        JSONArray variants = new JSONArray();
        boolean nullable = false;
        for (int i = 0; i < anyOf.size(); i++) {
            if (!(anyOf.get(i) instanceof Map<?, ?> raw)) {
                throw invalid("item " + i + " in 'anyOf' must be a dict, got " + typeName(anyOf.get(i)));
            }
            Map<String, Object> subSchema = asObject(raw);
            if ("null".equals(subSchema.get("type"))) {
                nullable = true;
            } else {
                variants.add(toGapic(subSchema));
            }
        }
        if (nullable) {
            result.put("nullable", true);
        }
        result.put("anyOf", variants);
        return result;
    }

    // ==================== 工具方法 ====================

    private static String refPath(Object ref) {
        if (!(ref instanceof String path)) {
            throw invalid("'$ref' value must be a string, got " + typeName(ref));
        }
        return path;
    }

    private static void checkDepth(int depth) {
        if (depth >= MAX_DEPTH) {
            throw new TranslationException("maximum recursion depth exceeded: depth " + depth);
        }
    }

    private static JSONObject asObject(Map<?, ?> map) {
        if (map instanceof JSONObject json) {
            return json;
        }
        JSONObject object = new JSONObject(map.size());
        map.forEach((key, value) -> object.put(String.valueOf(key), value));
        return object;
    }

    private static TranslationException invalid(String detail) {
        return new TranslationException("invalid JSON schema: " + detail);
    }

    private static String typeName(Object value) {
        return value == null ? "null" : value.getClass().getSimpleName();
    }
}
