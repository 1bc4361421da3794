package org.carball.profiler.profiler;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.extern.slf4j.Slf4j;
import org.carball.profiler.model.schema.LogicalType;
import org.carball.profiler.model.schema.LogicalTypeMap;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Extracts {@code logicalType} annotations from an Avro-style record schema.
 */
@Slf4j
public class LogicalTypeResolver {

    public LogicalTypeMap resolve(JsonNode schema) {
        if (schema == null || schema.isNull() || schema.isMissingNode()) {
            return LogicalTypeMap.empty();
        }

        JsonNode fields = schema.get("fields");
        if (fields == null || !fields.isArray()) {
            log.debug("Schema has no field list, no logical types resolved");
            return LogicalTypeMap.empty();
        }

        Map<String, LogicalType> types = new LinkedHashMap<>();
        int index = 0;
        for (JsonNode field : fields) {
            if (!field.isObject()) {
                throw new ProfilingException("Malformed schema: field #" + index + " is not an object");
            }
            JsonNode name = field.get("name");
            if (name == null || !name.isTextual()) {
                throw new ProfilingException("Malformed schema: field #" + index + " has no name");
            }

            String logicalType = findLogicalType(field.get("type"));
            if (logicalType != null) {
                types.put(name.asText(), new LogicalType(logicalType));
            }
            index++;
        }

        log.debug("Resolved logical types: {}", types);
        return LogicalTypeMap.of(types);
    }

    /**
     * Depth-first through unions and nested type wrappers; the first tag wins.
     */
    String findLogicalType(JsonNode typeDef) {
        if (typeDef == null || typeDef.isNull()) {
            return null;
        }
        if (typeDef.isArray()) {
            for (JsonNode alternative : typeDef) {
                String logicalType = findLogicalType(alternative);
                if (logicalType != null) {
                    return logicalType;
                }
            }
            return null;
        }
        if (typeDef.isObject()) {
            JsonNode logicalType = typeDef.get("logicalType");
            if (logicalType != null && logicalType.isTextual() && !logicalType.asText().isBlank()) {
                return logicalType.asText();
            }
            return findLogicalType(typeDef.get("type"));
        }
        return null;
    }
}
