package org.carball.profiler.profiler;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.carball.profiler.model.schema.LogicalType;
import org.carball.profiler.model.schema.LogicalTypeMap;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

public class LogicalTypeResolverTest {

    private final ObjectMapper mapper = new ObjectMapper();
    private LogicalTypeResolver resolver;

    @BeforeEach
    void setUp() {
        resolver = new LogicalTypeResolver();
    }

    @Test
    void shouldReturnEmptyMapWithoutSchema() {
        assertThat(resolver.resolve(null).size()).isZero();
        assertThat(resolver.resolve(mapper.createObjectNode()).size()).isZero();
    }

    @Test
    void shouldFindLogicalTypesInNestedTypesAndUnions() throws Exception {
        // Given
        JsonNode schema = mapper.readTree("""
            {
              "type": "record",
              "name": "Event",
              "fields": [
                {"name": "id", "type": "long"},
                {"name": "createdAt", "type": {"type": "long", "logicalType": "timestamp-millis"}},
                {"name": "updatedAt", "type": ["null", {"type": "long", "logicalType": "timestamp-micros"}]},
                {"name": "day", "type": {"type": {"type": "int", "logicalType": "date"}}}
              ]
            }
            """);

        // When
        LogicalTypeMap types = resolver.resolve(schema);

        // Then
        assertThat(types.get("id")).isEmpty();
        assertThat(types.get("createdAt")).contains(LogicalType.TIMESTAMP_MILLIS);
        assertThat(types.get("updatedAt")).contains(LogicalType.TIMESTAMP_MICROS);
        assertThat(types.get("day")).contains(new LogicalType("date"));
        assertThat(types.get("missing")).isEmpty();
    }

    @Test
    void shouldTakeFirstTagInUnion() throws Exception {
        JsonNode union = mapper.readTree("""
            [{"type": "long", "logicalType": "timestamp-micros"}, {"type": "long", "logicalType": "timestamp-millis"}]
            """);

        assertThat(resolver.findLogicalType(union)).isEqualTo("timestamp-micros");
    }

    @Test
    void shouldRejectFieldsWithoutName() throws Exception {
        JsonNode schema = mapper.readTree("""
            {"fields": [{"type": "long"}]}
            """);

        assertThatThrownBy(() -> resolver.resolve(schema))
                .isInstanceOf(ProfilingException.class)
                .hasMessageContaining("field #0 has no name");
    }

    @Test
    void shouldIgnoreSchemaWhoseFieldsAreNotAList() throws Exception {
        JsonNode schema = mapper.readTree("""
            {"fields": "none"}
            """);

        assertThat(resolver.resolve(schema).size()).isZero();
    }
}
