package works.nuka.soclebot.utils;

import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class JsonUtilsTest {

    @Test
    void toJson_validObject_returnsJsonString() {
        // Arrange
        Map<String, Object> testObject = new LinkedHashMap<>();
        testObject.put("name", "TestName");
        testObject.put("value", 123);
        testObject.put("active", true);

        // Act
        String result = JsonUtils.toJson(testObject);

        // Assert
        assertEquals("{\"name\":\"TestName\",\"value\":123,\"active\":true}", result);
    }

    @Test
    void toJson_instant_isWrittenAsIsoString() {
        // Act
        String result = JsonUtils.toJson(Map.of("at", Instant.parse("2024-03-01T12:00:00Z")));

        // Assert
        assertEquals("{\"at\":\"2024-03-01T12:00:00Z\"}", result);
    }

    @Test
    void fromJson_validJson_returnsObject() {
        // Arrange
        String json = "{\"name\":\"TestName\",\"value\":123,\"active\":true}";

        // Act
        @SuppressWarnings("unchecked")
        Map<String, Object> result = JsonUtils.fromJson(json, Map.class);

        // Assert
        assertNotNull(result);
        assertEquals("TestName", result.get("name"));
        assertEquals(123, ((Number) result.get("value")).intValue());
        assertEquals(true, result.get("active"));
    }

    @Test
    void fromJson_invalidOrNull_returnsNull() {
        assertNull(JsonUtils.fromJson("{pas du json", Map.class));
        assertNull(JsonUtils.fromJson(null, Map.class));
    }

    @Test
    void toStringMap_validJson_returnsMap() {
        // Act
        Map<String, String> result = JsonUtils.toStringMap("{\"channel_id\":\"42\",\"text\":\"hello\"}");

        // Assert
        assertEquals(Map.of("channel_id", "42", "text", "hello"), result);
    }

    @Test
    void toStringMap_blankOrInvalid_returnsEmptyMap() {
        assertTrue(JsonUtils.toStringMap(null).isEmpty());
        assertTrue(JsonUtils.toStringMap("  ").isEmpty());
        assertTrue(JsonUtils.toStringMap("[1, 2]").isEmpty());
    }
}
