package win.ixuni.nimbus.model.apigateway;

import com.fasterxml.jackson.databind.JsonNode;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import win.ixuni.nimbus.model.JsonPayloads;
import win.ixuni.nimbus.model.ModelParseException;
import win.ixuni.nimbus.model.ServiceResult;

import static org.junit.jupiter.api.Assertions.*;

class GetDocumentationPartResultTest {

    private static final String FULL = """
            {
              "id": "abc123",
              "location": {
                "type": "METHOD",
                "path": "/pets",
                "method": "GET",
                "statusCode": "200",
                "name": "listPets"
              },
              "properties": "{\\"description\\":\\"Lists pets\\"}",
              "unknownField": 42
            }""";

    @Test
    void copiesEveryPresentField() {
        GetDocumentationPartResult result = GetDocumentationPartResult.fromJson(FULL);

        assertEquals("abc123", result.getId());
        assertEquals("{\"description\":\"Lists pets\"}", result.getProperties());
        DocumentationPartLocation location = result.getLocation();
        assertEquals("METHOD", location.getType());
        assertEquals("/pets", location.getPath());
        assertEquals("GET", location.getMethod());
        assertEquals("200", location.getStatusCode());
        assertEquals("listPets", location.getName());
    }

    @Test
    @DisplayName("缺失字段保持默认值")
    void absentFieldsStayNull() {
        GetDocumentationPartResult result = GetDocumentationPartResult.fromJson("{\"id\":\"only-id\"}");

        assertEquals("only-id", result.getId());
        assertNull(result.getLocation());
        assertNull(result.getProperties());
    }

    @Test
    void partialLocation() {
        GetDocumentationPartResult result = GetDocumentationPartResult.fromJson("{\"location\":{\"type\":\"API\"}}");

        assertEquals("API", result.getLocation().getType());
        assertNull(result.getLocation().getPath());
        assertNull(result.getId());
    }

    @Test
    void jsonNullCountsAsAbsent() {
        GetDocumentationPartResult result = GetDocumentationPartResult.fromJson("{\"id\":null,\"location\":null}");

        assertNull(result.getId());
        assertNull(result.getLocation());
    }

    @Test
    @DisplayName("apply 不清除新载荷中缺失的字段")
    void applyKeepsFieldsMissingFromNewPayload() {
        GetDocumentationPartResult result = GetDocumentationPartResult.fromJson(FULL);

        result.apply(ServiceResult.of(JsonPayloads.parse("{\"id\":\"def456\"}")));

        assertEquals("def456", result.getId());
        assertEquals("METHOD", result.getLocation().getType());
        assertNotNull(result.getProperties());
    }

    @Test
    void rejectsMalformedOrNonObjectPayloads() {
        assertThrows(ModelParseException.class, () -> GetDocumentationPartResult.fromJson("{\"id\":"));
        assertThrows(ModelParseException.class, () -> GetDocumentationPartResult.fromJson("[1,2]"));
        assertThrows(ModelParseException.class, () -> GetDocumentationPartResult.fromJson("{\"location\":\"nowhere\"}"));
    }

    @Test
    void locationWritesOnlySetFields() {
        DocumentationPartLocation location = new DocumentationPartLocation();
        location.setType("RESOURCE");
        location.setPath("/pets");

        JsonNode json = location.toJson();

        assertEquals(2, json.size());
        assertEquals(location, new DocumentationPartLocation(json));
    }
}
