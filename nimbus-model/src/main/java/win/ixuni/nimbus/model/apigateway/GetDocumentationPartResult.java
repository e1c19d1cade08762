package win.ixuni.nimbus.model.apigateway;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.nimbus.model.JsonPayloads;
import win.ixuni.nimbus.model.ServiceResult;

/**
 * 文档片段查询结果 (GetDocumentationPart)
 */
@Data
@NoArgsConstructor
public class GetDocumentationPartResult {

    private String id;

    private DocumentationPartLocation location;

    /**
     * Documentation content, a JSON string
     */
    private String properties;

    public GetDocumentationPartResult(ServiceResult<JsonNode> result) {
        apply(result);
    }

    /**
     * @throws win.ixuni.nimbus.model.ModelParseException on malformed JSON or a non-object payload
     */
    public static GetDocumentationPartResult fromJson(String json) {
        return new GetDocumentationPartResult(ServiceResult.of(JsonPayloads.parse(json)));
    }

    /**
     * Copy the fields present in the payload; absent ones keep their value
     */
    public GetDocumentationPartResult apply(ServiceResult<JsonNode> result) {
        JsonNode json = JsonPayloads.requireObject(result.getPayload(), "GetDocumentationPartResult");
        JsonPayloads.ifString(json, "id", this::setId);
        JsonPayloads.ifObject(json, "location", DocumentationPartLocation::new, this::setLocation);
        JsonPayloads.ifString(json, "properties", this::setProperties);
        return this;
    }
}
