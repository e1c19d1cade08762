package win.ixuni.nimbus.model.apigateway;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.nimbus.model.JsonPayloads;

/**
 * Location of an API Gateway documentation part
 */
@Data
@NoArgsConstructor
public class DocumentationPartLocation {

    /**
     * API entity type, e.g. {@code API}, {@code METHOD}, {@code RESPONSE}
     */
    private String type;

    private String path;

    private String method;

    private String statusCode;

    private String name;

    public DocumentationPartLocation(JsonNode json) {
        apply(json);
    }

    /**
     * Copy the fields present in {@code json}; absent ones keep their value
     */
    public DocumentationPartLocation apply(JsonNode json) {
        JsonPayloads.requireObject(json, "DocumentationPartLocation");
        JsonPayloads.ifString(json, "type", this::setType);
        JsonPayloads.ifString(json, "path", this::setPath);
        JsonPayloads.ifString(json, "method", this::setMethod);
        JsonPayloads.ifString(json, "statusCode", this::setStatusCode);
        JsonPayloads.ifString(json, "name", this::setName);
        return this;
    }

    /**
     * @return JSON object with the fields that are set
     */
    public ObjectNode toJson() {
        ObjectNode json = JsonPayloads.mapper().createObjectNode();
        if (type != null) {
            json.put("type", type);
        }
        if (path != null) {
            json.put("path", path);
        }
        if (method != null) {
            json.put("method", method);
        }
        if (statusCode != null) {
            json.put("statusCode", statusCode);
        }
        if (name != null) {
            json.put("name", name);
        }
        return json;
    }
}
