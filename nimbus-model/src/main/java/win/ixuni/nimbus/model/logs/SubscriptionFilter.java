package win.ixuni.nimbus.model.logs;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.nimbus.model.JsonPayloads;

/**
 * 日志订阅过滤器
 */
@Data
@NoArgsConstructor
public class SubscriptionFilter {

    private String filterName;

    private String logGroupName;

    private String filterPattern;

    private String destinationArn;

    private String roleArn;

    /**
     * {@code Random} or {@code ByLogStream}
     */
    private String distribution;

    /**
     * Epoch milliseconds
     */
    private Long creationTime;

    public SubscriptionFilter(JsonNode json) {
        apply(json);
    }

    public SubscriptionFilter apply(JsonNode json) {
        JsonPayloads.requireObject(json, "SubscriptionFilter");
        JsonPayloads.ifString(json, "filterName", this::setFilterName);
        JsonPayloads.ifString(json, "logGroupName", this::setLogGroupName);
        JsonPayloads.ifString(json, "filterPattern", this::setFilterPattern);
        JsonPayloads.ifString(json, "destinationArn", this::setDestinationArn);
        JsonPayloads.ifString(json, "roleArn", this::setRoleArn);
        JsonPayloads.ifString(json, "distribution", this::setDistribution);
        JsonPayloads.ifLong(json, "creationTime", this::setCreationTime);
        return this;
    }

    public ObjectNode toJson() {
        ObjectNode json = JsonPayloads.mapper().createObjectNode();
        putIfSet(json, "filterName", filterName);
        putIfSet(json, "logGroupName", logGroupName);
        putIfSet(json, "filterPattern", filterPattern);
        putIfSet(json, "destinationArn", destinationArn);
        putIfSet(json, "roleArn", roleArn);
        putIfSet(json, "distribution", distribution);
        if (creationTime != null) {
            json.put("creationTime", creationTime);
        }
        return json;
    }

    private static void putIfSet(ObjectNode json, String key, String value) {
        if (value != null) {
            json.put(key, value);
        }
    }
}
