package win.ixuni.nimbus.model.logs;

import com.fasterxml.jackson.databind.JsonNode;
import lombok.Data;
import lombok.NoArgsConstructor;
import win.ixuni.nimbus.model.JsonPayloads;
import win.ixuni.nimbus.model.ServiceResult;

import java.util.ArrayList;
import java.util.List;

/**
 * CloudWatch Logs DescribeSubscriptionFilters response
 */
@Data
@NoArgsConstructor
public class DescribeSubscriptionFiltersResult {

    private List<SubscriptionFilter> subscriptionFilters = new ArrayList<>();

    /**
     * Token for the next page, absent on the last page
     */
    private String nextToken;

    public DescribeSubscriptionFiltersResult(ServiceResult<JsonNode> result) {
        apply(result);
    }

    public static DescribeSubscriptionFiltersResult fromJson(String json) {
        return new DescribeSubscriptionFiltersResult(ServiceResult.of(JsonPayloads.parse(json)));
    }

    /**
     * Copy the fields present in the payload. Filters are appended to the ones already held.
     */
    public DescribeSubscriptionFiltersResult apply(ServiceResult<JsonNode> result) {
        JsonNode json = JsonPayloads.requireObject(result.getPayload(), "DescribeSubscriptionFiltersResult");
        JsonPayloads.forEachObject(json, "subscriptionFilters", SubscriptionFilter::new, subscriptionFilters::add);
        JsonPayloads.ifString(json, "nextToken", this::setNextToken);
        return this;
    }

    public boolean hasMorePages() {
        return nextToken != null && !nextToken.isEmpty();
    }
}
