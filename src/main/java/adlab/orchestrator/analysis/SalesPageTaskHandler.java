package adlab.orchestrator.analysis;

import adlab.orchestrator.model.TaskType;
import adlab.orchestrator.worker.AnalysisException;
import adlab.orchestrator.worker.TaskContext;
import adlab.orchestrator.worker.TaskHandler;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * extract-sales-page: turns a product sales page into structured product information.
 */
public class SalesPageTaskHandler implements TaskHandler {

    private final AnalysisClient client;

    public SalesPageTaskHandler(AnalysisClient client) {
        this.client = client;
    }

    @Override
    public TaskType type() {
        return TaskType.EXTRACT_SALES_PAGE;
    }

    @Override
    public JsonNode execute(JsonNode payload, TaskContext context) throws AnalysisException, InterruptedException {
        return extract(payload.get("page_url").asText(), context);
    }

    JsonNode extract(String pageUrl, TaskContext context) throws AnalysisException, InterruptedException {
        context.reportProgress("fetching page");
        JsonNode page = client.extractSalesPage(pageUrl);

        context.reportProgress("extracting offer");
        if (page == null || !page.isObject()) {
            throw new AnalysisException("Sales page analysis returned no object");
        }
        JsonNode productName = page.get("product_name");
        if (productName == null || !productName.isTextual() || productName.asText().isBlank()) {
            throw new AnalysisException("Sales page is missing 'product_name'");
        }
        return page;
    }
}
