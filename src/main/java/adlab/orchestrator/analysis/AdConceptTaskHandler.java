package adlab.orchestrator.analysis;

import adlab.orchestrator.model.TaskType;
import adlab.orchestrator.worker.AnalysisException;
import adlab.orchestrator.worker.TaskContext;
import adlab.orchestrator.worker.TaskHandler;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

/**
 * extract-ad-concept: turns an ad image into a concept description.
 * Has no side effects beyond the backend call, so re-execution is safe.
 */
public class AdConceptTaskHandler implements TaskHandler {

    private final AnalysisClient client;

    public AdConceptTaskHandler(AnalysisClient client) {
        this.client = client;
    }

    @Override
    public TaskType type() {
        return TaskType.EXTRACT_AD_CONCEPT;
    }

    @Override
    public JsonNode execute(JsonNode payload, TaskContext context) throws AnalysisException, InterruptedException {
        return extract(payload.get("image_url").asText(), context);
    }

    /**
     * Extract and validate a concept. Shared with the recipe handler.
     */
    JsonNode extract(String imageUrl, TaskContext context) throws AnalysisException, InterruptedException {
        context.reportProgress("fetching image");
        JsonNode concept = client.extractAdConcept(imageUrl);

        context.reportProgress("analyzing layout");
        if (concept == null || !concept.isObject()) {
            throw new AnalysisException("Ad concept analysis returned no object");
        }
        requireText(concept, "title");
        requireText(concept, "summary");

        ObjectNode normalized = ((ObjectNode) concept).deepCopy();
        if (!normalized.path("details").isObject()) {
            normalized.putObject("details");
        }
        return normalized;
    }

    private static void requireText(JsonNode node, String field) throws AnalysisException {
        JsonNode value = node.get(field);
        if (value == null || !value.isTextual() || value.asText().isBlank()) {
            throw new AnalysisException("Ad concept is missing '" + field + "'");
        }
    }
}
