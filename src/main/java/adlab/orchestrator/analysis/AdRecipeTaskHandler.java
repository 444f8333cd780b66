package adlab.orchestrator.analysis;

import adlab.orchestrator.model.TaskType;
import adlab.orchestrator.repository.AnalysisArchive;
import adlab.orchestrator.repository.AnalysisArchive.AdRecipeEntry;
import adlab.orchestrator.worker.AnalysisException;
import adlab.orchestrator.worker.TaskContext;
import adlab.orchestrator.worker.TaskHandler;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Optional;
import java.util.UUID;

/**
 * generate-ad-recipe: combines an ad concept with sales page data into a
 * creative brief.
 *
 * The concept is reused from the archive when one exists for the ad,
 * otherwise extracted and archived. Archive writes are upserts keyed by
 * ad archive id and task id, so re-executing a task leaves one row each.
 */
public class AdRecipeTaskHandler implements TaskHandler {

    private static final Logger log = LoggerFactory.getLogger(AdRecipeTaskHandler.class);

    private final AdConceptTaskHandler conceptHandler;
    private final SalesPageTaskHandler salesPageHandler;
    private final AnalysisArchive archive;
    private final RecipePromptBuilder promptBuilder;
    private final ObjectMapper mapper;

    public AdRecipeTaskHandler(AdConceptTaskHandler conceptHandler, SalesPageTaskHandler salesPageHandler,
            AnalysisArchive archive, RecipePromptBuilder promptBuilder, ObjectMapper mapper) {
        this.conceptHandler = conceptHandler;
        this.salesPageHandler = salesPageHandler;
        this.archive = archive;
        this.promptBuilder = promptBuilder;
        this.mapper = mapper;
    }

    @Override
    public TaskType type() {
        return TaskType.GENERATE_AD_RECIPE;
    }

    @Override
    public JsonNode execute(JsonNode payload, TaskContext context) throws AnalysisException, InterruptedException {
        String adArchiveId = payload.get("ad_archive_id").asText();
        String imageUrl = payload.get("image_url").asText();
        String salesUrl = payload.get("sales_url").asText();
        String userId = payload.hasNonNull("user_id") ? payload.get("user_id").asText() : null;

        context.reportProgress("looking up ad concept");
        JsonNode adConcept = findArchivedConcept(adArchiveId).orElse(null);
        if (adConcept == null) {
            log.info("No archived ad concept for {}, extracting one", adArchiveId);
            adConcept = conceptHandler.extract(imageUrl, context);
            archive.storeAdConcept(adArchiveId, imageUrl, write(adConcept));
        } else {
            log.info("Reusing archived ad concept for {}", adArchiveId);
        }

        JsonNode salesPage = salesPageHandler.extract(salesUrl, context);

        context.reportProgress("building recipe prompt");
        String recipePrompt = promptBuilder.build(adConcept, salesPage);

        archive.storeAdRecipe(new AdRecipeEntry(
                context.taskId(),
                adArchiveId,
                imageUrl,
                salesUrl,
                archivableUserId(userId),
                write(adConcept),
                write(salesPage),
                recipePrompt));

        ObjectNode result = mapper.createObjectNode();
        result.put("ad_archive_id", adArchiveId);
        result.put("image_url", imageUrl);
        result.put("sales_url", salesUrl);
        result.set("ad_concept_json", adConcept);
        result.set("sales_page_json", salesPage);
        result.put("recipe_prompt", recipePrompt);
        result.put("user_id", userId);
        return result;
    }

    private Optional<JsonNode> findArchivedConcept(String adArchiveId) {
        Optional<String> archived = archive.findAdConcept(adArchiveId);
        if (archived.isEmpty()) {
            return Optional.empty();
        }
        try {
            return Optional.of(mapper.readTree(archived.get()));
        } catch (JsonProcessingException e) {
            log.warn("Archived ad concept for {} is unreadable, extracting a fresh one", adArchiveId);
            return Optional.empty();
        }
    }

    /**
     * The archive keys users by UUID; anything else is stored without a user.
     */
    private static String archivableUserId(String userId) {
        if (userId == null || userId.isBlank()) {
            return null;
        }
        try {
            return UUID.fromString(userId).toString();
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring user_id '{}' for the archive: not a UUID", userId);
            return null;
        }
    }

    private String write(JsonNode node) throws AnalysisException {
        try {
            return mapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new AnalysisException("Failed to serialize analysis output", e);
        }
    }
}
