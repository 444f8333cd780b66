package adlab.orchestrator.repository;

import java.util.Optional;

/**
 * Long-term archive of analysis outputs, reused across tasks.
 * Writes are upserts so a re-executed task does not duplicate rows.
 */
public interface AnalysisArchive {

    /**
     * Find the archived concept JSON for an ad.
     */
    Optional<String> findAdConcept(String adArchiveId);

    /**
     * Store (or replace) the concept JSON for an ad.
     */
    void storeAdConcept(String adArchiveId, String imageUrl, String conceptJson);

    /**
     * Store (or replace) the recipe produced by a task.
     */
    void storeAdRecipe(AdRecipeEntry entry);

    /**
     * Find the recipe produced by a task.
     */
    Optional<AdRecipeEntry> findAdRecipe(String taskId);

    /**
     * Archived ad recipe row.
     */
    record AdRecipeEntry(
            String taskId,
            String adArchiveId,
            String imageUrl,
            String salesUrl,
            String userId,
            String adConceptJson,
            String salesPageJson,
            String recipePrompt) {
    }
}
