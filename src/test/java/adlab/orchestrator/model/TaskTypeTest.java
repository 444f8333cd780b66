package adlab.orchestrator.model;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class TaskTypeTest {

    @Test
    void resolvesWireNames() {
        assertEquals(TaskType.EXTRACT_AD_CONCEPT, TaskType.fromWireName("extract-ad-concept").orElseThrow());
        assertEquals(TaskType.EXTRACT_SALES_PAGE, TaskType.fromWireName("extract-sales-page").orElseThrow());
        assertEquals(TaskType.GENERATE_AD_RECIPE, TaskType.fromWireName("generate-ad-recipe").orElseThrow());
    }

    @Test
    void unknownWireNameIsEmpty() {
        assertTrue(TaskType.fromWireName("EXTRACT_AD_CONCEPT").isEmpty());
        assertTrue(TaskType.fromWireName("resize-image").isEmpty());
        assertTrue(TaskType.fromWireName(null).isEmpty());
    }

    @Test
    void recipeRequiresAllInputs() {
        assertEquals(List.of("ad_archive_id", "image_url", "sales_url"),
                TaskType.GENERATE_AD_RECIPE.requiredFields());
        assertEquals(List.of("image_url"), TaskType.EXTRACT_AD_CONCEPT.requiredFields());
    }
}
