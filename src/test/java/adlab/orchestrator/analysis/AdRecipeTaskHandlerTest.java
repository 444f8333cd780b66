package adlab.orchestrator.analysis;

import adlab.orchestrator.model.TaskType;
import adlab.orchestrator.repository.AnalysisArchive.AdRecipeEntry;
import adlab.orchestrator.store.Database;
import adlab.orchestrator.store.JdbcAnalysisArchive;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class AdRecipeTaskHandlerTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();
    private static final String USER = "7f9c1d2e-3b4a-4c5d-8e6f-0a1b2c3d4e5f";

    private Database db;
    private JdbcAnalysisArchive archive;
    private FakeAnalysisClient client;
    private AdRecipeTaskHandler handler;

    @BeforeEach
    void setUp() {
        db = new Database("jdbc:h2:mem:test-recipe-" + System.nanoTime()
                + ";DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        archive = new JdbcAnalysisArchive(db);
        client = new FakeAnalysisClient();
        handler = new AdRecipeTaskHandler(new AdConceptTaskHandler(client), new SalesPageTaskHandler(client),
                archive, new RecipePromptBuilder(MAPPER), MAPPER);
    }

    @AfterEach
    void tearDown() {
        db.close();
    }

    private JsonNode payload(String userId) {
        var node = MAPPER.createObjectNode()
                .put("ad_archive_id", "ad-42")
                .put("image_url", "http://img/42.png")
                .put("sales_url", "http://shop/runner");
        if (userId != null) {
            node.put("user_id", userId);
        }
        return node;
    }

    @Test
    void extractsAndArchivesMissingConcept() throws Exception {
        RecordingTaskContext context = new RecordingTaskContext("task-1", TaskType.GENERATE_AD_RECIPE);

        JsonNode result = handler.execute(payload(USER), context);

        assertEquals(1, client.conceptCalls.get());
        assertEquals(1, client.salesPageCalls.get());
        assertTrue(archive.findAdConcept("ad-42").isPresent());

        assertEquals("ad-42", result.get("ad_archive_id").asText());
        assertEquals("Summer sale", result.get("ad_concept_json").get("title").asText());
        assertEquals("Trail Runner 2", result.get("sales_page_json").get("product_name").asText());
        assertEquals(USER, result.get("user_id").asText());

        String prompt = result.get("recipe_prompt").asText();
        assertTrue(prompt.contains("Summer sale"));
        assertTrue(prompt.contains("Trail Runner 2"));
        assertFalse(prompt.contains("{{AD_CONCEPT}}"));
        assertFalse(prompt.contains("{{PRODUCT_INFO}}"));

        assertEquals("looking up ad concept", context.progress.get(0));
        assertEquals("building recipe prompt", context.progress.get(context.progress.size() - 1));
    }

    @Test
    void reusesArchivedConcept() throws Exception {
        archive.storeAdConcept("ad-42", "http://img/42.png",
                "{\"title\":\"Archived\",\"summary\":\"s\",\"details\":{}}");

        JsonNode result = handler.execute(payload(null),
                new RecordingTaskContext("task-1", TaskType.GENERATE_AD_RECIPE));

        assertEquals(0, client.conceptCalls.get());
        assertEquals("Archived", result.get("ad_concept_json").get("title").asText());
        assertTrue(result.get("user_id").isNull());
    }

    @Test
    void reExecutionLeavesSingleRecipe() throws Exception {
        handler.execute(payload(USER), new RecordingTaskContext("task-1", TaskType.GENERATE_AD_RECIPE));
        handler.execute(payload(USER), new RecordingTaskContext("task-1", TaskType.GENERATE_AD_RECIPE));

        AdRecipeEntry entry = archive.findAdRecipe("task-1").orElseThrow();
        assertEquals(USER, entry.userId());
        // Second run found the concept archived by the first
        assertEquals(1, client.conceptCalls.get());

        try (var conn = db.getConnection();
                var st = conn.createStatement();
                var rs = st.executeQuery("SELECT COUNT(*) FROM ad_recipes")) {
            rs.next();
            assertEquals(1, rs.getInt(1));
        }
    }

    @Test
    void nonUuidUserIsNotArchived() throws Exception {
        JsonNode result = handler.execute(payload("user-123"),
                new RecordingTaskContext("task-1", TaskType.GENERATE_AD_RECIPE));

        assertEquals("user-123", result.get("user_id").asText());
        assertNull(archive.findAdRecipe("task-1").orElseThrow().userId());
    }
}
