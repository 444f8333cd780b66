package adlab.orchestrator.store;

import adlab.orchestrator.repository.AnalysisArchive.AdRecipeEntry;
import org.junit.jupiter.api.*;

import static org.junit.jupiter.api.Assertions.*;

class JdbcAnalysisArchiveTest {

    private static Database db;
    private static JdbcAnalysisArchive archive;

    @BeforeAll
    static void setup() {
        db = new Database("jdbc:h2:mem:test-archive;DB_CLOSE_DELAY=-1;MODE=PostgreSQL;DATABASE_TO_UPPER=FALSE", 4);
        archive = new JdbcAnalysisArchive(db);
    }

    @AfterAll
    static void teardown() {
        if (db != null)
            db.close();
    }

    @BeforeEach
    void clean() throws Exception {
        try (var conn = db.getConnection();
                var st = conn.createStatement()) {
            st.execute("DELETE FROM ad_concepts");
            st.execute("DELETE FROM ad_recipes");
            conn.commit();
        }
    }

    @Test
    void storeAndFindConcept() {
        assertTrue(archive.findAdConcept("ad-1").isEmpty());

        archive.storeAdConcept("ad-1", "http://img/1.png", "{\"title\":\"A\"}");

        assertEquals("{\"title\":\"A\"}", archive.findAdConcept("ad-1").orElseThrow());
    }

    @Test
    void storingConceptTwiceReplacesIt() {
        archive.storeAdConcept("ad-1", "http://img/1.png", "{\"title\":\"A\"}");
        archive.storeAdConcept("ad-1", "http://img/1.png", "{\"title\":\"B\"}");

        assertEquals("{\"title\":\"B\"}", archive.findAdConcept("ad-1").orElseThrow());
    }

    @Test
    void recipeUpsertIsKeyedByTask() {
        AdRecipeEntry entry = new AdRecipeEntry("task-1", "ad-1", "http://img", "http://sales", null,
                "{}", "{}", "prompt v1");
        archive.storeAdRecipe(entry);
        archive.storeAdRecipe(new AdRecipeEntry("task-1", "ad-1", "http://img", "http://sales", null,
                "{}", "{}", "prompt v2"));

        AdRecipeEntry stored = archive.findAdRecipe("task-1").orElseThrow();
        assertEquals("prompt v2", stored.recipePrompt());
        assertEquals("ad-1", stored.adArchiveId());
        assertNull(stored.userId());
        assertTrue(archive.findAdRecipe("task-2").isEmpty());
    }
}
