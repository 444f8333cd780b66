package adlab.orchestrator.store;

import adlab.orchestrator.repository.AnalysisArchive;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.sql.*;
import java.time.Instant;
import java.util.Optional;

/**
 * JDBC implementation of AnalysisArchive.
 * Upserts are UPDATE-then-INSERT; a lost insert race falls back to the update.
 */
public class JdbcAnalysisArchive implements AnalysisArchive {

    private static final Logger log = LoggerFactory.getLogger(JdbcAnalysisArchive.class);

    private final Database db;

    public JdbcAnalysisArchive(Database db) {
        this.db = db;
    }

    @Override
    public Optional<String> findAdConcept(String adArchiveId) {
        String sql = "SELECT concept_json FROM ad_concepts WHERE ad_archive_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, adArchiveId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.ofNullable(rs.getString(1));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find ad concept: " + adArchiveId, e);
        }
    }

    @Override
    public void storeAdConcept(String adArchiveId, String imageUrl, String conceptJson) {
        String updateSql = "UPDATE ad_concepts SET image_url = ?, concept_json = ? WHERE ad_archive_id = ?";
        String insertSql = """
                    INSERT INTO ad_concepts (ad_archive_id, image_url, concept_json, created_at)
                    VALUES (?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                if (updateConcept(conn, updateSql, adArchiveId, imageUrl, conceptJson) == 0) {
                    try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                        ps.setString(1, adArchiveId);
                        ps.setString(2, imageUrl);
                        ps.setString(3, conceptJson);
                        ps.setTimestamp(4, Timestamp.from(Instant.now()));
                        ps.executeUpdate();
                    }
                }
                conn.commit();
            } catch (SQLIntegrityConstraintViolationException e) {
                // Another writer inserted first
                conn.rollback();
                updateConcept(conn, updateSql, adArchiveId, imageUrl, conceptJson);
                conn.commit();
            }
            log.debug("Archived ad concept {}", adArchiveId);
        } catch (SQLException e) {
            throw new StoreException("Failed to store ad concept: " + adArchiveId, e);
        }
    }

    @Override
    public void storeAdRecipe(AdRecipeEntry entry) {
        String updateSql = """
                    UPDATE ad_recipes
                    SET ad_archive_id = ?, image_url = ?, sales_url = ?, user_id = ?,
                        ad_concept_json = ?, sales_page_json = ?, recipe_prompt = ?
                    WHERE task_id = ?
                """;
        String insertSql = """
                    INSERT INTO ad_recipes (ad_archive_id, image_url, sales_url, user_id,
                                            ad_concept_json, sales_page_json, recipe_prompt, task_id, created_at)
                    VALUES (?, ?, ?, ?, ?, ?, ?, ?, ?)
                """;

        try (Connection conn = db.getConnection()) {
            try {
                if (updateRecipe(conn, updateSql, entry) == 0) {
                    try (PreparedStatement ps = conn.prepareStatement(insertSql)) {
                        bindRecipe(ps, entry);
                        ps.setTimestamp(9, Timestamp.from(Instant.now()));
                        ps.executeUpdate();
                    }
                }
                conn.commit();
            } catch (SQLIntegrityConstraintViolationException e) {
                conn.rollback();
                updateRecipe(conn, updateSql, entry);
                conn.commit();
            }
            log.debug("Archived ad recipe for task {}", entry.taskId());
        } catch (SQLException e) {
            throw new StoreException("Failed to store ad recipe: " + entry.taskId(), e);
        }
    }

    @Override
    public Optional<AdRecipeEntry> findAdRecipe(String taskId) {
        String sql = "SELECT * FROM ad_recipes WHERE task_id = ?";

        try (Connection conn = db.getConnection();
                PreparedStatement ps = conn.prepareStatement(sql)) {

            ps.setString(1, taskId);
            try (ResultSet rs = ps.executeQuery()) {
                if (rs.next()) {
                    return Optional.of(new AdRecipeEntry(
                            rs.getString("task_id"),
                            rs.getString("ad_archive_id"),
                            rs.getString("image_url"),
                            rs.getString("sales_url"),
                            rs.getString("user_id"),
                            rs.getString("ad_concept_json"),
                            rs.getString("sales_page_json"),
                            rs.getString("recipe_prompt")));
                }
            }
            return Optional.empty();
        } catch (SQLException e) {
            throw new StoreException("Failed to find ad recipe: " + taskId, e);
        }
    }

    // Helper methods

    private static int updateConcept(Connection conn, String sql, String adArchiveId, String imageUrl,
            String conceptJson) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            ps.setString(1, imageUrl);
            ps.setString(2, conceptJson);
            ps.setString(3, adArchiveId);
            return ps.executeUpdate();
        }
    }

    private static int updateRecipe(Connection conn, String sql, AdRecipeEntry entry) throws SQLException {
        try (PreparedStatement ps = conn.prepareStatement(sql)) {
            bindRecipe(ps, entry);
            return ps.executeUpdate();
        }
    }

    /** Binds parameters 1-8 in the column order shared by the UPDATE and INSERT. */
    private static void bindRecipe(PreparedStatement ps, AdRecipeEntry entry) throws SQLException {
        ps.setString(1, entry.adArchiveId());
        ps.setString(2, entry.imageUrl());
        ps.setString(3, entry.salesUrl());
        ps.setString(4, entry.userId());
        ps.setString(5, entry.adConceptJson());
        ps.setString(6, entry.salesPageJson());
        ps.setString(7, entry.recipePrompt());
        ps.setString(8, entry.taskId());
    }
}
