package adlab.orchestrator.model;

import java.util.List;
import java.util.Optional;

/**
 * Supported analysis operations.
 * Each type knows its wire name and the payload fields it cannot run without.
 */
public enum TaskType {

    EXTRACT_AD_CONCEPT("extract-ad-concept",
            List.of("image_url"),
            "Ad concept extraction task started. Use the task_id to check the status."),

    EXTRACT_SALES_PAGE("extract-sales-page",
            List.of("page_url"),
            "Sales page extraction task started. Use the task_id to check the status."),

    GENERATE_AD_RECIPE("generate-ad-recipe",
            List.of("ad_archive_id", "image_url", "sales_url"),
            "Ad recipe generation task started. Use the task_id to check the status.");

    private final String wireName;
    private final List<String> requiredFields;
    private final String acceptedMessage;

    TaskType(String wireName, List<String> requiredFields, String acceptedMessage) {
        this.wireName = wireName;
        this.requiredFields = requiredFields;
        this.acceptedMessage = acceptedMessage;
    }

    public String wireName() {
        return wireName;
    }

    public List<String> requiredFields() {
        return requiredFields;
    }

    public String acceptedMessage() {
        return acceptedMessage;
    }

    /**
     * Resolve a type from its wire name (e.g. {@code extract-ad-concept}).
     */
    public static Optional<TaskType> fromWireName(String name) {
        if (name == null) {
            return Optional.empty();
        }
        for (TaskType type : values()) {
            if (type.wireName.equals(name)) {
                return Optional.of(type);
            }
        }
        return Optional.empty();
    }
}
