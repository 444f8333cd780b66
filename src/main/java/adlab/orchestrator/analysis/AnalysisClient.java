package adlab.orchestrator.analysis;

import adlab.orchestrator.worker.AnalysisException;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * Backend that performs the actual AI analysis.
 * Calls are slow and rate limited; callers run them on worker threads only.
 */
public interface AnalysisClient {

    /**
     * Analyze an ad creative image into a concept description
     * ({@code title}, {@code summary}, {@code details}).
     */
    JsonNode extractAdConcept(String imageUrl) throws AnalysisException, InterruptedException;

    /**
     * Analyze a sales page into product information (at least {@code product_name}).
     */
    JsonNode extractSalesPage(String pageUrl) throws AnalysisException, InterruptedException;
}
