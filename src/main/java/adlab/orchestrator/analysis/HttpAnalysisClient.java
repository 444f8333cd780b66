package adlab.orchestrator.analysis;

import adlab.orchestrator.worker.AnalysisException;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;

/**
 * AnalysisClient that posts JSON requests to an HTTP analysis backend:
 * {@code POST {base}/ad-concept {"image_url": ...}} and
 * {@code POST {base}/sales-page {"page_url": ...}}.
 */
public class HttpAnalysisClient implements AnalysisClient {

    private static final Logger log = LoggerFactory.getLogger(HttpAnalysisClient.class);

    private final String baseUrl;
    private final Duration requestTimeout;
    private final ObjectMapper mapper;
    private final HttpClient httpClient;

    /**
     * @param baseUrl        backend root URL, may be null when no backend is configured
     * @param requestTimeout per-request timeout
     */
    public HttpAnalysisClient(String baseUrl, Duration requestTimeout, ObjectMapper mapper) {
        this.baseUrl = baseUrl != null && baseUrl.endsWith("/")
                ? baseUrl.substring(0, baseUrl.length() - 1)
                : baseUrl;
        this.requestTimeout = requestTimeout;
        this.mapper = mapper;
        this.httpClient = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(10))
                .build();
    }

    @Override
    public JsonNode extractAdConcept(String imageUrl) throws AnalysisException, InterruptedException {
        ObjectNode body = mapper.createObjectNode();
        body.put("image_url", imageUrl);
        return post("/ad-concept", body);
    }

    @Override
    public JsonNode extractSalesPage(String pageUrl) throws AnalysisException, InterruptedException {
        ObjectNode body = mapper.createObjectNode();
        body.put("page_url", pageUrl);
        return post("/sales-page", body);
    }

    private JsonNode post(String path, ObjectNode body) throws AnalysisException, InterruptedException {
        if (baseUrl == null || baseUrl.isBlank()) {
            throw new AnalysisException("Analysis backend is not configured (ADLAB_ANALYSIS_URL)");
        }

        HttpResponse<String> response;
        try {
            HttpRequest request = HttpRequest.newBuilder()
                    .uri(URI.create(baseUrl + path))
                    .header("Content-Type", "application/json; charset=utf-8")
                    .timeout(requestTimeout)
                    .POST(HttpRequest.BodyPublishers.ofString(mapper.writeValueAsString(body), StandardCharsets.UTF_8))
                    .build();
            response = httpClient.send(request, HttpResponse.BodyHandlers.ofString());
        } catch (IllegalArgumentException e) {
            throw new AnalysisException("Invalid analysis backend URL: " + baseUrl + path, e);
        } catch (IOException e) {
            throw new AnalysisException("Analysis backend unreachable: " + e.getMessage(), e);
        }

        int statusCode = response.statusCode();
        if (statusCode < 200 || statusCode >= 300) {
            log.warn("Analysis backend {} returned HTTP {}: {}", path, statusCode, response.body());
            throw new AnalysisException("Analysis backend returned HTTP " + statusCode + " for " + path);
        }

        try {
            return mapper.readTree(response.body());
        } catch (JsonProcessingException e) {
            throw new AnalysisException("Analysis backend returned malformed JSON for " + path, e);
        }
    }
}
