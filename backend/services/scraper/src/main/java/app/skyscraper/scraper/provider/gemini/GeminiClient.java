package app.skyscraper.scraper.provider.gemini;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.http.MediaType;
import org.springframework.http.client.SimpleClientHttpRequestFactory;
import org.springframework.stereotype.Component;
import org.springframework.web.client.RestClient;

import java.time.Duration;

@Component
@ConditionalOnProperty(name = "app.scraper.reasoning.provider", havingValue = "gemini")
public class GeminiClient {

    static final String DEFAULT_BASE_URL = "https://generativelanguage.googleapis.com";
    static final Duration DEFAULT_TIMEOUT = Duration.ofSeconds(60);

    private final RestClient restClient;
    private final ObjectMapper objectMapper;

    public GeminiClient(RestClient.Builder restClientBuilder,
                        GeminiProps props,
                        ObjectMapper objectMapper) {
        Duration timeout = props.timeout() == null ? DEFAULT_TIMEOUT : props.timeout();
        SimpleClientHttpRequestFactory requestFactory = new SimpleClientHttpRequestFactory();
        requestFactory.setConnectTimeout(timeout);
        requestFactory.setReadTimeout(timeout);
        String baseUrl = props.baseUrl() == null || props.baseUrl().isBlank() ? DEFAULT_BASE_URL : props.baseUrl();
        this.restClient = restClientBuilder.clone()
                .baseUrl(baseUrl)
                .requestFactory(requestFactory)
                .build();
        this.objectMapper = objectMapper;
    }

    public GeminiResponseResult createResponse(String apiKey, GeminiResponseRequest request) {
        ObjectNode payload = objectMapper.createObjectNode();
        ArrayNode contents = payload.putArray("contents");
        ObjectNode user = contents.addObject();
        user.put("role", "user");
        ArrayNode parts = user.putArray("parts");
        parts.addObject().put("text", request.input());

        ObjectNode generationConfig = payload.putObject("generationConfig");
        if (request.maxOutputTokens() != null && request.maxOutputTokens() > 0) {
            generationConfig.put("maxOutputTokens", request.maxOutputTokens());
        }
        if (request.responseMimeType() != null && !request.responseMimeType().isBlank()) {
            generationConfig.put("responseMimeType", request.responseMimeType());
        }

        JsonNode response = restClient.post()
                .uri("/v1beta/models/{model}:generateContent", request.model())
                .header("x-goog-api-key", apiKey)
                .contentType(MediaType.APPLICATION_JSON)
                .body(payload)
                .retrieve()
                .body(JsonNode.class);

        if (response == null) {
            throw new IllegalStateException("Gemini response is empty");
        }
        String blockReason = GeminiResponseParser.extractBlockReason(response);
        if (blockReason != null) {
            throw new IllegalStateException("Gemini blocked the prompt: " + blockReason);
        }

        String outputText = GeminiResponseParser.extractText(response);
        String model = response.path("modelVersion").asText(null);
        if (model == null || model.isBlank()) {
            model = request.model();
        }
        JsonNode usage = response.path("usageMetadata");
        Integer inputTokens = usage.hasNonNull("promptTokenCount") ? usage.get("promptTokenCount").asInt() : null;
        Integer outputTokens = usage.hasNonNull("candidatesTokenCount") ? usage.get("candidatesTokenCount").asInt() : null;
        return new GeminiResponseResult(
                outputText,
                model,
                inputTokens,
                outputTokens,
                GeminiResponseParser.extractFinishReason(response)
        );
    }
}
