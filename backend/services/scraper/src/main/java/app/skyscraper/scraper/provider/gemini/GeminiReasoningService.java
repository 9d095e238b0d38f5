package app.skyscraper.scraper.provider.gemini;

import app.skyscraper.scraper.extraction.ReasoningService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

@Service
@ConditionalOnProperty(name = "app.scraper.reasoning.provider", havingValue = "gemini")
public class GeminiReasoningService implements ReasoningService {

    private static final Logger log = LoggerFactory.getLogger(GeminiReasoningService.class);

    static final String DEFAULT_MODEL = "gemini-2.0-flash";

    private final GeminiClient client;
    private final GeminiProps props;

    public GeminiReasoningService(GeminiClient client, GeminiProps props) {
        this.client = client;
        this.props = props;
    }

    @Override
    public String provider() {
        return "gemini";
    }

    @Override
    public String complete(String prompt) {
        String apiKey = props.apiKey();
        if (apiKey == null || apiKey.isBlank()) {
            throw new IllegalStateException("Gemini API key is not configured");
        }
        String model = props.model() == null || props.model().isBlank() ? DEFAULT_MODEL : props.model();
        GeminiResponseResult result = client.createResponse(apiKey, new GeminiResponseRequest(
                model,
                prompt,
                props.maxOutputTokens(),
                null
        ));
        log.debug("Gemini completion model={} tokensIn={} tokensOut={} finishReason={}",
                result.model(), result.inputTokens(), result.outputTokens(), result.finishReason());
        if (result.outputText() == null || result.outputText().isBlank()) {
            throw new IllegalStateException("Gemini returned no text (finishReason=" + result.finishReason() + ")");
        }
        return result.outputText();
    }
}
