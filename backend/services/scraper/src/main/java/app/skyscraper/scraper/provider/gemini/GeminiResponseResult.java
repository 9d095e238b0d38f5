package app.skyscraper.scraper.provider.gemini;

public record GeminiResponseResult(
        String outputText,
        String model,
        Integer inputTokens,
        Integer outputTokens,
        String finishReason
) {
}
