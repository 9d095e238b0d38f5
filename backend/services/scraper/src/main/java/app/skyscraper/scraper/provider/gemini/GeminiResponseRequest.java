package app.skyscraper.scraper.provider.gemini;

public record GeminiResponseRequest(
        String model,
        String input,
        Integer maxOutputTokens,
        String responseMimeType
) {
}
