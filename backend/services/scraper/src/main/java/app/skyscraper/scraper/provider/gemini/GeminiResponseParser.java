package app.skyscraper.scraper.provider.gemini;

import com.fasterxml.jackson.databind.JsonNode;

public final class GeminiResponseParser {

    private GeminiResponseParser() {
    }

    public static String extractText(JsonNode response) {
        if (response == null) {
            return "";
        }
        JsonNode candidates = response.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            return "";
        }
        JsonNode parts = candidates.get(0).path("content").path("parts");
        if (!parts.isArray() || parts.isEmpty()) {
            return "";
        }
        StringBuilder sb = new StringBuilder();
        for (JsonNode part : parts) {
            String text = part.path("text").asText(null);
            if (text != null && !text.isBlank()) {
                if (sb.length() > 0) {
                    sb.append('\n');
                }
                sb.append(text);
            }
        }
        return sb.toString();
    }

    public static String extractFinishReason(JsonNode response) {
        if (response == null) {
            return null;
        }
        JsonNode candidates = response.path("candidates");
        if (!candidates.isArray() || candidates.isEmpty()) {
            return null;
        }
        return candidates.get(0).path("finishReason").asText(null);
    }

    /**
     * Message of a blocked prompt, or {@code null} when the prompt was accepted.
     */
    public static String extractBlockReason(JsonNode response) {
        if (response == null) {
            return null;
        }
        String reason = response.path("promptFeedback").path("blockReason").asText(null);
        return reason == null || reason.isBlank() ? null : reason;
    }
}
