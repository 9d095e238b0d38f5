package app.skyscraper.scraper.extraction;

import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Service;

import java.util.Locale;

/**
 * Offline reasoning service with canned answers keyed by instruction keywords. Used when
 * no model provider is configured.
 */
@Service
@ConditionalOnProperty(name = "app.scraper.reasoning.provider", havingValue = "stub", matchIfMissing = true)
public class StubReasoningService implements ReasoningService {

    private static final String INSTRUCTION_MARKER = "Extract information based on this instruction: \"";

    @Override
    public String provider() {
        return "stub";
    }

    @Override
    public String complete(String prompt) {
        String instruction = instructionOf(prompt).toLowerCase(Locale.ROOT);
        if (containsAny(instruction, "price", "product", "shop", "cost")) {
            return fenced("""
                    {
                      "products": [
                        {"name": "Sample Product A", "price": "$19.99", "availability": "in stock"},
                        {"name": "Sample Product B", "price": "$29.99", "availability": "in stock"},
                        {"name": "Sample Product C", "price": "$49.99", "availability": "out of stock"}
                      ]
                    }
                    """);
        }
        if (containsAny(instruction, "contact", "email", "phone")) {
            return fenced("""
                    {
                      "emails": ["info@example.com", "support@example.com"],
                      "phones": ["+1 555-010-0000"]
                    }
                    """);
        }
        if (containsAny(instruction, "news", "article", "headline", "blog")) {
            return fenced("""
                    {
                      "articles": [
                        {"headline": "Sample headline one", "date": "2024-01-15", "summary": "Short summary of the first story."},
                        {"headline": "Sample headline two", "date": "2024-01-14", "summary": "Short summary of the second story."}
                      ]
                    }
                    """);
        }
        return fenced("""
                {
                  "summary": "Main content of the page extracted for the instruction.",
                  "key_points": ["First key point", "Second key point", "Third key point"]
                }
                """);
    }

    private String instructionOf(String prompt) {
        if (prompt == null) {
            return "";
        }
        int start = prompt.indexOf(INSTRUCTION_MARKER);
        if (start < 0) {
            return prompt;
        }
        start += INSTRUCTION_MARKER.length();
        int end = prompt.indexOf('"', start);
        return end < 0 ? prompt.substring(start) : prompt.substring(start, end);
    }

    private static boolean containsAny(String text, String... keywords) {
        for (String keyword : keywords) {
            if (text.contains(keyword)) {
                return true;
            }
        }
        return false;
    }

    private static String fenced(String json) {
        return "```json\n" + json.strip() + "\n```";
    }
}
