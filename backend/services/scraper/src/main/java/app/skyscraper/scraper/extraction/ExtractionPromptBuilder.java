package app.skyscraper.scraper.extraction;

import app.skyscraper.scraper.config.ExtractionProps;
import app.skyscraper.scraper.domain.job.ExtractionOptions;
import app.skyscraper.scraper.parse.NormalizedDocument;
import org.springframework.stereotype.Component;

@Component
public class ExtractionPromptBuilder {

    static final int DEFAULT_MAX_CONTENT_CHARS = 6000;

    private final int maxContentChars;

    public ExtractionPromptBuilder(ExtractionProps props) {
        this.maxContentChars = props.maxContentChars() == null || props.maxContentChars() <= 0
                ? DEFAULT_MAX_CONTENT_CHARS
                : props.maxContentChars();
    }

    public String build(NormalizedDocument document, String instruction, ExtractionOptions options) {
        String content = truncate(document.text());
        String schemaDirective = options.strictSchema()
                ? "Return exactly one JSON object. Do not add prose, comments or Markdown outside the JSON."
                : "Return only valid JSON.";
        String entityDirective = options.structuredExtraction()
                ? """
                  Also include an "entities" object grouping named entities found in the content by category
                  (for example "people", "organizations", "locations", "emails", "prices") and a numeric
                  "confidence" field between 0 and 1 describing how well the content answered the instruction.
                  """
                : "";

        return """
                Extract information based on this instruction: "%s"

                From website: %s
                Page title: %s
                Content: %s

                Based on the user's instruction, extract the relevant information in JSON format.
                Focus on what the user specifically requested.
                Structure your response appropriately for the type of data requested;
                use arrays of objects for repeated records such as products or listings.
                %s
                %s
                """.formatted(
                safe(instruction).trim(),
                safe(document.url()),
                safe(document.title()),
                content,
                entityDirective.trim(),
                schemaDirective
        );
    }

    String truncate(String text) {
        String value = safe(text);
        return value.length() <= maxContentChars ? value : value.substring(0, maxContentChars);
    }

    int maxContentChars() {
        return maxContentChars;
    }

    private String safe(String s) {
        return s == null ? "" : s;
    }
}
