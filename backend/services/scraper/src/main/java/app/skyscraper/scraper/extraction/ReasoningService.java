package app.skyscraper.scraper.extraction;

/**
 * External model that answers extraction prompts. Implementations throw an unchecked
 * exception when the service is unreachable or answers with an error.
 */
public interface ReasoningService {
    String provider();

    String complete(String prompt);
}
