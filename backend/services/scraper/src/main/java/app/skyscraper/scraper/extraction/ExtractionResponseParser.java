package app.skyscraper.scraper.extraction;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Locates the JSON payload in a model answer: a {@code ```json} fence first, then any
 * fence, then the whole answer, then the first balanced object or array in the text.
 * Only objects and arrays count as a payload.
 */
@Component
public class ExtractionResponseParser {

    private static final Pattern JSON_FENCE = Pattern.compile("```json\\s*(.*?)```", Pattern.DOTALL | Pattern.CASE_INSENSITIVE);
    private static final Pattern ANY_FENCE = Pattern.compile("```[A-Za-z0-9_-]*\\s*(.*?)```", Pattern.DOTALL);

    private final ObjectMapper objectMapper;

    public ExtractionResponseParser(ObjectMapper objectMapper) {
        this.objectMapper = objectMapper;
    }

    public Optional<JsonNode> parse(String response) {
        if (response == null || response.isBlank()) {
            return Optional.empty();
        }
        for (String candidate : candidates(response)) {
            Optional<JsonNode> parsed = readContainer(candidate);
            if (parsed.isPresent()) {
                return parsed;
            }
        }
        return Optional.empty();
    }

    private List<String> candidates(String response) {
        List<String> candidates = new ArrayList<>();
        addMatches(JSON_FENCE.matcher(response), candidates);
        addMatches(ANY_FENCE.matcher(response), candidates);
        candidates.add(response.trim());
        String balanced = firstBalanced(response);
        if (balanced != null) {
            candidates.add(balanced);
        }
        return candidates;
    }

    private void addMatches(Matcher matcher, List<String> candidates) {
        while (matcher.find()) {
            candidates.add(matcher.group(1).trim());
        }
    }

    private Optional<JsonNode> readContainer(String candidate) {
        if (candidate.isEmpty()) {
            return Optional.empty();
        }
        try {
            JsonNode node = objectMapper.readTree(candidate);
            return node != null && node.isContainerNode() ? Optional.of(node) : Optional.empty();
        } catch (JsonProcessingException ex) {
            return Optional.empty();
        }
    }

    static String firstBalanced(String text) {
        for (int start = 0; start < text.length(); start++) {
            char open = text.charAt(start);
            if (open != '{' && open != '[') {
                continue;
            }
            int end = matchingClose(text, start);
            if (end > start) {
                return text.substring(start, end + 1);
            }
        }
        return null;
    }

    private static int matchingClose(String text, int start) {
        int depth = 0;
        boolean inString = false;
        boolean escaped = false;
        for (int i = start; i < text.length(); i++) {
            char c = text.charAt(i);
            if (inString) {
                if (escaped) {
                    escaped = false;
                } else if (c == '\\') {
                    escaped = true;
                } else if (c == '"') {
                    inString = false;
                }
                continue;
            }
            if (c == '"') {
                inString = true;
            } else if (c == '{' || c == '[') {
                depth++;
            } else if (c == '}' || c == ']') {
                depth--;
                if (depth == 0) {
                    return i;
                }
            }
        }
        return -1;
    }
}
