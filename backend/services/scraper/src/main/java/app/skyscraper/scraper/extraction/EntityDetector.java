package app.skyscraper.scraper.extraction;

import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Pattern-based entity breakdown of page text, used when the model did not return one.
 */
@Component
public class EntityDetector {

    static final int MAX_PER_CATEGORY = 20;

    private static final Map<String, Pattern> PATTERNS = new LinkedHashMap<>();

    static {
        PATTERNS.put("emails", Pattern.compile("[A-Za-z0-9._%+-]+@[A-Za-z0-9.-]+\\.[A-Za-z]{2,}"));
        PATTERNS.put("urls", Pattern.compile("https?://[^\\s\"'<>()]+"));
        PATTERNS.put("phones", Pattern.compile("(?:\\+\\d{1,3}[ .-]?)?\\(?\\d{3}\\)?[ .-]\\d{3}[ .-]\\d{4}"));
        PATTERNS.put("prices", Pattern.compile("[$€£¥]\\s?\\d{1,3}(?:[,.]\\d{3})*(?:[.,]\\d{2})?"));
        PATTERNS.put("dates", Pattern.compile("\\b\\d{4}-\\d{2}-\\d{2}\\b|\\b\\d{1,2}/\\d{1,2}/\\d{2,4}\\b"));
    }

    public Map<String, List<String>> detect(String text) {
        Map<String, List<String>> entities = new LinkedHashMap<>();
        if (text == null || text.isBlank()) {
            return entities;
        }
        for (Map.Entry<String, Pattern> entry : PATTERNS.entrySet()) {
            Set<String> found = new LinkedHashSet<>();
            Matcher matcher = entry.getValue().matcher(text);
            while (matcher.find() && found.size() < MAX_PER_CATEGORY) {
                found.add(matcher.group().trim());
            }
            if (!found.isEmpty()) {
                entities.put(entry.getKey(), new ArrayList<>(found));
            }
        }
        return entities;
    }
}
