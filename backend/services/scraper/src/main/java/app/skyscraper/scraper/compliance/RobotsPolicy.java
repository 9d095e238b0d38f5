package app.skyscraper.scraper.compliance;

import java.util.Locale;

final class RobotsPolicy {

    private static final String DISALLOW = "disallow:";

    private RobotsPolicy() {
    }

    /**
     * True when any {@code Disallow} directive covers the whole site ({@code /} or {@code /*}).
     */
    static boolean hasBlanketDisallow(String content) {
        if (content == null || content.isBlank()) {
            return false;
        }
        for (String rawLine : content.split("\\r?\\n|\\r")) {
            String line = stripComment(rawLine).trim();
            if (!line.toLowerCase(Locale.ROOT).startsWith(DISALLOW)) {
                continue;
            }
            String path = line.substring(DISALLOW.length()).trim();
            if (path.equals("/") || path.equals("/*")) {
                return true;
            }
        }
        return false;
    }

    private static String stripComment(String line) {
        int idx = line.indexOf('#');
        return idx < 0 ? line : line.substring(0, idx);
    }
}
