package app.skyscraper.scraper.domain.type;

import app.skyscraper.scraper.export.ExportUnsupportedException;

import java.util.Locale;

public enum ExportFormat {
    json("application/json", "json"),
    csv("text/csv", "csv"),
    xml("application/xml", "xml"),
    dashboard("text/x-python", "py");

    private final String contentType;
    private final String extension;

    ExportFormat(String contentType, String extension) {
        this.contentType = contentType;
        this.extension = extension;
    }

    public String contentType() {
        return contentType;
    }

    public String extension() {
        return extension;
    }

    public static ExportFormat parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return json;
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (ExportFormat format : values()) {
            if (format.name().equals(normalized)) {
                return format;
            }
        }
        throw new ExportUnsupportedException(raw.trim());
    }
}
