package app.skyscraper.scraper.export;

public class ExportUnsupportedException extends IllegalArgumentException {

    private final String format;

    public ExportUnsupportedException(String format) {
        super("Unsupported export format: " + format);
        this.format = format;
    }

    public String getFormat() {
        return format;
    }
}
