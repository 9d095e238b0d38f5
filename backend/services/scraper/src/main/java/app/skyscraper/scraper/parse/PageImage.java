package app.skyscraper.scraper.parse;

public record PageImage(String src, String alt, String title) {
}
