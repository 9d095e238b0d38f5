package app.skyscraper.scraper.parse;

public record PageLink(String text, String href, String title) {
}
