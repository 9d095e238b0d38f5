package app.skyscraper.scraper.parse;

import java.util.List;
import java.util.Map;

/**
 * Structured view of a fetched page. Every collection holds at most the first N entries
 * in document order (see {@link StructuralExtractor}) and every URL is absolute.
 */
public record NormalizedDocument(
        String url,
        String title,
        String text,
        Map<String, String> meta,
        List<PageLink> links,
        List<PageImage> images,
        Map<String, List<String>> headings,
        List<PageTable> tables,
        List<PageForm> forms,
        List<PageList> lists
) {

    public ContentStats stats() {
        return new ContentStats(
                text == null ? 0 : text.length(),
                links.size(),
                images.size(),
                tables.size(),
                forms.size()
        );
    }

    public record ContentStats(
            int contentLength,
            int linksFound,
            int imagesFound,
            int tablesFound,
            int formsFound
    ) {
    }
}
