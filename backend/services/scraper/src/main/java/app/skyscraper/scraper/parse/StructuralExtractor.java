package app.skyscraper.scraper.parse;

import app.skyscraper.scraper.fetch.RawPage;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Parses raw markup into a {@link NormalizedDocument}. Parsing is lenient: malformed
 * markup yields whatever jsoup recovers, and missing parts become empty values.
 */
@Component
public class StructuralExtractor {

    private static final Logger log = LoggerFactory.getLogger(StructuralExtractor.class);

    public static final int MAX_LINKS = 100;
    public static final int MAX_IMAGES = 50;
    public static final int MAX_TABLES = 10;
    public static final int MAX_TABLE_ROWS = 20;
    public static final int MAX_FORMS = 5;
    public static final int MAX_LISTS = 10;
    public static final int MAX_LIST_ITEMS = 20;

    public NormalizedDocument parse(RawPage page) {
        String baseUrl = page.finalUrl() == null || page.finalUrl().isBlank() ? page.requestedUrl() : page.finalUrl();
        String markup = page.body() == null ? "" : page.body();
        Document doc;
        try {
            doc = Jsoup.parse(markup, baseUrl == null ? "" : baseUrl);
        } catch (RuntimeException ex) {
            log.warn("Markup could not be parsed url={} error={}", baseUrl, ex.getMessage());
            doc = Jsoup.parse("", baseUrl == null ? "" : baseUrl);
        }

        return new NormalizedDocument(
                baseUrl,
                doc.title().trim(),
                doc.body() == null ? "" : doc.body().text(),
                extractMeta(doc),
                extractLinks(doc),
                extractImages(doc),
                extractHeadings(doc),
                extractTables(doc),
                extractForms(doc),
                extractLists(doc)
        );
    }

    private Map<String, String> extractMeta(Document doc) {
        Map<String, String> meta = new LinkedHashMap<>();
        for (Element tag : doc.select("meta")) {
            String name = tag.hasAttr("name") ? tag.attr("name") : tag.attr("property");
            String content = tag.attr("content");
            if (!name.isBlank() && !content.isBlank()) {
                meta.put(name, content);
            }
        }
        return meta;
    }

    private List<PageLink> extractLinks(Document doc) {
        List<PageLink> links = new ArrayList<>();
        for (Element anchor : doc.select("a[href]")) {
            if (links.size() >= MAX_LINKS) {
                break;
            }
            String text = anchor.text().trim();
            String href = absolute(anchor, "href");
            if (!text.isEmpty() && !href.isEmpty()) {
                links.add(new PageLink(text, href, anchor.attr("title")));
            }
        }
        return links;
    }

    private List<PageImage> extractImages(Document doc) {
        List<PageImage> images = new ArrayList<>();
        for (Element img : doc.select("img[src]")) {
            if (images.size() >= MAX_IMAGES) {
                break;
            }
            String src = absolute(img, "src");
            if (!src.isEmpty()) {
                images.add(new PageImage(src, img.attr("alt"), img.attr("title")));
            }
        }
        return images;
    }

    private Map<String, List<String>> extractHeadings(Document doc) {
        Map<String, List<String>> headings = new LinkedHashMap<>();
        for (int level = 1; level <= 6; level++) {
            String tag = "h" + level;
            List<String> texts = new ArrayList<>();
            for (Element heading : doc.getElementsByTag(tag)) {
                texts.add(heading.text().trim());
            }
            headings.put(tag, texts);
        }
        return headings;
    }

    private List<PageTable> extractTables(Document doc) {
        List<PageTable> tables = new ArrayList<>();
        for (Element table : doc.getElementsByTag("table")) {
            if (tables.size() >= MAX_TABLES) {
                break;
            }
            Elements rowElements = ownRows(table);
            List<String> headers = rowElements.isEmpty() ? List.of() : cellTexts(rowElements.first());
            List<List<String>> rows = new ArrayList<>();
            for (int i = 1; i < rowElements.size() && rows.size() < MAX_TABLE_ROWS; i++) {
                List<String> cells = cellTexts(rowElements.get(i));
                if (!cells.isEmpty()) {
                    rows.add(cells);
                }
            }
            if (!headers.isEmpty() || !rows.isEmpty()) {
                tables.add(new PageTable(headers, rows));
            }
        }
        return tables;
    }

    // rows of nested tables belong to those tables
    private static Elements ownRows(Element table) {
        Elements rows = new Elements();
        for (Element row : table.getElementsByTag("tr")) {
            if (row.closest("table") == table) {
                rows.add(row);
            }
        }
        return rows;
    }

    private List<String> cellTexts(Element row) {
        List<String> cells = new ArrayList<>();
        for (Element cell : row.children()) {
            String tag = cell.normalName();
            if (tag.equals("td") || tag.equals("th")) {
                cells.add(cell.text().trim());
            }
        }
        return cells;
    }

    private List<PageForm> extractForms(Document doc) {
        List<PageForm> forms = new ArrayList<>();
        for (Element form : doc.getElementsByTag("form")) {
            if (forms.size() >= MAX_FORMS) {
                break;
            }
            List<PageForm.FormInput> inputs = new ArrayList<>();
            for (Element input : form.select("input, select, textarea")) {
                inputs.add(new PageForm.FormInput(
                        input.attr("name"),
                        input.hasAttr("type") ? input.attr("type") : input.normalName(),
                        input.attr("placeholder"),
                        input.hasAttr("required")
                ));
            }
            String method = form.attr("method").trim();
            forms.add(new PageForm(
                    form.hasAttr("action") ? absolute(form, "action") : "",
                    method.isEmpty() ? "GET" : method.toUpperCase(Locale.ROOT),
                    inputs
            ));
        }
        return forms;
    }

    private List<PageList> extractLists(Document doc) {
        List<PageList> lists = new ArrayList<>();
        for (Element list : doc.select("ul, ol")) {
            if (lists.size() >= MAX_LISTS) {
                break;
            }
            List<String> items = new ArrayList<>();
            for (Element item : list.getElementsByTag("li")) {
                if (items.size() >= MAX_LIST_ITEMS) {
                    break;
                }
                String text = item.text().trim();
                if (!text.isEmpty()) {
                    items.add(text);
                }
            }
            if (!items.isEmpty()) {
                lists.add(new PageList(list.normalName(), items));
            }
        }
        return lists;
    }

    private String absolute(Element element, String attribute) {
        String resolved = element.absUrl(attribute);
        return resolved.isEmpty() ? element.attr(attribute).trim() : resolved;
    }
}
