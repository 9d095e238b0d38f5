package app.skyscraper.scraper.export;

import app.skyscraper.scraper.domain.type.ExportFormat;
import app.skyscraper.scraper.extraction.result.ExtractionResult;
import app.skyscraper.scraper.extraction.result.ResultTable;
import app.skyscraper.scraper.extraction.result.TabularResult;
import com.fasterxml.jackson.databind.JsonNode;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVPrinter;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.StringWriter;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Tabular results become one CSV row per record (with a leading {@code table} column when
 * several tables are present); anything else becomes a single row of top-level values.
 * Nested values are written as JSON text.
 */
@Component
public class CsvArtifactWriter implements ArtifactWriter {

    static final String TABLE_COLUMN = "table";
    static final String VALUE_COLUMN = "value";

    @Override
    public ExportFormat format() {
        return ExportFormat.csv;
    }

    @Override
    public String write(ExtractionResult result, ExportContext context) {
        if (result instanceof TabularResult tabular) {
            List<ResultTable> tables = tabular.tables();
            if (!tables.isEmpty()) {
                return writeTables(tables);
            }
        }
        return writeSingleRow(result.data());
    }

    private String writeTables(List<ResultTable> tables) {
        boolean multiple = tables.size() > 1;
        Set<String> columns = new LinkedHashSet<>();
        tables.forEach(table -> columns.addAll(table.columns()));

        List<String> headers = new ArrayList<>();
        if (multiple) {
            headers.add(TABLE_COLUMN);
        }
        headers.addAll(columns);

        List<List<String>> rows = new ArrayList<>();
        for (ResultTable table : tables) {
            for (Map<String, JsonNode> record : table.rows()) {
                List<String> row = new ArrayList<>();
                if (multiple) {
                    row.add(table.name());
                }
                for (String column : columns) {
                    row.add(cell(record.get(column)));
                }
                rows.add(row);
            }
        }
        return print(headers, rows);
    }

    private String writeSingleRow(JsonNode data) {
        List<String> headers = new ArrayList<>();
        List<String> row = new ArrayList<>();
        if (data != null && data.isObject()) {
            data.fields().forEachRemaining(field -> {
                headers.add(field.getKey());
                row.add(cell(field.getValue()));
            });
        } else {
            headers.add(VALUE_COLUMN);
            row.add(cell(data));
        }
        return print(headers, List.of(row));
    }

    private String print(List<String> headers, List<List<String>> rows) {
        StringWriter out = new StringWriter();
        CSVFormat format = CSVFormat.DEFAULT.builder()
                .setHeader(headers.toArray(String[]::new))
                .build();
        try (CSVPrinter printer = new CSVPrinter(out, format)) {
            for (List<String> row : rows) {
                printer.printRecord(row);
            }
        } catch (IOException ex) {
            throw new UncheckedIOException("Failed to render CSV export", ex);
        }
        return out.toString();
    }

    static String cell(JsonNode value) {
        if (value == null || value.isNull() || value.isMissingNode()) {
            return "";
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }
}
