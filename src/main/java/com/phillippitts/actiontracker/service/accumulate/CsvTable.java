package com.phillippitts.actiontracker.service.accumulate;

import com.opencsv.CSVReader;
import com.opencsv.CSVReaderBuilder;
import com.opencsv.RFC4180ParserBuilder;
import com.opencsv.exceptions.CsvException;
import com.phillippitts.actiontracker.service.render.CsvFormat;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * In-memory form of the CSV accumulation file: the column names after {@code Action} and one
 * row of cells per action label, in file order.
 */
final class CsvTable {

    private static final Logger LOG = LogManager.getLogger(CsvTable.class);

    private final List<String> columns;
    private final Map<String, Map<String, String>> rows;

    CsvTable(List<String> columns, Map<String, Map<String, String>> rows) {
        this.columns = columns;
        this.rows = rows;
    }

    static CsvTable empty() {
        return new CsvTable(new ArrayList<>(), new LinkedHashMap<>());
    }

    /**
     * Parses file content. Blank or malformed content, or a first record that is not an
     * {@code Action} header, yields an empty table. Rows without a label are skipped. Quoted fields
     * may span lines.
     */
    static CsvTable parse(String content) {
        if (content == null || content.isBlank()) {
            return empty();
        }
        List<String[]> records;
        try (CSVReader reader = new CSVReaderBuilder(new StringReader(content))
                .withCSVParser(new RFC4180ParserBuilder().build())
                .build()) {
            records = reader.readAll();
        } catch (IOException | CsvException e) {
            LOG.warn("Accumulation file is not valid CSV, starting over: {}", e.getMessage());
            return empty();
        }
        if (records.isEmpty()) {
            return empty();
        }
        String[] header = records.get(0);
        if (header.length == 0 || !CsvFormat.ACTION_HEADER.equals(header[0].strip())) {
            return empty();
        }
        List<String> columns = new ArrayList<>();
        for (int c = 1; c < header.length; c++) {
            if (!header[c].isBlank()) {
                columns.add(header[c].strip());
            }
        }
        Map<String, Map<String, String>> rows = new LinkedHashMap<>();
        for (String[] fields : records.subList(1, records.size())) {
            String label = fields.length == 0 ? "" : fields[0].strip();
            if (label.isEmpty()) {
                continue;
            }
            Map<String, String> cells = new LinkedHashMap<>();
            for (int c = 1; c < fields.length && c < header.length; c++) {
                cells.put(header[c].strip(), fields[c].strip());
            }
            rows.put(label, cells);
        }
        return new CsvTable(columns, rows);
    }

    List<String> columns() {
        return columns;
    }

    Map<String, Map<String, String>> rows() {
        return rows;
    }

    /** Renders header and every row; missing cells become {@code -}. */
    String render(List<String> header) {
        List<String[]> records = new ArrayList<>();
        List<String> headerRow = new ArrayList<>();
        headerRow.add(CsvFormat.ACTION_HEADER);
        headerRow.addAll(header);
        records.add(headerRow.toArray(new String[0]));
        for (Map.Entry<String, Map<String, String>> row : rows.entrySet()) {
            List<String> fields = new ArrayList<>();
            fields.add(row.getKey());
            for (String column : header) {
                String value = row.getValue().get(column);
                fields.add(value == null || value.isBlank() ? CsvFormat.NOT_ACCESSED : value);
            }
            records.add(fields.toArray(new String[0]));
        }
        return CsvFormat.write(records);
    }
}
