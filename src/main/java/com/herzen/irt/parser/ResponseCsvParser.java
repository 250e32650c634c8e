package com.herzen.irt.parser;

import com.herzen.irt.domain.ResponseModels.RawResponseTable;
import com.herzen.irt.validation.SchemaException;
import org.springframework.stereotype.Component;

import java.util.*;

@Component
public class ResponseCsvParser {
    private static final List<String> ID_COLUMN_HINTS = List.of("id", "student", "person", "subject");

    public RawResponseTable parse(String content) {
        if (content == null || content.isBlank()) {
            throw new SchemaException("Response file is empty");
        }

        List<String> lines = Arrays.stream(content.split("\\R"))
                .filter(l -> !l.isBlank())
                .toList();
        List<String> header = tokenize(stripBom(lines.get(0)));
        if (lines.size() < 2) {
            throw new SchemaException("Response file has a header but no data rows");
        }

        List<List<String>> rows = new ArrayList<>();
        for (int i = 1; i < lines.size(); i++) {
            List<String> cells = tokenize(lines.get(i));
            if (cells.size() != header.size()) {
                throw new SchemaException("Line " + (i + 1) + " has " + cells.size()
                        + " cells; expected " + header.size());
            }
            rows.add(cells);
        }

        if (hasIdColumn(header)) {
            header = header.subList(1, header.size());
            rows = rows.stream().map(r -> r.subList(1, r.size())).toList();
        }
        if (header.isEmpty()) {
            throw new SchemaException("Response file has no item columns");
        }
        return new RawResponseTable(List.copyOf(header), rows.stream().map(List::copyOf).toList());
    }

    private boolean hasIdColumn(List<String> header) {
        String first = header.get(0).toLowerCase(Locale.ROOT);
        return ID_COLUMN_HINTS.stream().anyMatch(first::contains);
    }

    private List<String> tokenize(String line) {
        List<String> out = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        for (int i = 0; i < line.length(); i++) {
            char c = line.charAt(i);
            if (c == '"') {
                if (quoted && i + 1 < line.length() && line.charAt(i + 1) == '"') {
                    cell.append('"');
                    i++;
                } else {
                    quoted = !quoted;
                }
            } else if (c == ',' && !quoted) {
                out.add(cell.toString().trim());
                cell.setLength(0);
            } else {
                cell.append(c);
            }
        }
        out.add(cell.toString().trim());
        return out;
    }

    private String stripBom(String line) {
        return line.startsWith("\uFEFF") ? line.substring(1) : line;
    }
}
