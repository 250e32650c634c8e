package com.herzen.irt.validation;

import com.herzen.irt.domain.ResponseModels.RawResponseTable;
import com.herzen.irt.domain.ResponseModels.ResponseMatrix;
import com.herzen.irt.domain.ResponseModels.ValidatedResponses;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.util.*;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

@Component
public class ResponseMatrixValidator {
    private static final Logger log = LoggerFactory.getLogger(ResponseMatrixValidator.class);

    public static final int MIN_VALID_ROWS = 10;
    public static final int MIN_ITEMS = 2;

    private static final Set<String> MISSING_TOKENS = Set.of("", "na", "nan");
    private static final Pattern NUMBER = Pattern.compile("[-+]?(\\d+\\.?\\d*|\\.\\d+)([eE][-+]?\\d+)?");

    public ValidatedResponses validate(RawResponseTable table) {
        int itemCount = table.itemCount();
        List<List<Integer>> scored = new ArrayList<>(table.rows().size());
        Set<String> found = new TreeSet<>();
        boolean nonBinary = false;

        for (List<String> row : table.rows()) {
            List<Integer> cells = new ArrayList<>(itemCount);
            for (String raw : row) {
                Integer score = score(raw);
                if (score == null && !isMissing(raw)) {
                    nonBinary = true;
                    found.add(raw.trim());
                } else if (score != null) {
                    found.add(String.valueOf(score));
                }
                cells.add(score);
            }
            scored.add(cells);
        }

        if (nonBinary) {
            throw new SchemaException("Responses must be 0/1. Found: " + String.join(", ", found));
        }

        List<List<Integer>> valid = scored.stream()
                .filter(r -> {
                    int sum = rowSum(r);
                    return sum > 0 && sum < itemCount;
                })
                .map(Collections::unmodifiableList)
                .collect(Collectors.toList());

        if (valid.size() < MIN_VALID_ROWS) {
            throw new InsufficientDataException(valid.size());
        }

        return new ValidatedResponses(new ResponseMatrix(itemCount, List.copyOf(valid)), scored.size(), itemCount);
    }

    /**
     * Drops item columns whose answers never vary. A column needs at least two answers to count as
     * invariant; missing cells are ignored. Remaining columns keep their upload order.
     */
    public RawResponseTable dropInvariantItems(RawResponseTable table) {
        List<Integer> kept = new ArrayList<>();
        List<String> removed = new ArrayList<>();
        for (int j = 0; j < table.itemCount(); j++) {
            if (invariant(table, j)) {
                removed.add(table.itemLabels().get(j));
            } else {
                kept.add(j);
            }
        }
        if (kept.size() < MIN_ITEMS) {
            throw new SchemaException("Not enough valid items after removing invariant ones");
        }
        if (removed.isEmpty()) {
            return table;
        }
        log.warn("Removing invariant items: {}", removed);

        List<String> labels = kept.stream().map(table.itemLabels()::get).toList();
        List<List<String>> rows = table.rows().stream()
                .map(r -> kept.stream().map(r::get).toList())
                .toList();
        return new RawResponseTable(labels, rows);
    }

    private boolean invariant(RawResponseTable table, int column) {
        Set<String> values = new HashSet<>();
        int answered = 0;
        for (List<String> row : table.rows()) {
            String raw = row.get(column);
            if (isMissing(raw)) continue;
            answered++;
            values.add(normalize(raw));
        }
        return answered >= 2 && values.size() == 1;
    }

    private String normalize(String raw) {
        String trimmed = raw.trim();
        return NUMBER.matcher(trimmed).matches() ? String.valueOf(Double.parseDouble(trimmed)) : trimmed;
    }

    private int rowSum(List<Integer> row) {
        return row.stream().filter(Objects::nonNull).mapToInt(Integer::intValue).sum();
    }

    private boolean isMissing(String raw) {
        return raw == null || MISSING_TOKENS.contains(raw.trim().toLowerCase(Locale.ROOT));
    }

    private Integer score(String raw) {
        if (isMissing(raw) || !NUMBER.matcher(raw.trim()).matches()) return null;
        double value = Double.parseDouble(raw.trim());
        if (value == 0.0) return 0;
        if (value == 1.0) return 1;
        return null;
    }
}
