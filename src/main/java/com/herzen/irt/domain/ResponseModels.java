package com.herzen.irt.domain;

import java.util.List;
import java.util.Objects;

public class ResponseModels {
    public record RawResponseTable(List<String> itemLabels, List<List<String>> rows) {
        public int itemCount() {
            return itemLabels.size();
        }
    }

    /**
     * Binary score matrix, one row per respondent. A {@code null} cell is a missing response.
     */
    public record ResponseMatrix(int itemCount, List<List<Integer>> rows) {
        public int rowCount() {
            return rows.size();
        }

        public double responseRate() {
            return rows.stream()
                    .flatMap(List::stream)
                    .filter(Objects::nonNull)
                    .mapToInt(Integer::intValue)
                    .average()
                    .orElse(0.0);
        }
    }

    public record ValidatedResponses(ResponseMatrix cleaned, int originalRows, int originalItems) {}
}
