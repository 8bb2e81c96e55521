package io.burt.analytics.command;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.OptionalInt;

/**
 * The primary table returned by a command, with all values as strings.
 */
public final class CommandResult {
    private final List<String> columnNames;
    private final Map<String, Integer> columnNameToIndex;
    private final List<List<String>> rows;

    public CommandResult(List<String> columnNames, List<List<String>> rows) {
        this.columnNames = Collections.unmodifiableList(new ArrayList<>(columnNames));
        this.columnNameToIndex = new HashMap<>();
        for (int i = 0; i < columnNames.size(); i++) {
            columnNameToIndex.putIfAbsent(columnNames.get(i), i);
        }
        List<List<String>> copiedRows = new ArrayList<>(rows.size());
        for (List<String> row : rows) {
            if (row.size() != columnNames.size()) {
                throw new IllegalArgumentException(String.format("Expected rows with %d values, got %d", columnNames.size(), row.size()));
            }
            copiedRows.add(Collections.unmodifiableList(new ArrayList<>(row)));
        }
        this.rows = Collections.unmodifiableList(copiedRows);
    }

    public List<String> columnNames() {
        return columnNames;
    }

    public OptionalInt columnIndex(String columnName) {
        Integer index = columnNameToIndex.get(columnName);
        return index == null ? OptionalInt.empty() : OptionalInt.of(index);
    }

    public List<List<String>> rows() {
        return rows;
    }

    public int rowCount() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }
}
