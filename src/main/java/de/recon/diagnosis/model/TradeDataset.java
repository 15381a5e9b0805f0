package de.recon.diagnosis.model;

import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public final class TradeDataset {

    private final List<TradeRow> rows;
    private final Set<String> columns;

    public TradeDataset(List<TradeRow> rows) {
        this.rows = List.copyOf(rows);
        Set<String> cols = new LinkedHashSet<>();
        for (TradeRow row : this.rows) {
            cols.addAll(row.asMap().keySet());
        }
        this.columns = Set.copyOf(cols);
    }

    public static TradeDataset ofMaps(Collection<? extends Map<String, ?>> records) {
        List<TradeRow> rows = new ArrayList<>(records.size());
        for (Map<String, ?> record : records) {
            rows.add(new TradeRow(record));
        }
        return new TradeDataset(rows);
    }

    public List<TradeRow> getRows() {
        return rows;
    }

    public int size() {
        return rows.size();
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public TradeRow get(int index) {
        return rows.get(index);
    }

    public boolean hasColumn(String column) {
        return columns.contains(column);
    }

    public Set<String> getColumns() {
        return columns;
    }

    public List<Object> column(String column) {
        List<Object> values = new ArrayList<>(rows.size());
        for (TradeRow row : rows) {
            values.add(row.get(column));
        }
        return values;
    }

    public TradeDataset withColumn(String column, List<?> values) {
        if (values.size() != rows.size()) {
            throw new IllegalArgumentException("column " + column + " has " + values.size()
                    + " values for " + rows.size() + " rows");
        }
        List<TradeRow> updated = new ArrayList<>(rows.size());
        for (int i = 0; i < rows.size(); i++) {
            updated.add(rows.get(i).with(column, values.get(i)));
        }
        return new TradeDataset(updated);
    }
}
