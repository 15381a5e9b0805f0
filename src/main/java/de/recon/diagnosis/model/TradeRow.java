package de.recon.diagnosis.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

public final class TradeRow {

    private final Map<String, Object> fields;

    public TradeRow(Map<String, ?> fields) {
        this.fields = Collections.unmodifiableMap(new LinkedHashMap<>(fields));
    }

    public String getTradeId() {
        Object id = fields.get(Columns.TRADE_ID);
        return id == null ? null : id.toString();
    }

    public Object get(String column) {
        return fields.get(column);
    }

    public boolean has(String column) {
        return fields.containsKey(column);
    }

    public Map<String, Object> asMap() {
        return fields;
    }

    public String getString(String column) {
        Object v = fields.get(column);
        return v == null ? null : v.toString();
    }

    public Double getDouble(String column) {
        Object v = fields.get(column);
        if (v instanceof Number n) {
            double d = n.doubleValue();
            return Double.isNaN(d) ? null : d;
        }
        return null;
    }

    public boolean isFlagSet(String column) {
        return Boolean.TRUE.equals(fields.get(column));
    }

    public Double pvDiff() {
        return diff(Columns.PV_OLD, Columns.PV_NEW);
    }

    public Double deltaDiff() {
        return diff(Columns.DELTA_OLD, Columns.DELTA_NEW);
    }

    public boolean anyMismatch() {
        if (fields.containsKey(Columns.ANY_MISMATCH)) {
            return isFlagSet(Columns.ANY_MISMATCH);
        }
        return isFlagSet(Columns.PV_MISMATCH) || isFlagSet(Columns.DELTA_MISMATCH);
    }

    public TradeRow with(String column, Object value) {
        Map<String, Object> copy = new LinkedHashMap<>(fields);
        copy.put(column, value);
        return new TradeRow(copy);
    }

    private Double diff(String oldColumn, String newColumn) {
        Double oldValue = getDouble(oldColumn);
        Double newValue = getDouble(newColumn);
        if (oldValue == null || newValue == null) {
            return null;
        }
        return newValue - oldValue;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof TradeRow other)) return false;
        return fields.equals(other.fields);
    }

    @Override
    public int hashCode() {
        return Objects.hash(fields);
    }

    @Override
    public String toString() {
        return "TradeRow" + fields;
    }
}
