package io.marketlake.marketdata.schema;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Ordered list of named, typed columns.
 */
public final class ColumnSpec {
    private final List<Column> columns;
    private final Map<String, Integer> index = new HashMap<>();

    private ColumnSpec(List<Column> columns) {
        this.columns = List.copyOf(columns);
        for (int i = 0; i < this.columns.size(); i++) {
            if (index.put(this.columns.get(i).name(), i) != null) {
                throw new IllegalArgumentException("duplicate column " + this.columns.get(i).name());
            }
        }
    }

    public static ColumnSpec of(Column... columns) {
        return new ColumnSpec(List.of(columns));
    }

    public static ColumnSpec of(List<Column> columns) {
        return new ColumnSpec(columns);
    }

    /** This spec's columns followed by {@code other}'s. */
    public ColumnSpec concat(ColumnSpec other) {
        List<Column> all = new ArrayList<>(columns);
        all.addAll(other.columns);
        return new ColumnSpec(all);
    }

    public List<Column> columns() { return columns; }
    public int size() { return columns.size(); }
    public Column column(int i) { return columns.get(i); }

    /** Column position, or -1. */
    public int indexOf(String name) {
        Integer i = index.get(name);
        return i == null ? -1 : i;
    }

    public List<String> names() {
        List<String> out = new ArrayList<>(columns.size());
        for (Column c : columns) out.add(c.name());
        return out;
    }

    @Override
    public boolean equals(Object o) {
        return o instanceof ColumnSpec && ((ColumnSpec) o).columns.equals(columns);
    }

    @Override
    public int hashCode() { return columns.hashCode(); }

    @Override
    public String toString() { return columns.toString(); }
}
