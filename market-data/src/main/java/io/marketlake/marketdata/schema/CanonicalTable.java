package io.marketlake.marketdata.schema;

import io.marketlake.marketdata.DatasetKind;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Immutable column-major table whose columns are exactly the registered schema of its kind. Values are
 * {@code String}, {@code Short}, {@code Integer}, {@code Long}, {@code Double} or null, matching each
 * column's {@link ColumnType}.
 */
public final class CanonicalTable {
    private final DatasetKind kind;
    private final ColumnSpec spec;
    private final Object[][] columns;
    private final int rowCount;

    private CanonicalTable(DatasetKind kind, Object[][] columns, int rowCount) {
        this.kind = kind;
        this.spec = SchemaRegistry.specFor(kind);
        this.columns = columns;
        this.rowCount = rowCount;
    }

    public static Builder builder(DatasetKind kind) {
        return new Builder(kind);
    }

    public static CanonicalTable empty(DatasetKind kind) {
        return new Builder(kind).build();
    }

    /** Rows of {@code tables} in list order. Every table must be of {@code kind}. */
    public static CanonicalTable concat(DatasetKind kind, List<CanonicalTable> tables) {
        int total = 0;
        for (CanonicalTable t : tables) {
            if (t.kind != kind) {
                throw new SchemaMismatchException("Cannot concat " + t.kind + " table into " + kind);
            }
            total += t.rowCount;
        }
        int width = SchemaRegistry.specFor(kind).size();
        Object[][] cols = new Object[width][total];
        int offset = 0;
        for (CanonicalTable t : tables) {
            for (int c = 0; c < width; c++) {
                System.arraycopy(t.columns[c], 0, cols[c], offset, t.rowCount);
            }
            offset += t.rowCount;
        }
        return new CanonicalTable(kind, cols, total);
    }

    public DatasetKind kind() { return kind; }
    public ColumnSpec spec() { return spec; }
    public int rowCount() { return rowCount; }
    public int columnCount() { return spec.size(); }
    public boolean isEmpty() { return rowCount == 0; }

    public Object get(int row, int column) {
        Objects.checkIndex(row, rowCount);
        return columns[column][row];
    }

    public Object get(int row, String column) {
        return get(row, requireColumn(column));
    }

    public List<Object> column(String name) {
        Object[] values = columns[requireColumn(name)];
        return Collections.unmodifiableList(Arrays.asList(Arrays.copyOf(values, rowCount)));
    }

    public List<Object> row(int row) {
        Objects.checkIndex(row, rowCount);
        List<Object> out = new ArrayList<>(columns.length);
        for (Object[] col : columns) out.add(col[row]);
        return Collections.unmodifiableList(out);
    }

    private int requireColumn(String name) {
        int i = spec.indexOf(name);
        if (i < 0) throw new IllegalArgumentException(kind + " has no column " + name);
        return i;
    }

    @Override
    public String toString() {
        return "CanonicalTable{" + kind + ", rows=" + rowCount + '}';
    }

    public static final class Builder {
        private final DatasetKind kind;
        private final ColumnSpec spec;
        private final List<Object[]> rows = new ArrayList<>();

        private Builder(DatasetKind kind) {
            this.kind = Objects.requireNonNull(kind, "kind");
            this.spec = SchemaRegistry.specFor(kind);
        }

        public ColumnSpec spec() { return spec; }

        /**
         * @throws SchemaMismatchException on a wrong value count or a value whose class is not the column's type
         */
        public Builder addRow(Object... values) {
            if (values.length != spec.size()) {
                throw new SchemaMismatchException(kind + " row has " + values.length + " values, schema has " + spec.size());
            }
            for (int i = 0; i < values.length; i++) {
                Column c = spec.column(i);
                if (!c.type().accepts(values[i])) {
                    throw new SchemaMismatchException("Column " + c + " of " + kind + " cannot hold "
                            + values[i].getClass().getSimpleName() + " value " + values[i]);
                }
            }
            rows.add(values.clone());
            return this;
        }

        public Builder addRow(List<?> values) {
            return addRow(values.toArray());
        }

        public int rowCount() { return rows.size(); }

        public CanonicalTable build() {
            int n = rows.size();
            Object[][] cols = new Object[spec.size()][n];
            for (int r = 0; r < n; r++) {
                Object[] row = rows.get(r);
                for (int c = 0; c < row.length; c++) cols[c][r] = row[c];
            }
            return new CanonicalTable(kind, cols, n);
        }
    }
}
