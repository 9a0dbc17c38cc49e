package io.marketlake.marketdata.schema;

import io.marketlake.marketdata.DatasetKind;

import java.io.BufferedReader;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Header-first CSV for canonical tables. Encoding writes nulls as empty cells and quotes strings that contain a
 * comma, quote or line break. Decoding is strict: the header must be the kind's column names in order and every
 * cell must parse as its column type.
 */
public final class CsvTableCodec {
    private CsvTableCodec() {}

    public static byte[] encode(CanonicalTable table) {
        StringBuilder sb = new StringBuilder(64 + table.rowCount() * 16 * table.columnCount());
        appendLine(sb, table.spec().names());
        ColumnSpec spec = table.spec();
        List<String> cells = new ArrayList<>(spec.size());
        for (int r = 0; r < table.rowCount(); r++) {
            cells.clear();
            for (int c = 0; c < spec.size(); c++) {
                cells.add(spec.column(c).type().format(table.get(r, c)));
            }
            appendLine(sb, cells);
        }
        return sb.toString().getBytes(StandardCharsets.UTF_8);
    }

    /**
     * An empty body decodes to a zero-row table; anything else must start with the kind's header.
     *
     * @param source what the bytes are, for error messages
     */
    public static CanonicalTable decode(byte[] bytes, DatasetKind kind, String source) {
        try {
            return decode(new ByteArrayInputStream(bytes), kind, source);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    public static CanonicalTable decode(InputStream in, DatasetKind kind, String source) throws IOException {
        CanonicalTable.Builder builder = CanonicalTable.builder(kind);
        ColumnSpec spec = builder.spec();
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            List<String> header = readRecord(reader);
            while (header != null && isBlank(header)) header = readRecord(reader);
            if (header == null) return builder.build();
            SchemaRegistry.validateHeader(kind, trimAll(header), source);

            List<String> cells;
            int line = 1;
            while ((cells = readRecord(reader)) != null) {
                line++;
                if (isBlank(cells)) continue;
                if (cells.size() != spec.size()) {
                    throw new SchemaMismatchException(source + " row " + line + " has " + cells.size()
                            + " cells, " + kind + " has " + spec.size() + " columns");
                }
                Object[] values = new Object[spec.size()];
                for (int c = 0; c < values.length; c++) {
                    Column col = spec.column(c);
                    try {
                        values[c] = col.type().parse(cells.get(c));
                    } catch (NumberFormatException e) {
                        throw new SchemaMismatchException(source + " row " + line + ": '" + cells.get(c)
                                + "' is not a valid " + col, e);
                    }
                }
                builder.addRow(values);
            }
        }
        return builder.build();
    }

    /** First record of a CSV stream, or an empty list for an empty stream. */
    public static List<String> readHeader(InputStream in) throws IOException {
        try (BufferedReader reader = new BufferedReader(new InputStreamReader(in, StandardCharsets.UTF_8))) {
            List<String> header = readRecord(reader);
            while (header != null && isBlank(header)) header = readRecord(reader);
            return header == null ? List.of() : trimAll(header);
        }
    }

    private static void appendLine(StringBuilder sb, List<String> cells) {
        for (int i = 0; i < cells.size(); i++) {
            if (i > 0) sb.append(',');
            String v = cells.get(i);
            if (v.indexOf(',') >= 0 || v.indexOf('"') >= 0 || v.indexOf('\n') >= 0 || v.indexOf('\r') >= 0) {
                sb.append('"').append(v.replace("\"", "\"\"")).append('"');
            } else {
                sb.append(v);
            }
        }
        sb.append('\n');
    }

    // One CSV record; quoted cells may span lines. Null at end of input.
    private static List<String> readRecord(BufferedReader reader) throws IOException {
        String line = reader.readLine();
        if (line == null) return null;
        List<String> cells = new ArrayList<>();
        StringBuilder cell = new StringBuilder();
        boolean quoted = false;
        int i = 0;
        while (true) {
            if (i >= line.length()) {
                if (!quoted) break;
                String next = reader.readLine();
                if (next == null) throw new SchemaMismatchException("Unterminated quoted cell");
                cell.append('\n');
                line = next;
                i = 0;
                continue;
            }
            char ch = line.charAt(i++);
            if (quoted) {
                if (ch == '"') {
                    if (i < line.length() && line.charAt(i) == '"') {
                        cell.append('"');
                        i++;
                    } else {
                        quoted = false;
                    }
                } else {
                    cell.append(ch);
                }
            } else if (ch == '"') {
                quoted = true;
            } else if (ch == ',') {
                cells.add(cell.toString());
                cell.setLength(0);
            } else {
                cell.append(ch);
            }
        }
        cells.add(cell.toString());
        return cells;
    }

    private static boolean isBlank(List<String> cells) {
        return cells.size() == 1 && cells.get(0).isBlank();
    }

    private static List<String> trimAll(List<String> cells) {
        List<String> out = new ArrayList<>(cells.size());
        for (String c : cells) out.add(c.trim());
        return out;
    }
}
