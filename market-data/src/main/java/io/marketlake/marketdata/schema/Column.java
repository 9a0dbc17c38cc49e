package io.marketlake.marketdata.schema;

import java.util.Objects;

public record Column(String name, ColumnType type) {
    public Column {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(type, "type");
    }

    @Override
    public String toString() { return name + ":" + type.shortName(); }
}
