package io.marketlake.marketdata.store;

import java.util.List;

/** Objects matched by one pattern, sorted by key. */
public record ObjectRead(String pattern, List<StoredObject> objects) {
    public ObjectRead {
        objects = List.copyOf(objects);
    }

    public boolean isMissing() { return objects.isEmpty(); }
}
