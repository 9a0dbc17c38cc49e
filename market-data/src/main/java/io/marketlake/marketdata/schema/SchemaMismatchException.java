package io.marketlake.marketdata.schema;

/** A payload, table row or stored partition disagrees with the registered schema of its kind. */
public class SchemaMismatchException extends RuntimeException {
    public SchemaMismatchException(String message) { super(message); }
    public SchemaMismatchException(String message, Throwable cause) { super(message, cause); }
}
