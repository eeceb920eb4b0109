package com.example.typedcsv.exceptions;

/**
 * Root of every failure raised while matching headers or marshalling rows.
 * Unchecked because decoded records are handed out through {@link java.util.Iterator}.
 */
public abstract class CsvException extends RuntimeException {

    protected CsvException(String message) {
        super(message);
    }

    protected CsvException(String message, Throwable cause) {
        super(message, cause);
    }
}
