package com.example.typedcsv.exceptions;

/**
 * Failure reported by the underlying CSV library or the stream beneath it.
 */
public class CodecException extends CsvException {

    public CodecException(String message, Throwable cause) {
        super(message, cause);
    }
}
