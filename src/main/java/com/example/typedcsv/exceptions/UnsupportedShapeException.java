package com.example.typedcsv.exceptions;

/**
 * The record shape cannot be laid out as one flat row, e.g. a named field
 * holding more than one leaf.
 */
public class UnsupportedShapeException extends CsvException {

    public UnsupportedShapeException(String message) {
        super(message);
    }
}
