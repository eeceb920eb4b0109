package com.example.typedcsv.exceptions;

import lombok.Getter;

/**
 * The header row is narrower or wider than the active match policy allows.
 */
@Getter
public class HeaderCountMismatchException extends CsvException {

    private final int expected;
    private final int actual;

    public HeaderCountMismatchException(int expected, int actual) {
        super("The record type has " + expected + " field names, but there are " + actual + " headers");
        this.expected = expected;
        this.actual = actual;
    }
}
