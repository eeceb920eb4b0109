package com.example.typedcsv.exceptions;

public class HeaderNameMismatchException extends CsvException {

    public HeaderNameMismatchException(String detail) {
        super("Headers don't match field names: " + detail);
    }
}
