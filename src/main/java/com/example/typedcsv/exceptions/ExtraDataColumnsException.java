package com.example.typedcsv.exceptions;

import lombok.Getter;

@Getter
public class ExtraDataColumnsException extends CsvException {

    private final long recordNumber;
    private final int headerCount;

    public ExtraDataColumnsException(long recordNumber, int headerCount) {
        super("More data columns than headers in record " + recordNumber + " (" + headerCount + " headers)");
        this.recordNumber = recordNumber;
        this.headerCount = headerCount;
    }
}
