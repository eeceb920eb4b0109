package com.example.typedcsv.exceptions;

import lombok.Getter;

@Getter
public class LeafEncodeException extends CsvException {

    private final String recordType;
    private final String leafPath;

    public LeafEncodeException(String recordType, String leafPath, String reason) {
        super(recordType + "." + (leafPath.isEmpty() ? "<root>" : leafPath) + ": " + reason);
        this.recordType = recordType;
        this.leafPath = leafPath;
    }
}
