package com.example.typedcsv.exceptions;

import lombok.Getter;

/**
 * A raw field could not be parsed into the scalar type of its leaf.
 * {@code recordType} is filled in once the failure leaves the row decoder.
 */
@Getter
public class LeafDecodeException extends CsvException {

    private final String recordType;
    private final String leafPath;
    private final String text;
    private final String reason;

    public LeafDecodeException(String leafPath, String text, String reason) {
        this(null, leafPath, text, reason, null);
    }

    public LeafDecodeException(String leafPath, String text, String reason, Throwable cause) {
        this(null, leafPath, text, reason, cause);
    }

    private LeafDecodeException(String recordType, String leafPath, String text, String reason, Throwable cause) {
        super((recordType == null ? "" : recordType + ".")
                + (leafPath.isEmpty() ? "<root>" : leafPath) + ": " + reason, cause);
        this.recordType = recordType;
        this.leafPath = leafPath;
        this.text = text;
        this.reason = reason;
    }

    public LeafDecodeException withRecordType(String recordType) {
        return new LeafDecodeException(recordType, leafPath, text, reason, getCause());
    }
}
