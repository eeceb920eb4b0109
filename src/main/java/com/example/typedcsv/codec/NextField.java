package com.example.typedcsv.codec;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;

/**
 * One step of field-at-a-time reading: a field value, the end of the current record, or the end of the input.
 */
@Getter
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public final class NextField {

    public enum Kind { DATA, END_OF_RECORD, END_OF_INPUT }

    public static final NextField END_OF_RECORD = new NextField(Kind.END_OF_RECORD, null);
    public static final NextField END_OF_INPUT = new NextField(Kind.END_OF_INPUT, null);

    private final Kind kind;
    private final String value;

    public static NextField data(String value) {
        return new NextField(Kind.DATA, value == null ? "" : value);
    }

    @Override
    public String toString() {
        return kind == Kind.DATA ? "DATA(" + value + ")" : kind.name();
    }
}
