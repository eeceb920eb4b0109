package com.example.typedcsv.codec;

import java.io.Closeable;
import java.util.List;

/**
 * Field-at-a-time view of a CSV parser. Quoting, escaping and record framing
 * are the parser's business; failures surface as
 * {@link com.example.typedcsv.exceptions.CodecException}.
 */
public interface RecordSource extends Closeable {

    /**
     * Returns the first record of the input, or an empty list if there is none.
     * Calling it again returns the same row without consuming input.
     */
    List<String> readHeaderRow();

    NextField readNextField();

    @Override
    void close();
}
