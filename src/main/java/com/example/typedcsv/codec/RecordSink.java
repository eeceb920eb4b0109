package com.example.typedcsv.codec;

import java.io.Closeable;
import java.io.Flushable;
import java.util.List;

/**
 * Row-at-a-time view of a CSV printer.
 */
public interface RecordSink extends Closeable, Flushable {

    void writeRow(List<String> fields);

    @Override
    void flush();

    @Override
    void close();
}
