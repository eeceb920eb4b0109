package com.example.typedcsv.writer;

import com.example.typedcsv.codec.CsvCodec;
import com.example.typedcsv.codec.CsvFormatConfig;
import com.example.typedcsv.codec.RecordSink;
import com.example.typedcsv.mapping.FieldNames;
import com.example.typedcsv.shape.Shape;
import lombok.extern.slf4j.Slf4j;

import java.io.Closeable;
import java.io.Flushable;
import java.io.IOException;
import java.io.StringWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Collections;
import java.util.List;

/**
 * A CSV writer that writes the field names of the record shape as the header row.
 * <p>
 * The header is written just before the first record; a writer that encodes
 * nothing writes nothing. Output conforms to RFC 4180 except that the record
 * separator defaults to {@code \n}. A record with a single empty field is
 * written as {@code ""} so it cannot be read back as a blank line.
 */
@Slf4j
public class TypedCsvWriter<T> implements Flushable, Closeable {

    private final RecordSink sink;
    private final Shape<T> shape;
    private final StringWriter memory;
    private boolean firstRow = true;
    private long recordCount;

    private TypedCsvWriter(RecordSink sink, Shape<T> shape, StringWriter memory) {
        this.sink = sink;
        this.shape = shape;
        this.memory = memory;
    }

    public static <T> TypedCsvWriter<T> fromWriter(Writer writer, Shape<T> shape) {
        return fromWriter(writer, shape, new CsvFormatConfig(), CsvCodec.COMMONS);
    }

    public static <T> TypedCsvWriter<T> fromWriter(Writer writer, Shape<T> shape, CsvFormatConfig format, CsvCodec codec) {
        return new TypedCsvWriter<>(codec.openSink(writer, format.copy()), shape, null);
    }

    /**
     * Creates or truncates {@code path} and writes UTF-8 to it.
     */
    public static <T> TypedCsvWriter<T> fromFile(Path path, Shape<T> shape) throws IOException {
        return fromWriter(Files.newBufferedWriter(path, StandardCharsets.UTF_8), shape);
    }

    /**
     * Writes to an in-memory buffer, readable at any time with {@link #asString()}.
     */
    public static <T> TypedCsvWriter<T> toMemory(Shape<T> shape) {
        return toMemory(shape, new CsvFormatConfig(), CsvCodec.COMMONS);
    }

    public static <T> TypedCsvWriter<T> toMemory(Shape<T> shape, CsvFormatConfig format, CsvCodec codec) {
        StringWriter memory = new StringWriter();
        return new TypedCsvWriter<>(codec.openSink(memory, format.copy()), shape, memory);
    }

    /**
     * Writes {@code record} as one CSV record, preceded by the header row if it is the first.
     *
     * @throws com.example.typedcsv.exceptions.LeafEncodeException if a leaf cannot be rendered
     * @throws com.example.typedcsv.exceptions.UnsupportedShapeException if the shape cannot be laid out as a row
     */
    public void encode(T record) {
        if (firstRow) {
            FieldNames names = FieldNames.of(shape);
            log.debug("Writing header {} for {}", names.names(), shape.name());
            sink.writeRow(names.names());
            firstRow = false;
        }
        List<String> row = RowEncoder.encode(shape, record);
        sink.writeRow(row.isEmpty() ? Collections.singletonList("") : row);
        recordCount++;
    }

    public void encodeAll(Iterable<? extends T> records) {
        for (T record : records) {
            encode(record);
        }
    }

    /**
     * Everything written so far, for writers created with {@link #toMemory}.
     */
    public String asString() {
        if (memory == null) {
            throw new IllegalStateException("Not an in-memory writer");
        }
        sink.flush();
        return memory.toString();
    }

    /**
     * {@link #asString()} encoded as UTF-8.
     */
    public byte[] asBytes() {
        return asString().getBytes(StandardCharsets.UTF_8);
    }

    public long recordCount() {
        return recordCount;
    }

    @Override
    public void flush() {
        sink.flush();
    }

    @Override
    public void close() {
        try {
            sink.flush();
        } finally {
            sink.close();
            log.info("Wrote {} records of {}", recordCount, shape.name());
        }
    }
}
