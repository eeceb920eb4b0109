package com.example.typedcsv.reader;

import com.example.typedcsv.codec.NextField;
import com.example.typedcsv.codec.RecordSource;
import com.example.typedcsv.exceptions.CsvException;
import com.example.typedcsv.exceptions.ExtraDataColumnsException;
import com.example.typedcsv.mapping.ColumnMapper;
import com.example.typedcsv.mapping.ColumnMapping;
import com.example.typedcsv.mapping.FieldNames;
import com.example.typedcsv.mapping.MatchPolicy;
import com.example.typedcsv.shape.Shape;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.OptionalInt;

/**
 * One pass over the records of a CSV input, decoded into {@code T}.
 * <p>
 * The header row is read and reconciled with the shape's field names once,
 * before the first record. Any failure, whether in the headers or in a record,
 * is thrown from {@link #next()} exactly once and ends the iteration: the
 * position of the underlying parser is not trusted after an error.
 * An empty header row means the input holds no records.
 */
@Slf4j
public final class DecodedRecords<T> implements Iterator<T>, Iterable<T>, AutoCloseable {

    private final RecordSource source;
    private final Shape<T> shape;
    private final MatchPolicy policy;

    private boolean headerProcessed;
    private boolean terminated;
    private List<String> headers = Collections.emptyList();
    private FieldNames fieldNames;
    private ColumnMapping mapping;

    private T pending;
    private boolean hasPending;
    private CsvException pendingError;
    private long recordCount;

    DecodedRecords(RecordSource source, Shape<T> shape, MatchPolicy policy) {
        this.source = source;
        this.shape = shape;
        this.policy = policy;
    }

    /**
     * The header row of the input, empty if the input is empty or could not be read.
     */
    public List<String> headers() {
        processHeader();
        return headers;
    }

    /**
     * How columns feed the fields of the shape; empty if the input holds no
     * records or the headers could not be matched (the error is then thrown by {@link #next()}).
     */
    public Optional<ColumnMapping> columnMapping() {
        processHeader();
        return Optional.ofNullable(mapping);
    }

    private void processHeader() {
        if (headerProcessed) {
            return;
        }
        headerProcessed = true;
        try {
            headers = source.readHeaderRow();
            if (headers.isEmpty()) {
                log.debug("Empty header row; no records to decode into {}", shape.name());
                terminated = true;
                return;
            }
            fieldNames = FieldNames.of(shape);
            mapping = ColumnMapper.map(headers, fieldNames.names(), policy);
            log.debug("Mapped headers {} to {} fields {} of {}: {}",
                    headers, fieldNames.size(), fieldNames.names(), shape.name(), mapping);
        } catch (CsvException e) {
            fail(e);
        } catch (RuntimeException e) {
            terminated = true;
            throw e;
        }
    }

    @Override
    public boolean hasNext() {
        processHeader();
        if (!hasPending && pendingError == null && !terminated) {
            advance();
        }
        return hasPending || pendingError != null;
    }

    @Override
    public T next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        if (pendingError != null) {
            CsvException e = pendingError;
            pendingError = null;
            throw e;
        }
        T value = pending;
        pending = null;
        hasPending = false;
        return value;
    }

    private void advance() {
        try {
            List<String> row = readRow();
            if (row == null) {
                terminated = true;
                return;
            }
            pending = RowDecoder.decode(shape, row);
            hasPending = true;
            recordCount++;
        } catch (CsvException e) {
            fail(e);
        } catch (RuntimeException e) {
            terminated = true;
            throw e;
        }
    }

    /**
     * Reads the next record into leaf order, or returns {@code null} at the end of the input.
     */
    private List<String> readRow() {
        List<String> row = new ArrayList<>(Collections.nCopies(fieldNames.leafCount(), ""));
        int column = 0;
        while (true) {
            NextField next = source.readNextField();
            switch (next.getKind()) {
                case END_OF_INPUT:
                    if (column == 0) {
                        return null;
                    }
                    return row;
                case END_OF_RECORD:
                    return row;
                default:
                    if (column >= mapping.columnCount()) {
                        throw new ExtraDataColumnsException(recordCount + 1, mapping.columnCount());
                    }
                    OptionalInt field = mapping.fieldFor(column);
                    if (field.isPresent()) {
                        row.set(fieldNames.leafIndex(field.getAsInt()), next.getValue());
                    }
                    column++;
            }
        }
    }

    private void fail(CsvException e) {
        log.debug("Decoding {} stopped after {} records: {}", shape.name(), recordCount, e.getMessage());
        terminated = true;
        pendingError = e;
    }

    @Override
    public Iterator<T> iterator() {
        return this;
    }

    /**
     * Decodes all remaining records.
     *
     * @throws CsvException the first failure encountered
     */
    public List<T> toList() {
        List<T> records = new ArrayList<>();
        while (hasNext()) {
            records.add(next());
        }
        return records;
    }

    public long recordCount() {
        return recordCount;
    }

    @Override
    public void close() {
        log.info("Decoded {} records of {}", recordCount, shape.name());
        source.close();
    }
}
