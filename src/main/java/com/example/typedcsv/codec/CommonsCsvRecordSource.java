package com.example.typedcsv.codec;

import com.example.typedcsv.exceptions.CodecException;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.Reader;
import java.io.UncheckedIOException;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

/**
 * Apache Commons CSV implementation. Commons CSV only recognizes CR and LF as
 * record terminators when parsing; the configured record separator applies to output.
 */
@Slf4j
public class CommonsCsvRecordSource implements RecordSource {

    private final CSVParser parser;
    private final Iterator<CSVRecord> records;
    private List<String> header;
    private CSVRecord current;
    private int column;

    public CommonsCsvRecordSource(Reader reader, CsvFormatConfig cfg) {
        try {
            this.parser = format(cfg).parse(reader);
        } catch (IOException e) {
            throw new CodecException("Could not open CSV input: " + e.getMessage(), e);
        }
        this.records = parser.iterator();
    }

    static CSVFormat format(CsvFormatConfig cfg) {
        return CSVFormat.DEFAULT
                .withDelimiter(cfg.getDelimiter())
                .withQuote(cfg.getQuoteChar())
                .withEscape(cfg.quoteEscapeChar())
                .withRecordSeparator(cfg.getRecordSeparator())
                .withIgnoreEmptyLines(cfg.isSkipEmptyLines())
                .withIgnoreSurroundingSpaces(cfg.isTrim());
    }

    @Override
    public List<String> readHeaderRow() {
        if (header == null) {
            CSVRecord first = nextRecord();
            header = first == null ? Collections.emptyList() : Collections.unmodifiableList(toList(first));
            log.debug("commons-csv header row: {}", header);
        }
        return header;
    }

    @Override
    public NextField readNextField() {
        readHeaderRow();
        if (current == null) {
            current = nextRecord();
            column = 0;
            if (current == null) {
                return NextField.END_OF_INPUT;
            }
        }
        if (column < current.size()) {
            return NextField.data(current.get(column++));
        }
        current = null;
        return NextField.END_OF_RECORD;
    }

    private CSVRecord nextRecord() {
        try {
            return records.hasNext() ? records.next() : null;
        } catch (UncheckedIOException | IllegalStateException e) {
            throw new CodecException("commons-csv failed after record " + parser.getRecordNumber()
                    + ": " + e.getMessage(), e);
        }
    }

    private static List<String> toList(CSVRecord record) {
        List<String> values = new ArrayList<>(record.size());
        for (String value : record) {
            values.add(value);
        }
        return values;
    }

    @Override
    public void close() {
        try {
            parser.close();
        } catch (IOException e) {
            throw new CodecException("Could not close CSV input: " + e.getMessage(), e);
        }
    }
}
