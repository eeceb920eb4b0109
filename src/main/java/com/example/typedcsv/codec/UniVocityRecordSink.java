package com.example.typedcsv.codec;

import com.example.typedcsv.exceptions.CodecException;
import com.univocity.parsers.csv.CsvWriter;
import com.univocity.parsers.csv.CsvWriterSettings;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * uniVocity writer implementation.
 */
public class UniVocityRecordSink implements RecordSink {

    private final Writer out;
    private final CsvFormatConfig cfg;
    private final CsvWriter writer;

    public UniVocityRecordSink(Writer out, CsvFormatConfig cfg) {
        this.out = out;
        this.cfg = cfg;
        CsvWriterSettings settings = new CsvWriterSettings();
        UniVocityRecordSource.configure(settings.getFormat(), cfg);
        settings.setIgnoreLeadingWhitespaces(cfg.isTrim());
        settings.setIgnoreTrailingWhitespaces(cfg.isTrim());
        settings.setNullValue("");
        settings.setQuoteEscapingEnabled(true);
        settings.setMaxCharsPerColumn(cfg.getMaxCharsPerColumn());
        this.writer = new CsvWriter(out, settings);
    }

    @Override
    public void writeRow(List<String> fields) {
        if (fields.size() == 1 && fields.get(0).isEmpty() && cfg.getQuoteChar() != null) {
            // uniVocity would print a blank line
            writeQuotedEmptyRecord();
            return;
        }
        writer.writeRow(fields);
    }

    private void writeQuotedEmptyRecord() {
        writer.flush();
        try {
            out.write(cfg.getQuoteChar());
            out.write(cfg.getQuoteChar());
            out.write(cfg.getRecordSeparator());
        } catch (IOException e) {
            throw new CodecException("Could not write CSV record: " + e.getMessage(), e);
        }
    }

    @Override
    public void flush() {
        writer.flush();
    }

    @Override
    public void close() {
        writer.close();
    }
}
