package com.example.typedcsv.codec;

import com.example.typedcsv.exceptions.CodecException;
import com.univocity.parsers.common.TextParsingException;
import com.univocity.parsers.csv.CsvFormat;
import com.univocity.parsers.csv.CsvParser;
import com.univocity.parsers.csv.CsvParserSettings;
import lombok.extern.slf4j.Slf4j;

import java.io.Reader;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * uniVocity parser implementation. Unlike Commons CSV it honours a custom
 * record separator when parsing, which {@link CsvFormatConfig#ascii()} relies on.
 */
@Slf4j
public class UniVocityRecordSource implements RecordSource {

    private final CsvParser parser;
    private List<String> header;
    private String[] current;
    private int column;

    public UniVocityRecordSource(Reader reader, CsvFormatConfig cfg) {
        this.parser = new CsvParser(settings(cfg));
        try {
            parser.beginParsing(reader);
        } catch (TextParsingException e) {
            throw new CodecException("uniVocity could not start parsing: " + e.getMessage(), e);
        }
    }

    static CsvParserSettings settings(CsvFormatConfig cfg) {
        CsvParserSettings settings = new CsvParserSettings();
        configure(settings.getFormat(), cfg);
        if (isNewline(cfg.getRecordSeparator())) {
            settings.setLineSeparatorDetectionEnabled(true);
        }
        settings.setIgnoreLeadingWhitespaces(cfg.isTrim());
        settings.setIgnoreTrailingWhitespaces(cfg.isTrim());
        settings.setSkipEmptyLines(cfg.isSkipEmptyLines());
        settings.setNullValue("");
        settings.setEmptyValue("");
        settings.setMaxCharsPerColumn(cfg.getMaxCharsPerColumn());
        return settings;
    }

    static void configure(CsvFormat format, CsvFormatConfig cfg) {
        format.setDelimiter(cfg.getDelimiter());
        // uniVocity has no "no quote" setting; NUL never occurs in text data
        format.setQuote(cfg.getQuoteChar() == null ? '\0' : cfg.getQuoteChar());
        Character escape = cfg.quoteEscapeChar();
        if (escape != null) {
            format.setQuoteEscape(escape);
        } else if (cfg.getQuoteChar() != null) {
            format.setQuoteEscape(cfg.getQuoteChar());
        }
        format.setLineSeparator(cfg.getRecordSeparator());
    }

    private static boolean isNewline(String separator) {
        return "\n".equals(separator) || "\r\n".equals(separator) || "\r".equals(separator);
    }

    @Override
    public List<String> readHeaderRow() {
        if (header == null) {
            String[] first = nextRow();
            header = first == null ? Collections.emptyList() : Collections.unmodifiableList(Arrays.asList(first));
            log.debug("uniVocity header row: {}", header);
        }
        return header;
    }

    @Override
    public NextField readNextField() {
        readHeaderRow();
        if (current == null) {
            current = nextRow();
            column = 0;
            if (current == null) {
                return NextField.END_OF_INPUT;
            }
        }
        if (column < current.length) {
            return NextField.data(current[column++]);
        }
        current = null;
        return NextField.END_OF_RECORD;
    }

    private String[] nextRow() {
        try {
            return parser.parseNext();
        } catch (TextParsingException e) {
            throw new CodecException("uniVocity failed at line " + e.getLineIndex() + ": " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        parser.stopParsing();
    }
}
