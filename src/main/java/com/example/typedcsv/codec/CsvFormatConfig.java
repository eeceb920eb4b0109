package com.example.typedcsv.codec;

import lombok.Data;

/**
 * Dialect settings handed through to the CSV library.
 */
@Data
public class CsvFormatConfig {
    private char delimiter = ',';
    /** {@code null} disables quoting. */
    private Character quoteChar = '"';
    /** {@code null} means quotes are escaped by doubling, or by a backslash when {@link #doubleQuote} is off. */
    private Character escapeChar = null;
    private boolean doubleQuote = true;
    private String recordSeparator = "\n";
    private boolean trim = false;
    private boolean skipEmptyLines = true;
    private int maxCharsPerColumn = 1_000_000;

    public CsvFormatConfig copy() {
        CsvFormatConfig c = new CsvFormatConfig();
        c.setDelimiter(delimiter);
        c.setQuoteChar(quoteChar);
        c.setEscapeChar(escapeChar);
        c.setDoubleQuote(doubleQuote);
        c.setRecordSeparator(recordSeparator);
        c.setTrim(trim);
        c.setSkipEmptyLines(skipEmptyLines);
        c.setMaxCharsPerColumn(maxCharsPerColumn);
        return c;
    }

    /**
     * The character escaping a quote inside a quoted field, or {@code null} when quotes are doubled.
     */
    public Character quoteEscapeChar() {
        if (escapeChar != null) {
            return escapeChar;
        }
        return doubleQuote ? null : Character.valueOf('\\');
    }

    /**
     * ASCII delimited text: unit separator between fields, record separator between records, no quoting.
     */
    public CsvFormatConfig ascii() {
        setDelimiter('\u001f');
        setRecordSeparator("\u001e");
        setQuoteChar(null);
        return this;
    }
}
