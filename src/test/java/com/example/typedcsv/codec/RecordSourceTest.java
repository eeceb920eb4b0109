package com.example.typedcsv.codec;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.EnumSource;

import java.io.StringReader;
import java.io.StringWriter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertSame;

class RecordSourceTest {

    private static List<List<String>> drain(RecordSource source) {
        List<List<String>> rows = new ArrayList<>();
        List<String> row = new ArrayList<>();
        while (true) {
            NextField field = source.readNextField();
            if (field.getKind() == NextField.Kind.END_OF_INPUT) {
                return rows;
            }
            if (field.getKind() == NextField.Kind.END_OF_RECORD) {
                rows.add(row);
                row = new ArrayList<>();
            } else {
                row.add(field.getValue());
            }
        }
    }

    @ParameterizedTest
    @EnumSource(CsvCodec.class)
    void headerIsReadOnce(CsvCodec codec) {
        try (RecordSource source = codec.openSource(new StringReader("a,b\n0,1\n"), new CsvFormatConfig())) {
            List<String> header = source.readHeaderRow();
            assertEquals(Arrays.asList("a", "b"), header);
            assertSame(header, source.readHeaderRow());
            assertEquals(Collections.singletonList(Arrays.asList("0", "1")), drain(source));
        }
    }

    @ParameterizedTest
    @EnumSource(CsvCodec.class)
    void fieldsWithoutHeaderCallSkipTheHeader(CsvCodec codec) {
        try (RecordSource source = codec.openSource(new StringReader("a,b\n0,1\n2\n"), new CsvFormatConfig())) {
            assertEquals(Arrays.asList(Arrays.asList("0", "1"), Collections.singletonList("2")), drain(source));
        }
    }

    @ParameterizedTest
    @EnumSource(CsvCodec.class)
    void emptyInput(CsvCodec codec) {
        try (RecordSource source = codec.openSource(new StringReader(""), new CsvFormatConfig())) {
            assertEquals(Collections.emptyList(), source.readHeaderRow());
            assertEquals(NextField.Kind.END_OF_INPUT, source.readNextField().getKind());
        }
    }

    @ParameterizedTest
    @EnumSource(CsvCodec.class)
    void quotedAndBlankLines(CsvCodec codec) {
        String data = "x\n\"a,b\"\n\n\"\"\"q\"\"\"\n";
        try (RecordSource source = codec.openSource(new StringReader(data), new CsvFormatConfig())) {
            source.readHeaderRow();
            assertEquals(Arrays.asList(Collections.singletonList("a,b"), Collections.singletonList("\"q\"")),
                    drain(source));
        }
    }

    @ParameterizedTest
    @EnumSource(CsvCodec.class)
    void sinkQuotesLoneEmptyField(CsvCodec codec) {
        StringWriter out = new StringWriter();
        try (RecordSink sink = codec.openSink(out, new CsvFormatConfig())) {
            sink.writeRow(Collections.singletonList("x"));
            sink.writeRow(Collections.singletonList(""));
            sink.writeRow(Arrays.asList("1", ""));
        }
        assertEquals("x\n\"\"\n1,\n", out.toString());
    }

    @Test
    void codecByName() {
        assertEquals(CsvCodec.COMMONS, CsvCodec.fromName("commons"));
        assertEquals(CsvCodec.COMMONS, CsvCodec.fromName("Commons"));
        assertEquals(CsvCodec.UNIVOCITY, CsvCodec.fromName("univocity"));
        assertEquals(CsvCodec.UNIVOCITY, CsvCodec.fromName(null));
    }

    @Test
    void asciiConfig() {
        CsvFormatConfig cfg = new CsvFormatConfig().ascii();
        assertEquals('\u001f', cfg.getDelimiter());
        assertEquals("\u001e", cfg.getRecordSeparator());
        assertEquals(null, cfg.getQuoteChar());
        assertEquals(cfg, cfg.copy());
    }

    @Test
    void quoteEscapeFollowsDoubleQuote() {
        CsvFormatConfig cfg = new CsvFormatConfig();
        assertEquals(null, cfg.quoteEscapeChar());
        cfg.setDoubleQuote(false);
        assertEquals(Character.valueOf('\\'), cfg.quoteEscapeChar());
        cfg.setEscapeChar('~');
        assertEquals(Character.valueOf('~'), cfg.quoteEscapeChar());
        assertEquals(false, cfg.copy().isDoubleQuote());
    }
}
