package com.example.typedcsv.codec;

import java.io.Reader;
import java.io.Writer;

/**
 * CSV library backing a session: Apache Commons CSV or uniVocity-parsers.
 */
public enum CsvCodec {

    COMMONS {
        @Override
        public RecordSource openSource(Reader reader, CsvFormatConfig cfg) {
            return new CommonsCsvRecordSource(reader, cfg);
        }

        @Override
        public RecordSink openSink(Writer writer, CsvFormatConfig cfg) {
            return new CommonsCsvRecordSink(writer, cfg);
        }
    },

    UNIVOCITY {
        @Override
        public RecordSource openSource(Reader reader, CsvFormatConfig cfg) {
            return new UniVocityRecordSource(reader, cfg);
        }

        @Override
        public RecordSink openSink(Writer writer, CsvFormatConfig cfg) {
            return new UniVocityRecordSink(writer, cfg);
        }
    };

    public abstract RecordSource openSource(Reader reader, CsvFormatConfig cfg);

    public abstract RecordSink openSink(Writer writer, CsvFormatConfig cfg);

    /**
     * Resolves {@code "commons"} or {@code "univocity"}, ignoring case; anything else is uniVocity.
     */
    public static CsvCodec fromName(String name) {
        return "commons".equalsIgnoreCase(name) ? COMMONS : UNIVOCITY;
    }
}
