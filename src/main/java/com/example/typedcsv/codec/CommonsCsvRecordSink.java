package com.example.typedcsv.codec;

import com.example.typedcsv.exceptions.CodecException;
import org.apache.commons.csv.CSVPrinter;

import java.io.IOException;
import java.io.Writer;
import java.util.List;

/**
 * Apache Commons CSV printer. With quoting enabled a record made of a single
 * empty field is printed as {@code ""}, so it is not mistaken for a blank line.
 */
public class CommonsCsvRecordSink implements RecordSink {

    private final CSVPrinter printer;

    public CommonsCsvRecordSink(Writer writer, CsvFormatConfig cfg) {
        try {
            this.printer = new CSVPrinter(writer, CommonsCsvRecordSource.format(cfg));
        } catch (IOException e) {
            throw new CodecException("Could not open CSV output: " + e.getMessage(), e);
        }
    }

    @Override
    public void writeRow(List<String> fields) {
        try {
            printer.printRecord(fields);
        } catch (IOException e) {
            throw new CodecException("Could not write CSV record: " + e.getMessage(), e);
        }
    }

    @Override
    public void flush() {
        try {
            printer.flush();
        } catch (IOException e) {
            throw new CodecException("Could not flush CSV output: " + e.getMessage(), e);
        }
    }

    @Override
    public void close() {
        try {
            printer.close(true);
        } catch (IOException e) {
            throw new CodecException("Could not close CSV output: " + e.getMessage(), e);
        }
    }
}
