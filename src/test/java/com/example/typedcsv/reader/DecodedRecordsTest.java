package com.example.typedcsv.reader;

import com.example.typedcsv.TestShapes;
import com.example.typedcsv.TestShapes.Simple;
import com.example.typedcsv.exceptions.ExtraDataColumnsException;
import com.example.typedcsv.exceptions.HeaderNameMismatchException;
import com.example.typedcsv.exceptions.LeafDecodeException;
import com.example.typedcsv.mapping.ColumnMapping;
import com.example.typedcsv.mapping.HeaderMatcher;
import com.example.typedcsv.mapping.MatchPolicy;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class DecodedRecordsTest {

    @Test
    void headersAreReconciledOnce() {
        AtomicInteger comparisons = new AtomicInteger();
        HeaderMatcher counting = (header, field) -> {
            comparisons.incrementAndGet();
            return header.equals(field);
        };
        ListRecordSource source = new ListRecordSource(row("a", "b"), row("0", "1"), row("2", "3"));
        DecodedRecords<Simple> records = new DecodedRecords<>(source, TestShapes.SIMPLE,
                MatchPolicy.builder().headerMatcher(counting).build());

        assertEquals(row("a", "b"), records.headers());
        Optional<ColumnMapping> mapping = records.columnMapping();
        assertTrue(mapping.isPresent());
        assertEquals(row("a", "b"), records.headers());
        assertTrue(records.hasNext());
        assertTrue(records.hasNext());

        assertEquals(Arrays.asList(new Simple(0, 1), new Simple(2, 3)), records.toList());
        assertEquals(1, source.headerReads);
        assertEquals(2, comparisons.get());
        assertEquals(2, records.recordCount());
    }

    @Test
    void emptyHeaderRowMeansNoRecords() {
        ListRecordSource source = new ListRecordSource(row());
        DecodedRecords<Simple> records = new DecodedRecords<>(source, TestShapes.SIMPLE, MatchPolicy.STRICT);
        assertFalse(records.hasNext());
        assertEquals(Optional.empty(), records.columnMapping());
        assertEquals(0, source.fieldReads);
        assertThrows(NoSuchElementException.class, records::next);
    }

    @Test
    void headerErrorIsThrownOnceThenIterationEnds() {
        ListRecordSource source = new ListRecordSource(row("b", "a"), row("0", "1"));
        DecodedRecords<Simple> records = new DecodedRecords<>(source, TestShapes.SIMPLE, MatchPolicy.STRICT);
        assertEquals(Optional.empty(), records.columnMapping());
        assertTrue(records.hasNext());
        assertThrows(HeaderNameMismatchException.class, records::next);
        assertFalse(records.hasNext());
        assertEquals(0, source.fieldReads);
    }

    @Test
    void extraDataColumnsEndTheSession() {
        ListRecordSource source = new ListRecordSource(row("a", "b"), row("0", "1"), row("2", "3", "4"), row("5", "6"));
        DecodedRecords<Simple> records = new DecodedRecords<>(source, TestShapes.SIMPLE, MatchPolicy.STRICT);
        assertEquals(new Simple(0, 1), records.next());
        ExtraDataColumnsException e = assertThrows(ExtraDataColumnsException.class, records::next);
        assertEquals(2, e.getRecordNumber());
        assertFalse(records.hasNext());
    }

    @Test
    void leafFailureEndsTheSession() {
        ListRecordSource source = new ListRecordSource(row("a", "b"), row("x", "1"), row("2", "3"));
        DecodedRecords<Simple> records = new DecodedRecords<>(source, TestShapes.SIMPLE, MatchPolicy.STRICT);
        LeafDecodeException e = assertThrows(LeafDecodeException.class, records::next);
        assertEquals("Simple", e.getRecordType());
        assertEquals("a", e.getLeafPath());
        assertEquals("x", e.getText());
        assertEquals("Simple.a: could not convert 'x' to int", e.getMessage());
        assertFalse(records.hasNext());
    }

    @Test
    void ignoredColumnsAreNeverDecoded() {
        ListRecordSource source = new ListRecordSource(row("a", "junk", "b"), row("0", "not a number", "1"));
        DecodedRecords<Simple> records = new DecodedRecords<>(source, TestShapes.SIMPLE,
                MatchPolicy.builder().ignoreUnusedColumns(true).build());
        assertEquals(Collections.singletonList(new Simple(0, 1)), records.toList());
    }

    @Test
    void closeClosesTheSource() {
        ListRecordSource source = new ListRecordSource(row("a", "b"));
        new DecodedRecords<>(source, TestShapes.SIMPLE, MatchPolicy.STRICT).close();
        assertTrue(source.closed);
    }

    private static List<String> row(String... values) {
        return Arrays.asList(values);
    }
}
