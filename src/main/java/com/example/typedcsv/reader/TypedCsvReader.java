package com.example.typedcsv.reader;

import com.example.typedcsv.codec.Charsets;
import com.example.typedcsv.codec.CsvCodec;
import com.example.typedcsv.codec.CsvFormatConfig;
import com.example.typedcsv.mapping.HeaderMatcher;
import com.example.typedcsv.mapping.MatchPolicy;
import com.example.typedcsv.shape.Shape;
import lombok.extern.slf4j.Slf4j;

import java.io.BufferedInputStream;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/**
 * A CSV reader that checks the header row against the field names of the record shape.
 * <pre>{@code
 * try (DecodedRecords<Animal> rows = TypedCsvReader.fromFile(path).reorder(true).decode(ANIMAL)) {
 *     for (Animal animal : rows) { ... }
 * }
 * }</pre>
 * Options must be set before {@link #decode}; a reader decodes its input once.
 */
@Slf4j
public class TypedCsvReader {

    private final Reader input;
    private final CsvFormatConfig format = new CsvFormatConfig();
    private final MatchPolicy.MatchPolicyBuilder policy = MatchPolicy.builder();
    private CsvCodec codec = CsvCodec.COMMONS;
    private boolean decoded;

    private TypedCsvReader(Reader input) {
        this.input = Objects.requireNonNull(input, "input");
    }

    public static TypedCsvReader fromReader(Reader reader) {
        return new TypedCsvReader(reader);
    }

    public static TypedCsvReader fromString(String data) {
        return new TypedCsvReader(new StringReader(data));
    }

    /**
     * Reads UTF-8 encoded {@code data}.
     */
    public static TypedCsvReader fromBytes(byte[] data) {
        return new TypedCsvReader(new InputStreamReader(new ByteArrayInputStream(data), StandardCharsets.UTF_8));
    }

    /**
     * Opens {@code path}, guessing its charset.
     */
    public static TypedCsvReader fromFile(Path path) throws IOException {
        InputStream in = new BufferedInputStream(Files.newInputStream(path));
        try {
            Charset charset = Charsets.detect(in);
            log.debug("Reading {} as {}", path, charset);
            return new TypedCsvReader(new InputStreamReader(in, charset));
        } catch (IOException | RuntimeException e) {
            in.close();
            throw e;
        }
    }

    public static TypedCsvReader fromFile(Path path, String charsetName) throws IOException {
        Charset charset = Charsets.resolve(charsetName);
        return new TypedCsvReader(new InputStreamReader(Files.newInputStream(path), charset));
    }

    /**
     * Match headers to field names regardless of column order. Duplicate names keep their relative order.
     */
    public TypedCsvReader reorder(boolean reorder) {
        policy.reorderColumns(reorder);
        return this;
    }

    /**
     * Skip columns whose header matches no field instead of failing.
     */
    public TypedCsvReader ignoreUnusedColumns(boolean ignore) {
        policy.ignoreUnusedColumns(ignore);
        return this;
    }

    public TypedCsvReader ignoreAsciiCase(boolean ignore) {
        return headerMatcher(ignore ? HeaderMatcher.ASCII_CASE_INSENSITIVE : HeaderMatcher.EXACT);
    }

    public TypedCsvReader headerMatcher(HeaderMatcher matcher) {
        policy.headerMatcher(matcher);
        return this;
    }

    public TypedCsvReader policy(MatchPolicy matchPolicy) {
        return reorder(matchPolicy.isReorderColumns())
                .ignoreUnusedColumns(matchPolicy.isIgnoreUnusedColumns())
                .headerMatcher(matchPolicy.getHeaderMatcher());
    }

    public TypedCsvReader delimiter(char delimiter) {
        format.setDelimiter(delimiter);
        return this;
    }

    /**
     * @param quote the quote character, or {@code null} for no quoting
     */
    public TypedCsvReader quote(Character quote) {
        format.setQuoteChar(quote);
        return this;
    }

    /**
     * @param escape the character escaping quotes, or {@code null} to escape them by doubling
     */
    public TypedCsvReader escape(Character escape) {
        format.setEscapeChar(escape);
        return this;
    }

    /**
     * With {@code false}, a quote inside a quoted field is escaped by the escape
     * character (backslash unless {@link #escape} sets another) instead of being doubled.
     */
    public TypedCsvReader doubleQuote(boolean doubleQuote) {
        format.setDoubleQuote(doubleQuote);
        return this;
    }

    public TypedCsvReader recordSeparator(String separator) {
        format.setRecordSeparator(separator);
        return this;
    }

    public TypedCsvReader trim(boolean trim) {
        format.setTrim(trim);
        return this;
    }

    /**
     * Reads ASCII delimited text. Switches to the uniVocity parser, since Commons CSV
     * cannot split records on the ASCII record separator.
     */
    public TypedCsvReader ascii() {
        format.ascii();
        codec = CsvCodec.UNIVOCITY;
        return this;
    }

    public TypedCsvReader codec(CsvCodec csvCodec) {
        codec = Objects.requireNonNull(csvCodec, "codec");
        return this;
    }

    public <T> DecodedRecords<T> decode(Shape<T> shape) {
        if (decoded) {
            throw new IllegalStateException("decode() may only be called once per reader");
        }
        decoded = true;
        MatchPolicy matchPolicy = policy.build();
        log.debug("Decoding {} with {} and {}", shape.name(), codec, matchPolicy);
        return new DecodedRecords<>(codec.openSource(input, format.copy()), shape, matchPolicy);
    }
}
