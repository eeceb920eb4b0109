package com.example.typedcsv.codec;

import com.ibm.icu.text.CharsetDetector;
import com.ibm.icu.text.CharsetMatch;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Charset lookup for file inputs.
 */
@Slf4j
public final class Charsets {

    /** Below this ICU confidence the detected charset is not trusted. */
    static final int MIN_CONFIDENCE = 50;

    /** Bytes inspected by {@link #detect}. */
    static final int SAMPLE_SIZE = 8192;

    private Charsets() {}

    /**
     * Resolves {@code name} with {@link Charset#forName}; UTF-8 if it is blank or unknown.
     */
    public static Charset resolve(String name) {
        if (name == null || name.trim().isEmpty()) return StandardCharsets.UTF_8;
        try {
            return Charset.forName(name.trim());
        } catch (IllegalArgumentException e) {
            log.warn("Unknown charset '{}', falling back to UTF-8", name);
            return StandardCharsets.UTF_8;
        }
    }

    /**
     * Guesses the charset of {@code in} from its first {@value #SAMPLE_SIZE} bytes.
     * The stream must support mark/reset; its position is left unchanged.
     * <p>
     * A pure ASCII sample says nothing about the rest of the input and reads as UTF-8,
     * as does a sample ICU4J cannot place with enough confidence.
     */
    public static Charset detect(InputStream in) throws IOException {
        in.mark(SAMPLE_SIZE);
        byte[] sample;
        try {
            sample = in.readNBytes(SAMPLE_SIZE);
        } finally {
            in.reset();
        }
        if (isAscii(sample)) {
            log.debug("ASCII sample of {} bytes, using UTF-8", sample.length);
            return StandardCharsets.UTF_8;
        }
        CharsetDetector detector = new CharsetDetector();
        detector.setText(sample);
        CharsetMatch match = detector.detect();
        if (match == null || match.getConfidence() < MIN_CONFIDENCE) {
            log.debug("No confident charset match, using UTF-8");
            return StandardCharsets.UTF_8;
        }
        log.debug("Detected charset {} (confidence {})", match.getName(), match.getConfidence());
        return resolve(match.getName());
    }

    private static boolean isAscii(byte[] bytes) {
        for (byte b : bytes) {
            if (b < 0) {
                return false;
            }
        }
        return true;
    }
}
