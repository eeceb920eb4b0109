package com.example.typedcsv.mapping;

/**
 * Decides whether a header names a field.
 */
@FunctionalInterface
public interface HeaderMatcher {

    HeaderMatcher EXACT = String::equals;

    HeaderMatcher ASCII_CASE_INSENSITIVE = HeaderMatcher::equalsIgnoreAsciiCase;

    boolean matches(String header, String fieldName);

    static boolean equalsIgnoreAsciiCase(String a, String b) {
        if (a.length() != b.length()) {
            return false;
        }
        for (int i = 0; i < a.length(); i++) {
            if (toLowerAscii(a.charAt(i)) != toLowerAscii(b.charAt(i))) {
                return false;
            }
        }
        return true;
    }

    private static char toLowerAscii(char c) {
        return c >= 'A' && c <= 'Z' ? (char) (c + ('a' - 'A')) : c;
    }
}
