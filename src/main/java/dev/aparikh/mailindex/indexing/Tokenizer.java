package dev.aparikh.mailindex.indexing;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits text into lower-cased runs of ASCII letters and digits.
 * Every other character, including non-ASCII letters, ends the current token and is dropped.
 */
public final class Tokenizer {

    private Tokenizer() {
    }

    public static List<String> tokenize(String text) {
        if (text == null || text.isEmpty()) return List.of();

        List<String> out = new ArrayList<>();
        StringBuilder word = new StringBuilder();
        for (int i = 0; i < text.length(); i++) {
            char ch = toLowerAscii(text.charAt(i));
            if (isAlphanumericAscii(ch)) {
                word.append(ch);
            } else if (word.length() > 0) {
                out.add(word.toString());
                word.setLength(0);
            }
        }
        if (word.length() > 0) {
            out.add(word.toString());
        }
        return out;
    }

    /**
     * Lower-cases a query term with the same rule used at ingestion. No other normalization.
     */
    public static String normalize(String term) {
        if (term == null) return "";
        StringBuilder sb = new StringBuilder(term.length());
        for (int i = 0; i < term.length(); i++) {
            sb.append(toLowerAscii(term.charAt(i)));
        }
        return sb.toString();
    }

    private static char toLowerAscii(char ch) {
        return (ch >= 'A' && ch <= 'Z') ? (char) (ch + ('a' - 'A')) : ch;
    }

    private static boolean isAlphanumericAscii(char ch) {
        return (ch >= 'a' && ch <= 'z') || (ch >= '0' && ch <= '9');
    }
}
