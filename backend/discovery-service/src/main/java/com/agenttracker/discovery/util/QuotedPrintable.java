package com.agenttracker.discovery.util;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.regex.Pattern;

/**
 * Quoted-printable decoding.
 *
 * Newsletter bodies often arrive still encoded (=3D, =E2=80=99, soft breaks at line ends).
 * Runs of =XX escapes are collected as UTF-8 bytes and decoded together.
 */
public final class QuotedPrintable {

    private static final Pattern SOFT_LINE_BREAK = Pattern.compile("=\\r?\\n");
    private static final Pattern ENCODED_MARKER = Pattern.compile("=(?:3D|[0-9A-F]{2}=[0-9A-F]{2}|\\r?\\n)");

    private QuotedPrintable() {
    }

    /**
     * Whether the text carries quoted-printable artifacts
     */
    public static boolean looksEncoded(String text) {
        return text != null && ENCODED_MARKER.matcher(text).find();
    }

    /**
     * Decode only when the text looks encoded; otherwise return it unchanged.
     */
    public static String decodeIfEncoded(String text) {
        return looksEncoded(text) ? decode(text) : text;
    }

    public static String removeSoftBreaks(String text) {
        if (text == null) {
            return null;
        }
        return SOFT_LINE_BREAK.matcher(text).replaceAll("");
    }

    public static String decode(String text) {
        if (text == null || text.indexOf('=') < 0) {
            return text;
        }
        String joined = removeSoftBreaks(text);
        StringBuilder result = new StringBuilder(joined.length());
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        int length = joined.length();
        int i = 0;
        while (i < length) {
            char c = joined.charAt(i);
            if (c == '=' && i + 2 < length
                    && isHex(joined.charAt(i + 1)) && isHex(joined.charAt(i + 2))) {
                pending.write(Integer.parseInt(joined.substring(i + 1, i + 3), 16));
                i += 3;
                continue;
            }
            flush(pending, result);
            result.append(c);
            i++;
        }
        flush(pending, result);
        return result.toString();
    }

    private static void flush(ByteArrayOutputStream pending, StringBuilder result) {
        if (pending.size() > 0) {
            result.append(pending.toString(StandardCharsets.UTF_8));
            pending.reset();
        }
    }

    private static boolean isHex(char c) {
        return (c >= '0' && c <= '9') || (c >= 'A' && c <= 'F') || (c >= 'a' && c <= 'f');
    }
}
