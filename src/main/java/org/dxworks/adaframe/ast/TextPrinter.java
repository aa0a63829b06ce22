package org.dxworks.adaframe.ast;

import java.io.IOException;
import java.io.UncheckedIOException;

/**
 * Renders {@link Text} values to character sinks without mutating them.
 * <p>
 * Raw rendering writes every code point as-is. Quoted rendering wraps the
 * text in double quotes and escapes quotes, backslashes, control characters
 * and anything outside printable ASCII as {@code \xNN}, {@code \\uNNNN} or
 * {@code \UNNNNNNNN}.
 */
public final class TextPrinter {

    private TextPrinter() {
        // utility class
    }

    public static void print(Appendable out, Text text, boolean withQuotes) throws IOException {
        if (withQuotes) {
            appendQuoted(out, text);
        } else {
            appendRaw(out, text);
        }
    }

    public static String render(Text text, boolean withQuotes) {
        StringBuilder sb = new StringBuilder();
        try {
            print(sb, text, withQuotes);
        } catch (IOException e) {
            // StringBuilder never throws
            throw new UncheckedIOException(e);
        }
        return sb.toString();
    }

    static void appendQuoted(StringBuilder sb, Text text) {
        try {
            appendQuoted((Appendable) sb, text);
        } catch (IOException e) {
            throw new UncheckedIOException(e);
        }
    }

    private static void appendRaw(Appendable out, Text text) throws IOException {
        int length = text.length();
        for (int i = 0; i < length; i++) {
            int c = text.codePointAt(i);
            if (Character.isBmpCodePoint(c)) {
                out.append((char) c);
            } else {
                out.append(Character.highSurrogate(c)).append(Character.lowSurrogate(c));
            }
        }
    }

    private static void appendQuoted(Appendable out, Text text) throws IOException {
        out.append('"');
        int length = text.length();
        for (int i = 0; i < length; i++) {
            appendEscaped(out, text.codePointAt(i));
        }
        out.append('"');
    }

    private static void appendEscaped(Appendable out, int c) throws IOException {
        switch (c) {
            case '"':
                out.append("\\\"");
                return;
            case '\\':
                out.append("\\\\");
                return;
            case '\n':
                out.append("\\n");
                return;
            case '\r':
                out.append("\\r");
                return;
            case '\t':
                out.append("\\t");
                return;
            default:
                break;
        }
        if (c >= 0x20 && c < 0x7f) {
            out.append((char) c);
        } else if (c <= 0xff) {
            out.append(String.format("\\x%02x", c));
        } else if (c <= 0xffff) {
            out.append(String.format("\\u%04x", c));
        } else {
            out.append(String.format("\\U%08x", c));
        }
    }
}
