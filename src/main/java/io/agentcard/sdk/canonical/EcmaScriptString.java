package io.agentcard.sdk.canonical;

import com.fasterxml.jackson.core.SerializableString;

import java.io.IOException;
import java.io.OutputStream;
import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

/**
 * String value escaped the way ECMAScript {@code JSON.stringify} escapes it. Quote, backslash and the control
 * characters with a short form use it; other control characters and unpaired surrogates become six-character
 * escapes with lower-case hex digits. Everything else, supplementary characters included, is written as UTF-8.
 */
final class EcmaScriptString implements SerializableString {

    private static final char[] HEX = "0123456789abcdef".toCharArray();

    private final String value;
    private final String quoted;
    private final byte[] quotedUtf8;

    EcmaScriptString(String value) {
        this.value = value;
        this.quoted = escape(value);
        this.quotedUtf8 = quoted.getBytes(StandardCharsets.UTF_8);
    }

    static String escape(String value) {
        StringBuilder sb = new StringBuilder(value.length() + 8);
        int length = value.length();
        for (int i = 0; i < length; i++) {
            char ch = value.charAt(i);
            if (ch == '"') {
                sb.append("\\\"");
            } else if (ch == '\\') {
                sb.append("\\\\");
            } else if (ch == '\b') {
                sb.append("\\b");
            } else if (ch == '\t') {
                sb.append("\\t");
            } else if (ch == '\n') {
                sb.append("\\n");
            } else if (ch == '\f') {
                sb.append("\\f");
            } else if (ch == '\r') {
                sb.append("\\r");
            } else if (ch < 0x20) {
                appendUnicodeEscape(sb, ch);
            } else if (Character.isHighSurrogate(ch)) {
                if (i + 1 < length && Character.isLowSurrogate(value.charAt(i + 1))) {
                    sb.append(ch).append(value.charAt(++i));
                } else {
                    appendUnicodeEscape(sb, ch);
                }
            } else if (Character.isLowSurrogate(ch)) {
                appendUnicodeEscape(sb, ch);
            } else {
                sb.append(ch);
            }
        }
        return sb.toString();
    }

    private static void appendUnicodeEscape(StringBuilder sb, char ch) {
        sb.append("\\u")
            .append(HEX[(ch >> 12) & 0xF])
            .append(HEX[(ch >> 8) & 0xF])
            .append(HEX[(ch >> 4) & 0xF])
            .append(HEX[ch & 0xF]);
    }

    @Override
    public String getValue() {
        return value;
    }

    @Override
    public int charLength() {
        return value.length();
    }

    @Override
    public char[] asQuotedChars() {
        return quoted.toCharArray();
    }

    @Override
    public byte[] asUnquotedUTF8() {
        return value.getBytes(StandardCharsets.UTF_8);
    }

    @Override
    public byte[] asQuotedUTF8() {
        return quotedUtf8.clone();
    }

    @Override
    public int appendQuotedUTF8(byte[] buffer, int offset) {
        return copy(quotedUtf8, buffer, offset);
    }

    @Override
    public int appendQuoted(char[] buffer, int offset) {
        if (offset + quoted.length() > buffer.length) {
            return -1;
        }
        quoted.getChars(0, quoted.length(), buffer, offset);
        return quoted.length();
    }

    @Override
    public int appendUnquotedUTF8(byte[] buffer, int offset) {
        return copy(asUnquotedUTF8(), buffer, offset);
    }

    @Override
    public int appendUnquoted(char[] buffer, int offset) {
        if (offset + value.length() > buffer.length) {
            return -1;
        }
        value.getChars(0, value.length(), buffer, offset);
        return value.length();
    }

    @Override
    public int writeQuotedUTF8(OutputStream out) throws IOException {
        out.write(quotedUtf8);
        return quotedUtf8.length;
    }

    @Override
    public int writeUnquotedUTF8(OutputStream out) throws IOException {
        byte[] bytes = asUnquotedUTF8();
        out.write(bytes);
        return bytes.length;
    }

    @Override
    public int putQuotedUTF8(ByteBuffer buffer) {
        return put(quotedUtf8, buffer);
    }

    @Override
    public int putUnquotedUTF8(ByteBuffer buffer) {
        return put(asUnquotedUTF8(), buffer);
    }

    private static int copy(byte[] source, byte[] buffer, int offset) {
        if (offset + source.length > buffer.length) {
            return -1;
        }
        System.arraycopy(source, 0, buffer, offset, source.length);
        return source.length;
    }

    private static int put(byte[] source, ByteBuffer buffer) {
        if (source.length > buffer.remaining()) {
            return -1;
        }
        buffer.put(source);
        return source.length;
    }
}
