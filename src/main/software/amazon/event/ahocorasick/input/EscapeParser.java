package software.amazon.event.ahocorasick.input;

import java.io.ByteArrayOutputStream;

/**
 * Decodes backslash escapes in a pattern so that patterns can carry control and NUL bytes. Supported escapes are
 * {@code \b \f \n \r \t \v \' \" \\}, {@code \xHH} for one byte, and backslash-u followed by four hex digits
 * for two bytes (high byte first). A backslash followed by any other character stands for that character.
 */
public class EscapeParser {

    static final byte BACKSLASH_BYTE = 0x5C;

    private final boolean allowNul;

    /**
     * @param allowNul whether {@code \x00} or a zero byte from a backslash-u escape may appear in the result
     */
    public EscapeParser(boolean allowNul) {
        this.allowNul = allowNul;
    }

    public byte[] parse(final byte[] value) {
        return parse(value, 0, value.length);
    }

    /**
     * @param value  holds the escaped pattern
     * @param offset index of its first byte
     * @param length number of bytes
     * @return the unescaped bytes
     * @throws ParseException on a dangling backslash, a truncated or non-hex escape, or a forbidden NUL
     */
    public byte[] parse(final byte[] value, final int offset, final int length) {
        final ByteArrayOutputStream result = new ByteArrayOutputStream(length);
        final int end = offset + length;
        for (int i = offset; i < end; i++) {
            final byte b = value[i];
            if (b != BACKSLASH_BYTE) {
                result.write(b);
                continue;
            }
            if (++i >= end) {
                throw new ParseException("Dangling escape character at pos " + (i - 1 - offset));
            }
            final byte escaped = value[i];
            switch (escaped) {
                case 'b':
                    result.write('\b');
                    break;
                case 'f':
                    result.write('\f');
                    break;
                case 'n':
                    result.write('\n');
                    break;
                case 'r':
                    result.write('\r');
                    break;
                case 't':
                    result.write('\t');
                    break;
                case 'v':
                    result.write(0x0B);
                    break;
                case 'x':
                    result.write(hexByte(value, i + 1, end, offset));
                    i += 2;
                    break;
                case 'u':
                    result.write(hexByte(value, i + 1, end, offset));
                    result.write(hexByte(value, i + 3, end, offset));
                    i += 4;
                    break;
                default:
                    // covers \' \" \\ as well
                    result.write(escaped);
            }
        }
        return result.toByteArray();
    }

    private int hexByte(final byte[] value, final int at, final int end, final int offset) {
        if (at + 2 > end) {
            throw new ParseException("Truncated hex escape at pos " + (at - offset));
        }
        final int decoded = (hexDigit(value[at], at - offset) << 4) | hexDigit(value[at + 1], at + 1 - offset);
        if (decoded == 0 && !allowNul) {
            throw new ParseException("NUL byte not allowed at pos " + (at - offset));
        }
        return decoded;
    }

    private static int hexDigit(final byte b, final int pos) {
        if (b >= '0' && b <= '9') {
            return b - '0';
        }
        if (b >= 'a' && b <= 'f') {
            return b - 'a' + 10;
        }
        if (b >= 'A' && b <= 'F') {
            return b - 'A' + 10;
        }
        throw new ParseException("Invalid hex digit at pos " + pos);
    }
}
