package software.amazon.event.ahocorasick.input;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Splits pattern lists into individual, unescaped patterns. Two shapes are supported: a list of words separated by
 * spaces, and a pattern file holding one pattern per line.
 */
public class PatternListParser {

    private static final Logger logger = LoggerFactory.getLogger(PatternListParser.class);

    /**
     * Pattern files larger than this are refused.
     */
    public static final long MAX_FILE_SIZE = 1024000000L;

    private static final byte SPACE_BYTE = 0x20;
    private static final byte LF_BYTE = 0x0A;
    private static final byte CR_BYTE = 0x0D;

    private static final EscapeParser ESCAPE_PARSER = new EscapeParser(true);

    private PatternListParser() { }

    /**
     * Splits a space separated word list. The whole list is unescaped first, so an escaped space ({@code \x20})
     * separates words too, and the list ends at the first NUL byte. Runs of spaces count as one separator and produce
     * no empty patterns.
     *
     * @param words the list, encoded as UTF-8
     * @return the patterns, in list order
     */
    public static List<byte[]> parseWords(final String words) {
        final byte[] unescaped = ESCAPE_PARSER.parse(words.getBytes(StandardCharsets.UTF_8));
        final List<byte[]> patterns = new ArrayList<>();
        final int end = nulTerminatedLength(unescaped);
        int start = 0;
        for (int i = 0; i <= end; i++) {
            if (i == end || unescaped[i] == SPACE_BYTE) {
                if (i > start) {
                    patterns.add(Arrays.copyOfRange(unescaped, start, i));
                }
                start = i + 1;
            }
        }
        return patterns;
    }

    /**
     * Splits pattern file content into lines and unescapes each one. A carriage return ending a line is dropped, a
     * pattern ends at its first NUL byte, and lines left empty are skipped.
     *
     * @param content the file content
     * @return the patterns, in file order
     */
    public static List<byte[]> parseLines(final byte[] content) {
        final List<byte[]> patterns = new ArrayList<>();
        int start = 0;
        for (int i = 0; i <= content.length; i++) {
            if (i < content.length && content[i] != LF_BYTE) {
                continue;
            }
            int end = i;
            if (end > start && content[end - 1] == CR_BYTE) {
                end--;
            }
            if (end > start) {
                final byte[] line = ESCAPE_PARSER.parse(content, start, end - start);
                final int length = nulTerminatedLength(line);
                if (length > 0) {
                    patterns.add(length == line.length ? line : Arrays.copyOf(line, length));
                }
            }
            start = i + 1;
        }
        return patterns;
    }

    public static List<byte[]> parseLines(final InputStream source) throws IOException {
        return parseLines(source, MAX_FILE_SIZE);
    }

    static List<byte[]> parseLines(final InputStream source, final long maxSize) throws IOException {
        final ByteArrayOutputStream content = new ByteArrayOutputStream();
        final byte[] buffer = new byte[8192];
        int read;
        while ((read = source.read(buffer)) != -1) {
            if (content.size() + (long) read > maxSize) {
                throw new IOException("Refusing to parse pattern input because it is larger than " + maxSize
                        + " bytes");
            }
            content.write(buffer, 0, read);
        }
        return parseLines(content.toByteArray());
    }

    /**
     * Reads a pattern file.
     *
     * @param file the file
     * @return the patterns, in file order
     * @throws IOException if the file cannot be read or is too large
     * @throws ParseException if a line holds an invalid escape
     */
    public static List<byte[]> readFile(final Path file) throws IOException {
        final long size = Files.size(file);
        if (size > MAX_FILE_SIZE) {
            throw new IOException("Refusing to parse file " + file + " because it is too large (" + size + " bytes)");
        }
        final List<byte[]> patterns;
        try {
            patterns = parseLines(Files.readAllBytes(file));
        } catch (ParseException e) {
            throw new ParseException("In " + file + ": " + e.getMessage());
        }
        logger.debug("Loaded {} patterns from {}", patterns.size(), file);
        return patterns;
    }

    private static int nulTerminatedLength(final byte[] bytes) {
        for (int i = 0; i < bytes.length; i++) {
            if (bytes[i] == 0) {
                return i;
            }
        }
        return bytes.length;
    }
}
