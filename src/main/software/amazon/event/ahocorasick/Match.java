package software.amazon.event.ahocorasick;

import javax.annotation.Nullable;
import javax.annotation.concurrent.Immutable;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Objects;

/**
 * One occurrence of a pattern in the consumed input.
 *
 * Offsets count bytes. {@link #getOffset()} is where the match starts, counted over everything the matching context
 * has consumed since it was created or reset. {@link #getRelativeOffset()} is the same start position counted from the
 * beginning of the consume call that completed the match; it is negative when the match started in an earlier chunk.
 */
@Immutable
public final class Match {

    private final byte[] pattern;
    private final long offset;
    private final long relativeOffset;
    private final Object payload;

    Match(byte[] pattern, long offset, long relativeOffset, @Nullable Object payload) {
        this.pattern = pattern;
        this.offset = offset;
        this.relativeOffset = relativeOffset;
        this.payload = payload;
    }

    /**
     * Returns the matched pattern, as given by the first add call that created its trie path.
     */
    public byte[] getPattern() {
        return pattern.clone();
    }

    public String getPatternAsString() {
        return new String(pattern, StandardCharsets.UTF_8);
    }

    public int getPatternLength() {
        return pattern.length;
    }

    public long getOffset() {
        return offset;
    }

    public long getRelativeOffset() {
        return relativeOffset;
    }

    /**
     * Returns the absolute offset of the last byte of the match.
     */
    public long getEndOffset() {
        return offset + pattern.length - 1;
    }

    @Nullable
    public Object getPayload() {
        return payload;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) {
            return true;
        }
        if (o == null || getClass() != o.getClass()) {
            return false;
        }
        Match match = (Match) o;
        return offset == match.offset && relativeOffset == match.relativeOffset
                && Arrays.equals(pattern, match.pattern) && Objects.equals(payload, match.payload);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(offset, relativeOffset, payload) + Arrays.hashCode(pattern);
    }

    @Override
    public String toString() {
        return "M: P=" + getPatternAsString() + " O=" + offset + " RO=" + relativeOffset + " D=" + payload;
    }
}
