package org.pragmatica.profile.tree;

/**
 * A range in source text from start (inclusive) to end (exclusive).
 *
 * <p>Offsets are UTF-16 code-unit indices into the source {@code String}, not UTF-8
 * byte offsets; they differ from byte positions once the text contains non-ASCII
 * characters.
 */
public record SourceSpan(SourceLocation start, SourceLocation end) {

    public SourceSpan {
        if (start.offset() > end.offset()) {
            throw new IllegalArgumentException("Span start " + start.offset() + " is after end " + end.offset());
        }
    }

    public static SourceSpan of(SourceLocation start, SourceLocation end) {
        return new SourceSpan(start, end);
    }

    public static SourceSpan at(SourceLocation location) {
        return new SourceSpan(location, location);
    }

    public int length() {
        return end.offset() - start.offset();
    }

    public boolean isEmpty() {
        return length() == 0;
    }

    public String extract(String source) {
        return source.substring(start.offset(), end.offset());
    }

    /**
     * Span starting where this one starts and ending where {@code last} ends.
     */
    public SourceSpan through(SourceSpan last) {
        return new SourceSpan(start, last.end);
    }

    public SourceSpan merge(SourceSpan other) {
        var newStart = start.offset() <= other.start.offset() ? start : other.start;
        var newEnd = end.offset() >= other.end.offset() ? end : other.end;
        return new SourceSpan(newStart, newEnd);
    }

    @Override
    public String toString() {
        return start + "-" + end;
    }
}
