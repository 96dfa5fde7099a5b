package org.kidoni.symbolic;

/**
 * An {@link Appendable} that keeps at most {@code capacity} characters and silently drops the rest.
 */
public class BoundedAppender implements Appendable {
    private final StringBuilder buffer;
    private final int capacity;
    private boolean truncated;

    public BoundedAppender(final int capacity) {
        if (capacity < 0) {
            throw new IllegalArgumentException("capacity must not be negative: " + capacity);
        }
        this.capacity = capacity;
        this.buffer = new StringBuilder(Math.min(capacity, 64));
    }

    @Override
    public BoundedAppender append(final CharSequence csq) {
        CharSequence text = csq != null ? csq : "null";
        return append(text, 0, text.length());
    }

    @Override
    public BoundedAppender append(final CharSequence csq, final int start, final int end) {
        if (csq == null) {
            return append("null", start, end);
        }
        int room = capacity - buffer.length();
        int take = Math.min(room, end - start);
        buffer.append(csq, start, start + take);
        if (take < end - start) {
            truncated = true;
        }
        return this;
    }

    @Override
    public BoundedAppender append(final char c) {
        if (buffer.length() < capacity) {
            buffer.append(c);
        }
        else {
            truncated = true;
        }
        return this;
    }

    public int length() {
        return buffer.length();
    }

    boolean isTruncated() {
        return truncated;
    }

    public void copyTo(final char[] target) {
        buffer.getChars(0, buffer.length(), target, 0);
    }

    @Override
    public String toString() {
        return buffer.toString();
    }
}
