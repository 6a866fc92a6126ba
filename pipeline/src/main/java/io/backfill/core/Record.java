package io.backfill.core;

import java.util.Objects;

/**
 * One text record of the input, identified by its content and its ordinal position in the whole sequence.
 */
public final class Record implements Comparable<Record> {
    private final long ordinal; // 0-based position across the entire input
    private final String text;

    public Record(long ordinal, String text) {
        this.ordinal = ordinal;
        this.text = Objects.requireNonNull(text, "text");
    }

    public long ordinal() { return ordinal; }
    public String text() { return text; }

    @Override
    public int compareTo(Record o) {
        return Long.compare(this.ordinal, o.ordinal);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Record that)) return false;
        return ordinal == that.ordinal && text.equals(that.text);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ordinal, text);
    }

    @Override
    public String toString() {
        return "Record{" +
                "ordinal=" + ordinal +
                ", text=" + text +
                '}';
    }
}
