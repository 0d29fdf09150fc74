package io.github.eutro.stackless.env;

import java.util.Objects;

/**
 * A source location: a file and a character span within it.
 */
public final class Loc {
    private final String file;
    private final int start;
    private final int end;

    public Loc(String file, int start, int end) {
        if (start > end) {
            throw new IllegalArgumentException("span " + start + ".." + end + " is inverted");
        }
        this.file = Objects.requireNonNull(file);
        this.start = start;
        this.end = end;
    }

    public String getFile() {
        return file;
    }

    public int getStart() {
        return start;
    }

    public int getEnd() {
        return end;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Loc)) return false;
        Loc loc = (Loc) o;
        return start == loc.start && end == loc.end && file.equals(loc.file);
    }

    @Override
    public int hashCode() {
        return Objects.hash(file, start, end);
    }

    @Override
    public String toString() {
        return file + ":" + start + ".." + end;
    }
}
