package com.elara.kconfig;

import java.util.Objects;

/** A file/line position in the Kconfig sources. */
public final class Location {
    private final String filename;
    private final int line;

    public Location(String filename, int line) {
        this.filename = filename;
        this.line = line;
    }

    public String filename() { return filename; }
    public int line() { return line; }

    @Override
    public boolean equals(Object o) {
        if (!(o instanceof Location)) return false;
        Location other = (Location) o;
        return line == other.line && Objects.equals(filename, other.filename);
    }

    @Override
    public int hashCode() {
        return Objects.hash(filename, line);
    }

    @Override
    public String toString() {
        return filename + ":" + line;
    }
}
