package org.tims.core;

/**
 * Half-open range {@code [start, stop)} of frame ids processed as one unit.
 */
public final class FrameWindow {
    private final int start;
    private final int stop;

    public FrameWindow(int start, int stop) {
        if (stop <= start) {
            throw new IllegalArgumentException("Empty frame window [" + start + ", " + stop + ")");
        }
        this.start = start;
        this.stop = stop;
    }

    public int getStart() { return start; }
    public int getStop() { return stop; }

    public int size() {
        return stop - start;
    }

    public boolean contains(int frame) {
        return frame >= start && frame < stop;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof FrameWindow)) return false;
        FrameWindow other = (FrameWindow) o;
        return start == other.start && stop == other.stop;
    }

    @Override
    public int hashCode() {
        return 31 * start + stop;
    }

    @Override
    public String toString() {
        return "[" + start + ", " + stop + ")";
    }
}
