package kinet.deckkit.geometry;

import java.util.Objects;

/**
 * Horizontal band of fixed left edge, width and height; {@link #at(double)} places it at a given top.
 */
public final class Frame {

    private final double x;
    private final double width;
    private final double height;

    public Frame(double x, double width, double height) {
        this.x = x;
        this.width = width;
        this.height = height;
    }

    public static Frame of(double x, double width, double height) {
        return new Frame(x, width, height);
    }

    public double x() {
        return x;
    }

    public double width() {
        return width;
    }

    public double height() {
        return height;
    }

    public Box at(double top) {
        return new Box(x, top, width, height);
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Frame)) return false;
        Frame other = (Frame) o;
        return Double.compare(x, other.x) == 0
                && Double.compare(width, other.width) == 0
                && Double.compare(height, other.height) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, width, height);
    }

    @Override
    public String toString() {
        return "Frame[x=" + x + ", w=" + width + ", h=" + height + "]";
    }
}
