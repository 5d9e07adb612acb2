package kinet.deckkit.geometry;

import java.util.Locale;
import java.util.Objects;

/**
 * Axis-aligned rectangle in canvas units: top-left {@link Position} plus {@link Size}.
 * Boxes are never clipped; whether a box fits the canvas is checked with {@link Canvas#contains(Box)}.
 */
public final class Box {

    private final double x;
    private final double y;
    private final double width;
    private final double height;

    public Box(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public static Box of(double x, double y, double width, double height) {
        return new Box(x, y, width, height);
    }

    public static Box of(Position position, Size size) {
        return new Box(position.x(), position.y(), size.width(), size.height());
    }

    public double x() {
        return x;
    }

    public double y() {
        return y;
    }

    public double width() {
        return width;
    }

    public double height() {
        return height;
    }

    public double right() {
        return x + width;
    }

    public double bottom() {
        return y + height;
    }

    public Position position() {
        return new Position(x, y);
    }

    public Size size() {
        return new Size(width, height);
    }

    /** Shrinks the box by {@code dx} on the left and right and by {@code dy} on the top and bottom. */
    public Box inset(double dx, double dy) {
        return new Box(x + dx, y + dy, width - 2 * dx, height - 2 * dy);
    }

    /**
     * Tolerant comparison; boxes read back from a document carry EMU rounding.
     */
    public boolean approximatelyEquals(Box other, double epsilon) {
        return other != null
                && Math.abs(x - other.x) <= epsilon
                && Math.abs(y - other.y) <= epsilon
                && Math.abs(width - other.width) <= epsilon
                && Math.abs(height - other.height) <= epsilon;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Box)) return false;
        Box other = (Box) o;
        return Double.compare(x, other.x) == 0
                && Double.compare(y, other.y) == 0
                && Double.compare(width, other.width) == 0
                && Double.compare(height, other.height) == 0;
    }

    @Override
    public int hashCode() {
        return Objects.hash(x, y, width, height);
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "[x=%.3f, y=%.3f, w=%.3f, h=%.3f]", x, y, width, height);
    }
}
