package kinet.deckkit.geometry;

import kinet.deckkit.GeometryException;

import java.awt.Dimension;
import java.awt.geom.Rectangle2D;

/**
 * The fixed 16:9 widescreen canvas shared by every slide. Geometry is expressed in canvas units
 * (inches); the document stores points, 72 per unit.
 */
public final class Canvas {

    /** 13.333..., exactly 960 points. */
    public static final double WIDTH = 40.0 / 3;
    public static final double HEIGHT = 7.5;
    public static final double POINTS_PER_UNIT = 72.0;

    /** Page size handed to the slideshow, in points (960 x 540). */
    public static final Dimension PAGE_SIZE = new Dimension(
            (int) Math.round(WIDTH * POINTS_PER_UNIT),
            (int) Math.round(HEIGHT * POINTS_PER_UNIT));

    // anchors come back from the document in whole EMUs
    private static final double EPSILON = 1e-3;

    private Canvas() {}

    public static Box bounds() {
        return new Box(0, 0, WIDTH, HEIGHT);
    }

    public static boolean contains(Box box) {
        return box.x() >= -EPSILON
                && box.y() >= -EPSILON
                && box.width() >= 0
                && box.height() >= 0
                && box.right() <= WIDTH + EPSILON
                && box.bottom() <= HEIGHT + EPSILON;
    }

    public static boolean contains(Position p) {
        return p.x() >= -EPSILON && p.y() >= -EPSILON
                && p.x() <= WIDTH + EPSILON && p.y() <= HEIGHT + EPSILON;
    }

    public static void requireWithin(Box box, String what) {
        if (!contains(box)) {
            throw new GeometryException(what + " " + box + " lies outside the canvas " + bounds());
        }
    }

    public static double toPoints(double units) {
        return units * POINTS_PER_UNIT;
    }

    public static double toUnits(double points) {
        return points / POINTS_PER_UNIT;
    }

    public static Rectangle2D toAnchor(Box box) {
        return new Rectangle2D.Double(
                toPoints(box.x()), toPoints(box.y()), toPoints(box.width()), toPoints(box.height()));
    }

    public static Box fromAnchor(Rectangle2D anchor) {
        return new Box(
                toUnits(anchor.getX()), toUnits(anchor.getY()), toUnits(anchor.getWidth()), toUnits(anchor.getHeight()));
    }
}
