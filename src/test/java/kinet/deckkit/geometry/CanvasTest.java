package kinet.deckkit.geometry;

import kinet.deckkit.GeometryException;
import org.junit.jupiter.api.Test;

import java.awt.geom.Rectangle2D;

import static org.junit.jupiter.api.Assertions.*;

class CanvasTest {

    @Test
    void boundsCoverTheWidescreenPage() {
        Box bounds = Canvas.bounds();
        assertEquals(0, bounds.x());
        assertEquals(0, bounds.y());
        assertEquals(13.333, bounds.width(), 1e-3);
        assertEquals(7.5, bounds.height(), 1e-9);
        assertEquals(960, Canvas.PAGE_SIZE.width);
        assertEquals(540, Canvas.PAGE_SIZE.height);
    }

    @Test
    void boundsAnchorFillsThePage() {
        Rectangle2D anchor = Canvas.toAnchor(Canvas.bounds());
        assertEquals(Canvas.PAGE_SIZE.width, anchor.getWidth(), 1e-9);
        assertEquals(Canvas.PAGE_SIZE.height, anchor.getHeight(), 1e-9);
    }

    @Test
    void anchorsAreInPoints() {
        Rectangle2D anchor = Canvas.toAnchor(Box.of(1, 2, 3, 0.5));
        assertEquals(72, anchor.getX(), 1e-9);
        assertEquals(144, anchor.getY(), 1e-9);
        assertEquals(216, anchor.getWidth(), 1e-9);
        assertEquals(36, anchor.getHeight(), 1e-9);

        assertTrue(Canvas.fromAnchor(anchor).approximatelyEquals(Box.of(1, 2, 3, 0.5), 1e-9));
    }

    @Test
    void containsAcceptsTheCanvasEdges() {
        assertTrue(Canvas.contains(Canvas.bounds()));
        assertTrue(Canvas.contains(Box.of(0.5, 6.0, 12.333, 1.5)));
        assertTrue(Canvas.contains(Box.of(3, 1, 0, 2)));
        assertTrue(Canvas.contains(Position.of(13.333, 7.5)));
    }

    @Test
    void containsRejectsOverflow() {
        assertFalse(Canvas.contains(Box.of(5, 1, 10, 0.6)));
        assertFalse(Canvas.contains(Box.of(0.5, 6.5, 12.333, 1.5)));
        assertFalse(Canvas.contains(Box.of(-0.1, 0, 1, 1)));
        assertFalse(Canvas.contains(Position.of(14, 1)));

        GeometryException e = assertThrows(GeometryException.class,
                () -> Canvas.requireWithin(Box.of(5, 1, 10, 0.6), "bullet"));
        assertTrue(e.getMessage().startsWith("bullet"));
    }

    @Test
    void insetShrinksFromBothSides() {
        Box box = Box.of(1.5, 1.8, 10, 3).inset(0.2, 0.15);
        assertEquals(1.7, box.x(), 1e-9);
        assertEquals(1.95, box.y(), 1e-9);
        assertEquals(9.6, box.width(), 1e-9);
        assertEquals(2.7, box.height(), 1e-9);
        assertEquals(11.3, box.right(), 1e-9);
    }

    @Test
    void frameAnchorsAtTop() {
        Box box = Frame.of(0.5, 12.333, 1.5).at(2.8);
        assertEquals(Box.of(0.5, 2.8, 12.333, 1.5).toString(), box.toString());
        assertEquals(4.3, box.bottom(), 1e-9);
    }
}
