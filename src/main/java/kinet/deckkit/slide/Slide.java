package kinet.deckkit.slide;

import kinet.deckkit.ConfigurationException;
import kinet.deckkit.geometry.Box;
import kinet.deckkit.geometry.Canvas;
import kinet.deckkit.geometry.Position;
import kinet.deckkit.theme.Theme;
import org.apache.poi.xslf.usermodel.XSLFAutoShape;
import org.apache.poi.xslf.usermodel.XSLFConnectorShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.awt.Color;
import java.util.List;
import java.util.Objects;

/**
 * One slide of a {@link Deck}. The primitive builders append to the end of the element sequence, so
 * creation order is the back-to-front draw order. Only the most recently created slide of an open
 * deck accepts new elements.
 */
public final class Slide {

    private static final Logger log = LoggerFactory.getLogger(Slide.class);

    private final Deck deck;
    private final XSLFSlide slide;
    private final int index;
    private int nextZ;
    private boolean active = true;

    Slide(Deck deck, XSLFSlide slide, int index) {
        this.deck = deck;
        this.slide = slide;
        this.index = index;
    }

    // ---------- primitives ----------

    public TextHandle addTextBox(Box box) {
        requireActive();
        XSLFTextBox tb = slide.createTextBox();
        tb.setAnchor(Canvas.toAnchor(box));
        int z = nextZ++;
        log.trace("slide {} z={} text box {}", index + 1, z, box);
        return new TextHandle(this, tb, z);
    }

    /**
     * Appends a shape; a null {@code fill} leaves it outline-only (see {@link ShapeHandle#outline}).
     */
    public ShapeHandle addShape(ShapeKind kind, Box box, Color fill) {
        requireActive();
        if (kind == null) throw new ConfigurationException("Unsupported shape kind: null");
        XSLFAutoShape shape = slide.createAutoShape();
        shape.setShapeType(kind.shapeType());
        shape.setAnchor(Canvas.toAnchor(box));
        shape.setFillColor(fill);
        int z = nextZ++;
        log.trace("slide {} z={} {} {}", index + 1, z, kind, box);
        return new ShapeHandle(this, shape, z);
    }

    /**
     * Appends a straight line; the endpoints survive any direction through the shape's flip flags.
     */
    public Element addLine(Position from, Position to, Color color, double widthPt) {
        requireActive();
        Objects.requireNonNull(color, "color");
        XSLFConnectorShape line = slide.createConnector();
        Box bounds = Box.of(
                Math.min(from.x(), to.x()), Math.min(from.y(), to.y()),
                Math.abs(to.x() - from.x()), Math.abs(to.y() - from.y()));
        line.setAnchor(Canvas.toAnchor(bounds));
        line.setFlipHorizontal(to.x() < from.x());
        line.setFlipVertical(to.y() < from.y());
        line.setLineColor(color);
        line.setLineWidth(widthPt);
        int z = nextZ++;
        log.trace("slide {} z={} line {} -> {}", index + 1, z, from, to);
        return ElementReader.describe(line, z);
    }

    // ---------- inspection ----------

    public List<Element> elements() {
        return ElementReader.describe(slide);
    }

    public Element element(int z) {
        return elements().get(z);
    }

    public int elementCount() {
        return nextZ;
    }

    public SlideSnapshot snapshot() {
        return new SlideSnapshot(index, elements());
    }

    /** Zero-based position in the deck. */
    public int index() {
        return index;
    }

    public Theme theme() {
        return deck.theme();
    }

    public boolean isActive() {
        return active && !deck.isReleased();
    }

    void deactivate() {
        active = false;
    }

    void requireActive() {
        if (deck.isReleased()) {
            throw new IllegalStateException("Deck has already been saved; slide " + (index + 1) + " is read-only");
        }
        if (!active) {
            throw new IllegalStateException("Slide " + (index + 1) + " is no longer the active slide");
        }
    }

    XSLFSlide xslf() {
        return slide;
    }
}
