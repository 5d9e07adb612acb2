package kinet.deckkit.slide;

import org.apache.poi.xslf.usermodel.XSLFAutoShape;

import java.awt.Color;

/**
 * Handle on a shape element of the active slide.
 */
public final class ShapeHandle {

    private final Slide slide;
    private final XSLFAutoShape shape;
    private final int zIndex;

    ShapeHandle(Slide slide, XSLFAutoShape shape, int zIndex) {
        this.slide = slide;
        this.shape = shape;
        this.zIndex = zIndex;
    }

    public ShapeHandle outline(Color color, double widthPt) {
        slide.requireActive();
        shape.setLineColor(color);
        shape.setLineWidth(widthPt);
        return this;
    }

    public ShapeHandle noOutline() {
        slide.requireActive();
        shape.setLineColor(null);
        return this;
    }

    public Element element() {
        return ElementReader.describe(shape, zIndex);
    }
}
