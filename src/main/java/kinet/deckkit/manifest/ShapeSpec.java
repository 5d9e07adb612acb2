package kinet.deckkit.manifest;

import kinet.deckkit.slide.Components;
import kinet.deckkit.slide.ShapeKind;
import kinet.deckkit.slide.Slide;

/**
 * Free-standing filled shape, e.g. the layers of a pyramid diagram.
 */
public class ShapeSpec extends ElementSpec {
    private String kind;
    private BoxSpec box;
    private String color;

    public String getKind() { return kind; }
    public void setKind(String kind) { this.kind = kind; }

    public BoxSpec getBox() { return box; }
    public void setBox(BoxSpec box) { this.box = box; }

    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }

    @Override
    public void apply(Slide slide) {
        ShapeKind shapeKind = ShapeKind.fromName(required(kind, "shape.kind"));
        Components.addShape(slide, shapeKind, required(box, "shape.box").toBox(), required(color, "shape.color"));
    }
}
