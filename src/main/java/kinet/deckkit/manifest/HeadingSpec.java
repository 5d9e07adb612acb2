package kinet.deckkit.manifest;

import kinet.deckkit.ConfigurationException;
import kinet.deckkit.geometry.Box;

import java.util.function.DoubleFunction;

/**
 * Shared fields of titles and subtitles: either a {@code top} inside the theme's band or a full
 * {@code box}; size and color fall back to the theme.
 */
public abstract class HeadingSpec extends ElementSpec {
    private String text;
    private Double top;
    private BoxSpec box;
    private Double size;
    private String color;

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public Double getTop() { return top; }
    public void setTop(Double top) { this.top = top; }

    public BoxSpec getBox() { return box; }
    public void setBox(BoxSpec box) { this.box = box; }

    public Double getSize() { return size; }
    public void setSize(Double size) { this.size = size; }

    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }

    Box resolveBox(DoubleFunction<Box> band) {
        if (box != null) return box.toBox();
        if (top != null) return band.apply(top);
        throw new ConfigurationException("'" + text + "' needs either 'top' or 'box'");
    }
}
