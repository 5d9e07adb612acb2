package kinet.deckkit.slide;

import kinet.deckkit.geometry.Box;
import kinet.deckkit.geometry.Position;
import org.apache.poi.sl.usermodel.TextParagraph.TextAlign;

import java.awt.Color;
import java.util.Objects;

/**
 * Read-only snapshot of one rendered element of a slide, in canvas units.
 * <p>
 * Snapshots are taken from the underlying document, so a live deck and the same deck reloaded from
 * disk describe their elements the same way. Text properties ({@link #fontSize()}, {@link #isBold()},
 * {@link #fontColor()}, {@link #fontFamily()}) are those of the first text run; {@link #alignment()} is
 * that of the first paragraph.
 */
public final class Element {

    private final ElementKind kind;
    private final int zIndex;
    private final Box box;
    private final ShapeKind shapeKind;
    private final Color fill;
    private final Color lineColor;
    private final String text;
    private final Double fontSize;
    private final boolean bold;
    private final Color fontColor;
    private final String fontFamily;
    private final TextAlign alignment;
    private final boolean wordWrap;
    private final Position from;
    private final Position to;

    private Element(Builder b) {
        this.kind = b.kind;
        this.zIndex = b.zIndex;
        this.box = b.box;
        this.shapeKind = b.shapeKind;
        this.fill = b.fill;
        this.lineColor = b.lineColor;
        this.text = b.text;
        this.fontSize = b.fontSize;
        this.bold = b.bold;
        this.fontColor = b.fontColor;
        this.fontFamily = b.fontFamily;
        this.alignment = b.alignment;
        this.wordWrap = b.wordWrap;
        this.from = b.from;
        this.to = b.to;
    }

    static Builder builder(ElementKind kind, int zIndex, Box box) {
        return new Builder(kind, zIndex, box);
    }

    public ElementKind kind() {
        return kind;
    }

    /** Position in the slide's back-to-front draw order; 0 is the background. */
    public int zIndex() {
        return zIndex;
    }

    public Box box() {
        return box;
    }

    /** Preset geometry of a {@link ElementKind#SHAPE}, or null. */
    public ShapeKind shapeKind() {
        return shapeKind;
    }

    /** Fill color, or null for text elements, lines and outline-only shapes. */
    public Color fill() {
        return fill;
    }

    public Color lineColor() {
        return lineColor;
    }

    /** Paragraphs joined with {@code '\n'}, line breaks kept as {@code '\n'}; null for shapes and lines. */
    public String text() {
        return text;
    }

    public Double fontSize() {
        return fontSize;
    }

    public boolean isBold() {
        return bold;
    }

    public Color fontColor() {
        return fontColor;
    }

    public String fontFamily() {
        return fontFamily;
    }

    public TextAlign alignment() {
        return alignment;
    }

    public boolean isWordWrap() {
        return wordWrap;
    }

    /** Start point of a {@link ElementKind#LINE}, or null. */
    public Position from() {
        return from;
    }

    /** End point of a {@link ElementKind#LINE}, or null. */
    public Position to() {
        return to;
    }

    public boolean isText() {
        return kind == ElementKind.TEXT;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Element)) return false;
        Element e = (Element) o;
        return zIndex == e.zIndex
                && bold == e.bold
                && wordWrap == e.wordWrap
                && kind == e.kind
                && Objects.equals(box, e.box)
                && shapeKind == e.shapeKind
                && Objects.equals(fill, e.fill)
                && Objects.equals(lineColor, e.lineColor)
                && Objects.equals(text, e.text)
                && Objects.equals(fontSize, e.fontSize)
                && Objects.equals(fontColor, e.fontColor)
                && Objects.equals(fontFamily, e.fontFamily)
                && alignment == e.alignment
                && Objects.equals(from, e.from)
                && Objects.equals(to, e.to);
    }

    @Override
    public int hashCode() {
        return Objects.hash(kind, zIndex, box, shapeKind, fill, text, fontSize, bold, fontColor, alignment, wordWrap);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        sb.append(kind).append('#').append(zIndex).append(' ').append(box);
        if (shapeKind != null) sb.append(' ').append(shapeKind);
        if (fill != null) sb.append(" fill=").append(hex(fill));
        if (from != null) sb.append(' ').append(from).append(" -> ").append(to);
        if (text != null) {
            sb.append(" \"").append(text.replace("\n", "\\n")).append('"');
            if (fontSize != null) sb.append(' ').append(fontSize).append("pt");
            if (bold) sb.append(" bold");
        }
        return sb.toString();
    }

    private static String hex(Color c) {
        return String.format("#%02X%02X%02X", c.getRed(), c.getGreen(), c.getBlue());
    }

    static final class Builder {
        private final ElementKind kind;
        private final int zIndex;
        private final Box box;
        private ShapeKind shapeKind;
        private Color fill;
        private Color lineColor;
        private String text;
        private Double fontSize;
        private boolean bold;
        private Color fontColor;
        private String fontFamily;
        private TextAlign alignment;
        private boolean wordWrap;
        private Position from;
        private Position to;

        private Builder(ElementKind kind, int zIndex, Box box) {
            this.kind = kind;
            this.zIndex = zIndex;
            this.box = box;
        }

        Builder shapeKind(ShapeKind shapeKind) {
            this.shapeKind = shapeKind;
            return this;
        }

        Builder fill(Color fill) {
            this.fill = fill;
            return this;
        }

        Builder lineColor(Color lineColor) {
            this.lineColor = lineColor;
            return this;
        }

        Builder text(String text) {
            this.text = text;
            return this;
        }

        Builder fontSize(Double fontSize) {
            this.fontSize = fontSize;
            return this;
        }

        Builder bold(boolean bold) {
            this.bold = bold;
            return this;
        }

        Builder fontColor(Color fontColor) {
            this.fontColor = fontColor;
            return this;
        }

        Builder fontFamily(String fontFamily) {
            this.fontFamily = fontFamily;
            return this;
        }

        Builder alignment(TextAlign alignment) {
            this.alignment = alignment;
            return this;
        }

        Builder wordWrap(boolean wordWrap) {
            this.wordWrap = wordWrap;
            return this;
        }

        Builder endpoints(Position from, Position to) {
            this.from = from;
            this.to = to;
            return this;
        }

        Element build() {
            return new Element(this);
        }
    }
}
