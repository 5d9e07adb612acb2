package kinet.deckkit.slide;

import org.apache.poi.sl.usermodel.TextParagraph.TextAlign;

import java.awt.Color;
import java.util.Objects;

/**
 * Character and paragraph formatting for one paragraph added through a {@link TextHandle}.
 * Instances are immutable; every modifier returns a copy.
 */
public final class TextStyle {

    private final double fontSize;
    private final Color color;
    private final boolean bold;
    private final String fontFamily;
    private final TextAlign alignment;
    private final double spaceBefore;

    private TextStyle(double fontSize, Color color, boolean bold, String fontFamily, TextAlign alignment, double spaceBefore) {
        this.fontSize = fontSize;
        this.color = Objects.requireNonNull(color, "color");
        this.bold = bold;
        this.fontFamily = fontFamily;
        this.alignment = Objects.requireNonNull(alignment, "alignment");
        this.spaceBefore = spaceBefore;
    }

    /** Regular, left-aligned text in the default font. */
    public static TextStyle of(double fontSize, Color color) {
        return new TextStyle(fontSize, color, false, null, TextAlign.LEFT, 0);
    }

    public TextStyle bold(boolean bold) {
        return new TextStyle(fontSize, color, bold, fontFamily, alignment, spaceBefore);
    }

    public TextStyle font(String fontFamily) {
        return new TextStyle(fontSize, color, bold, fontFamily, alignment, spaceBefore);
    }

    public TextStyle align(TextAlign alignment) {
        return new TextStyle(fontSize, color, bold, fontFamily, alignment, spaceBefore);
    }

    public TextStyle centered() {
        return align(TextAlign.CENTER);
    }

    /** Space above the paragraph, in points. */
    public TextStyle spaceBefore(double points) {
        return new TextStyle(fontSize, color, bold, fontFamily, alignment, points);
    }

    public double fontSize() {
        return fontSize;
    }

    public Color color() {
        return color;
    }

    public boolean isBold() {
        return bold;
    }

    public String fontFamily() {
        return fontFamily;
    }

    public TextAlign alignment() {
        return alignment;
    }

    public double spaceBefore() {
        return spaceBefore;
    }
}
