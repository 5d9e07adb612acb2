package kinet.deckkit.slide;

import kinet.deckkit.geometry.Canvas;
import org.apache.poi.sl.usermodel.Insets2D;
import org.apache.poi.sl.usermodel.TextShape.TextAutofit;
import org.apache.poi.sl.usermodel.VerticalAlignment;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextRun;

/**
 * Mutable handle on a text element of the active slide. Text is added paragraph by paragraph; every
 * {@code '\n'} inside a paragraph becomes a line break, so the text is stored exactly as given.
 */
public final class TextHandle {

    private final Slide slide;
    private final XSLFTextBox shape;
    private final int zIndex;

    TextHandle(Slide slide, XSLFTextBox shape, int zIndex) {
        this.slide = slide;
        this.shape = shape;
        this.zIndex = zIndex;
        shape.clearText();
        shape.setTextAutofit(TextAutofit.NONE);
    }

    public TextHandle wordWrap(boolean wrap) {
        slide.requireActive();
        shape.setWordWrap(wrap);
        return this;
    }

    /** Inner margins in canvas units. */
    public TextHandle insets(double horizontal, double vertical) {
        slide.requireActive();
        double h = Canvas.toPoints(horizontal);
        double v = Canvas.toPoints(vertical);
        shape.setInsets(new Insets2D(v, h, v, h));
        return this;
    }

    public TextHandle verticalAlignment(VerticalAlignment alignment) {
        slide.requireActive();
        shape.setVerticalAlignment(alignment);
        return this;
    }

    public TextHandle addParagraph(String text, TextStyle style) {
        slide.requireActive();
        XSLFTextParagraph p = shape.addNewTextParagraph();
        p.setTextAlign(style.alignment());
        // negative spacing values are absolute points
        if (style.spaceBefore() > 0) p.setSpaceBefore(-style.spaceBefore());

        String[] lines = text.split("\n", -1);
        for (int i = 0; i < lines.length; i++) {
            if (i > 0) p.addLineBreak();
            if (lines[i].isEmpty() && lines.length > 1) continue;
            XSLFTextRun r = p.addNewTextRun();
            r.setText(lines[i]);
            r.setFontSize(style.fontSize());
            r.setFontColor(style.color());
            r.setBold(style.isBold());
            if (style.fontFamily() != null) r.setFontFamily(style.fontFamily());
        }
        return this;
    }

    public Element element() {
        return ElementReader.describe(shape, zIndex);
    }

    public String text() {
        return element().text();
    }
}
