package kinet.deckkit.slide;

import kinet.deckkit.geometry.Box;
import kinet.deckkit.geometry.Canvas;
import kinet.deckkit.geometry.Position;
import kinet.deckkit.geometry.Size;
import kinet.deckkit.theme.FontRole;
import kinet.deckkit.theme.Theme;
import org.apache.poi.sl.usermodel.TextParagraph.TextAlign;
import org.apache.poi.sl.usermodel.VerticalAlignment;

import java.awt.Color;
import java.util.Objects;

/**
 * Reusable visual patterns built from the slide primitives and the slide's {@link Theme}.
 * <p>
 * Colors are passed by theme name and resolved before anything is appended, so an unknown name
 * fails with a {@link kinet.deckkit.ConfigurationException} and leaves the slide as it was.
 * All text except code is word-wrapped inside its box.
 */
public final class Components {

    private static final double CONNECTOR_WIDTH_PT = 2.0;

    // labeled box text sits inside the shape
    private static final double LABEL_INSET_X = 0.2;
    private static final double LABEL_INSET_Y = 0.15;
    private static final double DESCRIPTION_SPACE_BEFORE_PT = 8.0;

    private Components() {}

    public static Slide addBackgroundSlide(Deck deck) {
        Color background = deck.theme().resolveColor(Theme.BACKGROUND);
        Slide slide = deck.newSlide();
        slide.addShape(ShapeKind.RECTANGLE, Canvas.bounds(), background).noOutline();
        return slide;
    }

    // ---------- titles ----------

    public static TextHandle addTitle(Slide slide, String text, Box box, double fontSize, String color) {
        return addCenteredText(slide, text, box, fontSize, color, true);
    }

    /** Title in the theme's title band at {@code top}, default size and color. */
    public static TextHandle addTitle(Slide slide, String text, double top) {
        Theme theme = slide.theme();
        return addTitle(slide, text, titleBox(slide, top), theme.fontSize(FontRole.TITLE), Theme.TITLE);
    }

    public static TextHandle addSubtitle(Slide slide, String text, Box box, double fontSize, String color) {
        return addCenteredText(slide, text, box, fontSize, color, false);
    }

    public static TextHandle addSubtitle(Slide slide, String text, double top) {
        Theme theme = slide.theme();
        return addSubtitle(slide, text, subtitleBox(slide, top), theme.fontSize(FontRole.SUBTITLE), Theme.SUBTITLE);
    }

    public static Box titleBox(Slide slide, double top) {
        return slide.theme().titleFrame().at(top);
    }

    public static Box subtitleBox(Slide slide, double top) {
        return slide.theme().subtitleFrame().at(top);
    }

    private static TextHandle addCenteredText(Slide slide, String text, Box box, double fontSize, String color, boolean bold) {
        Objects.requireNonNull(text, "text");
        Color c = slide.theme().resolveColor(color);
        return slide.addTextBox(box)
                .wordWrap(true)
                .addParagraph(text, TextStyle.of(fontSize, c).bold(bold).centered());
    }

    // ---------- code ----------

    public static TextHandle addCodeBlock(Slide slide, String code, Box box) {
        return addCodeBlock(slide, code, box, slide.theme().fontSize(FontRole.CODE));
    }

    /**
     * Backing shape plus an inset, non-wrapping text block in the code font. {@code code} is stored
     * verbatim; the caller picks a box large enough for it.
     */
    public static TextHandle addCodeBlock(Slide slide, String code, Box box, double fontSize) {
        Objects.requireNonNull(code, "code");
        Theme theme = slide.theme();
        Color background = theme.resolveColor(Theme.CODE_BACKGROUND);
        Color foreground = theme.resolveColor(Theme.CODE_TEXT);

        ShapeKind kind = theme.roundedCodeBlocks() ? ShapeKind.ROUNDED_RECTANGLE : ShapeKind.RECTANGLE;
        slide.addShape(kind, box, background).noOutline();

        return slide.addTextBox(box.inset(theme.codeInsetX(), theme.codeInsetY()))
                .wordWrap(false)
                .addParagraph(code, TextStyle.of(fontSize, foreground)
                        .font(theme.codeFont())
                        .align(TextAlign.LEFT));
    }

    // ---------- bullets ----------

    /**
     * Single-line bullet of the theme's bullet size. A non-empty {@code icon} is put in front of the
     * text with one space between them. The box never extends past the right edge of the canvas.
     */
    public static TextHandle addBulletPoint(Slide slide, String text, Position position, String color, String icon) {
        Objects.requireNonNull(text, "text");
        Theme theme = slide.theme();
        Color c = theme.resolveColor(color);

        Size size = theme.bulletSize();
        double width = Math.max(0, Math.min(size.width(), Canvas.WIDTH - position.x()));
        String content = icon == null || icon.isEmpty() ? text : icon + " " + text;

        return slide.addTextBox(Box.of(position, Size.of(width, size.height())))
                .wordWrap(true)
                .addParagraph(content, TextStyle.of(theme.fontSize(FontRole.BULLET), c));
    }

    public static TextHandle addBulletPoint(Slide slide, String text, Position position, String color) {
        return addBulletPoint(slide, text, position, color, "");
    }

    // ---------- boxes ----------

    public static TextHandle addLabeledBox(Slide slide, String title, String description, String color, Box box) {
        Theme theme = slide.theme();
        return addLabeledBox(slide, title, description, color, box, theme.fontSize(FontRole.BOX_TITLE), Theme.BOX_TITLE);
    }

    /**
     * Filled rounded rectangle with a centered bold title and one regular paragraph per line of
     * {@code description} (which may be empty).
     */
    public static TextHandle addLabeledBox(Slide slide, String title, String description, String color, Box box,
                                           double titleSize, String titleColor) {
        Objects.requireNonNull(title, "title");
        Theme theme = slide.theme();
        Color fill = theme.resolveColor(color);
        Color titleFont = theme.resolveColor(titleColor);
        Color descriptionFont = theme.resolveColor(Theme.BOX_DESCRIPTION);

        slide.addShape(ShapeKind.ROUNDED_RECTANGLE, box, fill).noOutline();

        TextHandle text = slide.addTextBox(box.inset(LABEL_INSET_X, LABEL_INSET_Y))
                .wordWrap(true)
                .verticalAlignment(VerticalAlignment.MIDDLE)
                .addParagraph(title, TextStyle.of(titleSize, titleFont).bold(true).centered());

        if (description != null && !description.isEmpty()) {
            TextStyle style = TextStyle.of(theme.fontSize(FontRole.BOX_DESCRIPTION), descriptionFont).centered();
            String[] lines = description.split("\n", -1);
            for (int i = 0; i < lines.length; i++) {
                text.addParagraph(lines[i], i == 0 ? style.spaceBefore(DESCRIPTION_SPACE_BEFORE_PT) : style);
            }
        }
        return text;
    }

    // ---------- shapes and connectors ----------

    public static ShapeHandle addShape(Slide slide, ShapeKind kind, Box box, String color) {
        Color fill = slide.theme().resolveColor(color);
        return slide.addShape(kind, box, fill).noOutline();
    }

    /** Straight 2pt line for flow diagrams. */
    public static Element addConnector(Slide slide, Position from, Position to, String color) {
        Color c = slide.theme().resolveColor(color);
        return slide.addLine(from, to, c, CONNECTOR_WIDTH_PT);
    }
}
