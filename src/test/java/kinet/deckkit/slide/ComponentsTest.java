package kinet.deckkit.slide;

import kinet.deckkit.ConfigurationException;
import kinet.deckkit.geometry.Box;
import kinet.deckkit.geometry.Canvas;
import kinet.deckkit.geometry.Position;
import kinet.deckkit.theme.Theme;
import org.apache.poi.sl.usermodel.TextParagraph.TextAlign;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.awt.Color;
import java.io.IOException;

import static org.junit.jupiter.api.Assertions.*;

class ComponentsTest {

    private static final double EPS = 1e-3;

    private Deck deck;
    private Slide slide;

    @BeforeEach
    void setUp() {
        deck = new Deck(Theme.defaults());
        deck.addSlide(s -> slide = s);
    }

    @AfterEach
    void tearDown() throws IOException {
        deck.close();
    }

    @Test
    void backgroundCoversTheCanvas() {
        assertEquals(1, slide.elementCount());
        Element bg = slide.element(0);
        assertEquals(ElementKind.SHAPE, bg.kind());
        assertEquals(ShapeKind.RECTANGLE, bg.shapeKind());
        assertEquals(new Color(24, 24, 27), bg.fill());
        assertNull(bg.lineColor());
        assertTrue(bg.box().approximatelyEquals(Canvas.bounds(), EPS));
        assertEquals(Canvas.WIDTH, bg.box().right(), 1e-9);
    }

    @Test
    void titleIsBoldCenteredAndWrapped() {
        Components.addTitle(slide, "Hello", 2.0);

        assertEquals(2, slide.elements().size());
        Element title = slide.element(1);
        assertEquals(ElementKind.TEXT, title.kind());
        assertEquals("Hello", title.text());
        assertEquals(60.0, title.fontSize());
        assertTrue(title.isBold());
        assertEquals(TextAlign.CENTER, title.alignment());
        assertTrue(title.isWordWrap());
        assertEquals(Color.WHITE, title.fontColor());
        assertTrue(title.box().approximatelyEquals(Box.of(0.5, 2.0, 12.333, 1.5), EPS));
    }

    @Test
    void subtitleUsesItsOwnBand() {
        Element subtitle = Components.addSubtitle(slide, "Nobody Talks About", 4.2).element();

        assertFalse(subtitle.isBold());
        assertEquals(32.0, subtitle.fontSize());
        assertEquals(new Color(161, 161, 170), subtitle.fontColor());
        assertTrue(subtitle.box().approximatelyEquals(Box.of(1.0, 4.2, 11.333, 1.0), EPS));
    }

    @Test
    void explicitTitleArgumentsWin() {
        Element title = Components.addTitle(slide, "You ship.", Box.of(0.5, 4.5, 12.333, 1.0), 48, "green").element();
        assertEquals(48.0, title.fontSize());
        assertEquals(new Color(34, 197, 94), title.fontColor());
    }

    @Test
    void codeBlockKeepsTextVerbatim() {
        String code = "const x = 1;\n  return x;\n\n}";
        Box box = Box.of(1, 1, 6, 3);
        Components.addCodeBlock(slide, code, box);

        Element background = slide.element(1);
        assertEquals(ShapeKind.ROUNDED_RECTANGLE, background.shapeKind());
        assertEquals(new Color(39, 39, 42), background.fill());
        assertTrue(background.box().approximatelyEquals(box, EPS));

        Element text = slide.element(2);
        assertEquals(code, text.text());
        assertEquals("Menlo", text.fontFamily());
        assertEquals(14.0, text.fontSize());
        assertFalse(text.isWordWrap());
        assertEquals(TextAlign.LEFT, text.alignment());
        assertEquals(new Color(228, 228, 231), text.fontColor());
        assertTrue(text.box().approximatelyEquals(Box.of(1.2, 1.2, 5.6, 2.6), EPS));
    }

    @Test
    void codeBlockFollowsThemeShapeAndInset() throws IOException {
        Theme square = Theme.defaults().toBuilder().roundedCodeBlocks(false).codeInset(0.2, 0.15).build();
        try (Deck other = new Deck(square)) {
            other.addSlide(s -> Components.addCodeBlock(s, "x", Box.of(2, 2.5, 9, 2), 18));
            Slide s = other.slides().get(0);
            assertEquals(ShapeKind.RECTANGLE, s.element(1).shapeKind());
            assertEquals(18.0, s.element(2).fontSize());
            assertTrue(s.element(2).box().approximatelyEquals(Box.of(2.2, 2.65, 8.6, 1.7), EPS));
        }
    }

    @Test
    void bulletPutsIconBeforeText() {
        Element bullet = Components.addBulletPoint(slide, "Real server", Position.of(1.5, 3.0), "white", "2.").element();

        assertEquals("2. Real server", bullet.text());
        assertEquals(28.0, bullet.fontSize());
        assertTrue(bullet.box().approximatelyEquals(Box.of(1.5, 3.0, 10, 0.6), EPS));

        Element plain = Components.addBulletPoint(slide, "TypeScript", Position.of(3, 2.7), "white").element();
        assertEquals("TypeScript", plain.text());
    }

    @Test
    void bulletNeverCrossesTheRightEdge() {
        Element bullet = Components.addBulletPoint(slide, "15 items in stock", Position.of(5, 1.5), "zinc-400").element();
        assertEquals(Canvas.WIDTH, bullet.box().right(), EPS);
        assertTrue(Canvas.contains(bullet.box()));
    }

    @Test
    void labeledBoxHasTitleAndDescriptionLines() {
        Box box = Box.of(0.8, 1.8, 3.8, 3);
        Components.addLabeledBox(slide, "Auth0", "Authentication\nUser Tiers\nReal SDK", "red-900", box);

        Element shape = slide.element(1);
        assertEquals(ShapeKind.ROUNDED_RECTANGLE, shape.shapeKind());
        assertEquals(new Color(127, 29, 29), shape.fill());

        Element text = slide.element(2);
        assertEquals("Auth0\nAuthentication\nUser Tiers\nReal SDK", text.text());
        assertTrue(text.isBold());
        assertEquals(24.0, text.fontSize());
        assertEquals(TextAlign.CENTER, text.alignment());
        assertTrue(text.box().approximatelyEquals(box.inset(0.2, 0.15), EPS));
    }

    @Test
    void labeledBoxWithoutDescription() {
        Components.addLabeledBox(slide, "Call #1\n15 units", "", "green", Box.of(1.5, 2.5, 3, 1.5));
        assertEquals("Call #1\n15 units", slide.element(2).text());
    }

    @Test
    void connectorKeepsItsDirection() {
        Element line = Components.addConnector(slide, Position.of(5, 4), Position.of(2, 1), Theme.CONNECTOR);

        assertEquals(ElementKind.LINE, line.kind());
        assertEquals(5, line.from().x(), EPS);
        assertEquals(4, line.from().y(), EPS);
        assertEquals(2, line.to().x(), EPS);
        assertEquals(1, line.to().y(), EPS);
        assertEquals(new Color(161, 161, 170), line.lineColor());

        Element reread = slide.element(1);
        assertEquals(line.from(), reread.from());
        assertEquals(line.to(), reread.to());
    }

    @Test
    void shapesByName() {
        Element triangle = Components.addShape(slide, ShapeKind.fromName("triangle"), Box.of(4.5, 1.5, 4.333, 1.5), "blue-800").element();
        assertEquals(ShapeKind.TRIANGLE, triangle.shapeKind());
        assertEquals(new Color(30, 64, 175), triangle.fill());
        assertThrows(ConfigurationException.class, () -> ShapeKind.fromName("hexagon"));
    }

    @Test
    void unknownColorLeavesSlideUnchanged() {
        int before = slide.elementCount();

        assertThrows(ConfigurationException.class,
                () -> Components.addTitle(slide, "x", Box.of(0.5, 1, 12, 1), 40, "chartreuse"));
        assertThrows(ConfigurationException.class,
                () -> Components.addLabeledBox(slide, "t", "d", "chartreuse", Box.of(1, 1, 3, 3)));
        assertThrows(ConfigurationException.class,
                () -> Components.addConnector(slide, Position.of(1, 1), Position.of(2, 2), "chartreuse"));

        assertEquals(before, slide.elementCount());
        assertEquals(before, slide.elements().size());
    }
}
