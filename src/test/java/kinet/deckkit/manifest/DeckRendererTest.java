package kinet.deckkit.manifest;

import kinet.deckkit.ConfigurationException;
import kinet.deckkit.geometry.Canvas;
import kinet.deckkit.slide.Deck;
import kinet.deckkit.slide.Element;
import kinet.deckkit.slide.ElementKind;
import kinet.deckkit.slide.ShapeKind;
import kinet.deckkit.slide.SlideSnapshot;
import kinet.deckkit.theme.FontRole;
import kinet.deckkit.theme.Theme;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;

import java.awt.Color;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class DeckRendererTest {

    private final ManifestLoader loader = new ManifestLoader();
    private final DeckRenderer renderer = new DeckRenderer();

    @ParameterizedTest
    @ValueSource(strings = {"video-01", "video-02", "video-03", "video-04"})
    void bundledDecksFitTheCanvas(String id) throws IOException {
        DeckManifest manifest = loader.loadBundled(id);
        try (Deck deck = renderer.render(manifest)) {
            assertEquals(manifest.getSlides().size(), deck.size());
            for (SlideSnapshot slide : deck.snapshot()) {
                for (Element e : slide.elements()) {
                    assertDoesNotThrow(() -> Canvas.requireWithin(e.box(), id + " slide " + (slide.index() + 1) + " " + e));
                }
            }
        }
    }

    @ParameterizedTest
    @CsvSource({"video-01, 16", "video-02, 20", "video-03, 19", "video-04, 9"})
    void bundledDecksKeepEverySlide(String id, int slides) throws IOException {
        DeckManifest manifest = loader.loadBundled(id);
        assertEquals(slides, manifest.getSlides().size());
        try (Deck deck = renderer.render(manifest)) {
            assertEquals(slides, deck.size());
        }
    }

    @Test
    void parallelTestingSlidesFollowTheTestingTable() throws IOException {
        try (Deck deck = renderer.render(loader.loadBundled("video-02"))) {
            List<SlideSnapshot> slides = deck.snapshot();
            assertEquals("The Easy Stuff", slides.get(11).texts().get(0));
            assertEquals("The Annoying Stuff", slides.get(12).texts().get(0));
            assertEquals("50 Tests in Parallel?", slides.get(15).texts().get(0));
            assertEquals("What if...", slides.get(17).texts().get(0));
        }
    }

    @Test
    void brandColorsComeFromTheManifestTheme() throws IOException {
        DeckManifest manifest = loader.loadBundled("video-02");
        Theme theme = renderer.themeFor(manifest);
        assertEquals(new Color(235, 84, 36), theme.resolveColor("auth0-orange"));
        assertFalse(Theme.defaults().hasColor("auth0-orange"));

        try (Deck deck = renderer.render(manifest)) {
            // three external services slide
            List<Element> elements = deck.snapshot().get(3).elements();
            assertTrue(elements.stream().anyMatch(e -> new Color(99, 91, 255).equals(e.fill())));
        }
    }

    @Test
    void typographyOverridesApplyPerDeck() throws IOException {
        DeckManifest manifest = loader.loadBundled("video-04");
        Theme theme = renderer.themeFor(manifest);
        assertEquals(54, theme.fontSize(FontRole.TITLE));
        assertEquals(24, theme.fontSize(FontRole.BULLET));
        assertFalse(theme.roundedCodeBlocks());

        try (Deck deck = renderer.render(manifest)) {
            Element title = deck.snapshot().get(0).element(1);
            assertEquals("Response Sequences", title.text());
            assertEquals(54.0, title.fontSize());

            // the problem slide: code block sits on a plain rectangle
            SlideSnapshot problem = deck.snapshot().get(2);
            assertTrue(problem.elements().stream()
                    .anyMatch(e -> e.kind() == ElementKind.SHAPE && e.shapeKind() == ShapeKind.RECTANGLE && e.zIndex() > 0));
        }
        assertEquals(60, Theme.defaults().fontSize(FontRole.TITLE));
    }

    @Test
    void errorsNameDeckAndSlide() throws IOException {
        String json = "{\"id\":\"broken\",\"output\":\"broken.pptx\",\"slides\":["
                + "{\"elements\":[{\"type\":\"title\",\"text\":\"ok\",\"top\":1}]},"
                + "{\"name\":\"bad color\",\"elements\":[{\"type\":\"bullet\",\"text\":\"x\",\"x\":1,\"y\":1,\"color\":\"chartreuse\"}]}]}";
        DeckManifest manifest = loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "inline");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> renderer.render(manifest));
        assertTrue(e.getMessage().startsWith("broken, slide 2 (bad color)"), e.getMessage());
        assertTrue(e.getMessage().contains("chartreuse"));
    }

    @ParameterizedTest
    @CsvSource(delimiter = '|', value = {
            "{\"type\":\"bullet\",\"text\":\"x\",\"x\":1}|bullet.y",
            "{\"type\":\"labeledBox\",\"title\":\"t\",\"color\":\"blue-800\",\"box\":{\"x\":1,\"y\":1,\"width\":3}}|box.height",
            "{\"type\":\"connector\",\"from\":{\"y\":1},\"to\":{\"x\":2,\"y\":1}}|point.x"
    })
    void missingCoordinatesFailInsteadOfDefaultingToZero(String element, String field) throws IOException {
        String json = "{\"id\":\"m\",\"output\":\"m.pptx\",\"slides\":[{\"name\":\"typo\",\"elements\":[" + element + "]}]}";
        DeckManifest manifest = loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "inline");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> renderer.render(manifest));
        assertTrue(e.getMessage().startsWith("m, slide 1 (typo)"), e.getMessage());
        assertTrue(e.getMessage().contains("'" + field + "'"), e.getMessage());
    }

    @Test
    void partialThemeGeometryFails() throws IOException {
        String json = "{\"id\":\"t\",\"output\":\"t.pptx\",\"theme\":{\"codeInset\":{\"x\":0.2}},"
                + "\"slides\":[{\"elements\":[]}]}";
        DeckManifest manifest = loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "inline");

        ConfigurationException e = assertThrows(ConfigurationException.class, () -> renderer.themeFor(manifest));
        assertTrue(e.getMessage().contains("'codeInset.y'"), e.getMessage());
    }

    @Test
    void headingNeedsTopOrBox() throws IOException {
        String json = "{\"id\":\"h\",\"output\":\"h.pptx\",\"slides\":[{\"elements\":[{\"type\":\"subtitle\",\"text\":\"floating\"}]}]}";
        DeckManifest manifest = loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "inline");
        assertThrows(ConfigurationException.class, () -> renderer.render(manifest));
    }
}
