package kinet.deckkit.manifest;

import kinet.deckkit.ConfigurationException;
import org.junit.jupiter.api.Test;

import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class ManifestLoaderTest {

    private final ManifestLoader loader = new ManifestLoader();

    private DeckManifest parse(String json) throws IOException {
        return loader.load(new ByteArrayInputStream(json.getBytes(StandardCharsets.UTF_8)), "inline");
    }

    @Test
    void bundledIdsAreListedInOrder() throws IOException {
        assertEquals(List.of("video-01", "video-02", "video-03", "video-04"), loader.bundledIds());
    }

    @Test
    void loadsBundledManifest() throws IOException {
        DeckManifest m = loader.loadBundled("video-02");

        assertEquals("video-02", m.getId());
        assertEquals("video-02-meet-payflow.pptx", m.getOutput());
        assertEquals("#EB5424", m.getTheme().getColors().get("auth0-orange"));

        ElementSpec first = m.getSlides().get(0).getElements().get(0);
        assertInstanceOf(TitleSpec.class, first);
        assertEquals("Meet PayFlow", ((TitleSpec) first).getText());
        assertEquals(72.0, ((TitleSpec) first).getSize());
    }

    @Test
    void codeLinesAreJoined() throws IOException {
        DeckManifest m = parse("{\"id\":\"x\",\"output\":\"x.pptx\",\"slides\":[{\"elements\":["
                + "{\"type\":\"code\",\"lines\":[\"a\",\"  b\"],\"box\":{\"x\":1,\"y\":1,\"width\":4,\"height\":2}}]}]}");
        CodeSpec code = (CodeSpec) m.getSlides().get(0).getElements().get(0);
        assertEquals("a\n  b", code.source());
    }

    @Test
    void unknownBundledIdFails() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> loader.loadBundled("video-99"));
        assertTrue(e.getMessage().contains("video-99"));
    }

    @Test
    void unknownElementTypeFails() {
        ConfigurationException e = assertThrows(ConfigurationException.class, () -> parse(
                "{\"id\":\"x\",\"output\":\"x.pptx\",\"slides\":[{\"elements\":[{\"type\":\"table\"}]}]}"));
        assertTrue(e.getMessage().contains("inline"));
    }

    @Test
    void unknownPropertyFails() {
        assertThrows(ConfigurationException.class, () -> parse(
                "{\"id\":\"x\",\"output\":\"x.pptx\",\"slides\":[{\"elements\":[{\"type\":\"title\",\"text\":\"t\",\"top\":1,\"font\":\"Arial\"}]}]}"));
    }

    @Test
    void missingIdOrBadOutputFails() {
        assertThrows(ConfigurationException.class, () -> parse(
                "{\"output\":\"x.pptx\",\"slides\":[{\"elements\":[]}]}"));
        assertThrows(ConfigurationException.class, () -> parse(
                "{\"id\":\"x\",\"output\":\"x.pdf\",\"slides\":[{\"elements\":[]}]}"));
        assertThrows(ConfigurationException.class, () -> parse(
                "{\"id\":\"x\",\"output\":\"x.pptx\",\"slides\":[]}"));
    }

    @Test
    void malformedJsonFails() {
        assertThrows(ConfigurationException.class, () -> parse("{\"id\":"));
    }
}
