package kinet.deckkit.manifest;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import kinet.deckkit.ConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Reads deck manifests from JSON. The manifests shipped with the generator live on the classpath
 * under {@code decks/}, listed by {@code decks/index.json}.
 */
public final class ManifestLoader {

    private static final Logger log = LoggerFactory.getLogger(ManifestLoader.class);

    private static final String BUNDLED_ROOT = "decks/";
    private static final String BUNDLED_INDEX = BUNDLED_ROOT + "index.json";

    private final ObjectMapper mapper;

    public ManifestLoader() {
        this.mapper = new ObjectMapper()
                .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES)
                .enable(DeserializationFeature.FAIL_ON_NULL_FOR_PRIMITIVES);
    }

    public DeckManifest load(Path path) throws IOException {
        try (InputStream in = Files.newInputStream(path)) {
            return load(in, path.toString());
        }
    }

    public DeckManifest load(InputStream in, String source) throws IOException {
        DeckManifest manifest;
        try {
            manifest = mapper.readValue(in, DeckManifest.class);
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid manifest " + source + ": " + e.getOriginalMessage(), e);
        }
        validate(manifest, source);
        log.debug("loaded manifest {} ({} slides) from {}", manifest.getId(), manifest.getSlides().size(), source);
        return manifest;
    }

    public DeckManifest loadBundled(String id) throws IOException {
        String resource = BUNDLED_ROOT + id + ".json";
        try (InputStream in = openResource(resource)) {
            if (in == null) {
                throw new ConfigurationException("No bundled manifest '" + id + "' (" + resource + ")");
            }
            return load(in, resource);
        }
    }

    /** Ids of the bundled manifests, in generation order. */
    public List<String> bundledIds() throws IOException {
        try (InputStream in = openResource(BUNDLED_INDEX)) {
            if (in == null) {
                throw new ConfigurationException("Missing " + BUNDLED_INDEX + " on the classpath");
            }
            return mapper.readValue(in, new TypeReference<List<String>>() {});
        } catch (JsonProcessingException e) {
            throw new ConfigurationException("Invalid " + BUNDLED_INDEX + ": " + e.getOriginalMessage(), e);
        }
    }

    private static InputStream openResource(String name) {
        return ManifestLoader.class.getClassLoader().getResourceAsStream(name);
    }

    private static void validate(DeckManifest m, String source) {
        if (m.getId() == null || m.getId().isBlank()) {
            throw new ConfigurationException("Manifest " + source + " has no 'id'");
        }
        if (m.getOutput() == null || !m.getOutput().endsWith(".pptx")) {
            throw new ConfigurationException("Manifest " + m.getId() + " needs an 'output' ending in .pptx");
        }
        if (m.getSlides() == null || m.getSlides().isEmpty()) {
            throw new ConfigurationException("Manifest " + m.getId() + " has no slides");
        }
        for (int i = 0; i < m.getSlides().size(); i++) {
            SlideSpec s = m.getSlides().get(i);
            if (s == null || s.getElements() == null || s.getElements().contains(null)) {
                throw new ConfigurationException("Manifest " + m.getId() + ": slide " + (i + 1) + " has an empty element list entry");
            }
        }
    }
}
