package kinet.deckkit;

import kinet.deckkit.manifest.DeckManifest;
import kinet.deckkit.manifest.DeckRenderer;
import kinet.deckkit.manifest.ManifestLoader;
import kinet.deckkit.slide.Deck;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Renders bundled deck manifests to .pptx files.
 * <p>
 * Usage: {@code DeckGenerator [id ...]}. Without arguments every bundled manifest is generated.
 * Files go to the directory named by the {@code deckkit.outputDir} system property, or the
 * working directory.
 */
public final class DeckGenerator {

    private static final Logger log = LoggerFactory.getLogger(DeckGenerator.class);

    public static final String OUTPUT_DIR_PROPERTY = "deckkit.outputDir";

    private final ManifestLoader loader;
    private final DeckRenderer renderer;
    private final Path outputDir;

    public DeckGenerator(Path outputDir) {
        this(new ManifestLoader(), new DeckRenderer(), outputDir);
    }

    public DeckGenerator(ManifestLoader loader, DeckRenderer renderer, Path outputDir) {
        this.loader = loader;
        this.renderer = renderer;
        this.outputDir = outputDir;
    }

    public static void main(String[] args) throws IOException {
        Path outputDir = Paths.get(System.getProperty(OUTPUT_DIR_PROPERTY, "."));
        DeckGenerator generator = new DeckGenerator(outputDir);
        List<String> ids = args.length > 0 ? Arrays.asList(args) : generator.loader.bundledIds();
        for (Path path : generator.generateAll(ids)) {
            System.out.println("Presentation saved to: " + path);
        }
    }

    public List<Path> generateAll(List<String> ids) throws IOException {
        List<Path> written = new ArrayList<>();
        for (String id : ids) {
            written.add(generate(id));
        }
        return written;
    }

    public Path generate(String id) throws IOException {
        return generate(loader.loadBundled(id));
    }

    public Path generate(DeckManifest manifest) throws IOException {
        Path target = outputDir.resolve(manifest.getOutput()).toAbsolutePath().normalize();
        log.info("Generating {} -> {}", manifest.getId(), target);
        Deck deck = renderer.render(manifest);
        deck.save(target);
        return target;
    }
}
