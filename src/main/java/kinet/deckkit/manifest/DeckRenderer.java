package kinet.deckkit.manifest;

import kinet.deckkit.ConfigurationException;
import kinet.deckkit.slide.Deck;
import kinet.deckkit.theme.Theme;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.util.List;

/**
 * Turns a {@link DeckManifest} into a populated {@link Deck}: one {@code addSlide} per slide spec,
 * one composite call per element spec, in manifest order.
 */
public final class DeckRenderer {

    private static final Logger log = LoggerFactory.getLogger(DeckRenderer.class);

    private final Theme base;

    public DeckRenderer() {
        this(Theme.defaults());
    }

    public DeckRenderer(Theme base) {
        this.base = base;
    }

    public Theme themeFor(DeckManifest manifest) {
        return manifest.getTheme() == null ? base : manifest.getTheme().applyTo(base);
    }

    /**
     * Renders every slide; on failure the partly built deck is released and the error propagates,
     * with configuration errors prefixed by the manifest id and slide number.
     */
    public Deck render(DeckManifest manifest) {
        Theme theme = themeFor(manifest);
        Deck deck = new Deck(theme);
        List<SlideSpec> slides = manifest.getSlides();
        int n = 0;
        try {
            for (SlideSpec spec : slides) {
                n++;
                deck.addSlide(slide -> spec.getElements().forEach(e -> e.apply(slide)));
            }
        } catch (ConfigurationException e) {
            ConfigurationException failure = new ConfigurationException(
                    manifest.getId() + ", slide " + n + describe(slides.get(n - 1)) + ": " + e.getMessage(), e);
            release(deck, failure);
            throw failure;
        } catch (RuntimeException e) {
            release(deck, e);
            throw e;
        }
        log.debug("rendered {} with {} slide(s)", manifest.getId(), deck.size());
        return deck;
    }

    private static String describe(SlideSpec spec) {
        return spec.getName() == null ? "" : " (" + spec.getName() + ")";
    }

    private static void release(Deck deck, RuntimeException failure) {
        try {
            deck.close();
        } catch (IOException closeFailure) {
            failure.addSuppressed(closeFailure);
        }
    }
}
