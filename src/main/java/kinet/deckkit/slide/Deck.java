package kinet.deckkit.slide;

import kinet.deckkit.geometry.Canvas;
import kinet.deckkit.theme.Theme;
import org.apache.poi.xslf.usermodel.SlideLayout;
import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFSlideLayout;
import org.apache.poi.xslf.usermodel.XSLFSlideMaster;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedOutputStream;
import java.io.Closeable;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.file.AtomicMoveNotSupportedException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.nio.file.StandardOpenOption;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.stream.Collectors;

/**
 * An ordered, append-only sequence of slides sharing one {@link Theme}, persisted once by
 * {@link #save(Path)}.
 * <p>
 * Slides are created through {@link #addSlide(Consumer)}: the new slide already carries its
 * full-canvas background and is the only slide that accepts elements until the next one is created.
 * A deck is not thread-safe.
 */
public final class Deck implements Closeable {

    private static final Logger log = LoggerFactory.getLogger(Deck.class);

    private final Theme theme;
    private final XMLSlideShow ppt;
    private final List<Slide> slides = new ArrayList<>();
    private boolean released;

    public Deck(Theme theme) {
        this.theme = Objects.requireNonNull(theme, "theme");
        this.ppt = new XMLSlideShow();
        this.ppt.setPageSize(Canvas.PAGE_SIZE);
    }

    /**
     * Creates a background slide, lets {@code buildFn} populate it and keeps it. If {@code buildFn}
     * throws, the slide is dropped again and the exception propagates.
     */
    public Deck addSlide(Consumer<Slide> buildFn) {
        Objects.requireNonNull(buildFn, "buildFn");
        Slide slide = Components.addBackgroundSlide(this);
        try {
            buildFn.accept(slide);
        } catch (RuntimeException | Error e) {
            discard(slide);
            throw e;
        }
        log.debug("slide {} built with {} element(s)", slide.index() + 1, slide.elementCount());
        return this;
    }

    /** Appends an empty slide and makes it the active one. */
    Slide newSlide() {
        requireOpen();
        if (!slides.isEmpty()) {
            slides.get(slides.size() - 1).deactivate();
        }
        XSLFSlide xslf = ppt.createSlide(blankLayout());
        Slide slide = new Slide(this, xslf, slides.size());
        slides.add(slide);
        return slide;
    }

    private void discard(Slide slide) {
        slide.deactivate();
        slides.remove(slide);
        ppt.removeSlide(slide.index());
        log.debug("slide {} discarded after a failed build", slide.index() + 1);
    }

    private XSLFSlideLayout blankLayout() {
        XSLFSlideMaster master = ppt.getSlideMasters().get(0);
        XSLFSlideLayout layout = master.getLayout(SlideLayout.BLANK);
        return layout != null ? layout : master.getSlideLayouts()[0];
    }

    /**
     * Writes every slide, in order, to {@code target} and releases the deck.
     * <p>
     * The document is written to a temporary file next to {@code target} and then moved over it, so
     * {@code target} is either the previous file, absent, or the complete new document. The deck is
     * released on every exit path and cannot be saved twice.
     */
    public void save(Path target) throws IOException {
        requireOpen();
        Path out = target.toAbsolutePath().normalize();
        try (XMLSlideShow show = ppt) {
            released = true;
            Path dir = out.getParent();
            Files.createDirectories(dir);
            Path tmp = dir.resolve(out.getFileName() + ".tmp");
            try {
                try (OutputStream os = new BufferedOutputStream(Files.newOutputStream(tmp,
                        StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING, StandardOpenOption.WRITE))) {
                    show.write(os);
                }
                try {
                    Files.move(tmp, out, StandardCopyOption.REPLACE_EXISTING, StandardCopyOption.ATOMIC_MOVE);
                } catch (AtomicMoveNotSupportedException ex) {
                    Files.move(tmp, out, StandardCopyOption.REPLACE_EXISTING);
                }
            } catch (IOException | RuntimeException e) {
                try {
                    Files.deleteIfExists(tmp);
                } catch (IOException cleanup) {
                    e.addSuppressed(cleanup);
                }
                throw e;
            }
        }
        log.info("Wrote {} slide(s) to {}", slides.size(), out);
    }

    /** Releases the deck without writing anything. */
    @Override
    public void close() throws IOException {
        if (released) return;
        released = true;
        ppt.close();
    }

    public Theme theme() {
        return theme;
    }

    public List<Slide> slides() {
        return Collections.unmodifiableList(slides);
    }

    public int size() {
        return slides.size();
    }

    public boolean isReleased() {
        return released;
    }

    public List<SlideSnapshot> snapshot() {
        requireOpen();
        return slides.stream().map(Slide::snapshot).collect(Collectors.toList());
    }

    private void requireOpen() {
        if (released) {
            throw new IllegalStateException("Deck has already been saved or closed");
        }
    }
}
