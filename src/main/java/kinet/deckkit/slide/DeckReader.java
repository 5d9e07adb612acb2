package kinet.deckkit.slide;

import org.apache.poi.xslf.usermodel.XMLSlideShow;
import org.apache.poi.xslf.usermodel.XSLFSlide;

import java.awt.Dimension;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Loads a saved presentation back into {@link SlideSnapshot}s.
 */
public final class DeckReader {

    private DeckReader() {}

    public static Contents read(Path path) throws IOException {
        try (InputStream is = Files.newInputStream(path);
             XMLSlideShow ppt = new XMLSlideShow(is)) {
            List<SlideSnapshot> slides = new ArrayList<>();
            int index = 0;
            for (XSLFSlide slide : ppt.getSlides()) {
                slides.add(new SlideSnapshot(index++, ElementReader.describe(slide)));
            }
            return new Contents(ppt.getPageSize(), slides);
        }
    }

    /** Page size and slides of a loaded file. */
    public static final class Contents {
        private final Dimension pageSize;
        private final List<SlideSnapshot> slides;

        Contents(Dimension pageSize, List<SlideSnapshot> slides) {
            this.pageSize = pageSize;
            this.slides = List.copyOf(slides);
        }

        public Dimension pageSize() {
            return pageSize;
        }

        public List<SlideSnapshot> slides() {
            return slides;
        }

        public int size() {
            return slides.size();
        }

        public SlideSnapshot slide(int index) {
            return slides.get(index);
        }
    }
}
