package kinet.deckkit.manifest;

import java.util.ArrayList;
import java.util.List;

/**
 * Declarative description of one deck: its slides in presentation order, the file it is written to
 * and the theme overrides that give it its own look.
 */
public class DeckManifest {
    private String id;
    private String title;
    private String output;
    private ThemeSpec theme;
    private List<SlideSpec> slides = new ArrayList<>();

    public DeckManifest() {}

    public String getId() { return id; }
    public void setId(String id) { this.id = id; }

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    /** Output file name, relative to the generator's output directory. */
    public String getOutput() { return output; }
    public void setOutput(String output) { this.output = output; }

    public ThemeSpec getTheme() { return theme; }
    public void setTheme(ThemeSpec theme) { this.theme = theme; }

    public List<SlideSpec> getSlides() { return slides; }
    public void setSlides(List<SlideSpec> slides) { this.slides = slides; }
}
