package kinet.deckkit.manifest;

import kinet.deckkit.ConfigurationException;
import kinet.deckkit.slide.Components;
import kinet.deckkit.slide.Slide;
import kinet.deckkit.theme.FontRole;

import java.util.List;

/**
 * Code block; the snippet is given either as one {@code code} string or as {@code lines}, which are
 * joined with {@code '\n'}.
 */
public class CodeSpec extends ElementSpec {
    private String code;
    private List<String> lines;
    private BoxSpec box;
    private Double size;

    public String getCode() { return code; }
    public void setCode(String code) { this.code = code; }

    public List<String> getLines() { return lines; }
    public void setLines(List<String> lines) { this.lines = lines; }

    public BoxSpec getBox() { return box; }
    public void setBox(BoxSpec box) { this.box = box; }

    public Double getSize() { return size; }
    public void setSize(Double size) { this.size = size; }

    String source() {
        if (code != null && lines != null) {
            throw new ConfigurationException("Code block has both 'code' and 'lines'");
        }
        if (code != null) return code;
        if (lines != null) return String.join("\n", lines);
        throw new ConfigurationException("Missing 'code.code' or 'code.lines'");
    }

    @Override
    public void apply(Slide slide) {
        double fontSize = size != null ? size : slide.theme().fontSize(FontRole.CODE);
        Components.addCodeBlock(slide, source(), required(box, "code.box").toBox(), fontSize);
    }
}
