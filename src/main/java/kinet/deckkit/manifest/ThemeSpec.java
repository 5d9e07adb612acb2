package kinet.deckkit.manifest;

import kinet.deckkit.geometry.Frame;
import kinet.deckkit.geometry.Size;
import kinet.deckkit.theme.FontRole;
import kinet.deckkit.theme.Theme;

import java.util.LinkedHashMap;
import java.util.Map;

import static kinet.deckkit.manifest.ElementSpec.required;

/**
 * Per-deck theme overrides. Anything left out keeps the value of the base theme.
 */
public class ThemeSpec {
    private Map<String, String> colors = new LinkedHashMap<>();
    private Map<String, Double> fontSizes = new LinkedHashMap<>();
    private FrameSpec titleFrame;
    private FrameSpec subtitleFrame;
    private SizeSpec bulletSize;
    private PointSpec codeInset;
    private Boolean roundedCodeBlocks;
    private String codeFont;

    public Map<String, String> getColors() { return colors; }
    public void setColors(Map<String, String> colors) { this.colors = colors; }

    public Map<String, Double> getFontSizes() { return fontSizes; }
    public void setFontSizes(Map<String, Double> fontSizes) { this.fontSizes = fontSizes; }

    public FrameSpec getTitleFrame() { return titleFrame; }
    public void setTitleFrame(FrameSpec titleFrame) { this.titleFrame = titleFrame; }

    public FrameSpec getSubtitleFrame() { return subtitleFrame; }
    public void setSubtitleFrame(FrameSpec subtitleFrame) { this.subtitleFrame = subtitleFrame; }

    public SizeSpec getBulletSize() { return bulletSize; }
    public void setBulletSize(SizeSpec bulletSize) { this.bulletSize = bulletSize; }

    public PointSpec getCodeInset() { return codeInset; }
    public void setCodeInset(PointSpec codeInset) { this.codeInset = codeInset; }

    public Boolean getRoundedCodeBlocks() { return roundedCodeBlocks; }
    public void setRoundedCodeBlocks(Boolean roundedCodeBlocks) { this.roundedCodeBlocks = roundedCodeBlocks; }

    public String getCodeFont() { return codeFont; }
    public void setCodeFont(String codeFont) { this.codeFont = codeFont; }

    public Theme applyTo(Theme base) {
        Theme.Builder b = base.toBuilder();
        if (colors != null) colors.forEach(b::color);
        if (fontSizes != null) fontSizes.forEach((role, size) -> b.fontSize(FontRole.fromKey(role), size));
        if (titleFrame != null) b.titleFrame(titleFrame.toFrame());
        if (subtitleFrame != null) b.subtitleFrame(subtitleFrame.toFrame());
        if (bulletSize != null) b.bulletSize(bulletSize.toSize());
        if (codeInset != null) b.codeInset(required(codeInset.getX(), "codeInset.x"), required(codeInset.getY(), "codeInset.y"));
        if (roundedCodeBlocks != null) b.roundedCodeBlocks(roundedCodeBlocks);
        if (codeFont != null) b.codeFont(codeFont);
        return b.build();
    }

    public static class FrameSpec {
        private Double x;
        private Double width;
        private Double height;

        public Double getX() { return x; }
        public void setX(Double x) { this.x = x; }

        public Double getWidth() { return width; }
        public void setWidth(Double width) { this.width = width; }

        public Double getHeight() { return height; }
        public void setHeight(Double height) { this.height = height; }

        Frame toFrame() {
            return Frame.of(required(x, "frame.x"), required(width, "frame.width"), required(height, "frame.height"));
        }
    }

    public static class SizeSpec {
        private Double width;
        private Double height;

        public Double getWidth() { return width; }
        public void setWidth(Double width) { this.width = width; }

        public Double getHeight() { return height; }
        public void setHeight(Double height) { this.height = height; }

        Size toSize() {
            return Size.of(required(width, "size.width"), required(height, "size.height"));
        }
    }
}
