package kinet.deckkit.theme;

import kinet.deckkit.ConfigurationException;
import kinet.deckkit.geometry.Frame;
import kinet.deckkit.geometry.Size;

import java.awt.Color;
import java.util.Collections;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

/**
 * Immutable palette and typography shared by every slide of a deck.
 * <p>
 * Colors are looked up by semantic name; an unknown name is a {@link ConfigurationException}, never a
 * silent fallback. Per-deck variations are made with {@link #toBuilder()}, which leaves this instance
 * untouched.
 */
public final class Theme {

    // semantic roles the composites rely on
    public static final String BACKGROUND = "background";
    public static final String TITLE = "title";
    public static final String SUBTITLE = "subtitle";
    public static final String TEXT = "text";
    public static final String MUTED = "muted";
    public static final String CODE_BACKGROUND = "code-background";
    public static final String CODE_TEXT = "code-text";
    public static final String BOX_TITLE = "box-title";
    public static final String BOX_DESCRIPTION = "box-description";
    public static final String CONNECTOR = "connector";

    static final List<String> REQUIRED_COLORS = List.of(
            BACKGROUND, TITLE, SUBTITLE, TEXT, MUTED, CODE_BACKGROUND, CODE_TEXT,
            BOX_TITLE, BOX_DESCRIPTION, CONNECTOR);

    private static final Color ZINC_900 = new Color(24, 24, 27);
    private static final Color ZINC_800 = new Color(39, 39, 42);
    private static final Color ZINC_400 = new Color(161, 161, 170);
    private static final Color ZINC_200 = new Color(228, 228, 231);
    private static final Color WHITE = new Color(255, 255, 255);

    private static final Theme DEFAULTS = new Builder()
            // palette
            .color("white", WHITE)
            .color("gray", ZINC_400)
            .color("zinc-400", ZINC_400)
            .color("zinc-200", ZINC_200)
            .color("zinc-800", ZINC_800)
            .color("zinc-900", ZINC_900)
            .color("red", new Color(239, 68, 68))
            .color("yellow", new Color(245, 158, 11))
            .color("green", new Color(34, 197, 94))
            .color("blue", new Color(59, 130, 246))
            .color("purple", new Color(168, 85, 247))
            .color("cyan", new Color(6, 182, 212))
            .color("emerald", new Color(16, 185, 129))
            .color("red-300", new Color(252, 165, 165))
            .color("red-900", new Color(127, 29, 29))
            .color("amber-900", new Color(120, 53, 15))
            .color("blue-800", new Color(30, 64, 175))
            .color("green-800", new Color(22, 101, 52))
            // roles
            .color(BACKGROUND, ZINC_900)
            .color(TITLE, WHITE)
            .color(SUBTITLE, ZINC_400)
            .color(TEXT, WHITE)
            .color(MUTED, ZINC_400)
            .color(CODE_BACKGROUND, ZINC_800)
            .color(CODE_TEXT, ZINC_200)
            .color(BOX_TITLE, WHITE)
            .color(BOX_DESCRIPTION, ZINC_200)
            .color(CONNECTOR, ZINC_400)
            .fontSize(FontRole.TITLE, 60)
            .fontSize(FontRole.SUBTITLE, 32)
            .fontSize(FontRole.BULLET, 28)
            .fontSize(FontRole.CODE, 14)
            .fontSize(FontRole.BOX_TITLE, 24)
            .fontSize(FontRole.BOX_DESCRIPTION, 16)
            .codeFont("Menlo")
            .titleFrame(Frame.of(0.5, 12.333, 1.5))
            .subtitleFrame(Frame.of(1.0, 11.333, 1.0))
            .bulletSize(Size.of(10, 0.6))
            .codeInset(0.2, 0.2)
            .roundedCodeBlocks(true)
            .build();

    private final Map<String, Color> colors;
    private final Map<FontRole, Double> fontSizes;
    private final String codeFont;
    private final Frame titleFrame;
    private final Frame subtitleFrame;
    private final Size bulletSize;
    private final double codeInsetX;
    private final double codeInsetY;
    private final boolean roundedCodeBlocks;

    private Theme(Builder b) {
        this.colors = Collections.unmodifiableMap(new LinkedHashMap<>(b.colors));
        this.fontSizes = Collections.unmodifiableMap(new EnumMap<>(b.fontSizes));
        this.codeFont = b.codeFont;
        this.titleFrame = b.titleFrame;
        this.subtitleFrame = b.subtitleFrame;
        this.bulletSize = b.bulletSize;
        this.codeInsetX = b.codeInsetX;
        this.codeInsetY = b.codeInsetY;
        this.roundedCodeBlocks = b.roundedCodeBlocks;
    }

    /** The dark widescreen theme every deck starts from. */
    public static Theme defaults() {
        return DEFAULTS;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        Builder b = new Builder();
        b.colors.putAll(colors);
        b.fontSizes.putAll(fontSizes);
        b.codeFont = codeFont;
        b.titleFrame = titleFrame;
        b.subtitleFrame = subtitleFrame;
        b.bulletSize = bulletSize;
        b.codeInsetX = codeInsetX;
        b.codeInsetY = codeInsetY;
        b.roundedCodeBlocks = roundedCodeBlocks;
        return b;
    }

    public Color resolveColor(String name) {
        if (name == null || name.isBlank()) {
            throw new ConfigurationException("Theme color name is missing");
        }
        Color c = colors.get(normalize(name));
        if (c == null) {
            throw new ConfigurationException("Unknown theme color: '" + name + "'");
        }
        return c;
    }

    public boolean hasColor(String name) {
        return name != null && colors.containsKey(normalize(name));
    }

    public Set<String> colorNames() {
        return colors.keySet();
    }

    public double fontSize(FontRole role) {
        return fontSizes.get(role);
    }

    public String codeFont() {
        return codeFont;
    }

    public Frame titleFrame() {
        return titleFrame;
    }

    public Frame subtitleFrame() {
        return subtitleFrame;
    }

    public Size bulletSize() {
        return bulletSize;
    }

    public double codeInsetX() {
        return codeInsetX;
    }

    public double codeInsetY() {
        return codeInsetY;
    }

    public boolean roundedCodeBlocks() {
        return roundedCodeBlocks;
    }

    /**
     * Parses {@code #RRGGBB} (the leading {@code #} is optional).
     */
    public static Color parseColor(String value) {
        String s = value == null ? "" : value.trim();
        if (s.startsWith("#")) s = s.substring(1);
        if (!s.matches("[0-9a-fA-F]{6}")) {
            throw new ConfigurationException("Malformed color value: '" + value + "' (expected #RRGGBB)");
        }
        return new Color(Integer.parseInt(s, 16));
    }

    private static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    public static final class Builder {
        private final Map<String, Color> colors = new LinkedHashMap<>();
        private final Map<FontRole, Double> fontSizes = new EnumMap<>(FontRole.class);
        private String codeFont;
        private Frame titleFrame;
        private Frame subtitleFrame;
        private Size bulletSize;
        private double codeInsetX;
        private double codeInsetY;
        private boolean roundedCodeBlocks = true;

        private Builder() {}

        public Builder color(String name, Color color) {
            if (name == null || name.isBlank()) throw new ConfigurationException("Theme color name is missing");
            if (color == null) throw new ConfigurationException("Theme color '" + name + "' has no value");
            colors.put(normalize(name), color);
            return this;
        }

        public Builder color(String name, String hex) {
            return color(name, parseColor(hex));
        }

        public Builder fontSize(FontRole role, double size) {
            if (!(size > 0)) throw new ConfigurationException("Font size for " + role.key() + " must be positive: " + size);
            fontSizes.put(role, size);
            return this;
        }

        public Builder codeFont(String family) {
            this.codeFont = family;
            return this;
        }

        public Builder titleFrame(Frame frame) {
            this.titleFrame = frame;
            return this;
        }

        public Builder subtitleFrame(Frame frame) {
            this.subtitleFrame = frame;
            return this;
        }

        public Builder bulletSize(Size size) {
            this.bulletSize = size;
            return this;
        }

        public Builder codeInset(double x, double y) {
            this.codeInsetX = x;
            this.codeInsetY = y;
            return this;
        }

        public Builder roundedCodeBlocks(boolean rounded) {
            this.roundedCodeBlocks = rounded;
            return this;
        }

        public Theme build() {
            for (String role : REQUIRED_COLORS) {
                if (!colors.containsKey(role)) {
                    throw new ConfigurationException("Theme is missing required color '" + role + "'");
                }
            }
            for (FontRole role : FontRole.values()) {
                if (!fontSizes.containsKey(role)) {
                    throw new ConfigurationException("Theme is missing font size for '" + role.key() + "'");
                }
            }
            if (codeFont == null || codeFont.isBlank()) {
                throw new ConfigurationException("Theme is missing the code font");
            }
            if (titleFrame == null || subtitleFrame == null || bulletSize == null) {
                throw new ConfigurationException("Theme is missing title/subtitle frames or bullet size");
            }
            return new Theme(this);
        }
    }
}
