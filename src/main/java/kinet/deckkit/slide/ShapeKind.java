package kinet.deckkit.slide;

import kinet.deckkit.ConfigurationException;
import org.apache.poi.sl.usermodel.ShapeType;

import java.util.Locale;

/**
 * Preset geometries the toolkit draws. Anything else is rejected as a configuration error.
 */
public enum ShapeKind {
    RECTANGLE(ShapeType.RECT),
    ROUNDED_RECTANGLE(ShapeType.ROUND_RECT),
    TRIANGLE(ShapeType.TRIANGLE),
    TRAPEZOID(ShapeType.TRAPEZOID),
    ELLIPSE(ShapeType.ELLIPSE);

    private final ShapeType shapeType;

    ShapeKind(ShapeType shapeType) {
        this.shapeType = shapeType;
    }

    ShapeType shapeType() {
        return shapeType;
    }

    /**
     * Accepts the enum name in any case, with dashes or underscores ({@code rounded-rectangle}).
     */
    public static ShapeKind fromName(String name) {
        String n = name == null ? "" : name.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        for (ShapeKind kind : values()) {
            if (kind.name().equals(n)) return kind;
        }
        throw new ConfigurationException("Unsupported shape kind: '" + name + "'");
    }

    static ShapeKind fromShapeType(ShapeType type) {
        for (ShapeKind kind : values()) {
            if (kind.shapeType == type) return kind;
        }
        return null;
    }
}
