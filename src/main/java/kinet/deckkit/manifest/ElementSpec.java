package kinet.deckkit.manifest;

import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import kinet.deckkit.ConfigurationException;
import kinet.deckkit.slide.Slide;

/**
 * One element of a slide in a manifest, selected by its {@code type} property.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "type")
@JsonSubTypes({
        @JsonSubTypes.Type(value = TitleSpec.class, name = "title"),
        @JsonSubTypes.Type(value = SubtitleSpec.class, name = "subtitle"),
        @JsonSubTypes.Type(value = CodeSpec.class, name = "code"),
        @JsonSubTypes.Type(value = BulletSpec.class, name = "bullet"),
        @JsonSubTypes.Type(value = LabeledBoxSpec.class, name = "labeledBox"),
        @JsonSubTypes.Type(value = ConnectorSpec.class, name = "connector"),
        @JsonSubTypes.Type(value = ShapeSpec.class, name = "shape")
})
public abstract class ElementSpec {

    /** Draws this element on {@code slide} through the composite components. */
    public abstract void apply(Slide slide);

    static <T> T required(T value, String what) {
        if (value == null) {
            throw new ConfigurationException("Missing '" + what + "'");
        }
        return value;
    }
}
