package kinet.deckkit.slide;

import java.util.List;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * The elements of one slide, in z-order, as read from the document.
 */
public final class SlideSnapshot {

    private final int index;
    private final List<Element> elements;

    SlideSnapshot(int index, List<Element> elements) {
        this.index = index;
        this.elements = List.copyOf(elements);
    }

    public int index() {
        return index;
    }

    public List<Element> elements() {
        return elements;
    }

    public Element element(int z) {
        return elements.get(z);
    }

    /** Text of every text element, in z-order. */
    public List<String> texts() {
        return elements.stream()
                .filter(Element::isText)
                .map(Element::text)
                .collect(Collectors.toList());
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof SlideSnapshot)) return false;
        SlideSnapshot other = (SlideSnapshot) o;
        return index == other.index && elements.equals(other.elements);
    }

    @Override
    public int hashCode() {
        return Objects.hash(index, elements);
    }

    @Override
    public String toString() {
        return "Slide " + (index + 1) + " " + elements;
    }
}
