package kinet.deckkit.manifest;

import java.util.ArrayList;
import java.util.List;

public class SlideSpec {
    private String name;
    private List<ElementSpec> elements = new ArrayList<>();

    public SlideSpec() {}

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }

    public List<ElementSpec> getElements() { return elements; }
    public void setElements(List<ElementSpec> elements) { this.elements = elements; }
}
