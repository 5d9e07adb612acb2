package kinet.deckkit.manifest;

import kinet.deckkit.slide.Components;
import kinet.deckkit.slide.Slide;
import kinet.deckkit.theme.FontRole;
import kinet.deckkit.theme.Theme;

public class LabeledBoxSpec extends ElementSpec {
    private String title;
    private String description;
    private String color;
    private BoxSpec box;
    private Double titleSize;
    private String titleColor;

    public String getTitle() { return title; }
    public void setTitle(String title) { this.title = title; }

    public String getDescription() { return description; }
    public void setDescription(String description) { this.description = description; }

    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }

    public BoxSpec getBox() { return box; }
    public void setBox(BoxSpec box) { this.box = box; }

    public Double getTitleSize() { return titleSize; }
    public void setTitleSize(Double titleSize) { this.titleSize = titleSize; }

    public String getTitleColor() { return titleColor; }
    public void setTitleColor(String titleColor) { this.titleColor = titleColor; }

    @Override
    public void apply(Slide slide) {
        double size = titleSize != null ? titleSize : slide.theme().fontSize(FontRole.BOX_TITLE);
        Components.addLabeledBox(slide,
                required(title, "labeledBox.title"),
                description != null ? description : "",
                required(color, "labeledBox.color"),
                required(box, "labeledBox.box").toBox(),
                size,
                titleColor != null ? titleColor : Theme.BOX_TITLE);
    }
}
