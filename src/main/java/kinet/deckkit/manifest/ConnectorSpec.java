package kinet.deckkit.manifest;

import kinet.deckkit.slide.Components;
import kinet.deckkit.slide.Slide;
import kinet.deckkit.theme.Theme;

public class ConnectorSpec extends ElementSpec {
    private PointSpec from;
    private PointSpec to;
    private String color;

    public PointSpec getFrom() { return from; }
    public void setFrom(PointSpec from) { this.from = from; }

    public PointSpec getTo() { return to; }
    public void setTo(PointSpec to) { this.to = to; }

    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }

    @Override
    public void apply(Slide slide) {
        Components.addConnector(slide,
                required(from, "connector.from").toPosition(),
                required(to, "connector.to").toPosition(),
                color != null ? color : Theme.CONNECTOR);
    }
}
