package kinet.deckkit.manifest;

import kinet.deckkit.geometry.Position;
import kinet.deckkit.slide.Components;
import kinet.deckkit.slide.Slide;
import kinet.deckkit.theme.Theme;

public class BulletSpec extends ElementSpec {
    private String text;
    private Double x;
    private Double y;
    private String color;
    private String icon;

    public String getText() { return text; }
    public void setText(String text) { this.text = text; }

    public Double getX() { return x; }
    public void setX(Double x) { this.x = x; }

    public Double getY() { return y; }
    public void setY(Double y) { this.y = y; }

    public String getColor() { return color; }
    public void setColor(String color) { this.color = color; }

    public String getIcon() { return icon; }
    public void setIcon(String icon) { this.icon = icon; }

    @Override
    public void apply(Slide slide) {
        Position at = Position.of(required(x, "bullet.x"), required(y, "bullet.y"));
        Components.addBulletPoint(slide, required(text, "bullet.text"), at,
                color != null ? color : Theme.TEXT, icon != null ? icon : "");
    }
}
