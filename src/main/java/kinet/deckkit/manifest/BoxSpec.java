package kinet.deckkit.manifest;

import kinet.deckkit.geometry.Box;

import static kinet.deckkit.manifest.ElementSpec.required;

public class BoxSpec {
    private Double x;
    private Double y;
    private Double width;
    private Double height;

    public BoxSpec() {}

    public BoxSpec(double x, double y, double width, double height) {
        this.x = x;
        this.y = y;
        this.width = width;
        this.height = height;
    }

    public Double getX() { return x; }
    public void setX(Double x) { this.x = x; }

    public Double getY() { return y; }
    public void setY(Double y) { this.y = y; }

    public Double getWidth() { return width; }
    public void setWidth(Double width) { this.width = width; }

    public Double getHeight() { return height; }
    public void setHeight(Double height) { this.height = height; }

    public Box toBox() {
        return Box.of(required(x, "box.x"), required(y, "box.y"),
                required(width, "box.width"), required(height, "box.height"));
    }
}
