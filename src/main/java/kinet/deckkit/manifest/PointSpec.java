package kinet.deckkit.manifest;

import kinet.deckkit.geometry.Position;

import static kinet.deckkit.manifest.ElementSpec.required;

public class PointSpec {
    private Double x;
    private Double y;

    public PointSpec() {}

    public PointSpec(double x, double y) {
        this.x = x;
        this.y = y;
    }

    public Double getX() { return x; }
    public void setX(Double x) { this.x = x; }

    public Double getY() { return y; }
    public void setY(Double y) { this.y = y; }

    public Position toPosition() {
        return Position.of(required(x, "point.x"), required(y, "point.y"));
    }
}
