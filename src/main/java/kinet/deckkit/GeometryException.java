package kinet.deckkit;

/**
 * A box that does not lie within the canvas. Builders never raise it; layouts are checked with
 * {@link kinet.deckkit.geometry.Canvas#requireWithin(kinet.deckkit.geometry.Box, String)}.
 */
public class GeometryException extends RuntimeException {

    public GeometryException(String message) {
        super(message);
    }
}
