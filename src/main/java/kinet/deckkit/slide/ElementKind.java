package kinet.deckkit.slide;

public enum ElementKind {
    TEXT,
    SHAPE,
    LINE,
    /** Anything the toolkit does not draw itself (pictures, groups); only seen in reloaded files. */
    OTHER
}
