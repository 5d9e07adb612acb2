package kinet.deckkit.slide;

import kinet.deckkit.geometry.Box;
import kinet.deckkit.geometry.Canvas;
import kinet.deckkit.geometry.Position;
import org.apache.poi.sl.draw.DrawPaint;
import org.apache.poi.sl.usermodel.PaintStyle;
import org.apache.poi.sl.usermodel.TextParagraph.TextAlign;
import org.apache.poi.xslf.usermodel.XSLFAutoShape;
import org.apache.poi.xslf.usermodel.XSLFConnectorShape;
import org.apache.poi.xslf.usermodel.XSLFShape;
import org.apache.poi.xslf.usermodel.XSLFSlide;
import org.apache.poi.xslf.usermodel.XSLFTextBox;
import org.apache.poi.xslf.usermodel.XSLFTextParagraph;
import org.apache.poi.xslf.usermodel.XSLFTextRun;

import java.awt.Color;
import java.util.ArrayList;
import java.util.List;

/**
 * Turns document shapes into {@link Element} snapshots.
 */
final class ElementReader {

    private static final String LINE_BREAK = "\n";

    private ElementReader() {}

    static List<Element> describe(XSLFSlide slide) {
        List<Element> out = new ArrayList<>();
        int z = 0;
        for (XSLFShape shape : slide.getShapes()) {
            out.add(describe(shape, z++));
        }
        return out;
    }

    static Element describe(XSLFShape shape, int z) {
        Box box = Canvas.fromAnchor(shape.getAnchor());

        if (shape instanceof XSLFConnectorShape) {
            XSLFConnectorShape line = (XSLFConnectorShape) shape;
            boolean flipH = line.getFlipHorizontal();
            boolean flipV = line.getFlipVertical();
            Position from = Position.of(flipH ? box.right() : box.x(), flipV ? box.bottom() : box.y());
            Position to = Position.of(flipH ? box.x() : box.right(), flipV ? box.y() : box.bottom());
            return Element.builder(ElementKind.LINE, z, box)
                    .lineColor(line.getLineColor())
                    .endpoints(from, to)
                    .build();
        }
        // a text box is also an auto shape, test it first
        if (shape instanceof XSLFTextBox) {
            return describeText((XSLFTextBox) shape, z, box);
        }
        if (shape instanceof XSLFAutoShape) {
            XSLFAutoShape s = (XSLFAutoShape) shape;
            return Element.builder(ElementKind.SHAPE, z, box)
                    .shapeKind(ShapeKind.fromShapeType(s.getShapeType()))
                    .fill(s.getFillColor())
                    .lineColor(s.getLineColor())
                    .build();
        }
        return Element.builder(ElementKind.OTHER, z, box).build();
    }

    private static Element describeText(XSLFTextBox tb, int z, Box box) {
        StringBuilder text = new StringBuilder();
        XSLFTextRun styled = null;
        TextAlign alignment = null;

        List<XSLFTextParagraph> paragraphs = tb.getTextParagraphs();
        for (int i = 0; i < paragraphs.size(); i++) {
            XSLFTextParagraph p = paragraphs.get(i);
            if (i == 0) {
                alignment = p.getTextAlign();
            } else {
                text.append('\n');
            }
            for (XSLFTextRun r : p.getTextRuns()) {
                String raw = r.getRawText();
                text.append(raw);
                if (styled == null && !LINE_BREAK.equals(raw)) styled = r;
            }
        }

        Element.Builder b = Element.builder(ElementKind.TEXT, z, box)
                .text(text.toString())
                .alignment(alignment)
                .wordWrap(tb.getWordWrap());
        if (styled != null) {
            b.fontSize(styled.getFontSize())
                    .bold(styled.isBold())
                    .fontFamily(styled.getFontFamily())
                    .fontColor(solidColor(styled.getFontColor()));
        }
        return b.build();
    }

    private static Color solidColor(PaintStyle paint) {
        if (paint instanceof PaintStyle.SolidPaint) {
            return DrawPaint.applyColorTransform(((PaintStyle.SolidPaint) paint).getSolidColor());
        }
        return null;
    }
}
