package kinet.deckkit.manifest;

import kinet.deckkit.slide.Components;
import kinet.deckkit.slide.Slide;
import kinet.deckkit.theme.FontRole;
import kinet.deckkit.theme.Theme;

public class TitleSpec extends HeadingSpec {

    @Override
    public void apply(Slide slide) {
        String text = required(getText(), "title.text");
        double size = getSize() != null ? getSize() : slide.theme().fontSize(FontRole.TITLE);
        String color = getColor() != null ? getColor() : Theme.TITLE;
        Components.addTitle(slide, text, resolveBox(top -> Components.titleBox(slide, top)), size, color);
    }
}
