package kinet.deckkit.manifest;

import kinet.deckkit.slide.Components;
import kinet.deckkit.slide.Slide;
import kinet.deckkit.theme.FontRole;
import kinet.deckkit.theme.Theme;

public class SubtitleSpec extends HeadingSpec {

    @Override
    public void apply(Slide slide) {
        String text = required(getText(), "subtitle.text");
        double size = getSize() != null ? getSize() : slide.theme().fontSize(FontRole.SUBTITLE);
        String color = getColor() != null ? getColor() : Theme.SUBTITLE;
        Components.addSubtitle(slide, text, resolveBox(top -> Components.subtitleBox(slide, top)), size, color);
    }
}
