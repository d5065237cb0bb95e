package org.casq.qual;

import org.casq.util.Namespaces;

import javax.xml.bind.annotation.XmlElement;
import javax.xml.bind.annotation.XmlElementWrapper;
import java.util.ArrayList;
import java.util.List;

public class Layout {
    @XmlElementWrapper(name = "listOfSpeciesGlyphs", namespace = Namespaces.LAYOUT)
    @XmlElement(name = "speciesGlyph", namespace = Namespaces.LAYOUT)
    private List<SpeciesGlyph> speciesGlyphs = new ArrayList<>();

    public List<SpeciesGlyph> getSpeciesGlyphs() {
        return speciesGlyphs;
    }
}
