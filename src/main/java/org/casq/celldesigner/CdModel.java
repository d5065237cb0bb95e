package org.casq.celldesigner;

import org.casq.util.Namespaces;

import javax.xml.bind.annotation.XmlElement;
import javax.xml.bind.annotation.XmlElementWrapper;
import javax.xml.bind.annotation.XmlType;
import java.util.ArrayList;
import java.util.List;

/**
 * The SBML model element with its CellDesigner alias lists.
 */
public class CdModel {
    @XmlElement
    private Annotation annotation;
    @XmlElementWrapper(name = "listOfSpecies")
    @XmlElement(name = "species")
    private List<Species> species;
    @XmlElementWrapper(name = "listOfReactions")
    @XmlElement(name = "reaction")
    private List<Reaction> reactions;

    public List<Species> getSpecies() {
        return (species == null) ? new ArrayList<>() : species;
    }

    public List<Reaction> getReactions() {
        return (reactions == null) ? new ArrayList<>() : reactions;
    }

    public List<SpeciesAlias> getComplexSpeciesAliases() {
        if (annotation == null || annotation.extension == null
                || annotation.extension.complexSpeciesAliases == null) {
            return new ArrayList<>();
        }
        return annotation.extension.complexSpeciesAliases;
    }

    public List<SpeciesAlias> getSpeciesAliases() {
        if (annotation == null || annotation.extension == null
                || annotation.extension.speciesAliases == null) {
            return new ArrayList<>();
        }
        return annotation.extension.speciesAliases;
    }

    @XmlType(name = "modelAnnotation")
    public static class Annotation {
        @XmlElement(namespace = Namespaces.CELLDESIGNER)
        private Extension extension;
    }

    @XmlType(name = "modelExtension")
    public static class Extension {
        @XmlElementWrapper(name = "listOfComplexSpeciesAliases", namespace = Namespaces.CELLDESIGNER)
        @XmlElement(name = "complexSpeciesAlias", namespace = Namespaces.CELLDESIGNER)
        private List<SpeciesAlias> complexSpeciesAliases;
        @XmlElementWrapper(name = "listOfSpeciesAliases", namespace = Namespaces.CELLDESIGNER)
        @XmlElement(name = "speciesAlias", namespace = Namespaces.CELLDESIGNER)
        private List<SpeciesAlias> speciesAliases;
    }
}
