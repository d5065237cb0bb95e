package org.casq.celldesigner;

import org.casq.util.Namespaces;

import javax.xml.bind.annotation.XmlAttribute;
import javax.xml.bind.annotation.XmlElement;
import javax.xml.bind.annotation.XmlElementWrapper;
import javax.xml.bind.annotation.XmlType;
import java.util.List;

/**
 * An SBML species definition. CellDesigner 4 keeps the species identity under
 * annotation/extension, older releases directly under annotation; both are bound.
 */
public class Species {
    @XmlAttribute
    private String id;
    @XmlAttribute
    private String name;
    @XmlElement
    private Annotation annotation;

    public String getId() {
        return id;
    }

    public String getName() {
        return name;
    }

    public Identity getIdentity() {
        if (annotation == null) {
            return null;
        }
        if (annotation.extension != null && annotation.extension.speciesIdentity != null) {
            return annotation.extension.speciesIdentity;
        }
        return annotation.speciesIdentity;
    }

    @XmlType(name = "speciesAnnotation")
    public static class Annotation {
        @XmlElement(namespace = Namespaces.CELLDESIGNER)
        private Extension extension;
        @XmlElement(namespace = Namespaces.CELLDESIGNER)
        private Identity speciesIdentity;
    }

    @XmlType(name = "speciesExtension")
    public static class Extension {
        @XmlElement(namespace = Namespaces.CELLDESIGNER)
        private Identity speciesIdentity;
    }

    @XmlType(name = "speciesIdentity")
    public static class Identity {
        @XmlElement(name = "class", namespace = Namespaces.CELLDESIGNER)
        private String speciesClass;
        @XmlElement(namespace = Namespaces.CELLDESIGNER)
        private State state;

        public String getSpeciesClass() {
            return speciesClass;
        }

        public List<Modification> getModifications() {
            return (state == null) ? null : state.modifications;
        }
    }

    @XmlType(name = "speciesState")
    public static class State {
        @XmlElementWrapper(name = "listOfModifications", namespace = Namespaces.CELLDESIGNER)
        @XmlElement(name = "modification", namespace = Namespaces.CELLDESIGNER)
        private List<Modification> modifications;
    }

    @XmlType(name = "speciesModification")
    public static class Modification {
        @XmlAttribute
        private String state;

        public String getState() {
            return state;
        }
    }
}
