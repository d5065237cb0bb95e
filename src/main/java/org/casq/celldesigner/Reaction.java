package org.casq.celldesigner;

import org.casq.util.Namespaces;

import javax.xml.bind.annotation.XmlAttribute;
import javax.xml.bind.annotation.XmlElement;
import javax.xml.bind.annotation.XmlElementWrapper;
import javax.xml.bind.annotation.XmlType;
import java.util.ArrayList;
import java.util.List;

/**
 * An SBML reaction; only its celldesigner:extension annotation is bound.
 */
public class Reaction {
    @XmlElement
    private Annotation annotation;

    public String getReactionType() {
        return (extension() == null) ? null : extension().reactionType;
    }

    public List<AliasLink> getBaseReactants() {
        Extension ext = extension();
        return (ext == null || ext.baseReactants == null) ? new ArrayList<>() : ext.baseReactants;
    }

    public List<AliasLink> getBaseProducts() {
        Extension ext = extension();
        return (ext == null || ext.baseProducts == null) ? new ArrayList<>() : ext.baseProducts;
    }

    public List<Modification> getModifications() {
        Extension ext = extension();
        return (ext == null || ext.modifications == null) ? new ArrayList<>() : ext.modifications;
    }

    private Extension extension() {
        return (annotation == null) ? null : annotation.extension;
    }

    @XmlType(name = "reactionAnnotation")
    public static class Annotation {
        @XmlElement(namespace = Namespaces.CELLDESIGNER)
        private Extension extension;
    }

    @XmlType(name = "reactionExtension")
    public static class Extension {
        @XmlElement(namespace = Namespaces.CELLDESIGNER)
        private String reactionType;
        @XmlElementWrapper(name = "baseReactants", namespace = Namespaces.CELLDESIGNER)
        @XmlElement(name = "baseReactant", namespace = Namespaces.CELLDESIGNER)
        private List<AliasLink> baseReactants;
        @XmlElementWrapper(name = "baseProducts", namespace = Namespaces.CELLDESIGNER)
        @XmlElement(name = "baseProduct", namespace = Namespaces.CELLDESIGNER)
        private List<AliasLink> baseProducts;
        @XmlElementWrapper(name = "listOfModification", namespace = Namespaces.CELLDESIGNER)
        @XmlElement(name = "modification", namespace = Namespaces.CELLDESIGNER)
        private List<Modification> modifications;
    }

    /** celldesigner:baseReactant / celldesigner:baseProduct */
    @XmlType(name = "aliasLink")
    public static class AliasLink {
        @XmlAttribute
        private String alias;

        public String getAlias() {
            return alias;
        }
    }

    @XmlType(name = "reactionModification")
    public static class Modification {
        @XmlAttribute
        private String type;
        @XmlAttribute
        private String aliases;

        public String getType() {
            return type;
        }

        public String getAliases() {
            return aliases;
        }
    }
}
