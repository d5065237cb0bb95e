package org.casq.celldesigner;

import org.casq.util.Namespaces;

import javax.xml.bind.annotation.XmlAttribute;
import javax.xml.bind.annotation.XmlElement;
import javax.xml.bind.annotation.XmlType;

/**
 * A celldesigner:speciesAlias or celldesigner:complexSpeciesAlias, i.e. one placement
 * of a species on the canvas.
 */
public class SpeciesAlias {
    @XmlAttribute
    private String id;
    @XmlAttribute
    private String species;
    @XmlAttribute
    private String compartmentAlias;
    @XmlElement(namespace = Namespaces.CELLDESIGNER)
    private String activity;
    @XmlElement(namespace = Namespaces.CELLDESIGNER)
    private Bounds bounds;

    public String getId() {
        return id;
    }

    public String getSpecies() {
        return species;
    }

    public String getCompartmentAlias() {
        return compartmentAlias;
    }

    public String getActivity() {
        return activity;
    }

    public Bounds getBounds() {
        return bounds;
    }

    @XmlType(name = "bounds")
    public static class Bounds {
        @XmlAttribute
        private String x;
        @XmlAttribute
        private String y;
        @XmlAttribute
        private String w;
        @XmlAttribute
        private String h;

        public String getX() {
            return x;
        }

        public String getY() {
            return y;
        }

        public String getW() {
            return w;
        }

        public String getH() {
            return h;
        }
    }
}
