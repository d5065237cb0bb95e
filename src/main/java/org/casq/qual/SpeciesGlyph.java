package org.casq.qual;

import org.casq.util.Namespaces;

import javax.xml.bind.annotation.XmlAttribute;
import javax.xml.bind.annotation.XmlElement;
import javax.xml.bind.annotation.XmlType;

/**
 * Places one qualitative species on the layout. Coordinates are kept as the
 * strings found in the CellDesigner bounds so they are written back untouched.
 */
public class SpeciesGlyph {
    @XmlAttribute(namespace = Namespaces.LAYOUT)
    private String species;
    @XmlElement(namespace = Namespaces.LAYOUT)
    private BoundingBox boundingBox;

    public SpeciesGlyph() {
    }

    public SpeciesGlyph(String species, String x, String y, String width, String height) {
        this.species = species;
        this.boundingBox = new BoundingBox(new Position(x, y), new Dimensions(width, height));
    }

    public String getSpecies() {
        return species;
    }

    public BoundingBox getBoundingBox() {
        return boundingBox;
    }

    @XmlType(propOrder = {"position", "dimensions"})
    public static class BoundingBox {
        @XmlElement(namespace = Namespaces.LAYOUT)
        private Position position;
        @XmlElement(namespace = Namespaces.LAYOUT)
        private Dimensions dimensions;

        public BoundingBox() {
        }

        BoundingBox(Position position, Dimensions dimensions) {
            this.position = position;
            this.dimensions = dimensions;
        }

        public Position getPosition() {
            return position;
        }

        public Dimensions getDimensions() {
            return dimensions;
        }
    }

    public static class Position {
        @XmlAttribute(namespace = Namespaces.LAYOUT)
        private String x;
        @XmlAttribute(namespace = Namespaces.LAYOUT)
        private String y;

        public Position() {
        }

        Position(String x, String y) {
            this.x = x;
            this.y = y;
        }

        public String getX() {
            return x;
        }

        public String getY() {
            return y;
        }
    }

    public static class Dimensions {
        @XmlAttribute(namespace = Namespaces.LAYOUT)
        private String height;
        @XmlAttribute(namespace = Namespaces.LAYOUT)
        private String width;

        public Dimensions() {
        }

        Dimensions(String width, String height) {
            this.width = width;
            this.height = height;
        }

        public String getWidth() {
            return width;
        }

        public String getHeight() {
            return height;
        }
    }
}
