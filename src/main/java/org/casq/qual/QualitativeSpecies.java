package org.casq.qual;

import org.casq.util.Namespaces;

import javax.xml.bind.annotation.XmlAttribute;

public class QualitativeSpecies {
    @XmlAttribute(namespace = Namespaces.QUAL)
    private int maxLevel;
    @XmlAttribute(namespace = Namespaces.QUAL)
    private String compartment;
    @XmlAttribute(namespace = Namespaces.QUAL)
    private String name;
    @XmlAttribute(namespace = Namespaces.QUAL)
    private boolean constant;
    @XmlAttribute(namespace = Namespaces.QUAL)
    private String id;

    public QualitativeSpecies() {
    }

    public QualitativeSpecies(String id, String name, String compartment, int maxLevel, boolean constant) {
        this.id = id;
        this.name = name;
        this.compartment = compartment;
        this.maxLevel = maxLevel;
        this.constant = constant;
    }

    public int getMaxLevel() {
        return maxLevel;
    }

    public String getCompartment() {
        return compartment;
    }

    public String getName() {
        return name;
    }

    public boolean isConstant() {
        return constant;
    }

    public String getId() {
        return id;
    }
}
