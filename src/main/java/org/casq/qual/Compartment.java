package org.casq.qual;

import javax.xml.bind.annotation.XmlAttribute;

public class Compartment {
    @XmlAttribute
    private boolean constant;
    @XmlAttribute
    private String id;

    public Compartment() {
    }

    public Compartment(String id, boolean constant) {
        this.id = id;
        this.constant = constant;
    }

    public boolean isConstant() {
        return constant;
    }

    public String getId() {
        return id;
    }
}
