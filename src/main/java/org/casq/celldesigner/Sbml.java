package org.casq.celldesigner;

import javax.xml.bind.annotation.XmlElement;

public class Sbml {
    @XmlElement
    private CdModel model;

    public CdModel getModel() {
        return model;
    }
}
