package org.casq.qual;

import org.casq.util.Namespaces;

import javax.xml.bind.annotation.XmlAttribute;
import javax.xml.bind.annotation.XmlElement;
import javax.xml.bind.annotation.XmlRootElement;

@XmlRootElement(name = "sbml")
public class QualSbml {
    @XmlAttribute
    private int level = 3;
    @XmlAttribute
    private int version = 1;
    @XmlAttribute(name = "required", namespace = Namespaces.LAYOUT)
    private boolean layoutRequired = false;
    @XmlAttribute(name = "required", namespace = Namespaces.QUAL)
    private boolean qualRequired = true;
    @XmlElement
    private QualModel model;

    public QualSbml() {
    }

    public QualSbml(QualModel model) {
        this.model = model;
    }

    public QualModel getModel() {
        return model;
    }
}
