/**
 * JAXB bindings for the SBML Level 3 qual document the converter writes,
 * including the species glyphs of the layout package.
 */
@XmlSchema(
        namespace = Namespaces.SBML_L3V1,
        elementFormDefault = XmlNsForm.QUALIFIED,
        xmlns = {
                @XmlNs(prefix = "", namespaceURI = Namespaces.SBML_L3V1),
                @XmlNs(prefix = "layout", namespaceURI = Namespaces.LAYOUT),
                @XmlNs(prefix = "qual", namespaceURI = Namespaces.QUAL)
        })
@XmlAccessorType(XmlAccessType.FIELD)
package org.casq.qual;

import org.casq.util.Namespaces;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import javax.xml.bind.annotation.XmlNs;
import javax.xml.bind.annotation.XmlNsForm;
import javax.xml.bind.annotation.XmlSchema;
