/**
 * JAXB bindings for the subset of a CellDesigner (SBML Level 2 Version 4) file
 * that the converter reads. Everything else in the input is ignored on unmarshalling.
 */
@XmlSchema(namespace = Namespaces.SBML_L2V4, elementFormDefault = XmlNsForm.QUALIFIED)
@XmlAccessorType(XmlAccessType.FIELD)
package org.casq.celldesigner;

import org.casq.util.Namespaces;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import javax.xml.bind.annotation.XmlNsForm;
import javax.xml.bind.annotation.XmlSchema;
