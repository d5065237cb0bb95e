package org.casq.qual;

import javax.xml.bind.annotation.XmlEnum;
import javax.xml.bind.annotation.XmlEnumValue;

@XmlEnum
public enum TransitionEffect {
    @XmlEnumValue("none")
    NONE,
    @XmlEnumValue("assignmentLevel")
    ASSIGNMENT_LEVEL
}
