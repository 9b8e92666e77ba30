package org.tesis.loteo;

// jerarquía vial
public enum RoadClass {
    PRIMARY, SECONDARY, LOCAL
}
