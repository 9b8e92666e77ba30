package org.tesis.loteo;

public enum TerminationReason {
    MAX_GENERATIONS, PLATEAU, CANCELLED
}
