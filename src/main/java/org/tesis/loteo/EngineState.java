package org.tesis.loteo;

public enum EngineState {
    INITIALIZING, EVALUATING, SELECTING, VARYING, TERMINATED
}
