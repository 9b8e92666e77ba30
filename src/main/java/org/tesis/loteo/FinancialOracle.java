package org.tesis.loteo;

// debe admitir llamadas concurrentes; cualquier excepción cuenta como falla
@FunctionalInterface
public interface FinancialOracle {
    FinancialScore score(Layout layout);
}
