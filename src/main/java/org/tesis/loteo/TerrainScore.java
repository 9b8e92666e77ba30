package org.tesis.loteo;

/**
 * @param gradingCost      costo de movimiento de tierra
 * @param slopeViolations  lotes cuya pendiente supera el máximo del modelo
 * @param maxSlopePercent  mayor pendiente observada entre los lotes, en porcentaje
 */
public record TerrainScore(double gradingCost, int slopeViolations, double maxSlopePercent) {
}
