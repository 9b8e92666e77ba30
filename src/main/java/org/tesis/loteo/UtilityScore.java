package org.tesis.loteo;

public record UtilityScore(double networkCost) {
}
