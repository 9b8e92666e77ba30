package org.tesis.loteo;

@FunctionalInterface
public interface TerrainOracle {
    TerrainScore score(Layout layout);
}
