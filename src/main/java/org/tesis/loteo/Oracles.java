package org.tesis.loteo;

import java.util.Objects;

// el financiero es obligatorio; redes y terreno pueden ser null
public final class Oracles {

    private final FinancialOracle financial;
    private final UtilityRoutingOracle utility;
    private final TerrainOracle terrain;

    private Oracles(FinancialOracle financial, UtilityRoutingOracle utility, TerrainOracle terrain) {
        this.financial = Objects.requireNonNull(financial, "financial");
        this.utility = utility;
        this.terrain = terrain;
    }

    public static Oracles of(FinancialOracle financial) {
        return new Oracles(financial, null, null);
    }

    // modelo financiero y estimador de redes por defecto, sin terreno
    public static Oracles defaults() {
        return new Oracles(new DefaultFinancialModel(), new RoadLengthUtilityEstimator(), null);
    }

    public Oracles withUtility(UtilityRoutingOracle u) {
        return new Oracles(financial, u, terrain);
    }

    public Oracles withTerrain(TerrainOracle t) {
        return new Oracles(financial, utility, t);
    }

    // acota cada llamada a timeoutMillis; aplicar antes de cached() para que un acierto no gaste hilo
    public Oracles withTimeout(long timeoutMillis) {
        return new Oracles(CachingOracles.financial(financial, timeoutMillis),
                utility == null ? null : CachingOracles.utility(utility, timeoutMillis),
                terrain == null ? null : CachingOracles.terrain(terrain, timeoutMillis));
    }

    // envuelve financiero y terreno con caché por genoma
    public Oracles cached() {
        return new Oracles(CachingOracles.financial(financial), utility,
                terrain == null ? null : CachingOracles.terrain(terrain));
    }

    public FinancialOracle financial()      { return financial; }
    public UtilityRoutingOracle utility()   { return utility; }
    public TerrainOracle terrain()          { return terrain; }
    public boolean hasUtility()             { return utility != null; }
    public boolean hasTerrain()             { return terrain != null; }
}
