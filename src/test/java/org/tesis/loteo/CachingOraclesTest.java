package org.tesis.loteo;

import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.*;

class CachingOraclesTest {

    private static Layout a, b;

    @BeforeAll
    static void decode() {
        LayoutDecoder d = new LayoutDecoder();
        double[] other = GenomeRepair.canonical().toArray();
        other[Genome.LOT_WIDTH] = 0.9;
        a = d.decode(GenomeRepair.canonical(), Sites.bisected());
        b = d.decode(Genome.of(other), Sites.bisected());
    }

    @Test
    void testFinancial_CachedByGenome() {
        AtomicInteger calls = new AtomicInteger();
        CachingOracles.CachedFinancial c = CachingOracles.financial(l -> {
            calls.incrementAndGet();
            return FinancialScore.of(100, 100 + l.lotCount());
        });
        FinancialScore first = c.score(a);
        assertSame(first, c.score(a));
        assertEquals(1, calls.get());
        c.score(b);
        assertEquals(2, calls.get());
        assertEquals(2, c.size());
    }

    @Test
    void testFinancial_FailuresAreNotCached() {
        AtomicInteger calls = new AtomicInteger();
        CachingOracles.CachedFinancial c = CachingOracles.financial(l -> {
            if (calls.incrementAndGet() == 1) throw new OracleException("timeout");
            return FinancialScore.of(1, 2);
        });
        assertThrows(OracleException.class, () -> c.score(a));
        assertEquals(0, c.size());
        assertEquals(100.0, c.score(a).roiPercentage(), 1e-12);
        assertEquals(2, calls.get());
    }

    @Test
    void testTerrain_CachedByGenome() {
        AtomicInteger calls = new AtomicInteger();
        CachingOracles.CachedTerrain c = CachingOracles.terrain(l -> {
            calls.incrementAndGet();
            return new TerrainScore(10, 0, 1);
        });
        c.score(a);
        c.score(a);
        assertEquals(1, calls.get());
        assertEquals(1, c.size());
    }

    @Test
    void testWrapIsIdempotent() {
        CachingOracles.CachedFinancial c = CachingOracles.financial(new DefaultFinancialModel());
        assertSame(c, CachingOracles.financial(c));
        Oracles o = Oracles.defaults().withTerrain(new PlanarTerrainModel(0, 0.01, 0)).cached();
        assertTrue(o.financial() instanceof CachingOracles.CachedFinancial);
        assertTrue(o.terrain() instanceof CachingOracles.CachedTerrain);
        assertSame(o.financial(), o.cached().financial());
        assertTrue(o.hasUtility());
        assertNull(Oracles.of(new DefaultFinancialModel()).cached().terrain());
    }

    // ========== Plazo por llamada ==========

    @Test
    void testTimed_AnswerWithinLimit() {
        FinancialOracle o = CachingOracles.financial(l -> FinancialScore.of(100, 150), 5_000);
        assertEquals(50.0, o.score(a).roiPercentage(), 1e-12);
    }

    @Test
    void testTimed_DelegateFailurePassesThrough() {
        TerrainOracle o = CachingOracles.terrain(l -> { throw new OracleException("sin DEM"); }, 5_000);
        OracleException e = assertThrows(OracleException.class, () -> o.score(a));
        assertEquals("sin DEM", e.getMessage());
    }

    @Test
    @Timeout(10)
    void testTimed_HungCallBecomesOracleException() {
        UtilityRoutingOracle hung = (lots, roads) -> {
            try {
                Thread.sleep(60_000);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return new UtilityScore(1);
        };
        UtilityRoutingOracle o = CachingOracles.utility(hung, 50);
        OracleException e = assertThrows(OracleException.class, () -> o.score(a.lots(), a.roads()));
        assertTrue(e.getMessage().contains("50 ms"), e.getMessage());
    }

    @Test
    void testTimed_RejectsNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> CachingOracles.financial(new DefaultFinancialModel(), 0));
    }
}
