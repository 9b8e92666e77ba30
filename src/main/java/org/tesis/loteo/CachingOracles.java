package org.tesis.loteo;

import java.util.List;
import java.util.Map;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Adaptadores para oráculos costosos (p.ej. remotos).
 *
 * Caché: el genoma del layout es la clave. Un adaptador sirve a un solo predio: el mismo genoma
 * sobre otro predio daría otro layout. Las fallas no se guardan, así que un reintento vuelve a
 * consultar al oráculo.
 *
 * Plazo: cada llamada corre en un hilo aparte y se abandona al vencer el plazo con una
 * OracleException, que el evaluador cuenta como falla.
 */
public final class CachingOracles {

    private CachingOracles() {
    }

    public static CachedFinancial financial(FinancialOracle delegate) {
        return delegate instanceof CachedFinancial c ? c : new CachedFinancial(delegate);
    }

    public static CachedTerrain terrain(TerrainOracle delegate) {
        return delegate instanceof CachedTerrain c ? c : new CachedTerrain(delegate);
    }

    private static final ExecutorService CALLS = Executors.newCachedThreadPool(new ThreadFactory() {
        private final AtomicInteger seq = new AtomicInteger();

        @Override
        public Thread newThread(Runnable r) {
            Thread t = new Thread(r, "loteo-oraculo-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        }
    });

    public static FinancialOracle financial(FinancialOracle delegate, long timeoutMillis) {
        checkTimeout(timeoutMillis);
        return layout -> bounded(() -> delegate.score(layout), timeoutMillis, "financiero");
    }

    public static TerrainOracle terrain(TerrainOracle delegate, long timeoutMillis) {
        checkTimeout(timeoutMillis);
        return layout -> bounded(() -> delegate.score(layout), timeoutMillis, "de terreno");
    }

    public static UtilityRoutingOracle utility(UtilityRoutingOracle delegate, long timeoutMillis) {
        checkTimeout(timeoutMillis);
        return (List<Lot> lots, List<Road> roads) -> bounded(() -> delegate.score(lots, roads), timeoutMillis, "de redes");
    }

    private static void checkTimeout(long timeoutMillis) {
        if (timeoutMillis <= 0) throw new IllegalArgumentException("Plazo de oráculo debe ser > 0: " + timeoutMillis);
    }

    static <T> T bounded(Callable<T> call, long timeoutMillis, String oracle) {
        Future<T> f = CALLS.submit(call);
        try {
            return f.get(timeoutMillis, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            f.cancel(true);
            throw new OracleException("Oráculo " + oracle + " sin respuesta tras " + timeoutMillis + " ms", e);
        } catch (InterruptedException e) {
            f.cancel(true);
            Thread.currentThread().interrupt();
            throw new OracleException("Interrumpido esperando al oráculo " + oracle, e);
        } catch (ExecutionException e) {
            if (e.getCause() instanceof RuntimeException re) throw re;
            throw new OracleException("Falla del oráculo " + oracle, e.getCause());
        }
    }

    public static final class CachedFinancial implements FinancialOracle {
        private final FinancialOracle delegate;
        private final Map<Genome, FinancialScore> cache = new ConcurrentHashMap<>();

        CachedFinancial(FinancialOracle delegate) {
            this.delegate = delegate;
        }

        @Override
        public FinancialScore score(Layout layout) {
            return cache.computeIfAbsent(layout.genome(), g -> delegate.score(layout));
        }

        public int size() {
            return cache.size();
        }
    }

    public static final class CachedTerrain implements TerrainOracle {
        private final TerrainOracle delegate;
        private final Map<Genome, TerrainScore> cache = new ConcurrentHashMap<>();

        CachedTerrain(TerrainOracle delegate) {
            this.delegate = delegate;
        }

        @Override
        public TerrainScore score(Layout layout) {
            return cache.computeIfAbsent(layout.genome(), g -> delegate.score(layout));
        }

        public int size() {
            return cache.size();
        }
    }
}
