package org.tesis.loteo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.text.DecimalFormat;
import java.util.*;
import java.util.concurrent.*;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Motor evolutivo multiobjetivo: población inicial con un individuo canónico, evaluación en un
 * pool de hilos con barrera por generación, selección por torneo sobre rangos de Pareto, cruce,
 * mutación, élites e inmigrantes.
 *
 * El Random solo se usa en el hilo del motor, así que el resultado no depende de la cantidad
 * de hilos de evaluación.
 */
public class EvolutionEngine implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(EvolutionEngine.class);

    static final double IMPROVEMENT_EPS = 1e-9;

    private final OptimizerConfig config;
    private final EvaluationPipeline pipeline;
    private final ExecutorService pool;
    private final DecimalFormat df = new DecimalFormat("#,##0.###");
    private volatile EngineState state = EngineState.INITIALIZING;
    private boolean interrupted;

    public EvolutionEngine(SiteInput site, Oracles oracles, OptimizerConfig config) {
        this.config = config;
        Oracles o = config.oracleTimeoutMillis() > 0 ? oracles.withTimeout(config.oracleTimeoutMillis()) : oracles;
        this.pipeline = new EvaluationPipeline(site, new LayoutDecoder(config.decoder()), o);
        this.pool = config.threads() > 1 ? Executors.newFixedThreadPool(config.threads(), daemonThreads()) : null;
    }

    private static ThreadFactory daemonThreads() {
        AtomicInteger seq = new AtomicInteger();
        return r -> {
            Thread t = new Thread(r, "loteo-eval-" + seq.incrementAndGet());
            t.setDaemon(true);
            return t;
        };
    }

    public EngineState state() {
        return state;
    }

    public OptimizerConfig config() {
        return config;
    }

    EvaluationPipeline pipeline() {
        return pipeline;
    }

    public OptimizationResult run() {
        return run(new CancellationFlag());
    }

    public OptimizationResult run(CancellationFlag cancel) {
        long t0 = System.currentTimeMillis();
        state = EngineState.INITIALIZING;
        interrupted = false;
        log.info("==== EvolutionEngine RUN {} ====", new Date());
        log.info("INI | límite área={} | restricciones={} | {}", df.format(pipeline.site().boundary().area()),
                pipeline.site().constraints().size(), config);

        Random rng = new Random(config.seed());
        List<Individual> init = new ArrayList<>(config.populationSize());
        init.add(new Individual(GenomeRepair.canonical()));
        while (init.size() < config.populationSize()) init.add(new Individual(GeneticOperators.randomGenome(rng)));
        Population pop = new Population(init, 0);
        log.info("Población inicial: {}", pop.size());

        long evals0 = pipeline.evaluations(), fails0 = pipeline.oracleFailures();
        evaluateAll(pop, cancel);
        return loop(pop, rng, new ArrayList<>(), config.maxGenerations(), cancel, t0, evals0, fails0, 0, 0);
    }

    /**
     * Continúa una corrida terminada desde su población final por extraGenerations generaciones
     * más. Los élites se conservan, así que el mejor objetivo financiero no retrocede.
     */
    public OptimizationResult resume(OptimizationResult previous, int extraGenerations, CancellationFlag cancel) {
        if (extraGenerations < 0) throw new IllegalArgumentException("extraGenerations < 0: " + extraGenerations);
        long t0 = System.currentTimeMillis();
        interrupted = false;
        log.info("==== EvolutionEngine RESUME desde gen {} (+{}) ====", previous.generations(), extraGenerations);
        Random rng = new Random(config.seed() * 31 + previous.generations());
        long evals0 = pipeline.evaluations(), fails0 = pipeline.oracleFailures();
        Population pop = previous.finalPopulation();
        evaluateAll(pop, cancel);
        return loop(pop, rng, new ArrayList<>(previous.bestFinancialHistory()),
                previous.generations() + extraGenerations, cancel, t0, evals0, fails0,
                previous.evaluations(), previous.oracleFailures());
    }

    public OptimizationResult resume(OptimizationResult previous, int extraGenerations) {
        return resume(previous, extraGenerations, new CancellationFlag());
    }

    private OptimizationResult loop(Population pop, Random rng, List<Double> history, int endGen,
                                    CancellationFlag cancel, long t0, long evals0, long fails0,
                                    long priorEvals, long priorFails) {
        state = EngineState.SELECTING;
        Ranking rk = ParetoSelector.rank(pop.fitness());
        double best = ParetoSelector.front(pop, rk).bestFinancial();
        if (history.isEmpty()) history.add(best);
        log.info("Pre-loop | mejor financiero={} | frente={}", df.format(best), countRank0(rk));

        TerminationReason reason = TerminationReason.MAX_GENERATIONS;
        int stall = 0;
        int gen = pop.generation();
        while (gen < endGen) {
            if (cancel.isCancelled()) {
                reason = TerminationReason.CANCELLED;
                log.info("Cancelado antes de la generación {}", gen + 1);
                break;
            }
            gen++;
            long tg = System.currentTimeMillis();
            log.info("=== Gen {} INI ===", gen);

            state = EngineState.VARYING;
            List<Individual> next = vary(pop, rk, rng);
            pop = new Population(next, gen);
            evaluateAll(pop, cancel);

            state = EngineState.SELECTING;
            rk = ParetoSelector.rank(pop.fitness());
            double now = ParetoSelector.front(pop, rk).bestFinancial();
            if (now > best + IMPROVEMENT_EPS) {
                log.info("Mejora | financiero={} (antes {})", df.format(now), df.format(best));
                best = now;
                stall = 0;
            } else {
                stall++;
                log.debug("Sin mejora | financiero={} | {} generaciones", df.format(best), stall);
            }
            history.add(now);
            pipeline.retainOnly(genomes(pop));
            log.info("=== Gen {} FIN | frente={} | dur={} ms ===", gen, countRank0(rk), System.currentTimeMillis() - tg);

            if (stall >= config.plateauWindow()) {
                reason = TerminationReason.PLATEAU;
                log.info("Early-stop tras {} generaciones sin mejora.", config.plateauWindow());
                break;
            }
        }

        state = EngineState.TERMINATED;
        ParetoFront front = ParetoSelector.front(pop, rk);
        long evals = priorEvals + pipeline.evaluations() - evals0;
        long fails = priorFails + pipeline.oracleFailures() - fails0;
        OptimizationResult result = new OptimizationResult(front, pop, gen, reason, history, fails, evals,
                System.currentTimeMillis() - t0);
        summary(result);
        if (interrupted) Thread.currentThread().interrupt();
        return result;
    }

    List<Individual> vary(Population pop, Ranking rk, Random rng) {
        int n = config.populationSize();
        List<FitnessVector> fs = pop.fitness();
        List<Individual> next = new ArrayList<>(n);
        for (int i : ParetoSelector.elites(fs, rk, config.eliteCount())) next.add(pop.get(i));
        for (int k=0;k<config.immigrants() && next.size()<n;k++) {
            next.add(new Individual(GeneticOperators.randomGenome(rng)));
        }
        while (next.size() < n) {
            Genome a = pop.get(GeneticOperators.tournament(fs, rk, config.tournamentK(), rng)).genome();
            Genome b = pop.get(GeneticOperators.tournament(fs, rk, config.tournamentK(), rng)).genome();
            Genome[] kids = rng.nextDouble() < config.crossoverProbability()
                    ? GeneticOperators.crossover(a, b, config.crossoverPoints(), rng)
                    : new Genome[]{a, b};
            for (Genome c : kids) {
                if (next.size() >= n) break;
                if (rng.nextDouble() < config.mutationProbability()) c = GeneticOperators.mutate(c, config.mutationSigma(), rng);
                next.add(new Individual(c));
            }
        }
        return next;
    }

    // barrera: al volver, todo individuo de la población está evaluado
    void evaluateAll(Population pop, CancellationFlag cancel) {
        Map<Genome, List<Individual>> pending = new LinkedHashMap<>();
        for (Individual i : pop.members()) {
            if (!i.isEvaluated()) pending.computeIfAbsent(i.genome(), g -> new ArrayList<>()).add(i);
        }
        if (pending.isEmpty()) return;
        state = EngineState.EVALUATING;

        Map<Genome, Evaluation> done = new HashMap<>();
        if (pool != null) {
            List<Genome> keys = new ArrayList<>(pending.keySet());
            List<Callable<Evaluation>> tasks = new ArrayList<>(keys.size());
            for (Genome g : keys) tasks.add(() -> pipeline.evaluate(g));
            try {
                List<Future<Evaluation>> fut = pool.invokeAll(tasks);
                for (int k=0;k<keys.size();k++) done.put(keys.get(k), fut.get(k).get());
            } catch (InterruptedException e) {
                interrupted = true;
                cancel.cancel();
                log.warn("Interrupción durante la evaluación: se completa la generación en línea y se cancela");
            } catch (ExecutionException e) {
                throw new IllegalStateException("Falla inesperada al evaluar", e.getCause());
            }
        }
        for (Map.Entry<Genome, List<Individual>> e : pending.entrySet()) {
            Evaluation ev = done.get(e.getKey());
            if (ev == null) ev = pipeline.evaluate(e.getKey());
            for (Individual i : e.getValue()) i.evaluation(ev);
        }
    }

    private static Set<Genome> genomes(Population pop) {
        Set<Genome> out = new HashSet<>();
        for (Individual i : pop.members()) out.add(i.genome());
        return out;
    }

    private static int countRank0(Ranking rk) {
        int n = 0;
        for (int i=0;i<rk.size();i++) if (rk.rank(i) == 0) n++;
        return n;
    }

    private void summary(OptimizationResult r) {
        ParetoFront f = r.front();
        log.info("------------------------------");
        log.info("RESUMEN FINAL (LOTEO)");
        log.info("Seed               : {}", config.seed());
        log.info("Generaciones       : {}", r.generations());
        log.info("Término            : {}", r.reason());
        log.info("Evaluaciones       : {}", r.evaluations());
        log.info("Fallas de oráculo  : {}", r.oracleFailures());
        log.info("Frente de Pareto   : {} ({} factibles)", f.size(), f.feasibleCount());
        Individual rec = f.recommended();
        if (rec != null) {
            Layout l = rec.layout();
            FitnessVector fv = rec.fitness();
            log.info("Lotes              : {}", l.lotCount());
            log.info("Calidad media      : {}", df.format(l.meanQuality()));
            log.info("Eficiencia vial    : {}", df.format(fv.raw(FitnessVector.ROAD_EFFICIENCY)));
            log.info("ROI                : {}", fv.failed(FitnessVector.FINANCIAL)
                    ? "FALLA" : df.format(fv.raw(FitnessVector.FINANCIAL)) + " %");
            log.info("Área vendible      : {}", df.format(l.sellableArea()));
            log.info("Área vial          : {}", df.format(l.roadArea()));
            log.info("% verde            : {} %", df.format(100.0 * l.greenRatio()));
            log.info("Factible           : {}", fv.feasible() ? "sí" : "no " + rec.report().violations());
        }
        log.info("Tiempo total       : {} ms ({} s)", r.elapsedMillis(), df.format(r.elapsedMillis() / 1000.0));
        log.info("------------------------------");
    }

    @Override
    public void close() {
        if (pool != null) pool.shutdownNow();
    }
}
