package org.tesis.loteo;

import java.util.Collection;
import java.util.HashSet;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * decodificar -> terreno -> validar -> objetivos, memoizado por genoma reparado.
 * Seguro para hilos: dos hilos con el mismo genoma pueden calcularlo a la vez, pero queda
 * una sola evaluación en la caché.
 */
public class EvaluationPipeline {

    private final SiteInput site;
    private final LayoutDecoder decoder;
    private final ConstraintValidator validator;
    private final FitnessEvaluator evaluator;
    private final Map<Genome, Evaluation> cache = new ConcurrentHashMap<>();
    private final AtomicLong computed = new AtomicLong();

    public EvaluationPipeline(SiteInput site, LayoutDecoder decoder, Oracles oracles) {
        this.site = site;
        this.decoder = decoder;
        this.validator = new ConstraintValidator(site.constraints());
        this.evaluator = new FitnessEvaluator(oracles);
    }

    public Evaluation evaluate(Genome genome) {
        Genome g = GenomeRepair.repair(genome);
        Evaluation e = cache.get(g);
        if (e != null) return e;
        e = compute(g);
        Evaluation prev = cache.putIfAbsent(g, e);
        return prev != null ? prev : e;
    }

    Evaluation compute(Genome g) {
        computed.incrementAndGet();
        Layout layout = decoder.decode(g, site);
        TerrainScore terrain = evaluator.terrain(layout);
        ConstraintReport report = validator.validate(layout, terrain);
        FitnessVector fitness = evaluator.evaluate(layout, report, terrain);
        return new Evaluation(layout, report, fitness);
    }

    // descarta lo que no pertenece a la población vigente (acota memoria)
    void retainOnly(Collection<Genome> keep) {
        Set<Genome> k = new HashSet<>(keep);
        cache.keySet().retainAll(k);
    }

    public SiteInput site()                 { return site; }
    public LayoutDecoder decoder()          { return decoder; }
    public ConstraintValidator validator()  { return validator; }
    public long evaluations()               { return computed.get(); }
    public long oracleFailures()            { return evaluator.oracleFailures(); }
    int cacheSize()                         { return cache.size(); }
}
