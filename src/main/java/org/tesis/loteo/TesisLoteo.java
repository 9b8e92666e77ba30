package org.tesis.loteo;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.nio.file.Path;

// uso: TesisLoteo <sitio.csv> [restricciones.properties] [optimizador.properties]
public class TesisLoteo {

    private static final Logger log = LoggerFactory.getLogger(TesisLoteo.class);

    public static void main(String[] args) throws Exception {
        String inputCsv = "input/sitio.csv";
        String constraints = null;
        String configFile = null;

        if (args.length >= 1) inputCsv = args[0];
        if (args.length >= 2) constraints = args[1];
        if (args.length >= 3) configFile = args[2];

        // 1) Leer el predio y las restricciones (un límite inválido corta aquí)
        SiteInput site = new CsvSiteLoader(Path.of(inputCsv), constraints == null ? null : Path.of(constraints)).load();

        // 2) Parámetros de la corrida
        OptimizerConfig config = configFile == null ? OptimizerConfig.defaults() : OptimizerConfig.load(Path.of(configFile));

        // 3) Optimizar
        OptimizationResult result;
        try (EvolutionEngine engine = new EvolutionEngine(site, Oracles.defaults(), config)) {
            result = engine.run();
        }

        // 4) Detalle del recomendado
        Layout best = result.recommendedLayout();
        for (Lot l : best.lots()) log.info("{}", l);
        for (Road r : best.roads()) log.info("{}", r);
        for (Violation v : result.recommendedReport().violations()) log.warn("Incumple {}", v);
        if (!result.converged()) log.warn("Ninguna solución del frente es factible");
    }
}
