package org.tesis.loteo;

import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Properties;

/**
 * Parámetros de una corrida. Los valores por defecto están en el classpath (loteo.properties)
 * y un archivo de propiedades puede sobrescribir cualquiera. Claves desconocidas o valores
 * fuera de rango fallan al cargar con el nombre de la clave.
 */
public final class OptimizerConfig {

    static final String RESOURCE = "/loteo.properties";

    // parámetros del algoritmo genético
    static final int    POP_SIZE            = 60;
    static final int    GENERATIONS_MAX     = 200;
    static final int    TOURNAMENT_K        = 3;
    static final double CROSSOVER_P         = 0.9;
    static final int    CROSSOVER_POINTS    = 2;
    static final double MUTATION_P          = 0.3;
    static final double MUTATION_SIGMA      = 0.1;
    static final int    ELITE_COUNT         = 2;
    static final int    IMMIGRANTS_PER_GEN  = 2;
    static final int    EARLY_STOP_GENS     = 25;
    static final long   DEFAULT_SEED        = 42L;
    static final long   ORACLE_TIMEOUT_MS   = 0L;    // 0 = sin plazo

    private final int populationSize;
    private final int maxGenerations;
    private final int tournamentK;
    private final double crossoverProbability;
    private final int crossoverPoints;
    private final double mutationProbability;
    private final double mutationSigma;
    private final int eliteCount;
    private final int immigrants;
    private final int plateauWindow;
    private final long seed;
    private final int threads;
    private final long oracleTimeoutMillis;
    private final DecoderSettings decoder;

    private OptimizerConfig(Builder b) {
        this.populationSize = b.populationSize;
        this.maxGenerations = b.maxGenerations;
        this.tournamentK = b.tournamentK;
        this.crossoverProbability = b.crossoverProbability;
        this.crossoverPoints = b.crossoverPoints;
        this.mutationProbability = b.mutationProbability;
        this.mutationSigma = b.mutationSigma;
        this.eliteCount = b.eliteCount;
        this.immigrants = b.immigrants;
        this.plateauWindow = b.plateauWindow;
        this.seed = b.seed;
        this.threads = b.threads > 0 ? b.threads : Runtime.getRuntime().availableProcessors();
        this.oracleTimeoutMillis = b.oracleTimeoutMillis;
        this.decoder = b.decoder;
    }

    public static Builder builder() {
        return new Builder();
    }

    // valores del classpath, o las constantes si el recurso no existe
    public static OptimizerConfig defaults() {
        return builder().build();
    }

    public static OptimizerConfig load(Path path) throws IOException {
        Properties p = new Properties();
        try (Reader r = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            p.load(r);
        }
        return fromProperties(p);
    }

    public static OptimizerConfig fromProperties(Properties p) {
        Builder b = builder();
        b.apply(p);
        return b.build();
    }

    public int populationSize()             { return populationSize; }
    public int maxGenerations()             { return maxGenerations; }
    public int tournamentK()                { return tournamentK; }
    public double crossoverProbability()    { return crossoverProbability; }
    public int crossoverPoints()            { return crossoverPoints; }
    public double mutationProbability()     { return mutationProbability; }
    public double mutationSigma()           { return mutationSigma; }
    public int eliteCount()                 { return eliteCount; }
    public int immigrants()                 { return immigrants; }
    public int plateauWindow()              { return plateauWindow; }
    public long seed()                      { return seed; }
    public int threads()                    { return threads; }
    public long oracleTimeoutMillis()       { return oracleTimeoutMillis; }
    public DecoderSettings decoder()        { return decoder; }

    public Builder toBuilder() {
        Builder b = new Builder(false);
        b.populationSize = populationSize;
        b.maxGenerations = maxGenerations;
        b.tournamentK = tournamentK;
        b.crossoverProbability = crossoverProbability;
        b.crossoverPoints = crossoverPoints;
        b.mutationProbability = mutationProbability;
        b.mutationSigma = mutationSigma;
        b.eliteCount = eliteCount;
        b.immigrants = immigrants;
        b.plateauWindow = plateauWindow;
        b.seed = seed;
        b.threads = threads;
        b.oracleTimeoutMillis = oracleTimeoutMillis;
        b.decoder = decoder;
        return b;
    }

    @Override
    public String toString() {
        return String.format(Locale.US,
                "pop=%d gen=%d k=%d pc=%.2f(%dp) pm=%.2f sigma=%.3f elite=%d inmigrantes=%d plateau=%d seed=%d hilos=%d plazo=%dms",
                populationSize, maxGenerations, tournamentK, crossoverProbability, crossoverPoints,
                mutationProbability, mutationSigma, eliteCount, immigrants, plateauWindow, seed, threads, oracleTimeoutMillis);
    }

    public static final class Builder {
        int populationSize = POP_SIZE;
        int maxGenerations = GENERATIONS_MAX;
        int tournamentK = TOURNAMENT_K;
        double crossoverProbability = CROSSOVER_P;
        int crossoverPoints = CROSSOVER_POINTS;
        double mutationProbability = MUTATION_P;
        double mutationSigma = MUTATION_SIGMA;
        int eliteCount = ELITE_COUNT;
        int immigrants = IMMIGRANTS_PER_GEN;
        int plateauWindow = EARLY_STOP_GENS;
        long seed = DEFAULT_SEED;
        int threads = 0;
        long oracleTimeoutMillis = ORACLE_TIMEOUT_MS;
        DecoderSettings decoder = DecoderSettings.defaults();

        private Builder() {
            this(true);
        }

        private Builder(boolean classpathDefaults) {
            if (classpathDefaults) apply(classpathProperties());
        }

        public Builder populationSize(int v)            { populationSize = v; return this; }
        public Builder maxGenerations(int v)            { maxGenerations = v; return this; }
        public Builder tournamentK(int v)               { tournamentK = v; return this; }
        public Builder crossoverProbability(double v)   { crossoverProbability = v; return this; }
        public Builder crossoverPoints(int v)           { crossoverPoints = v; return this; }
        public Builder mutationProbability(double v)    { mutationProbability = v; return this; }
        public Builder mutationSigma(double v)          { mutationSigma = v; return this; }
        public Builder eliteCount(int v)                { eliteCount = v; return this; }
        public Builder immigrants(int v)                { immigrants = v; return this; }
        public Builder plateauWindow(int v)             { plateauWindow = v; return this; }
        public Builder seed(long v)                     { seed = v; return this; }
        public Builder threads(int v)                   { threads = v; return this; }
        public Builder oracleTimeoutMillis(long v)      { oracleTimeoutMillis = v; return this; }
        public Builder decoder(DecoderSettings v)       { decoder = v; return this; }

        void apply(Properties p) {
            DecoderSettings d = decoder;
            double minLot = d.minLotSize(), frontage = d.minFrontage(), buffer = d.bufferWidth();
            double road = d.roadWidth(), primary = d.primaryRoadWidth();
            double aspectMin = d.aspectMin(), aspectMax = d.aspectMax();
            double blockMin = d.minBlockLength(), blockMax = d.maxBlockLength();
            for (String key : p.stringPropertyNames()) {
                String v = p.getProperty(key).trim();
                switch (key) {
                    case "population.size":       populationSize = integer(key, v); break;
                    case "generations.max":       maxGenerations = integer(key, v); break;
                    case "tournament.k":          tournamentK = integer(key, v); break;
                    case "crossover.probability": crossoverProbability = number(key, v); break;
                    case "crossover.points":      crossoverPoints = integer(key, v); break;
                    case "mutation.probability":  mutationProbability = number(key, v); break;
                    case "mutation.sigma":        mutationSigma = number(key, v); break;
                    case "elite.count":           eliteCount = integer(key, v); break;
                    case "immigrants":            immigrants = integer(key, v); break;
                    case "plateau.window":        plateauWindow = integer(key, v); break;
                    case "seed":                  seed = longValue(key, v); break;
                    case "threads":               threads = integer(key, v); break;
                    case "oracle.timeout.ms":     oracleTimeoutMillis = longValue(key, v); break;
                    case "lot.size.min":          minLot = number(key, v); break;
                    case "lot.frontage.min":      frontage = number(key, v); break;
                    case "lot.aspect.min":        aspectMin = number(key, v); break;
                    case "lot.aspect.max":        aspectMax = number(key, v); break;
                    case "buffer.width":          buffer = number(key, v); break;
                    case "road.width":            road = number(key, v); break;
                    case "road.width.primary":    primary = number(key, v); break;
                    case "block.length.min":      blockMin = number(key, v); break;
                    case "block.length.max":      blockMax = number(key, v); break;
                    default: throw new IllegalArgumentException("Clave de configuración desconocida: " + key);
                }
            }
            decoder = new DecoderSettings(minLot, frontage, buffer, road, primary, aspectMin, aspectMax, blockMin, blockMax);
        }

        public OptimizerConfig build() {
            check("population.size", populationSize >= 2);
            check("generations.max", maxGenerations >= 0);
            check("tournament.k", tournamentK >= 1);
            check("crossover.probability", crossoverProbability >= 0 && crossoverProbability <= 1);
            check("crossover.points", crossoverPoints == 1 || crossoverPoints == 2);
            check("mutation.probability", mutationProbability >= 0 && mutationProbability <= 1);
            check("mutation.sigma", mutationSigma > 0);
            check("elite.count", eliteCount >= 1 && eliteCount < populationSize);
            check("immigrants", immigrants >= 0 && eliteCount + immigrants < populationSize);
            check("plateau.window", plateauWindow >= 1);
            check("threads", threads >= 0);
            check("oracle.timeout.ms", oracleTimeoutMillis >= 0);
            return new OptimizerConfig(this);
        }
    }

    static Properties classpathProperties() {
        Properties p = new Properties();
        try (InputStream in = OptimizerConfig.class.getResourceAsStream(RESOURCE)) {
            if (in != null) p.load(in);
        } catch (IOException e) {
            throw new IllegalStateException("No se pudo leer " + RESOURCE, e);
        }
        return p;
    }

    private static void check(String key, boolean ok) {
        if (!ok) throw new IllegalArgumentException("Valor fuera de rango para " + key);
    }

    private static int integer(String key, String v) {
        try {
            return Integer.parseInt(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Entero inválido para " + key + ": " + v);
        }
    }

    private static long longValue(String key, String v) {
        try {
            return Long.parseLong(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Entero inválido para " + key + ": " + v);
        }
    }

    private static double number(String key, String v) {
        try {
            return Double.parseDouble(v);
        } catch (NumberFormatException e) {
            throw new IllegalArgumentException("Número inválido para " + key + ": " + v);
        }
    }
}
