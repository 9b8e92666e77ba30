package org.tesis.loteo;

import org.locationtech.jts.geom.GeometryFactory;
import org.locationtech.jts.geom.LineString;
import org.locationtech.jts.geom.Polygon;
import org.locationtech.jts.geom.PrecisionModel;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Carga el predio desde un CSV de vértices (entity_type,entity_id,ring,point_idx,x,y) y las
 * restricciones desde un archivo de propiedades.
 *
 * <p>Entidades: BOUNDARY (exactamente una), EXCLUSION, PREFERRED (polígonos) y GUIDE (polilíneas).
 */
public class CsvSiteLoader implements SiteLoader {

    private static final Logger log = LoggerFactory.getLogger(CsvSiteLoader.class);

    static final String BOUNDARY  = "BOUNDARY";
    static final String EXCLUSION = "EXCLUSION";
    static final String PREFERRED = "PREFERRED";
    static final String GUIDE     = "GUIDE";

    private final Path csv;
    private final Path constraintsFile;
    private final GeometryFactory gf = new GeometryFactory(new PrecisionModel(PrecisionModel.FLOATING), 0);

    public CsvSiteLoader(Path csv, Path constraintsFile) {
        this.csv = csv;
        this.constraintsFile = constraintsFile;
    }

    @Override
    public SiteInput load() throws IOException {
        List<VertexRow> rows = CsvGeometryReader.readCsv(csv);
        ConstraintSet constraints = constraintsFile == null ? ConstraintSet.empty() : ConstraintSet.read(constraintsFile);
        SiteInput site = fromRows(rows, constraints, gf);
        log.info("Predio cargado de {} | {} | restricciones={} | exclusiones={} | preferentes={} | guías={}",
                csv, site.boundary(), constraints.size(), site.exclusionZones().size(),
                site.preferredZones().size(), site.roadGuides().size());
        return site;
    }

    // variante sin archivos, usada también por las pruebas
    static SiteInput load(Reader csvReader, ConstraintSet constraints) throws IOException {
        BufferedReader br = csvReader instanceof BufferedReader b ? b : new BufferedReader(csvReader);
        List<VertexRow> rows = CsvGeometryReader.readCsv(br, "<reader>");
        return fromRows(rows, constraints, new GeometryFactory(new PrecisionModel(PrecisionModel.FLOATING), 0));
    }

    static SiteInput fromRows(List<VertexRow> rows, ConstraintSet constraints, GeometryFactory gf) {
        Map<String, Polygon> boundaries;
        try {
            boundaries = GeomUtils.buildPolygons(rows, BOUNDARY, gf);
        } catch (IllegalArgumentException e) {
            throw new InvalidBoundaryException("Límite ilegible: " + e.getMessage(), e);
        }
        if (boundaries.isEmpty()) throw new InvalidBoundaryException("No se encontró BOUNDARY en el CSV");
        if (boundaries.size() > 1) throw new InvalidBoundaryException("Se esperaba un único BOUNDARY, hay " + boundaries.size());
        Boundary boundary = Boundary.of(boundaries.values().iterator().next());

        List<Polygon> exclusions = validZones(GeomUtils.buildPolygons(rows, EXCLUSION, gf), EXCLUSION);
        List<Polygon> preferred  = validZones(GeomUtils.buildPolygons(rows, PREFERRED, gf), PREFERRED);
        List<LineString> guides  = GeomUtils.buildLines(rows, GUIDE, gf);
        return new SiteInput(boundary, constraints, exclusions, preferred, guides);
    }

    // las zonas inválidas se descartan con aviso; solo el límite es motivo de rechazo
    private static List<Polygon> validZones(Map<String, Polygon> zones, String type) {
        List<Polygon> out = new ArrayList<>();
        for (Map.Entry<String, Polygon> e : zones.entrySet()) {
            if (e.getValue().isValid() && e.getValue().getArea() > 0) {
                out.add(e.getValue());
            } else {
                log.warn("{} {} inválida, se ignora", type, e.getKey());
            }
        }
        return out;
    }

    public static SiteInput load(Path csv, Path constraintsFile) throws IOException {
        return new CsvSiteLoader(csv, constraintsFile).load();
    }
}
