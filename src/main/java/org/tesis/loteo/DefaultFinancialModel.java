package org.tesis.loteo;

/**
 * Modelo financiero simple para correr sin un oráculo externo. Costos: preparación del sitio,
 * vías (principal más cara), conexión por lote, paisajismo y arbolado, honorarios e imprevistos.
 * Ingresos: precio base de la zona con premios por esquina, calidad y frente, y descuentos
 * por lote grande o forma irregular.
 */
public class DefaultFinancialModel implements FinancialOracle {

    // costos (unidades monetarias por m², m o unidad)
    static final double SITE_CLEARING_PER_AREA  = 2.0;
    static final double GRADING_PER_AREA        = 1.2;
    static final double ROAD_COST_PER_LENGTH    = 320.0;
    static final double PRIMARY_MULTIPLIER      = 1.5;
    static final double CONNECTION_PER_LOT      = 4_000.0;
    static final double LANDSCAPING_PER_AREA    = 6.0;
    static final double TREE_COST               = 80.0;
    static final double AREA_PER_TREE           = 50.0;
    static final double DESIGN_FEE              = 0.03;
    static final double CONTINGENCY             = 0.10;

    // ingresos
    static final double CORNER_PREMIUM          = 0.20;
    static final double QUALITY_PREMIUM         = 0.15;
    static final double QUALITY_PREMIUM_FROM    = 85.0;
    static final double FRONTAGE_PER_LENGTH     = 2.0;
    static final double IRREGULAR_DISCOUNT      = 0.05;
    static final double IRREGULAR_BELOW         = 60.0;

    @Override
    public FinancialScore score(Layout layout) {
        return FinancialScore.of(cost(layout), revenue(layout));
    }

    double cost(Layout layout) {
        double site = layout.boundary().area();
        double subtotal = site * (SITE_CLEARING_PER_AREA + GRADING_PER_AREA);
        for (Road r : layout.roads()) {
            double c = r.length() * ROAD_COST_PER_LENGTH;
            subtotal += r.roadClass() == RoadClass.PRIMARY ? c * PRIMARY_MULTIPLIER : c;
        }
        subtotal += layout.lotCount() * CONNECTION_PER_LOT;
        double green = layout.greenArea();
        subtotal += green * LANDSCAPING_PER_AREA;
        subtotal += Math.floor(green / AREA_PER_TREE) * TREE_COST;
        return subtotal * (1.0 + DESIGN_FEE + CONTINGENCY);
    }

    double revenue(Layout layout) {
        double total = 0;
        for (Lot l : layout.lots()) total += lotRevenue(l);
        return total;
    }

    static double lotRevenue(Lot lot) {
        ZoneType.Params p = lot.zone().params();
        double base = lot.area() * p.basePricePerArea();
        double r = base;
        if (lot.isCorner()) r += base * CORNER_PREMIUM;
        if (lot.quality() > QUALITY_PREMIUM_FROM) r += base * QUALITY_PREMIUM;
        r += lot.frontage() * FRONTAGE_PER_LENGTH;
        if (lot.area() > p.largeLotArea()) r -= base * p.largeLotDiscount();
        if (lot.quality() < IRREGULAR_BELOW) r -= base * IRREGULAR_DISCOUNT;
        return r;
    }
}
