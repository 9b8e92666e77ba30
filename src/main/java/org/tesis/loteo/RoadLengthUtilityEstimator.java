package org.tesis.loteo;

import java.util.List;

// agua, alcantarillado y electricidad a lo largo de todas las vías, más una acometida por lote
public class RoadLengthUtilityEstimator implements UtilityRoutingOracle {

    static final double WATER_PER_LENGTH    = 20.0;
    static final double SEWER_PER_LENGTH    = 32.0;
    static final double ELECTRIC_PER_LENGTH = 16.0;
    static final double SERVICE_LINE        = 1_500.0;

    @Override
    public UtilityScore score(List<Lot> lots, List<Road> roads) {
        double length = 0;
        for (Road r : roads) length += r.length();
        double cost = length * (WATER_PER_LENGTH + SEWER_PER_LENGTH + ELECTRIC_PER_LENGTH)
                + lots.size() * SERVICE_LINE;
        return new UtilityScore(cost);
    }
}
