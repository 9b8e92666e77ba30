package org.tesis.loteo;

import java.util.List;

// trazado de redes de servicios (agua, alcantarillado, electricidad)
@FunctionalInterface
public interface UtilityRoutingOracle {
    UtilityScore score(List<Lot> lots, List<Road> roads);
}
