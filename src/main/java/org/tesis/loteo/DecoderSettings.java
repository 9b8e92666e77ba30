package org.tesis.loteo;

// valores del decodificador cuando las restricciones no fijan el parámetro
public record DecoderSettings(double minLotSize, double minFrontage, double bufferWidth, double roadWidth,
                              double primaryRoadWidth, double aspectMin, double aspectMax,
                              double minBlockLength, double maxBlockLength) {

    public DecoderSettings {
        positive("lot.size.min", minLotSize);
        positive("lot.frontage.min", minFrontage);
        positive("road.width", roadWidth);
        positive("road.width.primary", primaryRoadWidth);
        positive("block.length.min", minBlockLength);
        if (!(bufferWidth >= 0)) throw new IllegalArgumentException("buffer.width debe ser >= 0: " + bufferWidth);
        if (!(aspectMin >= 1.0 && aspectMax >= aspectMin)) {
            throw new IllegalArgumentException("lot.aspect.min/max inválidos: " + aspectMin + " / " + aspectMax);
        }
        if (!(maxBlockLength >= minBlockLength)) {
            throw new IllegalArgumentException("block.length.max debe ser >= block.length.min: " + maxBlockLength);
        }
    }

    public static DecoderSettings defaults() {
        return new DecoderSettings(1000.0, 20.0, 10.0, 12.0, 20.0, 1.5, 2.0, 60.0, 250.0);
    }

    private static void positive(String key, double v) {
        if (!(v > 0)) throw new IllegalArgumentException(key + " debe ser > 0: " + v);
    }
}
