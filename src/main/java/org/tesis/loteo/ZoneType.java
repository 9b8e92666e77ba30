package org.tesis.loteo;

public enum ZoneType {
    FACTORY  (new Params(120.0, 5000.0, 0.10)),
    WAREHOUSE(new Params(100.0, 8000.0, 0.05)),
    OFFICE   (new Params(160.0, 3000.0, 0.15));

    /**
     * @param basePricePerArea precio base de venta por unidad de área
     * @param largeLotArea     área desde la cual aplica descuento por lote grande
     * @param largeLotDiscount fracción de descuento por lote grande
     */
    public record Params(double basePricePerArea, double largeLotArea, double largeLotDiscount) {
    }

    private final Params params;

    ZoneType(Params params) {
        this.params = params;
    }

    public Params params() {
        return params;
    }
}
