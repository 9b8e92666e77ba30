package org.tesis.loteo;

public record FinancialScore(double totalCost, double totalRevenue, double roiPercentage) {

    // ROI = (ingreso - costo) / costo, en porcentaje; 0 si no hay costo
    public static FinancialScore of(double totalCost, double totalRevenue) {
        double roi = totalCost > 0 ? (totalRevenue - totalCost) / totalCost * 100.0 : 0.0;
        return new FinancialScore(totalCost, totalRevenue, roi);
    }

    public FinancialScore plusCost(double extra) {
        return of(totalCost + extra, totalRevenue);
    }
}
