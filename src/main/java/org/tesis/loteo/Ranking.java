package org.tesis.loteo;

// rango de no dominancia (0 = frente) y hacinamiento, por posición en la población
public final class Ranking {

    private final int[] rank;
    private final double[] crowding;

    Ranking(int[] rank, double[] crowding) {
        this.rank = rank;
        this.crowding = crowding;
    }

    public int rank(int i)          { return rank[i]; }
    public double crowding(int i)   { return crowding[i]; }
    public int size()               { return rank.length; }

    public int frontCount() {
        int max = -1;
        for (int r : rank) max = Math.max(max, r);
        return max + 1;
    }
}
