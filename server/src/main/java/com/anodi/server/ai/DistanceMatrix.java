package com.anodi.server.ai;

/**
 * Symmetric matrix of pairwise image distances with a zero diagonal. Rows
 * follow the caller's image order; when a reference image takes part it is
 * the last row and column.
 */
public class DistanceMatrix {

    private final double[][] values;
    private final int referenceIndex;

    DistanceMatrix(double[][] values, int referenceIndex) {
        this.values = values;
        this.referenceIndex = referenceIndex;
    }

    public int getSize() {
        return values.length;
    }

    /**
     * Row of the reference image, or -1 when there is none.
     */
    public int getReferenceIndex() {
        return referenceIndex;
    }

    public boolean hasReference() {
        return referenceIndex >= 0;
    }

    public double get(int i, int j) {
        return values[i][j];
    }

    public double[][] getValues() {
        double[][] copy = new double[values.length][];
        for (int i = 0; i < values.length; i++) {
            copy[i] = values[i].clone();
        }
        return copy;
    }

    /**
     * Comma separated rows, for external embedding and plotting tools.
     */
    public String toCsv() {
        StringBuilder sb = new StringBuilder();
        for (double[] row : values) {
            for (int j = 0; j < row.length; j++) {
                if (j > 0)
                    sb.append(',');
                sb.append(row[j]);
            }
            sb.append('\n');
        }
        return sb.toString();
    }
}
