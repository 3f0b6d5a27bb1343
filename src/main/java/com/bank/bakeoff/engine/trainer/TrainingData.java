package com.bank.bakeoff.engine.trainer;

import java.util.Random;

final class TrainingData {

    private TrainingData() {}

    static double[] asTarget(int[] y) {
        double[] target = new double[y.length];
        for (int i = 0; i < y.length; i++) target[i] = y[i];
        return target;
    }

    static int[] allRows(int n) {
        int[] rows = new int[n];
        for (int i = 0; i < n; i++) rows[i] = i;
        return rows;
    }

    static int[] bootstrap(int n, Random random) {
        int[] rows = new int[n];
        for (int i = 0; i < n; i++) rows[i] = random.nextInt(n);
        return rows;
    }
}
