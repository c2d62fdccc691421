package com.tenacy.aiops.scoring;

import java.util.ArrayList;
import java.util.List;
import java.util.Random;

/**
 * 학습이 끝난 isolation forest 앙상블.
 * <p>
 * 이상 점수 {@code s(x) = 2^(-E[h(x)] / c(psi))}. 빨리 고립되는(경로가 짧은) 샘플일수록 1에 가깝다.
 * 인스턴스는 한 배치에 대해서만 만들어지고 실행 간에 재사용하지 않는다.
 */
public class IsolationForest {

    private static final double EULER_GAMMA = 0.5772156649015329;

    private final List<IsolationTree> trees;
    private final int subsampleSize;

    private IsolationForest(List<IsolationTree> trees, int subsampleSize) {
        this.trees = trees;
        this.subsampleSize = subsampleSize;
    }

    /**
     * @param data       rows x features
     * @param treeCount  트리 수
     * @param maxSamples 트리별 최대 서브샘플 크기
     * @param random     시드가 고정된 난수 생성기
     */
    public static IsolationForest fit(double[][] data, int treeCount, int maxSamples, Random random) {
        if (data.length == 0) {
            throw new IllegalArgumentException("cannot fit isolation forest on empty data");
        }
        int psi = Math.min(maxSamples, data.length);
        int maxDepth = (int) Math.ceil(log2(Math.max(psi, 2)));

        List<IsolationTree> trees = new ArrayList<>(treeCount);
        for (int t = 0; t < treeCount; t++) {
            int[] sample = sampleWithoutReplacement(data.length, psi, random);
            trees.add(IsolationTree.grow(data, sample, maxDepth, random));
        }
        return new IsolationForest(trees, psi);
    }

    public double[] scoreSamples(double[][] data) {
        double normalizer = averagePathLength(subsampleSize);
        double[] scores = new double[data.length];
        for (int i = 0; i < data.length; i++) {
            double total = 0.0;
            for (IsolationTree tree : trees) {
                total += tree.pathLength(data[i]);
            }
            double meanDepth = total / trees.size();
            scores[i] = normalizer > 0 ? Math.pow(2.0, -meanDepth / normalizer) : 0.5;
        }
        return scores;
    }

    public int getTreeCount() {
        return trees.size();
    }

    public int getSubsampleSize() {
        return subsampleSize;
    }

    /**
     * n개 샘플 BST에서 실패 탐색의 평균 경로 길이 c(n).
     */
    static double averagePathLength(int n) {
        if (n <= 1) {
            return 0.0;
        }
        if (n == 2) {
            return 1.0;
        }
        return 2.0 * (Math.log(n - 1.0) + EULER_GAMMA) - 2.0 * (n - 1.0) / n;
    }

    private static int[] sampleWithoutReplacement(int population, int size, Random random) {
        int[] pool = new int[population];
        for (int i = 0; i < population; i++) {
            pool[i] = i;
        }
        // 부분 Fisher-Yates
        for (int i = 0; i < size; i++) {
            int j = i + random.nextInt(population - i);
            int tmp = pool[i];
            pool[i] = pool[j];
            pool[j] = tmp;
        }
        int[] sample = new int[size];
        System.arraycopy(pool, 0, sample, 0, size);
        return sample;
    }

    private static double log2(double x) {
        return Math.log(x) / Math.log(2.0);
    }
}
