package com.tenacy.aiops.domain;

import lombok.EqualsAndHashCode;
import lombok.ToString;

import java.util.Collections;
import java.util.List;

/**
 * 윈도우 순서대로 정렬된 FeatureVector 행렬 (rows x {@link FeatureVector#ARITY}).
 */
@EqualsAndHashCode
@ToString
public class FeatureMatrix {

    private final List<FeatureVector> rows;

    public FeatureMatrix(List<FeatureVector> rows) {
        this.rows = Collections.unmodifiableList(rows);
    }

    public static FeatureMatrix empty() {
        return new FeatureMatrix(Collections.emptyList());
    }

    public int rowCount() {
        return rows.size();
    }

    public int columnCount() {
        return FeatureVector.ARITY;
    }

    public boolean isEmpty() {
        return rows.isEmpty();
    }

    public FeatureVector row(int index) {
        return rows.get(index);
    }

    public List<FeatureVector> getRows() {
        return rows;
    }

    public double[][] toArray() {
        double[][] data = new double[rows.size()][];
        for (int i = 0; i < rows.size(); i++) {
            data[i] = rows.get(i).toArray();
        }
        return data;
    }
}
