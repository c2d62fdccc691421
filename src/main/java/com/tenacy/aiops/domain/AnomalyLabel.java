package com.tenacy.aiops.domain;

import lombok.Value;

@Value
public class AnomalyLabel {
    int windowIndex;
    boolean anomalous;
    double score;
}
