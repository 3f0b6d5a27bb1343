package com.bank.bakeoff.engine.tree;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TreeOptions {
    @Builder.Default
    int maxDepth = 8;
    @Builder.Default
    int minSamplesSplit = 2;
    @Builder.Default
    int minSamplesLeaf = 1;
    int maxFeatures;            // 0 = consider every feature
    boolean randomThresholds;
}
