package com.bank.bakeoff.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class RubricOutcome {
    private int championIndex;          // -1 when every candidate failed
    private int runnerUpIndex;          // -1 when there is no other ranked candidate
    private boolean championMeetsConstraints;
    private boolean fallbackUsed;       // no candidate met the constraints
    private List<Integer> eligibleIndices;
    private List<Double> scores;        // index-aligned with candidates, null for failed ones
}
