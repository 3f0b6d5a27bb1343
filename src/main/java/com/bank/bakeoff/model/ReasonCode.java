package com.bank.bakeoff.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ReasonCode {
    private String code;
    private String description;
    private String feature;
    private String direction;       // "increase" or "decrease"
    private double contribution;    // signed score change attributed to the feature
    private double featureValue;
}
