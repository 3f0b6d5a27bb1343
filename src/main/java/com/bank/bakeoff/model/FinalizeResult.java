package com.bank.bakeoff.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class FinalizeResult {
    private String bakeoffId;
    private String championVersionId;
    private String narrativeShort;
    private String narrativeLong;
}
