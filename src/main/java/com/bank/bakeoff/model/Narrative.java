package com.bank.bakeoff.model;

import lombok.AllArgsConstructor;
import lombok.Data;
import lombok.NoArgsConstructor;

@Data
@NoArgsConstructor
@AllArgsConstructor
public class Narrative {
    private String narrativeShort;
    private String narrativeLong;
}
