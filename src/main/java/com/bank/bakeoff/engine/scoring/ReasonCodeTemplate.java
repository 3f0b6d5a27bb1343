package com.bank.bakeoff.engine.scoring;

import java.util.Arrays;
import java.util.List;
import java.util.regex.Pattern;

/**
 * Named reason codes matched by encoded feature name.
 */
public enum ReasonCodeTemplate {

    HIGH_AMOUNT_VS_BASELINE("HighAmountVsBaseline", "Transaction amount significantly above baseline",
            "amount.*zscore", "amount.*log", "^amount$", "amt.*zscore"),
    OUT_OF_HOURS("OutOfHours", "Wire initiated outside normal business hours",
            "isoutofhours", "out.?of.?hours"),
    WEEKEND_TRANSACTION("WeekendTransaction", "Transaction occurred on a weekend",
            "isweekend", "weekend"),
    RISK_CORRIDOR("RiskCorridor", "Destination corridor associated with elevated risk",
            "country.*risk", "destination.*risk", "riskcorridor", "highriskcountry"),
    CALLBACK_BYPASS("CallbackBypass", "Callback verification was not completed",
            "callback.*verified", "callback.*bypass"),
    SOD_EXCEPTION("SODException", "Initiator and reviewer are the same person",
            "initiator.*reviewer", "sod.*exception", "same.*person"),
    BURST_ACTIVITY("BurstActivity", "Multiple wires from the same customer in rapid sequence",
            "burst", "rapid.*sequence", "frequency"),
    IRREGULAR_APPROVAL("IrregularApproval", "Approval level inconsistent with transaction characteristics",
            "approval.*level");

    private final String code;
    private final String description;
    private final List<Pattern> featurePatterns;

    ReasonCodeTemplate(String code, String description, String... patterns) {
        this.code = code;
        this.description = description;
        this.featurePatterns = Arrays.stream(patterns)
                .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
                .toList();
    }

    public String getCode() {
        return code;
    }

    public String getDescription() {
        return description;
    }

    public boolean matches(String featureName) {
        return featurePatterns.stream().anyMatch(p -> p.matcher(featureName).find());
    }

    public static ReasonCodeTemplate match(String featureName) {
        for (ReasonCodeTemplate template : values()) {
            if (template.matches(featureName)) return template;
        }
        return null;
    }
}
