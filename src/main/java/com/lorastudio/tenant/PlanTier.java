package com.lorastudio.tenant;

public enum PlanTier {
    STARTER(10),
    STANDARD(50),
    PRO(200),
    ENTERPRISE(5000);

    private final int monthlyTrainingRuns;

    PlanTier(int monthlyTrainingRuns) {
        this.monthlyTrainingRuns = monthlyTrainingRuns;
    }

    public int monthlyTrainingRuns() {
        return monthlyTrainingRuns;
    }
}
