package com.scanops.entity;

/**
 * The six fixed phases of a workflow session, in execution order.
 */
public enum WorkflowPhase {
    INTELLIGENCE_PLANNING(1, "Target Intelligence Analysis",
            "Profile the target and plan the assessment", "RECONNAISSANCE", Severity.LOW, 2),
    AUTOMATED_SCAN(2, "Automated Security Scan",
            "Discover open ports, services and versions", "NETWORK", Severity.LOW, 5),
    DEEP_RECONNAISSANCE(3, "Deep Reconnaissance",
            "Enumerate subdomains, endpoints and technologies", "RECONNAISSANCE", Severity.LOW, 5),
    VULNERABILITY_SCANNING(4, "Vulnerability Assessment",
            "Test for known CVEs, injection flaws and misconfigurations", "VULNERABILITY", Severity.MEDIUM, 5),
    EXPLOITATION_CHAIN(5, "Attack Chain Analysis",
            "Correlate findings into exploitable attack paths", "EXPLOITATION", Severity.LOW, 3),
    FINAL_REPORT(6, "Generate Security Report",
            "Aggregate findings and compute the risk score", "REPORT", Severity.INFO, 0);

    private final int stepNumber;
    private final String title;
    private final String description;
    private final String category;
    private final Severity failureSeverity;
    private final int maxToolCalls;

    WorkflowPhase(int stepNumber, String title, String description, String category,
                  Severity failureSeverity, int maxToolCalls) {
        this.stepNumber = stepNumber;
        this.title = title;
        this.description = description;
        this.category = category;
        this.failureSeverity = failureSeverity;
        this.maxToolCalls = maxToolCalls;
    }

    public int stepNumber() {
        return stepNumber;
    }

    public String title() {
        return title;
    }

    public String description() {
        return description;
    }

    public String category() {
        return category;
    }

    /** Severity of the finding recorded when the phase itself fails. */
    public Severity failureSeverity() {
        return failureSeverity;
    }

    /** Upper bound on tool calls the phase may spend, further capped by the session budget. */
    public int maxToolCalls() {
        return maxToolCalls;
    }

    public boolean aiDriven() {
        return this != FINAL_REPORT;
    }
}
