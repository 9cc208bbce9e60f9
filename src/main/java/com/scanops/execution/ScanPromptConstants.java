package com.scanops.execution;

public final class ScanPromptConstants {

    private ScanPromptConstants() {
        // constants only
    }

    public static final String SYSTEM_PROMPT = """
            You are a security assessment operator working through an authorized engagement.
            You can call security tools exposed by the scan backend. Pick the tools that fit the target type,
            run them, read their output and decide whether further calls are needed within the tool call budget.
            Never scan anything other than the given target.

            When you are done, write a concise analysis in markdown. For every notable issue include a severity word
            (critical, high, medium, low or info), the affected service or URL and any CVE or CWE identifier.
            Finish with these labelled sections, each followed by a blank line:
            Remediation: how to fix the issues
            Exploitation: how an attacker could abuse them
            Verification: commands that confirm the issue or its fix
            """;

    public static final String USER_TEMPLATE = """
            Target: {target}
            Objective: {objective}
            Parameters: {params}
            Tool call budget: {budget}

            Task:
            {task}
            """;

    public static final String RUN_TASK = """
            Run the %s tool (%s) against the target with the given parameters.
            Report the raw results and analyze them for security issues.""";

    public static final String INTELLIGENCE_PLANNING_TASK = """
            Build an intelligence profile of %s for a %s assessment.
            1. Determine whether the target is a host, an IP address, a domain or a web application
            2. Resolve DNS records and identify hosting and network ownership
            3. Propose which scanning techniques suit the target in the following phases
            Keep active probing light; this phase is about planning.""";

    public static final String AUTOMATED_SCAN_TASK = """
            Perform network reconnaissance on %s for a %s assessment.
            1. Identify open ports and running services
            2. Detect service versions and technologies
            3. Identify security issues in the network configuration
            Use a port scanner such as nmap, masscan or rustscan according to the target type.""";

    public static final String DEEP_RECONNAISSANCE_TASK = """
            Perform deep reconnaissance on %s for a %s assessment.
            1. Enumerate subdomains and related assets
            2. Discover hidden endpoints and directories
            3. Identify technologies and frameworks in use
            4. Map the attack surface
            For domains prefer subfinder, amass or httpx. For web applications prefer gobuster, feroxbuster or katana.
            For technology detection use wafw00f or httpx with technology detection.""";

    public static final String VULNERABILITY_SCANNING_TASK = """
            Perform vulnerability scanning on %s for a %s assessment.
            1. Scan for known CVEs
            2. Test for common web vulnerabilities such as SQL injection and XSS
            3. Check for misconfigurations
            4. Identify outdated software with known vulnerabilities
            Prefer nuclei, nikto, sqlmap, dalfox or wpscan according to the target. Prioritize critical and high severity issues.""";

    public static final String EXPLOITATION_CHAIN_TASK = """
            Analyze attack chains and exploitation paths for %s (%s assessment).

            Findings recorded so far:
            %s

            1. Analyze how the discovered weaknesses could be chained together
            2. Identify the most critical attack paths
            3. Assess the impact of successful exploitation
            4. Prioritize remediation by risk
            Only run additional tools when they help confirm an attack chain.""";

    public static final String NO_PREVIOUS_FINDINGS = "No findings yet.";
}
