package com.scanops.execution;

import com.scanops.entity.Finding;
import com.scanops.entity.Tool;
import com.scanops.entity.WorkflowObjective;
import com.scanops.entity.WorkflowPhase;
import org.springframework.lang.Nullable;
import org.springframework.stereotype.Service;
import org.springframework.util.StringUtils;

import java.util.List;
import java.util.stream.Collectors;

import static com.scanops.execution.ScanPromptConstants.*;

@Service
public class ScanPromptService {

    private static final int MAX_SUMMARIZED_FINDINGS = 30;

    public String systemPrompt() {
        return SYSTEM_PROMPT;
    }

    public String runTask(Tool tool) {
        String binary = StringUtils.hasText(tool.getBinary()) ? tool.getBinary() : tool.getSlug();
        return RUN_TASK.formatted(tool.getName(), binary);
    }

    /**
     * Task description for an AI-driven workflow phase.
     *
     * @param previousFindings findings of earlier phases, only used by the exploitation chain phase
     */
    public String phaseTask(WorkflowPhase phase, String target, @Nullable WorkflowObjective objective,
                            List<Finding> previousFindings) {
        String goal = objective == null ? WorkflowObjective.COMPREHENSIVE.wireName() : objective.wireName();
        return switch (phase) {
            case INTELLIGENCE_PLANNING -> INTELLIGENCE_PLANNING_TASK.formatted(target, goal);
            case AUTOMATED_SCAN -> AUTOMATED_SCAN_TASK.formatted(target, goal);
            case DEEP_RECONNAISSANCE -> DEEP_RECONNAISSANCE_TASK.formatted(target, goal);
            case VULNERABILITY_SCANNING -> VULNERABILITY_SCANNING_TASK.formatted(target, goal);
            case EXPLOITATION_CHAIN -> EXPLOITATION_CHAIN_TASK.formatted(target, goal, summarize(previousFindings));
            case FINAL_REPORT -> throw new IllegalArgumentException("The final report is built locally");
        };
    }

    String summarize(List<Finding> findings) {
        if (findings == null || findings.isEmpty()) {
            return NO_PREVIOUS_FINDINGS;
        }
        return findings.stream()
                .limit(MAX_SUMMARIZED_FINDINGS)
                .map(f -> "- [" + f.getSeverity() + "] " + f.getTitle()
                        + (StringUtils.hasText(f.getCveId()) ? " (" + f.getCveId() + ")" : ""))
                .collect(Collectors.joining("\n"));
    }
}
