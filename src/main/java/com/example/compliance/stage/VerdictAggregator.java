package com.example.compliance.stage;

import com.example.compliance.model.TaskFinding;
import com.example.compliance.model.VerdictStatus;

import java.util.Collection;

/**
 * Clause verdict from per-task findings.
 * <ol>
 *   <li>any GAP: NON_COMPLIANT, even when other tasks found no evidence</li>
 *   <li>no task with evidence: NO_EVIDENCE</li>
 *   <li>every task SUPPORTED: COMPLIANT</li>
 *   <li>otherwise: INCONCLUSIVE</li>
 * </ol>
 * A COMPLIANT aggregate is then checked against the judge's overall flag by {@link #reconcile}.
 */
public final class VerdictAggregator {

    private VerdictAggregator() {
    }

    public static VerdictStatus aggregate(Collection<TaskFinding> findings) {
        if (findings.contains(TaskFinding.GAP)) {
            return VerdictStatus.NON_COMPLIANT;
        }
        if (findings.isEmpty() || findings.stream().allMatch(f -> f == TaskFinding.NO_EVIDENCE)) {
            return VerdictStatus.NO_EVIDENCE;
        }
        if (findings.stream().allMatch(f -> f == TaskFinding.SUPPORTED)) {
            return VerdictStatus.COMPLIANT;
        }
        return VerdictStatus.INCONCLUSIVE;
    }

    /**
     * Downgrades a COMPLIANT aggregate to INCONCLUSIVE when the judge's overall flag says the
     * clause is not met. Task gaps keep precedence over a positive overall flag.
     */
    public static VerdictStatus reconcile(VerdictStatus aggregated, Boolean overallCompliant) {
        if (aggregated == VerdictStatus.COMPLIANT && Boolean.FALSE.equals(overallCompliant)) {
            return VerdictStatus.INCONCLUSIVE;
        }
        return aggregated;
    }
}
