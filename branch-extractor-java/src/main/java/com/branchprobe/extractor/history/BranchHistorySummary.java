package com.branchprobe.extractor.history;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Outcome-history features per branch: the fraction taken over the last 4 outcomes, and a
 * geometric summary with the fraction taken over the last 2, 4 and 8 outcomes. A window
 * longer than the history uses the whole history.
 */
public class BranchHistorySummary {

    static final int[] GEOMETRIC_WINDOWS = {2, 4, 8};

    public record BranchSummary(long branchId, double lastFourOutcomes, List<Double> geometricSummary) {

        public String render() {
            StringBuilder sb = new StringBuilder();
            sb.append("Branch ").append(Long.toUnsignedString(branchId))
              .append(": [last_4_outcomes: ").append(lastFourOutcomes)
              .append(", geometric_summary: [");
            for (int k = 0; k < geometricSummary.size(); k++) {
                if (k > 0) sb.append(", ");
                sb.append(geometricSummary.get(k));
            }
            return sb.append("]]").toString();
        }
    }

    public List<BranchSummary> summarize(Map<Long, List<Boolean>> outcomes) {
        List<BranchSummary> summaries = new ArrayList<>();
        for (Map.Entry<Long, List<Boolean>> e : outcomes.entrySet()) {
            List<Boolean> history = e.getValue();
            List<Double> geometric = new ArrayList<>();
            for (int window : GEOMETRIC_WINDOWS) {
                geometric.add(takenFraction(history, window));
            }
            summaries.add(new BranchSummary(e.getKey(), takenFraction(history, 4), geometric));
        }
        return summaries;
    }

    public String render(List<BranchSummary> summaries) {
        StringBuilder sb = new StringBuilder();
        for (BranchSummary s : summaries) {
            sb.append(s.render()).append('\n');
        }
        return sb.toString();
    }

    static double takenFraction(List<Boolean> history, int window) {
        if (history.isEmpty()) {
            return 0.0;
        }
        int n = Math.min(window, history.size());
        int taken = 0;
        for (Boolean outcome : history.subList(history.size() - n, history.size())) {
            if (outcome) taken++;
        }
        return (double) taken / n;
    }
}
