package com.example.contentops.flowguard.quality;

import java.util.List;
import java.util.Map;

/**
 * Boolean checklist outcome.
 *
 * @param checks      check name to verdict, in evaluation order
 * @param score       share of passed checks
 * @param suggestions one suggestion per failed check, in check order
 */
public record ChecklistResult(Map<String, Boolean> checks, double score, List<String> suggestions) {

    public boolean passed(String check) {
        return Boolean.TRUE.equals(checks.get(check));
    }
}
