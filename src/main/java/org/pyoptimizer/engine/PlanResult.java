package org.pyoptimizer.engine;

import org.pyoptimizer.model.DeclinedFinding;
import org.pyoptimizer.model.Patch;
import org.pyoptimizer.model.SupersededPatch;

import java.util.List;

/**
 * The conflict-free set of candidate patches for one script, plus what was dropped
 * on the way.
 *
 * @param patches    mutually non-overlapping patches, in source order
 * @param superseded candidates that lost a conflict
 * @param declined   findings no rule turned into a candidate
 */
public record PlanResult(List<Patch> patches, List<SupersededPatch> superseded, List<DeclinedFinding> declined) {

    public PlanResult {
        patches = List.copyOf(patches);
        superseded = List.copyOf(superseded);
        declined = List.copyOf(declined);
    }

    public List<Patch> proven() {
        return patches.stream().filter(Patch::isProven).toList();
    }

    public List<Patch> heuristic() {
        return patches.stream().filter(patch -> !patch.isProven()).toList();
    }
}
