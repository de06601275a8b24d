package com.structcheck.common.verification;

import com.structcheck.common.model.DemandPoint;
import com.structcheck.common.model.LoadCombination;
import com.structcheck.common.model.MomentAxis;

import java.util.ArrayList;
import java.util.List;

/**
 * Converts provider load combinations into demand points for one axis: the provider's
 * tension-positive axial force is flipped to compression-positive.
 */
public final class DemandPoints {

    private DemandPoints() {}

    public static List<DemandPoint> from(List<LoadCombination> combinations, MomentAxis axis) {
        return from(combinations, axis, 0.0);
    }

    /**
     * @param angleDeg moment-plane angle, used by {@link MomentAxis#COMBINED} only
     */
    public static List<DemandPoint> from(List<LoadCombination> combinations, MomentAxis axis,
                                         double angleDeg) {
        List<DemandPoint> demands = new ArrayList<>(combinations.size());
        for (LoadCombination combo : combinations) {
            demands.add(new DemandPoint(combo.compressionAxial(), axis.moment(combo, angleDeg),
                combo.label()));
        }
        return demands;
    }
}
