package io.layoffs.analytics;

import java.util.ArrayList;
import java.util.List;

/**
 * Prefix sum over a monthly series, in the order given. The caller supplies the months sorted;
 * nothing is re-sorted here.
 */
public class RollingTotalComputer {

    public List<RollingTotal> compute(List<MonthlyTotal> monthly) {
        List<RollingTotal> out = new ArrayList<>(monthly.size());
        long running = 0L;
        for (MonthlyTotal m : monthly) {
            running += m.total();
            out.add(new RollingTotal(m.month(), m.total(), running));
        }
        return out;
    }
}
