package org.qosroute.routing.solver;

import it.unimi.dsi.fastutil.doubles.DoubleList;
import it.unimi.dsi.fastutil.doubles.DoubleLists;

enum EmptyTrace implements SolverTrace {
    INSTANCE;

    @Override
    public DoubleList bestFitnessHistory() {
        return DoubleLists.EMPTY_LIST;
    }

    @Override
    public int iterations() {
        return 0;
    }

    @Override
    public boolean cancelled() {
        return false;
    }
}
