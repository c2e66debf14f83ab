package com.trainops.prognosis.event.build;

import com.trainops.prognosis.error.ProblemLog;
import com.trainops.prognosis.event.EventGraph;
import com.trainops.prognosis.target.TargetEdge;
import gnu.trove.list.TIntList;
import gnu.trove.list.array.TIntArrayList;

/**
 * Translates one target edge. Translation happens in two steps: {@link #splice} rewrites the pending chains of the
 * two node builders, then, after all node builders have committed, {@link #addToGraph} adds whatever edges the link
 * needs beyond those chains. Both steps run at most once.
 */
public abstract class EventEdgeBuilder {

    public final TargetEdge targetEdge;

    protected final EventNodeBuilder from;

    protected final EventNodeBuilder to;

    private boolean spliced = false;

    private boolean committed = false;

    /** Edges added or found by {@link #link}. */
    protected final TIntList linkedEdges = new TIntArrayList();

    protected EventEdgeBuilder (TargetEdge targetEdge, EventNodeBuilder from, EventNodeBuilder to) {
        this.targetEdge = targetEdge;
        this.from = from;
        this.to = to;
    }

    public final void splice (ProblemLog problems) {
        if (spliced) return;
        spliced = true;
        rewriteChains(problems);
    }

    public final void addToGraph (EventGraph graph, ProblemLog problems) {
        if (committed) return;
        committed = true;
        link(graph, problems);
    }

    public TIntList linkedEdges () {
        return linkedEdges;
    }

    /** Rewrite the pending chains of the two targets. Does nothing by default. */
    protected void rewriteChains (ProblemLog problems) { }

    /** Add edges between the committed chains. Does nothing by default. */
    protected void link (EventGraph graph, ProblemLog problems) { }

}
