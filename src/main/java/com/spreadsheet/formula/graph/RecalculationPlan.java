package com.spreadsheet.formula.graph;

import java.util.Collections;
import java.util.List;
import java.util.Set;

/**
 * What a recalculation has to do: cells on a reference cycle (all become #CIRCULAR!)
 * and every other affected cell in an order where precedents come first.
 */
public class RecalculationPlan {
    private final List<String> order;
    private final Set<String> circular;

    public RecalculationPlan(List<String> order, Set<String> circular) {
        this.order = Collections.unmodifiableList(order);
        this.circular = Collections.unmodifiableSet(circular);
    }

    public List<String> getOrder() {
        return order;
    }

    public Set<String> getCircular() {
        return circular;
    }
}
