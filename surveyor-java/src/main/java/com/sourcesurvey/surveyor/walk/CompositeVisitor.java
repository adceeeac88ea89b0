package com.sourcesurvey.surveyor.walk;

import com.sourcesurvey.surveyor.report.Category;
import org.eclipse.jdt.core.dom.ASTNode;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Runs several visitors over one traversal. Each node goes only to the
 * visitors registered for its kind, in registration order.
 */
public class CompositeVisitor implements NodeVisitor {

    private final List<NodeVisitor> visitors = new ArrayList<>();
    private final Map<NodeKind, List<NodeVisitor>> byKind = new EnumMap<>(NodeKind.class);

    public CompositeVisitor(List<? extends NodeVisitor> visitors) {
        for (NodeVisitor visitor : visitors) {
            add(visitor);
        }
    }

    public final CompositeVisitor add(NodeVisitor visitor) {
        if (visitor.handledKinds().contains(NodeKind.OTHER)) {
            throw new IllegalArgumentException("Visitors cannot register for OTHER: " + visitor);
        }
        visitors.add(visitor);
        for (NodeKind kind : visitor.handledKinds()) {
            byKind.computeIfAbsent(kind, k -> new ArrayList<>()).add(visitor);
        }
        return this;
    }

    @Override
    public Set<NodeKind> handledKinds() {
        return byKind.isEmpty() ? EnumSet.noneOf(NodeKind.class) : EnumSet.copyOf(byKind.keySet());
    }

    @Override
    public Set<Category> categories() {
        Set<Category> categories = EnumSet.noneOf(Category.class);
        for (NodeVisitor visitor : visitors) {
            categories.addAll(visitor.categories());
        }
        return categories;
    }

    /** Descends unless every dispatched visitor asked to skip. */
    @Override
    public boolean visit(NodeKind kind, ASTNode node, DetectionContext context) {
        List<NodeVisitor> registered = byKind.get(kind);
        if (registered == null) return true;
        boolean descend = false;
        for (NodeVisitor visitor : registered) {
            descend |= visitor.visit(kind, node, context);
        }
        return descend;
    }
}
