package com.claimstrategy.common.tree;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * One procedural stage of a claim. Immutable once built.
 *
 * @param action      stage label
 * @param probability conditional probability of taking this branch from its parent
 * @param cost        cost incurred at this stage
 * @param timeDays    elapsed days at this stage
 * @param value       recovery at a terminal stage; {@code null} for intermediate stages
 * @param children    follow-on stages, empty for leaves
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TreeNode(
    @JsonProperty("action")      String action,
    @JsonProperty("probability") double probability,
    @JsonProperty("cost")        double cost,
    @JsonProperty("timeDays")    int timeDays,
    @JsonProperty("value")       Double value,
    @JsonProperty("children")    List<TreeNode> children
) {
    public TreeNode {
        children = children == null ? List.of() : List.copyOf(children);
    }

    static TreeNode branch(String action, double probability, double cost, int timeDays,
                           TreeNode... children) {
        return new TreeNode(action, probability, cost, timeDays, null, List.of(children));
    }

    static TreeNode leaf(String action, double probability, double value, double cost, int timeDays) {
        return new TreeNode(action, probability, cost, timeDays, value, List.of());
    }

    @JsonIgnore
    public boolean isLeaf() {
        return children.isEmpty();
    }

    /** Levels from this node to its deepest leaf, counting this node as 1. */
    public int depth() {
        int deepest = 0;
        for (TreeNode child : children) {
            deepest = Math.max(deepest, child.depth());
        }
        return deepest + 1;
    }

    /** Leaves in depth-first, declaration order. */
    public List<TreeNode> leaves() {
        List<TreeNode> out = new ArrayList<>();
        collectLeaves(this, out);
        return List.copyOf(out);
    }

    /** Depth-first search by action label; {@code null} when absent. */
    public TreeNode find(String actionLabel) {
        if (action.equals(actionLabel)) return this;
        for (TreeNode child : children) {
            TreeNode hit = child.find(actionLabel);
            if (hit != null) return hit;
        }
        return null;
    }

    private static void collectLeaves(TreeNode node, List<TreeNode> out) {
        if (node.isLeaf()) {
            out.add(node);
            return;
        }
        for (TreeNode child : node.children) {
            collectLeaves(child, out);
        }
    }
}
