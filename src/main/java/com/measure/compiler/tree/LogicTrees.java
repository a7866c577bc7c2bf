package com.measure.compiler.tree;

import com.measure.compiler.model.CriteriaNode;
import com.measure.compiler.model.DataElement;
import com.measure.compiler.model.LogicalClause;
import com.measure.compiler.model.LogicalOperator;
import com.measure.compiler.model.NodeKind;
import com.measure.compiler.model.SiblingConnection;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.NoSuchElementException;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;

/**
 * Operations over criteria trees: traversal, validation, rendering, copy-on-write edits
 * and comparison. Every edit returns a new clause and leaves its input untouched.
 */
public final class LogicTrees {
    static final int MAX_RECOMMENDED_DEPTH = 4;

    private LogicTrees() {
    }

    // ========== Traversal ==========

    /**
     * Pre-order, depth-first walk starting at the root clause. The returned iterable can be
     * iterated any number of times and yields the same sequence each time.
     * @param root Root clause
     * @return Lazy sequence of visits
     */
    public static Iterable<TreeVisit> walk(LogicalClause root) {
        return () -> new WalkIterator(root);
    }

    public static List<DataElement> criteria(LogicalClause root) {
        List<DataElement> result = new ArrayList<>();
        for (TreeVisit visit : walk(root)) {
            if (!visit.isClause()) {
                result.add(visit.getNode().asElement());
            }
        }
        return result;
    }

    public static List<LogicalClause> groups(LogicalClause root) {
        List<LogicalClause> result = new ArrayList<>();
        for (TreeVisit visit : walk(root)) {
            if (visit.isClause()) {
                result.add(visit.getNode().asClause());
            }
        }
        return result;
    }

    public static int depth(LogicalClause root) {
        int max = 0;
        for (TreeVisit visit : walk(root)) {
            max = Math.max(max, visit.getDepth());
        }
        return max;
    }

    /**
     * Node at the given path, or empty when the path leaves the tree.
     */
    public static Optional<CriteriaNode> nodeAt(LogicalClause root, TreePath path) {
        CriteriaNode current = CriteriaNode.of(root);
        for (int index : path.getIndices()) {
            if (!current.isClause() || index >= current.asClause().getChildren().size()) {
                return Optional.empty();
            }
            current = current.asClause().getChildren().get(index);
        }
        return Optional.of(current);
    }

    /**
     * Copy of the tree with the node at {@code path} replaced. Clauses off the path are shared.
     * @param root Root clause
     * @param path Address of the node to replace; the root path requires a clause replacement
     * @param replacement New node
     * @return The new root
     */
    public static LogicalClause replaceAt(LogicalClause root, TreePath path, CriteriaNode replacement) {
        if (path.isRoot()) {
            return replacement.asClause();
        }
        return replaceAt(root, path.getIndices(), 0, replacement);
    }

    private static LogicalClause replaceAt(LogicalClause clause, List<Integer> indices, int position,
                                           CriteriaNode replacement) {
        int index = indices.get(position);
        if (index >= clause.getChildren().size()) {
            throw new IllegalArgumentException("Path leaves the tree at index " + index + " of " + clause.getId());
        }
        List<CriteriaNode> children = clause.copyChildren();
        if (position == indices.size() - 1) {
            children.set(index, replacement);
        } else {
            CriteriaNode child = children.get(index);
            if (!child.isClause()) {
                throw new IllegalArgumentException("Path descends into criterion " + child.getId());
            }
            children.set(index, CriteriaNode.of(replaceAt(child.asClause(), indices, position + 1, replacement)));
        }
        return clause.withChildren(children);
    }

    // ========== Validation ==========

    /**
     * Validate structure. Never throws; a null root yields EMPTY_TREE.
     * @param root Root clause, may be null
     * @return Errors, warnings and statistics
     */
    public static TreeValidationResult validate(LogicalClause root) {
        List<TreeIssue> errors = new ArrayList<>();
        List<TreeIssue> warnings = new ArrayList<>();
        if (root == null) {
            errors.add(new TreeIssue(TreeIssueCode.EMPTY_TREE, "Logic tree is empty", null, null));
            return new TreeValidationResult(errors, warnings, TreeStats.empty());
        }

        Set<String> seenIds = new HashSet<>();
        int maxDepth = 0;
        int criteriaCount = 0;
        int groupCount = 0;

        for (TreeVisit visit : walk(root)) {
            CriteriaNode node = visit.getNode();
            TreePath path = visit.getPath();
            maxDepth = Math.max(maxDepth, visit.getDepth());

            if (!seenIds.add(node.getId())) {
                errors.add(new TreeIssue(TreeIssueCode.CIRCULAR_REFERENCE,
                        "Node id \"" + node.getId() + "\" appears more than once", node.getId(), path));
            }

            if (!node.isClause()) {
                criteriaCount++;
                continue;
            }

            groupCount++;
            LogicalClause clause = node.asClause();
            int childCount = clause.getChildren().size();

            if (clause.getOperator() == null) {
                errors.add(new TreeIssue(TreeIssueCode.INVALID_OPERATOR,
                        "Group has no operator", clause.getId(), path));
            }
            for (SiblingConnection connection : clause.getSiblingConnections()) {
                if (connection.getToIndex() >= childCount) {
                    errors.add(new TreeIssue(TreeIssueCode.INVALID_OPERATOR,
                            "Operator override " + connection + " refers to a missing child", clause.getId(), path));
                }
            }

            if (childCount == 0) {
                errors.add(new TreeIssue(TreeIssueCode.EMPTY_GROUP,
                        "Group has no children", clause.getId(), path));
            } else if (clause.getOperator() == LogicalOperator.NOT && childCount > 1) {
                errors.add(new TreeIssue(TreeIssueCode.NOT_WITH_MULTIPLE_CHILDREN,
                        "NOT group must have exactly one child, found " + childCount, clause.getId(), path));
            } else if (clause.getOperator() != LogicalOperator.NOT && childCount == 1) {
                warnings.add(new TreeIssue(TreeIssueCode.SINGLE_CHILD_GROUP,
                        "Group has a single child and could be flattened", clause.getId(), path));
            }

            if (clause.hasSiblingConnections()) {
                warnings.add(new TreeIssue(TreeIssueCode.MIXED_OPERATORS,
                        "Group mixes operators between siblings", clause.getId(), path));
            }
        }

        if (maxDepth > MAX_RECOMMENDED_DEPTH) {
            warnings.add(new TreeIssue(TreeIssueCode.DEEPLY_NESTED,
                    "Tree is deeply nested (depth: " + maxDepth + "). Consider simplifying.", root.getId(),
                    TreePath.root()));
        }

        TreeStats stats = new TreeStats(criteriaCount + groupCount, maxDepth, criteriaCount, groupCount);
        return new TreeValidationResult(errors, warnings, stats);
    }

    // ========== Flat projection ==========

    public static List<FlatLogicItem> toFlatList(LogicalClause root) {
        List<FlatLogicItem> items = new ArrayList<>();
        appendFlat(root, 0, null, items);
        return items;
    }

    private static void appendFlat(LogicalClause clause, int depth, String parentId, List<FlatLogicItem> items) {
        String label = clause.getDescription() != null ? clause.getDescription() : clause.getOperator() + " group";
        items.add(new FlatLogicItem(clause.getId(), NodeKind.CLAUSE, depth, parentId, label,
                clause.getOperator(), clause.getSiblingConnections()));
        for (CriteriaNode child : clause.getChildren()) {
            switch (child.getKind()) {
                case CLAUSE -> appendFlat(child.asClause(), depth + 1, clause.getId(), items);
                case ELEMENT -> {
                    DataElement element = child.asElement();
                    items.add(new FlatLogicItem(element.getId(), NodeKind.ELEMENT, depth + 1, clause.getId(),
                            describe(element), null, null));
                }
            }
        }
    }

    /**
     * Rebuild a tree from its flat projection. Criteria are resolved through {@code lookup};
     * ids it cannot resolve are dropped.
     * @param items Flat items in any order consistent with their parent ids
     * @param lookup Resolves criterion ids to elements, returning null when unknown
     * @return The rebuilt root, or null when the list has no root group
     */
    public static LogicalClause fromFlatList(List<FlatLogicItem> items, Function<String, DataElement> lookup) {
        Map<String, List<FlatLogicItem>> childrenByParent = new LinkedHashMap<>();
        FlatLogicItem rootItem = null;
        for (FlatLogicItem item : items) {
            if (item.getParentId() == null) {
                if (rootItem == null && item.getKind() == NodeKind.CLAUSE) {
                    rootItem = item;
                }
            } else {
                childrenByParent.computeIfAbsent(item.getParentId(), k -> new ArrayList<>()).add(item);
            }
        }
        if (rootItem == null) {
            return null;
        }
        return buildGroup(rootItem, childrenByParent, lookup, new HashSet<>());
    }

    private static LogicalClause buildGroup(FlatLogicItem groupItem, Map<String, List<FlatLogicItem>> childrenByParent,
                                            Function<String, DataElement> lookup, Set<String> building) {
        if (!building.add(groupItem.getId())) {
            throw new IllegalArgumentException("Flat list nests group " + groupItem.getId() + " inside itself");
        }
        List<CriteriaNode> children = new ArrayList<>();
        for (FlatLogicItem item : childrenByParent.getOrDefault(groupItem.getId(), List.of())) {
            if (item.getKind() == NodeKind.CLAUSE) {
                children.add(CriteriaNode.of(buildGroup(item, childrenByParent, lookup, building)));
            } else {
                DataElement element = lookup.apply(item.getId());
                if (element != null) {
                    children.add(CriteriaNode.of(element));
                }
            }
        }
        building.remove(groupItem.getId());
        return new LogicalClause(groupItem.getId(), groupItem.getOperator(), null, children,
                groupItem.getSiblingConnections(), null, null);
    }

    // ========== Rendering ==========

    /**
     * Readable rendering: NOT as {@code NOT (...)}, nested groups parenthesized, the root bare.
     */
    public static String toNaturalLanguage(LogicalClause root) {
        return render(CriteriaNode.of(root), 0, LogicTrees::describe, " AND ", " OR ", "NOT (%s)", false);
    }

    /**
     * Same recursive shape as {@link #toNaturalLanguage} with leaves rendered by the caller.
     * Groups are always parenthesized and joined with line breaks, as CQL boolean expressions.
     * Mixed connectives associate left to right, so {@code a OR b AND c} renders as
     * {@code ((a or b) and c)}.
     * @param root Root clause
     * @param elementRenderer Renders one leaf
     * @return The combined expression, {@code true} for an empty group
     */
    public static String toExpression(LogicalClause root, Function<DataElement, String> elementRenderer) {
        return render(CriteriaNode.of(root), 0, elementRenderer, "\n    and ", "\n    or ", "not (%s)", true);
    }

    private static String render(CriteriaNode node, int depth, Function<DataElement, String> leafRenderer,
                                 String andJoin, String orJoin, String notFormat, boolean expressionMode) {
        if (!node.isClause()) {
            return leafRenderer.apply(node.asElement());
        }
        LogicalClause clause = node.asClause();
        List<CriteriaNode> children = clause.getChildren();
        if (children.isEmpty()) {
            return expressionMode ? "true" : "";
        }
        if (clause.getOperator() == LogicalOperator.NOT) {
            return String.format(notFormat,
                    render(children.get(0), depth + 1, leafRenderer, andJoin, orJoin, notFormat, expressionMode));
        }
        List<String> parts = new ArrayList<>();
        for (CriteriaNode child : children) {
            parts.add(render(child, depth + 1, leafRenderer, andJoin, orJoin, notFormat, expressionMode));
        }
        if (parts.size() == 1) {
            return parts.get(0);
        }
        StringBuilder joined = new StringBuilder(parts.get(0));
        LogicalOperator previous = null;
        for (int i = 1; i < parts.size(); i++) {
            LogicalOperator op = clause.operatorBetween(i - 1, i);
            // left-to-right: group what came before when the connective changes
            if (expressionMode && previous != null && op != previous) {
                joined.insert(0, '(').append(')');
            }
            joined.append(op == LogicalOperator.OR ? orJoin : andJoin).append(parts.get(i));
            previous = op;
        }
        boolean parenthesize = expressionMode || depth > 0;
        return parenthesize ? "(" + joined + ")" : joined.toString();
    }

    private static String describe(DataElement element) {
        String description = element.getDescription();
        return description != null && !description.isBlank()
                ? description
                : "[" + element.getClinicalType().getValue() + "]";
    }

    // ========== Edits ==========

    public static LogicalClause addChild(LogicalClause clause, CriteriaNode child) {
        List<CriteriaNode> children = clause.copyChildren();
        children.add(child);
        return clause.withChildren(children);
    }

    /**
     * Remove the child with the given id. Overrides touching it are dropped and later
     * overrides move down one position. Unknown ids return the clause unchanged.
     */
    public static LogicalClause removeChild(LogicalClause clause, String childId) {
        int removedIndex = indexOf(clause, childId);
        if (removedIndex < 0) {
            return clause;
        }
        List<CriteriaNode> children = clause.copyChildren();
        children.remove(removedIndex);
        List<SiblingConnection> connections = new ArrayList<>();
        for (SiblingConnection connection : clause.getSiblingConnections()) {
            if (connection.touches(removedIndex)) {
                continue;
            }
            connections.add(connection.getFromIndex() > removedIndex ? connection.shift(-1) : connection);
        }
        return clause.withChildren(children, connections);
    }

    public static LogicalClause replaceChild(LogicalClause clause, String childId, CriteriaNode replacement) {
        int index = indexOf(clause, childId);
        if (index < 0) {
            return clause;
        }
        List<CriteriaNode> children = clause.copyChildren();
        children.set(index, replacement);
        return clause.withChildren(children);
    }

    /**
     * Change the default operator. Pairwise overrides are cleared.
     */
    public static LogicalClause setOperator(LogicalClause clause, LogicalOperator operator) {
        return clause.withOperator(operator).withSiblingConnections(List.of());
    }

    /**
     * Override the operator between two adjacent children. Setting the default operator
     * removes the override instead.
     */
    public static LogicalClause setOperatorBetween(LogicalClause clause, int i, int j, LogicalOperator operator) {
        int size = clause.getChildren().size();
        if (i < 0 || j < 0 || i >= size || j >= size) {
            throw new IndexOutOfBoundsException("Sibling indices " + i + ", " + j + " outside 0.." + (size - 1));
        }
        List<SiblingConnection> connections = new ArrayList<>();
        for (SiblingConnection connection : clause.getSiblingConnections()) {
            if (!connection.joins(i, j)) {
                connections.add(connection);
            }
        }
        if (operator != clause.getOperator()) {
            connections.add(new SiblingConnection(i, j, operator));
        }
        return clause.withSiblingConnections(connections);
    }

    /**
     * Recursively unwrap single-child groups other than NOT.
     */
    public static LogicalClause flatten(LogicalClause clause) {
        List<CriteriaNode> children = new ArrayList<>();
        for (CriteriaNode child : clause.getChildren()) {
            if (!child.isClause()) {
                children.add(child);
                continue;
            }
            LogicalClause flattened = flatten(child.asClause());
            if (flattened.getChildren().size() == 1 && flattened.getOperator() != LogicalOperator.NOT) {
                children.add(flattened.getChildren().get(0));
            } else {
                children.add(CriteriaNode.of(flattened));
            }
        }
        return clause.withChildren(children);
    }

    private static int indexOf(LogicalClause clause, String childId) {
        List<CriteriaNode> children = clause.getChildren();
        for (int i = 0; i < children.size(); i++) {
            if (children.get(i).getId().equals(childId)) {
                return i;
            }
        }
        return -1;
    }

    // ========== Comparison ==========

    /**
     * Structural equality: operators, child kinds and criterion ids, pairwise. Leaf bodies
     * are not compared.
     */
    public static boolean areEqual(LogicalClause a, LogicalClause b) {
        if (a == null || b == null) {
            return a == b;
        }
        if (a.getOperator() != b.getOperator() || a.getChildren().size() != b.getChildren().size()) {
            return false;
        }
        for (int i = 0; i < a.getChildren().size(); i++) {
            CriteriaNode left = a.getChildren().get(i);
            CriteriaNode right = b.getChildren().get(i);
            if (left.getKind() != right.getKind()) {
                return false;
            }
            if (left.isClause()) {
                if (!areEqual(left.asClause(), right.asClause())) {
                    return false;
                }
            } else if (!left.getId().equals(right.getId())) {
                return false;
            }
        }
        return true;
    }

    public static TreeDiff diff(LogicalClause before, LogicalClause after) {
        List<String> beforeIds = before != null ? criteria(before).stream().map(DataElement::getId).toList() : List.of();
        List<String> afterIds = after != null ? criteria(after).stream().map(DataElement::getId).toList() : List.of();
        Set<String> beforeSet = new HashSet<>(beforeIds);
        Set<String> afterSet = new HashSet<>(afterIds);

        List<String> added = afterIds.stream().filter(id -> !beforeSet.contains(id)).toList();
        List<String> removed = beforeIds.stream().filter(id -> !afterSet.contains(id)).toList();

        List<OperatorChange> operatorChanges = new ArrayList<>();
        if (before != null && after != null) {
            Map<String, LogicalOperator> beforeOperators = new LinkedHashMap<>();
            for (LogicalClause group : groups(before)) {
                beforeOperators.put(group.getId(), group.getOperator());
            }
            for (LogicalClause group : groups(after)) {
                if (beforeOperators.containsKey(group.getId())
                        && beforeOperators.get(group.getId()) != group.getOperator()) {
                    operatorChanges.add(new OperatorChange(group.getId(), beforeOperators.get(group.getId()),
                            group.getOperator()));
                }
            }
        }
        return new TreeDiff(added, removed, operatorChanges);
    }

    private static final class WalkIterator implements Iterator<TreeVisit> {
        private final Deque<TreeVisit> stack = new ArrayDeque<>();

        WalkIterator(LogicalClause root) {
            if (root != null) {
                stack.push(new TreeVisit(CriteriaNode.of(root), 0, TreePath.root()));
            }
        }

        @Override
        public boolean hasNext() {
            return !stack.isEmpty();
        }

        @Override
        public TreeVisit next() {
            if (stack.isEmpty()) {
                throw new NoSuchElementException();
            }
            TreeVisit visit = stack.pop();
            if (visit.isClause()) {
                List<CriteriaNode> children = visit.getNode().asClause().getChildren();
                for (int i = children.size() - 1; i >= 0; i--) {
                    stack.push(new TreeVisit(children.get(i), visit.getDepth() + 1, visit.getPath().child(i)));
                }
            }
            return visit;
        }
    }
}
