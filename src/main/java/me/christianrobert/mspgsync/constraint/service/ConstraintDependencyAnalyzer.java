package me.christianrobert.mspgsync.constraint.service;

import me.christianrobert.mspgsync.core.exception.CyclicConstraintException;
import me.christianrobert.mspgsync.core.job.model.table.ConstraintMetadata;
import me.christianrobert.mspgsync.core.job.model.table.TableMetadata;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.*;

/**
 * Analyzes and sorts constraints by dependency order for creation.
 *
 * Constraint Creation Order:
 * 1. Primary Keys (foundational, no dependencies)
 * 2. Unique Constraints (can be referenced by FKs)
 * 3. Foreign Keys (grouped by table, tables in topological order of the FK graph)
 * 4. Check Constraints (independent, can fail without blocking others)
 *
 * The order is deterministic: ties are broken by table and constraint name, so the same
 * schema always yields the same statement order. A cycle in the FK graph between different
 * tables has no valid order and fails with {@link CyclicConstraintException}. Self-referencing
 * FKs are not cycles in this sense; they come last.
 */
public class ConstraintDependencyAnalyzer {

    private static final Logger log = LoggerFactory.getLogger(ConstraintDependencyAnalyzer.class);

    private static final Comparator<TableConstraintPair> BY_TABLE_AND_NAME = Comparator
            .comparing(TableConstraintPair::getTableKey)
            .thenComparing(pair -> pair.constraint.getConstraintName().toLowerCase(Locale.ROOT));

    /**
     * Sorts constraints by dependency order for creation.
     *
     * @param tables List of tables with their constraints
     * @return List of table-constraint pairs sorted by creation order
     * @throws CyclicConstraintException if foreign keys form a cycle between tables
     */
    public static List<TableConstraintPair> sortConstraintsByDependency(List<TableMetadata> tables) {
        List<TableConstraintPair> primaryKeys = new ArrayList<>();
        List<TableConstraintPair> uniques = new ArrayList<>();
        List<TableConstraintPair> foreignKeys = new ArrayList<>();
        List<TableConstraintPair> checks = new ArrayList<>();

        for (TableMetadata table : tables) {
            for (ConstraintMetadata constraint : table.getConstraints()) {
                TableConstraintPair pair = new TableConstraintPair(table, constraint);
                if (constraint.isPrimaryKey()) {
                    primaryKeys.add(pair);
                } else if (constraint.isUniqueConstraint()) {
                    uniques.add(pair);
                } else if (constraint.isForeignKey()) {
                    foreignKeys.add(pair);
                } else if (constraint.isCheckConstraint()) {
                    checks.add(pair);
                }
            }
        }

        primaryKeys.sort(BY_TABLE_AND_NAME);
        uniques.sort(BY_TABLE_AND_NAME);
        checks.sort(BY_TABLE_AND_NAME);

        List<TableConstraintPair> sortedConstraints = new ArrayList<>(primaryKeys);
        sortedConstraints.addAll(uniques);
        sortedConstraints.addAll(sortForeignKeysByDependency(foreignKeys));
        sortedConstraints.addAll(checks);

        log.info("Sorted {} constraints by dependency order ({} PK, {} UNIQUE, {} FK, {} CHECK)",
                sortedConstraints.size(), primaryKeys.size(), uniques.size(), foreignKeys.size(), checks.size());
        return sortedConstraints;
    }

    /**
     * Orders the foreign keys so that the FKs of a referenced table come before the FKs of
     * tables referencing it.
     */
    static List<TableConstraintPair> sortForeignKeysByDependency(List<TableConstraintPair> foreignKeys) {
        List<TableConstraintPair> selfReferencing = new ArrayList<>();
        Map<String, List<TableConstraintPair>> fksBySourceTable = new TreeMap<>();
        Map<String, Set<String>> dependencies = new TreeMap<>();

        for (TableConstraintPair pair : foreignKeys) {
            String sourceTable = pair.getTableKey();
            String targetTable = pair.getReferencedTableKey();

            if (sourceTable.equals(targetTable)) {
                selfReferencing.add(pair);
                log.debug("FK {} is self-referencing ({}), will be added last",
                        pair.constraint.getConstraintName(), sourceTable);
                continue;
            }

            // sourceTable depends on targetTable
            dependencies.computeIfAbsent(sourceTable, k -> new TreeSet<>()).add(targetTable);
            dependencies.computeIfAbsent(targetTable, k -> new TreeSet<>());
            fksBySourceTable.computeIfAbsent(sourceTable, k -> new ArrayList<>()).add(pair);
            log.debug("FK dependency: {} -> {} (FK: {})", sourceTable, targetTable, pair.constraint.getConstraintName());
        }

        List<String> sortedTables = topologicalOrder(dependencies);

        List<TableConstraintPair> result = new ArrayList<>();
        for (String table : sortedTables) {
            List<TableConstraintPair> tableFKs = fksBySourceTable.get(table);
            if (tableFKs != null) {
                tableFKs.sort(BY_TABLE_AND_NAME);
                result.addAll(tableFKs);
            }
        }
        selfReferencing.sort(BY_TABLE_AND_NAME);
        result.addAll(selfReferencing);

        log.info("Sorted {} foreign keys: {} topologically sorted, {} self-referencing",
                foreignKeys.size(), foreignKeys.size() - selfReferencing.size(), selfReferencing.size());
        return result;
    }

    /**
     * Kahn's algorithm over "table depends on tables". Dependencies come first; among tables
     * that are ready at the same time the smallest name wins.
     *
     * @param dependencies every node as a key, mapped to the nodes it depends on
     * @throws CyclicConstraintException naming the tables of every cycle
     */
    public static List<String> topologicalOrder(Map<String, Set<String>> dependencies) {
        Map<String, Integer> remaining = new HashMap<>();
        Map<String, List<String>> dependents = new HashMap<>();
        for (Map.Entry<String, Set<String>> entry : dependencies.entrySet()) {
            remaining.putIfAbsent(entry.getKey(), 0);
            for (String dependency : entry.getValue()) {
                remaining.putIfAbsent(dependency, 0);
                remaining.merge(entry.getKey(), 1, Integer::sum);
                dependents.computeIfAbsent(dependency, k -> new ArrayList<>()).add(entry.getKey());
            }
        }

        PriorityQueue<String> ready = new PriorityQueue<>();
        for (Map.Entry<String, Integer> entry : remaining.entrySet()) {
            if (entry.getValue() == 0) {
                ready.add(entry.getKey());
            }
        }

        List<String> sorted = new ArrayList<>();
        while (!ready.isEmpty()) {
            String table = ready.poll();
            sorted.add(table);
            for (String dependent : dependents.getOrDefault(table, List.of())) {
                if (remaining.merge(dependent, -1, Integer::sum) == 0) {
                    ready.add(dependent);
                }
            }
        }

        if (sorted.size() < remaining.size()) {
            List<List<String>> cycles = findCycles(dependencies);
            log.error("Circular FK dependencies detected: {}", cycles);
            throw new CyclicConstraintException(cycles);
        }
        return sorted;
    }

    /**
     * Strongly connected components with more than one table (Tarjan), each sorted by name.
     */
    static List<List<String>> findCycles(Map<String, Set<String>> dependencies) {
        TarjanState state = new TarjanState(dependencies);
        for (String node : new TreeSet<>(state.nodes())) {
            if (!state.index.containsKey(node)) {
                state.strongConnect(node);
            }
        }
        state.components.sort(Comparator.comparing(component -> component.get(0)));
        return state.components;
    }

    private static final class TarjanState {
        private final Map<String, Set<String>> edges;
        private final Map<String, Integer> index = new HashMap<>();
        private final Map<String, Integer> lowLink = new HashMap<>();
        private final Deque<String> stack = new ArrayDeque<>();
        private final Set<String> onStack = new HashSet<>();
        private final List<List<String>> components = new ArrayList<>();
        private int counter;

        TarjanState(Map<String, Set<String>> edges) {
            this.edges = edges;
        }

        Set<String> nodes() {
            Set<String> nodes = new HashSet<>(edges.keySet());
            edges.values().forEach(nodes::addAll);
            return nodes;
        }

        void strongConnect(String node) {
            index.put(node, counter);
            lowLink.put(node, counter);
            counter++;
            stack.push(node);
            onStack.add(node);

            for (String next : edges.getOrDefault(node, Set.of())) {
                if (!index.containsKey(next)) {
                    strongConnect(next);
                    lowLink.put(node, Math.min(lowLink.get(node), lowLink.get(next)));
                } else if (onStack.contains(next)) {
                    lowLink.put(node, Math.min(lowLink.get(node), index.get(next)));
                }
            }

            if (lowLink.get(node).equals(index.get(node))) {
                List<String> component = new ArrayList<>();
                String member;
                do {
                    member = stack.pop();
                    onStack.remove(member);
                    component.add(member);
                } while (!member.equals(node));
                if (component.size() > 1) {
                    Collections.sort(component);
                    components.add(component);
                }
            }
        }
    }

    /**
     * Pair of table and constraint for sorted list.
     */
    public static class TableConstraintPair {
        public final TableMetadata table;
        public final ConstraintMetadata constraint;

        public TableConstraintPair(TableMetadata table, ConstraintMetadata constraint) {
            this.table = table;
            this.constraint = constraint;
        }

        public String getQualifiedTableName() {
            return table.getSchema() + "." + table.getTableName();
        }

        String getTableKey() {
            return getQualifiedTableName().toLowerCase(Locale.ROOT);
        }

        String getReferencedTableKey() {
            return (constraint.getReferencedSchema() + "." + constraint.getReferencedTable()).toLowerCase(Locale.ROOT);
        }

        @Override
        public String toString() {
            return String.format("TableConstraintPair{table=%s.%s, constraint=%s, type=%s}",
                    table.getSchema(), table.getTableName(),
                    constraint.getConstraintName(), constraint.getConstraintType());
        }
    }
}
