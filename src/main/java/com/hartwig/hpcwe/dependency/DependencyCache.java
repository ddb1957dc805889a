package com.hartwig.hpcwe.dependency;

import java.io.StringWriter;
import java.util.Collection;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;
import java.util.stream.IntStream;

import com.hartwig.hpcwe.model.EntityKind;
import com.hartwig.hpcwe.model.StoreElement;
import com.hartwig.hpcwe.model.StoreElementIteration;
import com.hartwig.hpcwe.model.StoreRun;
import com.hartwig.hpcwe.store.PersistentStore;

import org.jgrapht.graph.DefaultDirectedGraph;
import org.jgrapht.graph.DefaultEdge;
import org.jgrapht.nio.Attribute;
import org.jgrapht.nio.DefaultAttribute;
import org.jgrapht.nio.dot.DOTExporter;
import org.jgrapht.traverse.DepthFirstIterator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Dependencies between runs, iterations and elements of one workflow, computed in a single pass over the store.
 * <p>
 * A run depends on the run recorded as the {@code EAR_ID} source of any parameter in its data index. Iteration
 * dependencies are the union over their runs, element dependencies the union over their iterations. The cache is a
 * snapshot: build a new one after the store changed.
 */
public class DependencyCache {
    private static final Logger LOGGER = LoggerFactory.getLogger(DependencyCache.class);
    static final String RUN_SOURCE_KEY = "EAR_ID";

    private final Map<Integer, Set<Integer>> runDependencies;
    private final Map<Integer, Set<Integer>> runDependents;
    private final Map<Integer, Set<Integer>> iterationRunDependencies;
    private final Map<Integer, Set<Integer>> iterationDependencies;
    private final Map<Integer, Set<Integer>> elementIterationDependencies;
    private final Map<Integer, Set<Integer>> elementDependencies;
    private final Map<Integer, Set<Integer>> elementDependents;
    private final Map<Integer, Set<Integer>> elementDependentsRecursive;
    private final DefaultDirectedGraph<Integer, DefaultEdge> elementGraph;

    private DependencyCache(final Map<Integer, Set<Integer>> runDependencies, final Map<Integer, Set<Integer>> runDependents,
            final Map<Integer, Set<Integer>> iterationRunDependencies, final Map<Integer, Set<Integer>> iterationDependencies,
            final Map<Integer, Set<Integer>> elementIterationDependencies, final Map<Integer, Set<Integer>> elementDependencies,
            final Map<Integer, Set<Integer>> elementDependents, final Map<Integer, Set<Integer>> elementDependentsRecursive,
            final DefaultDirectedGraph<Integer, DefaultEdge> elementGraph) {
        this.runDependencies = runDependencies;
        this.runDependents = runDependents;
        this.iterationRunDependencies = iterationRunDependencies;
        this.iterationDependencies = iterationDependencies;
        this.elementIterationDependencies = elementIterationDependencies;
        this.elementDependencies = elementDependencies;
        this.elementDependents = elementDependents;
        this.elementDependentsRecursive = elementDependentsRecursive;
        this.elementGraph = elementGraph;
    }

    public static DependencyCache build(PersistentStore store) {
        try (var ignored = store.cachedLoad()) {
            var runs = store.getRuns(allIds(store, EntityKind.RUN));
            var iterations = store.getElementIterations(allIds(store, EntityKind.ITERATION));
            var elements = store.getElements(allIds(store, EntityKind.ELEMENT));
            var sources = store.getParameterSources(allIds(store, EntityKind.PARAMETER));
            return build(runs, iterations, elements, sources);
        }
    }

    static DependencyCache build(List<StoreRun> runs, List<StoreElementIteration> iterations, List<StoreElement> elements,
            List<Map<String, Object>> parameterSources) {
        var runDependencies = new HashMap<Integer, Set<Integer>>();
        var runDependents = new HashMap<Integer, Set<Integer>>();
        for (StoreRun run : runs) {
            runDependents.computeIfAbsent(run.id(), id -> new TreeSet<>());
            var sources = new TreeSet<Integer>();
            for (Integer parameterId : run.dataIndex().allParameterIds()) {
                var producer = parameterSources.get(parameterId).get(RUN_SOURCE_KEY);
                if (producer instanceof Number && ((Number) producer).intValue() != run.id()) {
                    sources.add(((Number) producer).intValue());
                }
            }
            runDependencies.put(run.id(), sources);
            for (Integer source : sources) {
                runDependents.computeIfAbsent(source, id -> new TreeSet<>()).add(run.id());
            }
        }

        var iterationOfRun = new HashMap<Integer, Integer>();
        var iterationRunDependencies = new HashMap<Integer, Set<Integer>>();
        for (StoreElementIteration iteration : iterations) {
            var dependencies = new TreeSet<Integer>();
            for (List<Integer> runIds : iteration.runIds().values()) {
                for (Integer runId : runIds) {
                    iterationOfRun.put(runId, iteration.id());
                    dependencies.addAll(runDependencies.getOrDefault(runId, Set.of()));
                }
            }
            iterationRunDependencies.put(iteration.id(), dependencies);
        }
        var iterationDependencies = mapValues(iterationRunDependencies, iterationOfRun);

        var elementOfIteration = new HashMap<Integer, Integer>();
        var elementIterationDependencies = new HashMap<Integer, Set<Integer>>();
        for (StoreElement element : elements) {
            var dependencies = new TreeSet<Integer>();
            for (Integer iterationId : element.iterationIds()) {
                elementOfIteration.put(iterationId, element.id());
                dependencies.addAll(iterationDependencies.getOrDefault(iterationId, Set.of()));
            }
            elementIterationDependencies.put(element.id(), dependencies);
        }
        var elementDependencies = mapValues(elementIterationDependencies, elementOfIteration);

        var graph = new DefaultDirectedGraph<Integer, DefaultEdge>(DefaultEdge.class);
        elements.forEach(element -> graph.addVertex(element.id()));
        var elementDependents = new HashMap<Integer, Set<Integer>>();
        elements.forEach(element -> elementDependents.put(element.id(), new TreeSet<>()));
        for (var entry : elementDependencies.entrySet()) {
            for (Integer dependency : entry.getValue()) {
                elementDependents.get(dependency).add(entry.getKey());
                if (!dependency.equals(entry.getKey())) {
                    graph.addEdge(dependency, entry.getKey());
                }
            }
        }

        var elementDependentsRecursive = new HashMap<Integer, Set<Integer>>();
        for (StoreElement element : elements) {
            var reachable = new TreeSet<Integer>();
            var iterator = new DepthFirstIterator<>(graph, element.id());
            while (iterator.hasNext()) {
                reachable.add(iterator.next());
            }
            reachable.remove(element.id());
            elementDependentsRecursive.put(element.id(), reachable);
        }
        LOGGER.debug("Built dependency cache over {} run(s), {} iteration(s) and {} element(s)",
                runs.size(),
                iterations.size(),
                elements.size());

        return new DependencyCache(runDependencies,
                runDependents,
                iterationRunDependencies,
                iterationDependencies,
                elementIterationDependencies,
                elementDependencies,
                elementDependents,
                elementDependentsRecursive,
                graph);
    }

    private static List<Integer> allIds(PersistentStore store, EntityKind kind) {
        return IntStream.range(0, store.count(kind)).boxed().collect(Collectors.toList());
    }

    private static Map<Integer, Set<Integer>> mapValues(Map<Integer, Set<Integer>> dependencies, Map<Integer, Integer> owner) {
        var mapped = new HashMap<Integer, Set<Integer>>();
        for (var entry : dependencies.entrySet()) {
            mapped.put(entry.getKey(),
                    entry.getValue()
                            .stream()
                            .map(owner::get)
                            .filter(Objects::nonNull)
                            .collect(Collectors.toCollection(TreeSet::new)));
        }
        return mapped;
    }

    private static Set<Integer> lookup(Map<Integer, Set<Integer>> table, int id, String kind) {
        var values = table.get(id);
        if (values == null) {
            throw new IllegalArgumentException(String.format("No %s with ID %s in dependency cache", kind, id));
        }
        return Collections.unmodifiableSet(values);
    }

    public Set<Integer> runDependencies(int runId) {
        return lookup(runDependencies, runId, "run");
    }

    public Set<Integer> runDependents(int runId) {
        return lookup(runDependents, runId, "run");
    }

    /**
     * Runs, in any iteration, that the runs of this iteration depend on.
     */
    public Set<Integer> iterationRunDependencies(int iterationId) {
        return lookup(iterationRunDependencies, iterationId, "iteration");
    }

    public Set<Integer> iterationDependencies(int iterationId) {
        return lookup(iterationDependencies, iterationId, "iteration");
    }

    public Set<Integer> elementIterationDependencies(int elementId) {
        return lookup(elementIterationDependencies, elementId, "element");
    }

    public Set<Integer> elementDependencies(int elementId) {
        return lookup(elementDependencies, elementId, "element");
    }

    public Set<Integer> elementDependents(int elementId) {
        return lookup(elementDependents, elementId, "element");
    }

    /**
     * All elements that depend on this one directly or through other elements.
     */
    public Set<Integer> elementDependentsRecursive(int elementId) {
        return lookup(elementDependentsRecursive, elementId, "element");
    }

    public Set<Integer> elementDependentsRecursive(Collection<Integer> elementIds) {
        var dependents = new TreeSet<Integer>();
        elementIds.forEach(id -> dependents.addAll(elementDependentsRecursive(id)));
        return dependents;
    }

    public String toDotFormat() {
        var exporter = new DOTExporter<Integer, DefaultEdge>();
        exporter.setVertexAttributeProvider((v) -> {
            Map<String, Attribute> map = new LinkedHashMap<>();
            map.put("label", DefaultAttribute.createAttribute("element " + v));
            return map;
        });
        var writer = new StringWriter();
        exporter.exportGraph(elementGraph, writer);
        return writer.toString();
    }
}
