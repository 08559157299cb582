package io.surfworks.graphforge.core.graph;

import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.logging.Logger;

/**
 * Copies a function into a new function of the same module.
 *
 * <p>Nodes are copied first with their original edges, then every edge whose
 * producer was a copied node is redirected to the copy. Edges to variables
 * are kept as they are: variables belong to the module and are shared, never
 * duplicated.
 */
final class GraphCloner {

    private static final Logger LOG = Logger.getLogger(GraphCloner.class.getName());

    private GraphCloner() {}

    /**
     * @param mapping null, or an empty map to receive old node to new node
     */
    static Function clone(Function source, String newName, Map<Node, Node> mapping) {
        if (mapping != null && !mapping.isEmpty()) {
            throw new GraphBuildException("The node mapping for cloning '%s' must be empty", source.name());
        }
        requireResolvableEdges(source);

        Module module = source.parent();
        Function copy = module.createFunction(newName);

        Map<Integer, Node> currToNew = new HashMap<>();
        Map<Node, Node> ordered = new LinkedHashMap<>();
        for (Node node : source.nodes()) {
            Node cloned = node.shallowCopy(module.allocateId());
            currToNew.put(node.id(), cloned);
            ordered.put(node, cloned);
            copy.addNode(cloned);
        }

        // The copies still read from the source function; point them at each other.
        for (Node node : copy.nodes()) {
            for (int i = 0; i < node.numInputs(); i++) {
                NodeValue input = node.nthInput(i);
                Node target = currToNew.get(input.producerId());
                if (target == null) {
                    continue;
                }
                node.setNthInput(i, new NodeValue(target.id(), input.resNo(), input.type()));
            }
        }

        if (mapping != null) {
            mapping.putAll(ordered);
        }
        if (copy.nodes().size() != source.nodes().size()) {
            throw new IllegalStateException("Clone of '" + source.name() + "' has " + copy.nodes().size()
                    + " nodes, expected " + source.nodes().size());
        }
        LOG.fine(() -> "Cloned '" + source.name() + "' into '" + newName + "' (" + copy.nodes().size() + " nodes)");
        return copy;
    }

    private static void requireResolvableEdges(Function source) {
        for (Node node : source.nodes()) {
            for (int i = 0; i < node.numInputs(); i++) {
                NodeValue input = node.nthInput(i);
                if (source.producerOf(input).isEmpty()) {
                    throw new GraphVerificationException(GraphVerifier.Rule.RESOLVED_EDGES,
                            List.of(node.name()),
                            "Could not find a mapping for input '" + node.inputName(i) + "' of '" + node.name()
                                    + "' while cloning '" + source.name() + "': producer #" + input.producerId()
                                    + " is neither a node of the function nor a variable of the module");
                }
            }
        }
    }
}
