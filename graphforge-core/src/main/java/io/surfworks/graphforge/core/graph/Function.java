package io.surfworks.graphforge.core.graph;

import com.google.gson.JsonArray;
import com.google.gson.JsonObject;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.logging.Logger;

/**
 * One computation graph: an ordered list of nodes owned by this function,
 * whose edges point at other nodes of the function or at variables of the
 * parent {@link Module}.
 *
 * <p>Nodes are normally added through {@link #builder()}, which infers result
 * types before appending.
 */
public final class Function {

    private static final Logger LOG = Logger.getLogger(Function.class.getName());

    private final Module parent;
    private final String name;
    private final List<Node> nodes = new ArrayList<>();
    private final Map<Integer, Node> nodesById = new HashMap<>();
    private final NodeBuilder builder;

    Function(Module parent, String name) {
        this.parent = parent;
        this.name = name;
        this.builder = new NodeBuilder(this);
    }

    public String name() {
        return name;
    }

    public Module parent() {
        return parent;
    }

    public NodeBuilder builder() {
        return builder;
    }

    /**
     * Nodes in insertion order. Variables are not included; see
     * {@link Module#variables()}.
     */
    public List<Node> nodes() {
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Appends a node, giving it a module-unique name derived from its
     * current one. Ownership passes to this function.
     */
    public Node addNode(Node node) {
        Objects.requireNonNull(node, "node");
        node.setName(parent.uniqueName(node.name()));
        nodes.add(node);
        nodesById.put(node.id(), node);
        LOG.finer(() -> "Added " + node + " to '" + name + "'");
        return node;
    }

    /**
     * Erases a node, or delegates to {@link Module#eraseVariable} when given a
     * variable.
     *
     * <p>Other nodes still reading the erased node are not rewired; their
     * edges stop resolving and {@link #verify()} reports them.
     *
     * @throws GraphBuildException if the node does not belong to this function
     */
    public void eraseNode(ValueProducer producer) {
        if (producer instanceof Variable variable) {
            parent.eraseVariable(variable);
            return;
        }
        Node node = (Node) producer;
        int idx = nodes.indexOf(node);
        if (idx < 0) {
            throw new GraphBuildException("Could not find node '%s' to delete in function '%s'", node.name(), name);
        }
        eraseNode(idx);
    }

    /**
     * Erases the node at {@code position} in {@link #nodes()}.
     */
    public void eraseNode(int position) {
        Node node = nodes.remove(position);
        if (!nodes.contains(node) && nodesById.get(node.id()) == node) {
            nodesById.remove(node.id());
        }
        LOG.finer(() -> "Erased " + node + " from '" + name + "'");
    }

    public Optional<Node> getNodeByName(String nodeName) {
        for (Node node : nodes) {
            if (node.name().equals(nodeName)) {
                return Optional.of(node);
            }
        }
        return Optional.empty();
    }

    public boolean contains(Node node) {
        return nodesById.get(node.id()) == node;
    }

    /**
     * Resolves the producer of an edge: a node of this function or a variable
     * of the parent module. Empty when the edge dangles.
     */
    public Optional<ValueProducer> producerOf(NodeValue value) {
        Node node = nodesById.get(value.producerId());
        if (node != null) {
            return Optional.of(node);
        }
        return parent.variable(value.producerId()).map(v -> v);
    }

    /**
     * Nodes with at least one input reading {@code value}.
     */
    public List<Node> usersOf(NodeValue value) {
        List<Node> users = new ArrayList<>();
        for (Node node : nodes) {
            for (NodeValue input : node.inputs()) {
                if (input.sameEndpoint(value)) {
                    users.add(node);
                    break;
                }
            }
        }
        return users;
    }

    /**
     * Redirects every input reading {@code from} to read {@code to}.
     *
     * @return the number of edges changed
     * @throws GraphBuildException if the two values have different types
     */
    public int replaceAllUsesOfWith(NodeValue from, NodeValue to) {
        if (from.type() != to.type()) {
            throw new GraphBuildException("Cannot replace %s with %s: types differ", from, to);
        }
        int replaced = 0;
        for (Node node : nodes) {
            for (int i = 0; i < node.numInputs(); i++) {
                if (node.nthInput(i).sameEndpoint(from)) {
                    node.setNthInput(i, to);
                    replaced++;
                }
            }
        }
        return replaced;
    }

    /**
     * Clones this function into a new function of the same module.
     *
     * @see GraphCloner
     */
    public Function clone(String newName) {
        return GraphCloner.clone(this, newName, null);
    }

    /**
     * Clones this function and records which new node each old node became.
     *
     * @param mapping must be empty; filled with old node to new node
     */
    public Function clone(String newName, Map<Node, Node> mapping) {
        return GraphCloner.clone(this, newName, Objects.requireNonNull(mapping, "mapping"));
    }

    /**
     * Checks the structural invariants of this function against its module.
     *
     * @throws GraphVerificationException on the first violation found
     */
    public void verify() {
        GraphVerifier.verify(this);
    }

    void clear() {
        nodes.clear();
        nodesById.clear();
    }

    /**
     * JSON description of this function's nodes, in order.
     */
    public String dump() {
        JsonObject obj = new JsonObject();
        obj.addProperty("function", name);
        JsonArray arr = new JsonArray();
        for (Node node : nodes) {
            arr.add(node.toJson());
        }
        obj.add("nodes", arr);
        return GraphJson.render(obj);
    }

    @Override
    public String toString() {
        return "Function[" + name + ", nodes=" + nodes.size() + "]";
    }
}
