package com.abhikarta.orchestrator.graph;

import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for Graph and Node state handling. Pure in-memory, no mocks.
 */
class GraphTest {

    private static Graph chain() {
        return new Graph("g", "chain", null)
                .addNode(Node.agent("a", "echo_agent", Map.of()))
                .addNode(Node.agent("b", "echo_agent", Map.of()))
                .addNode(Node.agent("c", "echo_agent", Map.of()))
                .addEdge("a", "b")
                .addEdge("b", "c");
    }

    // ------------------------------------------------------------------
    // Construction
    // ------------------------------------------------------------------

    @Test
    void addNode_duplicateId_throws() {
        Graph graph = new Graph("g", null, null).addNode(Node.agent("a", "x", Map.of()));

        assertThatThrownBy(() -> graph.addNode(Node.tool("a", "y", Map.of())))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("Duplicate node id 'a'");
    }

    @Test
    void addEdge_unknownNode_throws() {
        Graph graph = new Graph("g", null, null).addNode(Node.agent("a", "x", Map.of()));

        assertThatThrownBy(() -> graph.addEdge("a", "missing"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("unknown node");
    }

    @Test
    void addEdge_closingCycle_throws() {
        Graph graph = chain();

        assertThatThrownBy(() -> graph.addEdge("c", "a"))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("cycle");
        assertThatThrownBy(() -> graph.addEdge("a", "a"))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void addEdge_twice_recordsOneEdge() {
        Graph graph = chain().addEdge("a", "b");

        assertThat(graph.edges()).hasSize(2);
        assertThat(graph.getNode("b").orElseThrow().getDependencies()).containsExactly("a");
    }

    @Test
    void startNodes_areNodesWithoutDependencies() {
        Graph graph = chain().addNode(Node.tool("d", "word_count", Map.of()));

        assertThat(graph.startNodes()).extracting(Node::getNodeId).containsExactly("a", "d");
    }

    // ------------------------------------------------------------------
    // Ready set
    // ------------------------------------------------------------------

    @Test
    void getReadyNodes_onlyPendingNodesWithSatisfiedDependencies() {
        Graph graph = chain();

        assertThat(graph.getReadyNodes(Set.of())).extracting(Node::getNodeId).containsExactly("a");
        assertThat(graph.getReadyNodes(Set.of("a"))).extracting(Node::getNodeId).containsExactly("a", "b");

        Node a = graph.getNode("a").orElseThrow();
        a.markRunning();
        a.complete(Map.of("ok", true));
        assertThat(graph.getReadyNodes(graph.satisfiedIds())).extracting(Node::getNodeId).containsExactly("b");
    }

    @Test
    void skippedNodes_satisfyDependents() {
        Graph graph = chain();
        graph.getNode("a").orElseThrow().skip("branch not taken", false);

        assertThat(graph.satisfiedIds()).containsExactly("a");
        assertThat(graph.getReadyNodes(graph.satisfiedIds())).extracting(Node::getNodeId).containsExactly("b");
    }

    // ------------------------------------------------------------------
    // Failure propagation
    // ------------------------------------------------------------------

    @Test
    void propagateFailures_skipsWholeChainBelowFailedNode() {
        Graph graph = chain();
        Node a = graph.getNode("a").orElseThrow();
        a.markRunning();
        a.fail("boom");

        List<Node> skipped = graph.propagateFailures();

        assertThat(skipped).extracting(Node::getNodeId).containsExactlyInAnyOrder("b", "c");
        assertThat(skipped).allMatch(Node::isUpstreamFailed);
        assertThat(graph.isTerminal()).isTrue();
        assertThat(graph.propagateFailures()).isEmpty();
    }

    @Test
    void propagateFailures_leavesUnrelatedBranchAlone() {
        Graph graph = chain().addNode(Node.tool("d", "word_count", Map.of()));
        Node a = graph.getNode("a").orElseThrow();
        a.markRunning();
        a.fail("boom");

        graph.propagateFailures();

        assertThat(graph.getNode("d").orElseThrow().getStatus()).isEqualTo(NodeStatus.PENDING);
        assertThat(graph.isTerminal()).isFalse();
    }

    @Test
    void conditionalSkip_doesNotPropagate() {
        Graph graph = chain();
        graph.getNode("a").orElseThrow().skip("branch not taken", false);

        assertThat(graph.propagateFailures()).isEmpty();
    }

    // ------------------------------------------------------------------
    // Node transitions
    // ------------------------------------------------------------------

    @Test
    void node_cannotStartTwice() {
        Node node = Node.agent("a", "echo_agent", Map.of());
        node.markRunning();

        assertThatThrownBy(node::markRunning).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void humanNode_waitsThenCompletes() {
        Node node = Node.humanInLoop("h", null);
        node.awaitHuman();
        node.complete(Map.of("approved", true));

        assertThat(node.getStatus()).isEqualTo(NodeStatus.COMPLETED);
        assertThat(node.getMessage()).isEqualTo("Approval required");
    }

    @Test
    void agentNode_cannotAwaitHuman() {
        Node node = Node.agent("a", "echo_agent", Map.of());

        assertThatThrownBy(node::awaitHuman).isInstanceOf(IllegalStateException.class);
    }

    @Test
    void resetAll_returnsEveryNodeToPending() {
        Graph graph = chain();
        Node a = graph.getNode("a").orElseThrow();
        a.markRunning();
        a.complete(Map.of());

        graph.resetAll();

        assertThat(graph.nodesIn(NodeStatus.PENDING)).hasSize(3);
        assertThat(a.getResult()).isNull();
    }

    @Test
    void snapshot_carriesStructureAndStatus() {
        Graph graph = chain();
        Node a = graph.getNode("a").orElseThrow();
        a.markRunning();
        a.fail("boom");

        GraphSnapshot snapshot = graph.snapshot();

        assertThat(snapshot.graphId()).isEqualTo("g");
        assertThat(snapshot.edges()).containsExactly(new Graph.Edge("a", "b"), new Graph.Edge("b", "c"));
        assertThat(snapshot.startNodes()).containsExactly("a");
        assertThat(snapshot.nodes().get(0).status()).isEqualTo("FAILED");
        assertThat(snapshot.nodes().get(0).error()).isEqualTo("boom");
    }
}
