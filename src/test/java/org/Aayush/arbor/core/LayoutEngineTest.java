package org.Aayush.arbor.core;

import org.Aayush.arbor.model.LayoutConfig;
import org.Aayush.arbor.model.LayoutDirection;
import org.Aayush.arbor.model.LayoutEdge;
import org.Aayush.arbor.model.LayoutNode;
import org.Aayush.arbor.model.LayoutResult;
import org.Aayush.arbor.model.LayoutTelemetry;
import org.Aayush.arbor.model.PositionedNode;
import org.Aayush.arbor.strategy.LayoutStrategyRegistry;
import org.Aayush.arbor.strategy.Placement;
import org.Aayush.arbor.strategy.TreeLayoutStrategy;
import org.Aayush.arbor.testutil.TreeFixtures;
import org.Aayush.arbor.tree.LayoutTree;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;

import static org.Aayush.arbor.testutil.TreeFixtures.EPS;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertInstanceOf;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@DisplayName("LayoutEngine Tests")
class LayoutEngineTest {
    private static final LayoutConfig CONFIG = LayoutConfig.defaults();

    @ParameterizedTest
    @ValueSource(strings = {
            LayoutStrategyRegistry.STRATEGY_HIERARCHICAL,
            LayoutStrategyRegistry.STRATEGY_REINGOLD_TILFORD,
            LayoutStrategyRegistry.STRATEGY_ENHANCED_TREE
    })
    @DisplayName("Single node is the root at the origin")
    void testSingleNode(String strategy) {
        LayoutResult result = LayoutEngine.create(strategy, CONFIG)
                .layout(List.of(LayoutNode.of("only")), List.of());

        assertEquals(1, result.getNodes().size());
        PositionedNode node = result.getNodes().get(0);
        assertEquals(0.0d, node.getX(), EPS);
        assertEquals(0.0d, node.getY(), EPS);
        assertEquals(0, node.getLevel());
        assertTrue(node.isRoot());
        assertEquals(0, node.getData().get(PositionedNode.DATA_LEVEL));
        assertEquals(Boolean.TRUE, node.getData().get(PositionedNode.DATA_IS_ROOT));
        assertEquals("TB", node.getData().get(PositionedNode.DATA_LAYOUT_DIRECTION));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            LayoutStrategyRegistry.STRATEGY_HIERARCHICAL,
            LayoutStrategyRegistry.STRATEGY_REINGOLD_TILFORD,
            LayoutStrategyRegistry.STRATEGY_ENHANCED_TREE
    })
    @DisplayName("Chain shares one cross-axis coordinate and steps one level per node")
    void testChain(String strategy) {
        TreeFixtures.Input input = TreeFixtures.tree("A>B", "B>C");
        LayoutResult result = LayoutEngine.create(strategy, CONFIG).layout(input.nodes(), input.edges());

        double x = result.node("A").getX();
        assertEquals(x, result.node("B").getX(), EPS);
        assertEquals(x, result.node("C").getX(), EPS);
        assertEquals(0.0d, result.node("A").getY(), EPS);
        assertEquals(CONFIG.levelStep(), result.node("B").getY(), EPS);
        assertEquals(2.0d * CONFIG.levelStep(), result.node("C").getY(), EPS);
    }

    @Test
    @DisplayName("Empty input returns an empty result")
    void testEmptyInput() {
        LayoutResult result = LayoutEngine.create(LayoutStrategyRegistry.STRATEGY_REINGOLD_TILFORD, CONFIG)
                .layout(List.of(), List.of());

        assertTrue(result.getNodes().isEmpty());
        assertTrue(result.getEdges().isEmpty());
        assertEquals(-1, result.getTelemetry().getMaxLevel());
        assertNull(result.getTelemetry().getRootId());
    }

    @Test
    @DisplayName("Payload is preserved and layout fields are merged in")
    void testPayloadMerge() {
        LayoutNode deploy = LayoutNode.builder()
                .id("deploy")
                .type("resource")
                .dataEntry("kind", "Deployment")
                .dataEntry("replicas", 3)
                .build();
        LayoutResult result = LayoutEngine.create(LayoutStrategyRegistry.STRATEGY_ENHANCED_TREE, LayoutConfig.leftToRight())
                .layout(List.of(deploy, LayoutNode.of("rs")), List.of(LayoutEdge.of("deploy", "rs")));

        PositionedNode node = result.node("deploy");
        assertEquals("resource", node.getType());
        Map<String, Object> data = node.getData();
        assertEquals("Deployment", data.get("kind"));
        assertEquals(3, data.get("replicas"));
        assertEquals("LR", data.get(PositionedNode.DATA_LAYOUT_DIRECTION));
        assertFalse(result.node("rs").isRoot());
        assertEquals(1, result.node("rs").getData().get(PositionedNode.DATA_LEVEL));
        assertThrows(UnsupportedOperationException.class, () -> node.getData().put("x", 1));
    }

    @Test
    @DisplayName("Unknown strategy falls back to hierarchical and says so in telemetry")
    void testUnknownStrategyFallback() {
        LayoutEngine engine = LayoutEngine.create("Radial", CONFIG);
        TreeFixtures.Input input = TreeFixtures.tree("A>B");
        LayoutTelemetry telemetry = engine.layout(input.nodes(), input.edges()).getTelemetry();

        assertTrue(engine.fallbackApplied());
        assertEquals(LayoutStrategyRegistry.STRATEGY_HIERARCHICAL, engine.strategyId());
        assertEquals("Radial", telemetry.getRequestedStrategyId());
        assertEquals(LayoutStrategyRegistry.STRATEGY_HIERARCHICAL, telemetry.getStrategyId());
        assertTrue(telemetry.isFallbackApplied());
    }

    @Test
    @DisplayName("Blank and null strategy names fall back too")
    void testBlankStrategyFallback() {
        assertTrue(LayoutEngine.create("  ", CONFIG).fallbackApplied());
        assertTrue(LayoutEngine.create(null, CONFIG).fallbackApplied());
        LayoutEngine engine = LayoutEngine.create(" ENHANCED-tree ", CONFIG);
        assertFalse(engine.fallbackApplied());
        assertEquals(LayoutStrategyRegistry.STRATEGY_ENHANCED_TREE, engine.strategyId());
    }

    @Test
    @DisplayName("Telemetry counts dropped edges and unreachable nodes")
    void testTelemetryCounts() {
        List<LayoutNode> nodes = TreeFixtures.nodes("R", "A", "B", "X");
        List<LayoutEdge> edges = List.of(
                LayoutEdge.of("R", "A"),
                LayoutEdge.of("A", "B"),
                LayoutEdge.of("A", "ghost")
        );
        LayoutResult result = LayoutEngine.create(LayoutStrategyRegistry.STRATEGY_REINGOLD_TILFORD, CONFIG)
                .layout(nodes, edges);
        LayoutTelemetry telemetry = result.getTelemetry();

        assertEquals(4, telemetry.getNodeCount());
        assertEquals(3, telemetry.getEdgeCount());
        assertEquals(1, telemetry.getDroppedEdgeCount());
        assertEquals(1, telemetry.getUnreachableNodeCount());
        assertEquals(2, telemetry.getMaxLevel());
        assertEquals("R", telemetry.getRootId());
        assertEquals(3, result.getEdges().size());

        PositionedNode orphan = result.node("X");
        assertEquals(0, orphan.getLevel());
        assertFalse(orphan.isRoot());
        assertEquals(0.0d, orphan.getX(), EPS);
        assertEquals(0.0d, orphan.getY(), EPS);
    }

    @Test
    @DisplayName("Equal inputs produce equal results")
    void testDeterminism() {
        TreeFixtures.Input input = TreeFixtures.randomTree(200, 99L);
        LayoutEngine engine = LayoutEngine.create(LayoutStrategyRegistry.STRATEGY_REINGOLD_TILFORD, CONFIG);

        assertEquals(engine.layout(input.nodes(), input.edges()), engine.layout(input.nodes(), input.edges()));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            LayoutStrategyRegistry.STRATEGY_HIERARCHICAL,
            LayoutStrategyRegistry.STRATEGY_REINGOLD_TILFORD,
            LayoutStrategyRegistry.STRATEGY_ENHANCED_TREE
    })
    @DisplayName("Left-to-right is the top-to-bottom layout with axes swapped")
    void testDirectionSymmetry(String strategy) {
        TreeFixtures.Input input = TreeFixtures.randomTree(50, 17L);
        LayoutResult tb = LayoutEngine.create(strategy, LayoutConfig.topToBottom()).layout(input.nodes(), input.edges());
        LayoutResult lr = LayoutEngine.create(strategy, LayoutConfig.leftToRight()).layout(input.nodes(), input.edges());

        for (int i = 0; i < tb.getNodes().size(); i++) {
            PositionedNode down = tb.getNodes().get(i);
            PositionedNode across = lr.getNodes().get(i);
            assertEquals(down.getX(), across.getY(), EPS);
            assertEquals(down.getY(), across.getX(), EPS);
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {
            LayoutStrategyRegistry.STRATEGY_HIERARCHICAL,
            LayoutStrategyRegistry.STRATEGY_REINGOLD_TILFORD,
            LayoutStrategyRegistry.STRATEGY_ENHANCED_TREE
    })
    @DisplayName("Every edge connects consecutive levels")
    void testEdgeLevels(String strategy) {
        TreeFixtures.Input input = TreeFixtures.caterpillar(5, 2);
        LayoutResult result = LayoutEngine.create(strategy, CONFIG).layout(input.nodes(), input.edges());
        TreeFixtures.assertEdgeLevels(result, input.edges());
    }

    @Test
    @DisplayName("Duplicate ids keep input count and share one placement")
    void testDuplicateIds() {
        List<LayoutNode> nodes = TreeFixtures.nodes("A", "B", "A");
        LayoutResult result = LayoutEngine.create(LayoutStrategyRegistry.STRATEGY_REINGOLD_TILFORD, CONFIG)
                .layout(nodes, List.of(LayoutEdge.of("A", "B")));

        assertEquals(3, result.getNodes().size());
        assertEquals("A", result.getNodes().get(2).getId());
        assertEquals(result.getNodes().get(0).getX(), result.getNodes().get(2).getX(), EPS);
        assertEquals(3, result.getTelemetry().getNodeCount());
        assertEquals(0, result.getTelemetry().getUnreachableNodeCount());
    }

    @Test
    @DisplayName("Null edge list is treated as empty")
    void testNullEdgeList() {
        LayoutResult result = LayoutEngine.create(LayoutStrategyRegistry.STRATEGY_HIERARCHICAL, CONFIG)
                .layout(TreeFixtures.nodes("A", "B"), null);

        assertTrue(result.getEdges().isEmpty());
        assertTrue(result.node("A").isRoot());
        assertEquals(1, result.getTelemetry().getUnreachableNodeCount());
    }

    @Test
    @DisplayName("Invalid configs are rejected with reason codes")
    void testConfigValidation() {
        LayoutException missing = assertThrows(LayoutException.class, () -> LayoutEngine.create("hierarchical", null));
        assertEquals(LayoutEngine.REASON_CONFIG_REQUIRED, missing.getReasonCode());

        LayoutException negative = assertThrows(
                LayoutException.class,
                () -> LayoutEngine.create("hierarchical", CONFIG.toBuilder().nodeWidth(-1.0d).build())
        );
        assertEquals(LayoutEngine.REASON_INVALID_CONFIG, negative.getReasonCode());
        assertTrue(negative.getMessage().contains("nodeWidth"));

        LayoutException nan = assertThrows(
                LayoutException.class,
                () -> LayoutEngine.create("hierarchical", CONFIG.toBuilder().verticalSpacing(Double.NaN).build())
        );
        assertEquals(LayoutEngine.REASON_INVALID_CONFIG, nan.getReasonCode());

        LayoutException direction = assertThrows(
                LayoutException.class,
                () -> LayoutEngine.create("hierarchical", CONFIG.toBuilder().direction(null).build())
        );
        assertEquals(LayoutEngine.REASON_INVALID_CONFIG, direction.getReasonCode());
    }

    @Test
    @DisplayName("Zero spacing is accepted")
    void testZeroSpacing() {
        LayoutConfig tight = LayoutConfig.builder()
                .horizontalSpacing(0.0d)
                .verticalSpacing(0.0d)
                .direction(LayoutDirection.TOP_TO_BOTTOM)
                .build();
        TreeFixtures.Input input = TreeFixtures.tree("A>B", "A>C");
        LayoutResult result = LayoutEngine.create(LayoutStrategyRegistry.STRATEGY_REINGOLD_TILFORD, tight)
                .layout(input.nodes(), input.edges());

        assertEquals(280.0d, result.node("C").getX() - result.node("B").getX(), EPS);
        assertEquals(140.0d, result.node("B").getY(), EPS);
    }

    @Test
    @DisplayName("Custom strategy with a short placement violates the contract")
    void testShortPlacementRejected() {
        TreeLayoutStrategy broken = new TreeLayoutStrategy() {
            @Override
            public String id() {
                return "broken";
            }

            @Override
            public Placement place(LayoutTree tree, LayoutConfig config) {
                return new Placement(new double[0], new double[0]);
            }
        };
        LayoutEngine engine = LayoutEngine.builder()
                .strategyName("broken")
                .config(CONFIG)
                .strategyRegistry(new LayoutStrategyRegistry(List.of(broken)))
                .build();

        LayoutException ex = assertThrows(
                LayoutException.class,
                () -> engine.layout(TreeFixtures.nodes("A"), List.of())
        );
        assertEquals(LayoutEngine.REASON_STRATEGY_CONTRACT, ex.getReasonCode());
    }

    @Test
    @DisplayName("Custom strategy failures are wrapped with their cause")
    void testFailingStrategyWrapped() {
        TreeLayoutStrategy failing = new TreeLayoutStrategy() {
            @Override
            public String id() {
                return "failing";
            }

            @Override
            public Placement place(LayoutTree tree, LayoutConfig config) {
                throw new IllegalStateException("boom");
            }
        };
        LayoutEngine engine = LayoutEngine.builder()
                .strategyName("failing")
                .config(CONFIG)
                .strategyRegistry(new LayoutStrategyRegistry(List.of(failing)))
                .build();

        LayoutException ex = assertThrows(
                LayoutException.class,
                () -> engine.layout(TreeFixtures.nodes("A"), List.of())
        );
        assertEquals(LayoutEngine.REASON_STRATEGY_CONTRACT, ex.getReasonCode());
        assertInstanceOf(IllegalStateException.class, ex.getCause());
    }

    @Test
    @DisplayName("Null node list and null elements raise reason-coded errors")
    void testNodeContract() {
        LayoutEngine engine = LayoutEngine.create(LayoutStrategyRegistry.STRATEGY_ENHANCED_TREE, CONFIG);
        LayoutException ex = assertThrows(LayoutException.class, () -> engine.layout(null, List.of()));
        assertEquals(LayoutEngine.REASON_NODES_REQUIRED, ex.getReasonCode());
        assertTrue(ex.getMessage().startsWith("[ARBOR_NODES_REQUIRED]"));
    }

    @Test
    @DisplayName("One engine shared across threads yields identical results")
    void testSharedEngineAcrossThreads() throws Exception {
        LayoutEngine engine = LayoutEngine.create(LayoutStrategyRegistry.STRATEGY_ENHANCED_TREE, CONFIG);
        TreeFixtures.Input input = TreeFixtures.randomTree(300, 4242L);
        LayoutResult expected = engine.layout(input.nodes(), input.edges());

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<LayoutResult>> futures = new ArrayList<>();
            for (int i = 0; i < 16; i++) {
                futures.add(executor.submit(() -> engine.layout(input.nodes(), input.edges())));
            }
            for (Future<LayoutResult> future : futures) {
                assertEquals(expected, future.get(10, TimeUnit.SECONDS));
            }
        } finally {
            executor.shutdownNow();
        }
    }
}
