package authz.modelgraph.cycle;

import java.util.List;

import org.junit.jupiter.api.Test;

import authz.modelgraph.TestModels;
import authz.modelgraph.graph.Graph;
import authz.modelgraph.graph.GraphBuilder;
import authz.modelgraph.model.AuthorizationModel;
import authz.modelgraph.model.RelatedTypeRef;
import authz.modelgraph.model.TypeDefinition;

import static authz.modelgraph.model.RewriteExpression.computed;
import static authz.modelgraph.model.RewriteExpression.direct;
import static authz.modelgraph.model.RewriteExpression.tupleset;
import static authz.modelgraph.model.RewriteExpression.union;
import static org.junit.jupiter.api.Assertions.*;

class CycleAnalyzerTest {

    private static final RelatedTypeRef USER = RelatedTypeRef.of("user");

    private final CycleAnalyzer analyzer = new CycleAnalyzer();

    private CycleReport classify(AuthorizationModel model) {
        final CycleReport report = analyzer.classify(new GraphBuilder(model).build());
        assertEquals(report.totalCycles(), report.definitiveCount() + report.possibleCount());
        assertEquals(report.totalCycles(), report.cycles().size());
        return report;
    }

    private static void assertCounts(CycleReport report, int definitive, int possible) {
        assertEquals(definitive, report.definitiveCount(), "definitive");
        assertEquals(possible, report.possibleCount(), "possible");
    }

    @Test
    void mutuallyComputedRelationsAreDefinitive() {
        final CycleReport report = classify(TestModels.mutualComputed());

        assertCounts(report, 1, 0);
        final Cycle cycle = report.cycles().get(0);
        assertEquals(List.of("resource#a", "resource#b"), cycle.labels());
        assertEquals("resource#a -> resource#b -> resource#a", cycle.describe());
        assertTrue(report.hasDefinitiveCycles());
    }

    @Test
    void loopThroughDirectAssignmentIsPossible() {
        final CycleReport report = classify(TestModels.editorViewerLoop());

        assertCounts(report, 0, 2);
        assertTrue(report.hasCycles());
        assertFalse(report.hasDefinitiveCycles());
        assertTrue(report.cycles().stream().anyMatch(c -> c.labels().equals(List.of("document#viewer"))));
        assertTrue(report.cycles().stream()
                .anyMatch(c -> c.labels().equals(List.of("document#editor", "document#viewer"))));
    }

    @Test
    void directAssignmentsAloneHaveNoCycles() {
        final CycleReport report = classify(TestModels.directOnly());

        assertEquals(0, report.totalCycles());
        assertFalse(report.hasCycles());
        assertTrue(report.cycles().isEmpty());
    }

    @Test
    void selfComputedRelationIsOneNodeCycle() {
        final CycleReport report = classify(TestModels.selfComputed());

        assertCounts(report, 1, 0);
        assertEquals(1, report.cycles().get(0).length());
        assertEquals(List.of("resource#x"), report.cycles().get(0).labels());
    }

    @Test
    void threeStepComputedChain() {
        final AuthorizationModel model = AuthorizationModel.of(TypeDefinition.of("resource")
                .withRelation("x", computed("y"))
                .withRelation("y", computed("z"))
                .withRelation("z", computed("x")));

        final CycleReport report = classify(model);

        assertCounts(report, 1, 0);
        assertEquals(3, report.cycles().get(0).length());
    }

    @Test
    void unionWithDirectBaseCaseIsStillDefinitive() {
        // x: [user] or y; y: [user] or z; z: [user] or x
        final AuthorizationModel model = AuthorizationModel.of(
                TypeDefinition.of("user"),
                TypeDefinition.of("resource")
                        .withRelation("x", union(direct(), computed("y")), USER)
                        .withRelation("y", union(direct(), computed("z")), USER)
                        .withRelation("z", union(direct(), computed("x")), USER));

        assertCounts(classify(model), 1, 0);
    }

    @Test
    void fullyConnectedComputedRelationsEnumerateEveryCycle() {
        // four relations, each "[user] or" the other three: 6 two-cycles, 8 three-cycles, 6 four-cycles
        final AuthorizationModel model = AuthorizationModel.of(
                TypeDefinition.of("user"),
                TypeDefinition.of("resource")
                        .withRelation("member", union(direct(), computed("memberA"), computed("memberB"), computed("memberC")), USER)
                        .withRelation("memberA", union(direct(), computed("member"), computed("memberB"), computed("memberC")), USER)
                        .withRelation("memberB", union(direct(), computed("member"), computed("memberA"), computed("memberC")), USER)
                        .withRelation("memberC", union(direct(), computed("member"), computed("memberA"), computed("memberB")), USER));

        final CycleReport report = classify(model);

        assertEquals(20, report.totalCycles());
        assertCounts(report, 20, 0);
        assertEquals(6, report.cycles().stream().filter(c -> c.length() == 2).count());
        assertEquals(8, report.cycles().stream().filter(c -> c.length() == 3).count());
        assertEquals(6, report.cycles().stream().filter(c -> c.length() == 4).count());
    }

    @Test
    void cyclesAcrossTypesAreCounted() {
        // canvas relations only feed from account; account admin/member/super_admin form a computed triangle
        final AuthorizationModel model = AuthorizationModel.of(
                TypeDefinition.of("user"),
                TypeDefinition.of("canvas")
                        .withRelation("can_edit", union(computed("editor"), computed("owner")))
                        .withRelation("editor", direct(), USER, RelatedTypeRef.userset("account", "member"))
                        .withRelation("owner", direct(), USER)
                        .withRelation("viewer", direct(), USER, RelatedTypeRef.userset("account", "member")),
                TypeDefinition.of("account")
                        .withRelation("admin", union(direct(), computed("member"), computed("super_admin"), computed("owner")), USER)
                        .withRelation("member", union(direct(), computed("owner"), computed("admin"), computed("super_admin")), USER)
                        .withRelation("owner", direct(), USER)
                        .withRelation("super_admin", union(direct(), computed("admin"), computed("member")), USER));

        final CycleReport report = classify(model);

        assertCounts(report, 5, 0);
        assertTrue(report.cycles().stream().allMatch(c -> c.labels().stream().allMatch(l -> l.startsWith("account#"))));
    }

    @Test
    void directSelfReferenceIsPossible() {
        // editor: [user]; viewer: [document#viewer] or editor
        final AuthorizationModel model = AuthorizationModel.of(
                TypeDefinition.of("user"),
                TypeDefinition.of("document")
                        .withRelation("editor", direct(), USER)
                        .withRelation("viewer", union(direct(), computed("editor")),
                                RelatedTypeRef.userset("document", "viewer")));

        final CycleReport report = classify(model);

        assertCounts(report, 0, 1);
        assertEquals(CycleKind.POSSIBLE, report.cycles().get(0).kind());
    }

    @Test
    void intersectionAndDifferenceComputedOperandsCloseDefinitiveCycles() {
        assertCounts(classify(TestModels.intersectionAndUnion()), 1, 0);
        assertCounts(classify(TestModels.exclusionAndUnion()), 1, 0);
    }

    @Test
    void recursiveParentTuplesetIsPossible() {
        final CycleReport report = classify(TestModels.recursiveParent());

        assertCounts(report, 0, 1);
        assertEquals(List.of("folder#viewer"), report.possibleCycles().get(0).labels());
    }

    @Test
    void parallelComputedEdgeMakesTheStepComputed() {
        // viewer: editor or editor from parent; editor: viewer
        final AuthorizationModel model = AuthorizationModel.of(TypeDefinition.of("folder")
                .withRelation("parent", direct(), RelatedTypeRef.of("folder"))
                .withRelation("editor", computed("viewer"))
                .withRelation("viewer", union(computed("editor"), tupleset("parent", "editor"))));

        final Graph graph = new GraphBuilder(model).build();
        final int editor = graph.nodeId("folder#editor").orElseThrow();
        final int viewer = graph.nodeId("folder#viewer").orElseThrow();
        assertEquals(2, graph.edgesBetween(editor, viewer).size());

        final CycleReport report = analyzer.classify(graph);

        assertCounts(report, 1, 0);
    }

    @Test
    void analysisIgnoresPruning() {
        final Graph graph = new GraphBuilder(TestModels.editorViewerLoop()).build();

        final CycleReport full = analyzer.classify(graph);
        final CycleReport pruned = analyzer.classify(graph.withoutIsolatedNodes());

        assertEquals(full.totalCycles(), pruned.totalCycles());
        assertEquals(full.definitiveCount(), pruned.definitiveCount());
        assertEquals(full.cycles(), pruned.cycles());
    }

    @Test
    void reportRejectsInconsistentCounts() {
        assertThrows(IllegalArgumentException.class, () -> new CycleReport(2, 1, 0, List.of()));
    }
}
