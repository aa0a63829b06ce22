package org.dxworks.adaframe.ast;

import org.dxworks.adaframe.schema.Field;
import org.dxworks.adaframe.schema.NodeKind;
import org.dxworks.adaframe.schema.NodeShape;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertTrue;

/**
 * Checks every field against every node of the sample units.
 */
public class FieldSweepTest {

    private AnalysisContext context;

    @BeforeEach
    void setUp() {
        context = AnalysisContext.create();
    }

    @AfterEach
    void tearDown() {
        context.destroy();
    }

    @ParameterizedTest
    @ValueSource(strings = {"foo.adb", "counters.ads", "tabs.adb"})
    void everyFieldOnEveryNode(String sample) {
        Node root = context.getUnitFromFile(Paths.get("src/test/resources/samples/ada", sample)).rootOrThrow();
        List<Node> nodes = new ArrayList<>();
        root.traverse(node -> {
            nodes.add(node);
            return VisitStatus.INTO;
        });
        assertTrue(nodes.size() > 1);

        for (Node node : nodes) {
            NodeKind kind = node.kind();
            for (Field field : Field.values()) {
                Slot<Node> slot = Fields.get(node, field);
                String where = field + " on " + node;
                assertEquals(field.isApplicableTo(kind), slot.isAvailable(), where);

                Node[] out = {Node.NULL};
                boolean[] called = {false};
                Node previous = out[0];
                boolean written = slot.into(value -> {
                    called[0] = true;
                    out[0] = value;
                });
                assertEquals(slot.isAvailable(), written, where);
                assertEquals(slot.isAvailable(), called[0], where);
                if (!slot.isAvailable()) {
                    assertSame(previous, out[0], where);
                    assertEquals(SlotError.FIELD_NOT_APPLICABLE, slot.error().get(), where);
                    continue;
                }
                if (!field.isOptional()) {
                    assertFalse(slot.isEmpty(), where);
                }
                if (slot.isPresent()) {
                    assertTrue(slot.get().kind().isA(field.valueType()), where);
                    assertEquals(node, slot.get().parent(), where);
                }
            }
        }
    }

    @ParameterizedTest
    @ValueSource(strings = {"foo.adb", "counters.ads", "tabs.adb"})
    void childAtInRangeAlwaysSucceeds(String sample) {
        Node root = context.getUnitFromFile(Paths.get("src/test/resources/samples/ada", sample)).rootOrThrow();
        root.traverse(node -> {
            NodeKind kind = node.kind();
            int count = node.childCount();
            if (kind.shape() == NodeShape.FIELDS) {
                assertEquals(kind.arity(), count, node.toString());
            } else if (kind.shape() == NodeShape.TOKEN) {
                assertEquals(0, count, node.toString());
            }
            for (int i = 0; i < count; i++) {
                Slot<Node> child = node.childAt(i);
                assertTrue(child.isAvailable(), node + " child " + i);
                if (child.isPresent()) {
                    assertEquals(node, child.get().parent());
                } else {
                    assertTrue(kind.fields().get(i).isOptional(), node + " child " + i);
                }
            }
            assertEquals(SlotError.INDEX_OUT_OF_RANGE, node.childAt(count).error().get());
            assertEquals(SlotError.INDEX_OUT_OF_RANGE, node.childAt(-1).error().get());
            return VisitStatus.INTO;
        });
    }
}
