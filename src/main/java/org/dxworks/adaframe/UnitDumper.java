package org.dxworks.adaframe;

import org.dxworks.adaframe.ast.AnalysisUnit;
import org.dxworks.adaframe.ast.Fields;
import org.dxworks.adaframe.ast.Node;
import org.dxworks.adaframe.ast.Qualifiers;
import org.dxworks.adaframe.ast.Slot;
import org.dxworks.adaframe.ast.TextPrinter;
import org.dxworks.adaframe.model.Diagnostic;
import org.dxworks.adaframe.model.NodeDump;
import org.dxworks.adaframe.model.UnitDump;
import org.dxworks.adaframe.schema.Field;
import org.dxworks.adaframe.schema.NodeKind;

import java.util.ArrayList;
import java.util.LinkedHashMap;

/**
 * Converts analysis units into the Jackson-friendly {@link UnitDump} model.
 * Fields are walked through the typed accessors, so an empty optional field
 * shows up as a {@code null} entry.
 */
public final class UnitDumper {

    private UnitDumper() {
        // utility class
    }

    public static UnitDump dump(AnalysisUnit unit) {
        UnitDump result = new UnitDump();
        result.filePath = unit.getFilename();
        result.parsed = unit.isParsed();
        result.tokens = unit.getTokenCount();
        for (Diagnostic diagnostic : unit.getDiagnostics()) {
            result.diagnostics.add(diagnostic.toString());
        }
        Node root = unit.root();
        if (!root.isNull()) {
            result.root = dump(root);
        }
        return result;
    }

    public static NodeDump dump(Node node) {
        NodeKind kind = node.kind();
        NodeDump result = new NodeDump();
        result.kind = kind.kindName();
        result.range = node.sourceRange().toString();
        if (node.isGhost()) {
            result.ghost = true;
        }
        if (kind.isQualifier()) {
            result.value = Qualifiers.asBool(node);
        }
        switch (kind.shape()) {
            case TOKEN:
                result.text = TextPrinter.render(node.text(), false);
                break;
            case LIST:
                result.items = new ArrayList<>();
                for (Node item : node.children()) {
                    result.items.add(dump(item));
                }
                break;
            default:
                if (!kind.fields().isEmpty()) {
                    result.fields = new LinkedHashMap<>();
                    for (Field field : kind.fields()) {
                        Slot<Node> slot = Fields.get(node, field);
                        result.fields.put(field.fieldName(), slot.isPresent() ? dump(slot.get()) : null);
                    }
                }
                break;
        }
        return result;
    }
}
