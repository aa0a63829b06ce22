package org.dxworks.adaframe.schema;

import java.util.ArrayList;
import java.util.List;

/**
 * Consistency checks over the node kind registry and the field table.
 */
public final class Schema {

    private Schema() {
        // utility class
    }

    /**
     * @throws IllegalStateException listing every inconsistency found
     */
    public static void validate() {
        List<String> problems = problems();
        if (!problems.isEmpty()) {
            throw new IllegalStateException("Inconsistent node schema: " + String.join("; ", problems));
        }
    }

    static List<String> problems() {
        List<String> problems = new ArrayList<>();
        for (NodeKind kind : NodeKind.values()) {
            List<Field> fields = kind.fields();
            if (kind.shape() != NodeShape.FIELDS && !fields.isEmpty()) {
                problems.add(kind.kindName() + " is a " + kind.shape() + " kind but declares fields");
            }
            for (int i = 0; i < fields.size(); i++) {
                if (fields.get(i).index() != i) {
                    problems.add(kind.kindName() + "." + fields.get(i).fieldName()
                            + " has offset " + fields.get(i).index() + ", expected " + i);
                }
            }
            if (kind.isList() && kind.elementType() == null) {
                problems.add(kind.kindName() + " has no element type");
            }
            if (kind.isQualifier() && !kind.parent().isQualifier()) {
                problems.add(kind.kindName() + " is a qualifier outside a qualifier family");
            }
        }
        for (NodeFamily family : NodeFamily.values()) {
            if (!family.isQualifier()) continue;
            long present = countQualifierMembers(family, true);
            long absent = countQualifierMembers(family, false);
            if (present != 1 || absent != 1) {
                problems.add(family.kindName() + " needs exactly one present and one absent kind");
            }
        }
        return problems;
    }

    private static long countQualifierMembers(NodeFamily family, boolean value) {
        return NodeKind.membersOf(family).stream()
                .filter(k -> k.isQualifier() && k.qualifierValue() == value)
                .count();
    }
}
