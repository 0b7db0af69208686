package com.pagemodel.generator.expression.ast;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Base class for nodes of the conservative expression/statement subset understood by
 * {@link com.pagemodel.generator.expression.ExpressionParser}.
 */
public abstract class JsNode {

    /**
     * Direct child nodes in source order. Absent optional children are omitted.
     */
    public abstract List<JsNode> children();

    protected static List<JsNode> childrenOf(Object... parts) {
        List<JsNode> out = new ArrayList<>();
        for (Object part : parts) {
            if (part instanceof JsNode node) {
                out.add(node);
            } else if (part instanceof List<?> list) {
                for (Object item : list) {
                    if (item instanceof JsNode node) {
                        out.add(node);
                    }
                }
            }
        }
        return Collections.unmodifiableList(out);
    }
}
