package org.pyoptimizer.astnode;

import org.pyoptimizer.astvisitor.Visitor;

import java.util.ArrayList;
import java.util.List;

/**
 * The DictLiteralNode class represents a dict display.
 * <p>
 * {@code keys} and {@code values} have the same size. A null key marks a
 * {@code **mapping} entry, whose mapping is the corresponding value.
 */
public class DictLiteralNode extends AbstractNode {
    public final List<Node> keys;
    public final List<Node> values;

    public DictLiteralNode(List<Node> keys, List<Node> values) {
        this.keys = keys;
        this.values = values;
    }

    @Override
    public List<Node> children() {
        List<Object> parts = new ArrayList<>();
        for (int i = 0; i < values.size(); i++) {
            parts.add(keys.get(i));
            parts.add(values.get(i));
        }
        return childList(parts);
    }

    @Override
    public void accept(Visitor visitor) {
        visitor.visit(this);
    }
}
