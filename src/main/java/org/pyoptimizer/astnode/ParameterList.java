package org.pyoptimizer.astnode;

import java.util.ArrayList;
import java.util.List;

/**
 * Parameters of a {@code def} or a {@code lambda}, in declaration order.
 */
public class ParameterList {
    public final List<Parameter> parameters;

    public ParameterList(List<Parameter> parameters) {
        this.parameters = parameters;
    }

    public static ParameterList empty() {
        return new ParameterList(new ArrayList<>());
    }

    /**
     * Names bound by the parameter list when the function is called.
     */
    public List<String> boundNames() {
        List<String> names = new ArrayList<>();
        for (Parameter parameter : parameters) {
            if (parameter.name() != null) {
                names.add(parameter.name());
            }
        }
        return names;
    }

    /**
     * Annotation and default expressions, in source order.
     */
    public List<Node> nodes() {
        List<Node> nodes = new ArrayList<>();
        for (Parameter parameter : parameters) {
            if (parameter.annotation() != null) {
                nodes.add(parameter.annotation());
            }
            if (parameter.defaultValue() != null) {
                nodes.add(parameter.defaultValue());
            }
        }
        return nodes;
    }
}
