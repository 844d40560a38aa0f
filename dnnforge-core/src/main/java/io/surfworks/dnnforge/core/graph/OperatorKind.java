package io.surfworks.dnnforge.core.graph;

/**
 * Tag identifying what an operator computes. Rewrite rules dispatch on the tag.
 *
 * @param namespace the operator family ("generic", "dnn", ...)
 * @param name the operator name within the family
 */
public record OperatorKind(String namespace, String name) {

    public static OperatorKind of(String namespace, String name) {
        return new OperatorKind(namespace, name);
    }

    @Override
    public String toString() {
        return namespace + "." + name;
    }
}
