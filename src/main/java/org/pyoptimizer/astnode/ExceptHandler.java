package org.pyoptimizer.astnode;

/**
 * One {@code except [type [as name]]:} clause.
 *
 * @param type    the exception type expression, null for a bare {@code except:}
 * @param name    the bound name, or null
 * @param body    the handler body
 * @param isGroup true for {@code except*}
 */
public record ExceptHandler(Node type, String name, BlockNode body, boolean isGroup) {
}
