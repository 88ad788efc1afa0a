package org.hwir.ir;

import org.hwir.compiler.visitors.inner.InnerVisitor;

/** A node which appears inside a module: a type, an expression,
 * a statement, or a port. */
public interface IHwInnerNode extends IHwNode {
    void accept(InnerVisitor visitor);

    /** True if the two nodes have the same class and all their
     * fields are the same objects. */
    boolean sameFields(IHwInnerNode other);
}
