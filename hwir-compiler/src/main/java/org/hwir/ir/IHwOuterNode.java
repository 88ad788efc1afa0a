package org.hwir.ir;

import org.hwir.compiler.visitors.outer.CircuitVisitor;

/** A circuit or a module. */
public interface IHwOuterNode extends IHwNode {
    void accept(CircuitVisitor visitor);
}
