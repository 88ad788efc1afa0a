package org.hwir.ir.statement;

import org.hwir.ir.HwNode;
import org.hwir.ir.IHwInnerNode;
import org.hwir.ir.SourceInfo;

/** Base class for all statements appearing in a module body. */
public abstract class HwStatement extends HwNode implements IHwInnerNode {
    protected HwStatement(SourceInfo info) {
        super(info);
    }
}
