package org.hwir.ir.statement;

import org.hwir.ir.IHasType;
import org.hwir.ir.SourceInfo;

/** A statement which introduces a name in the module scope. */
public abstract class HwDeclaration extends HwStatement implements IHasType {
    public final String name;

    protected HwDeclaration(SourceInfo info, String name) {
        super(info);
        this.name = name;
    }
}
