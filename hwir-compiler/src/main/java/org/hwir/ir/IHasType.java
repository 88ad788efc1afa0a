package org.hwir.ir;

import org.hwir.ir.type.HwType;

public interface IHasType {
    HwType getType();
}
