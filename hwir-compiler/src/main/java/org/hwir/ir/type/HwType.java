package org.hwir.ir.type;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.ir.HwNode;
import org.hwir.ir.IHwInnerNode;
import org.hwir.ir.SourceInfo;

/** Base class for all types of expressions, ports and declarations. */
public abstract class HwType extends HwNode implements IHwInnerNode {
    protected HwType(SourceInfo info) {
        super(info);
    }

    /** Structural type equality. */
    public abstract boolean sameType(HwType other);

    public boolean isInterval() {
        return this.is(HwTypeInterval.class);
    }

    /** True if this type or any type nested within it is an interval type. */
    public boolean containsInterval() {
        return this.isInterval();
    }

    public boolean isUnknown() {
        return this.is(HwTypeUnknown.class);
    }

    @Override
    public boolean equals(Object obj) {
        if (!(obj instanceof HwType))
            return false;
        return this.sameType((HwType) obj);
    }

    @Override
    public boolean sameFields(IHwInnerNode other) {
        HwType type = other.as(HwType.class);
        if (type == null)
            return false;
        return this.sameType(type);
    }

    public static HwType fromJsonType(JsonNode node, String property, JsonDecoder decoder) {
        return fromJsonInner(node, property, decoder, HwType.class);
    }
}
