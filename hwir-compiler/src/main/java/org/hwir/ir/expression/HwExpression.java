package org.hwir.ir.expression;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.ir.HwNode;
import org.hwir.ir.IHasType;
import org.hwir.ir.IHwInnerNode;
import org.hwir.ir.SourceInfo;
import org.hwir.ir.type.HwType;
import org.hwir.ir.type.HwTypeInterval;

/** Base class for all expressions. */
public abstract class HwExpression extends HwNode implements IHwInnerNode, IHasType {
    public final HwType type;

    protected HwExpression(SourceInfo info, HwType type) {
        super(info);
        this.type = type;
    }

    @Override
    public HwType getType() {
        return this.type;
    }

    /** The same expression with a different result type. */
    public abstract HwExpression withType(HwType type);

    /** The type of this expression as an interval, or an error if it is not one. */
    public HwTypeInterval getIntervalType() {
        HwTypeInterval result = this.type.as(HwTypeInterval.class);
        if (result == null)
            throw this.error("Expected an interval-typed expression, found " + this + " : " + this.type);
        return result;
    }

    public static HwType getJsonType(JsonNode node, JsonDecoder decoder) {
        return HwType.fromJsonType(node, "type", decoder);
    }
}
