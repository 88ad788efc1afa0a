package org.hwir.ir.statement;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.IHwInnerNode;
import org.hwir.ir.SourceInfo;
import org.hwir.ir.expression.HwExpression;
import org.hwir.ir.type.HwType;
import org.hwir.util.IIndentStream;
import org.hwir.util.Utilities;

import javax.annotation.Nullable;

/** A register clocked by {@code clock}.  When {@code reset} is asserted
 * the register takes the value {@code init}; both are present or absent together. */
public final class HwDefRegister extends HwDeclaration {
    public final HwType type;
    public final HwExpression clock;
    @Nullable
    public final HwExpression reset;
    @Nullable
    public final HwExpression init;

    public HwDefRegister(SourceInfo info, String name, HwType type, HwExpression clock,
                         @Nullable HwExpression reset, @Nullable HwExpression init) {
        super(info, name);
        this.type = type;
        this.clock = clock;
        this.reset = reset;
        this.init = init;
        if ((reset == null) != (init == null))
            throw this.error("Register " + name + " must have both reset and init, or neither");
    }

    public HwDefRegister(String name, HwType type, HwExpression clock,
                         @Nullable HwExpression reset, @Nullable HwExpression init) {
        this(SourceInfo.EMPTY, name, type, clock, reset, init);
    }

    public HwDefRegister(String name, HwType type, HwExpression clock) {
        this(name, type, clock, null, null);
    }

    @Override
    public HwType getType() {
        return this.type;
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.property("type");
        this.type.accept(visitor);
        visitor.property("clock");
        this.clock.accept(visitor);
        if (this.reset != null) {
            visitor.property("reset");
            this.reset.accept(visitor);
        }
        if (this.init != null) {
            visitor.property("init");
            this.init.accept(visitor);
        }
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IHwInnerNode other) {
        HwDefRegister o = other.as(HwDefRegister.class);
        if (o == null)
            return false;
        return this.name.equals(o.name) &&
                this.type == o.type &&
                this.clock == o.clock &&
                this.reset == o.reset &&
                this.init == o.init;
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("reg ")
                .append(this.name)
                .append(" : ")
                .append(this.type)
                .append(", ")
                .append(this.clock);
        if (this.reset != null && this.init != null)
            builder.append(" with reset => (")
                    .append(this.reset)
                    .append(", ")
                    .append(this.init)
                    .append(")");
        return builder;
    }

    @SuppressWarnings("unused")
    public static HwDefRegister fromJson(JsonNode node, JsonDecoder decoder) {
        String name = Utilities.getStringProperty(node, "name");
        HwType type = HwType.fromJsonType(node, "type", decoder);
        HwExpression clock = fromJsonInner(node, "clock", decoder, HwExpression.class);
        HwExpression reset = null;
        HwExpression init = null;
        if (node.has("reset"))
            reset = fromJsonInner(node, "reset", decoder, HwExpression.class);
        if (node.has("init"))
            init = fromJsonInner(node, "init", decoder, HwExpression.class);
        return new HwDefRegister(name, type, clock, reset, init);
    }
}
