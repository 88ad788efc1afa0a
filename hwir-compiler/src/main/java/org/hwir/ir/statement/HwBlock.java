package org.hwir.ir.statement;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.inner.InnerVisitor;
import org.hwir.ir.IHwInnerNode;
import org.hwir.ir.SourceInfo;
import org.hwir.util.IIndentStream;
import org.hwir.util.Linq;

import java.util.List;

/** A sequence of statements executed in order. */
public final class HwBlock extends HwStatement {
    public final List<HwStatement> statements;

    public HwBlock(SourceInfo info, List<HwStatement> statements) {
        super(info);
        this.statements = statements;
    }

    public HwBlock(List<HwStatement> statements) {
        this(SourceInfo.EMPTY, statements);
    }

    public HwBlock(HwStatement... statements) {
        this(Linq.list(statements));
    }

    @Override
    public void accept(InnerVisitor visitor) {
        VisitDecision decision = visitor.preorder(this);
        if (decision.stop()) return;
        visitor.push(this);
        visitor.startArrayProperty("statements");
        int index = 0;
        for (HwStatement statement: this.statements) {
            visitor.propertyIndex(index);
            index++;
            statement.accept(visitor);
        }
        visitor.endArrayProperty("statements");
        visitor.pop(this);
        visitor.postorder(this);
    }

    @Override
    public boolean sameFields(IHwInnerNode other) {
        HwBlock o = other.as(HwBlock.class);
        if (o == null)
            return false;
        return Linq.same(this.statements, o.statements);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("{").increase();
        for (HwStatement statement: this.statements)
            builder.append(statement).newline();
        return builder.decrease().append("}");
    }

    @SuppressWarnings("unused")
    public static HwBlock fromJson(JsonNode node, JsonDecoder decoder) {
        List<HwStatement> statements = fromJsonInnerList(node, "statements", decoder, HwStatement.class);
        return new HwBlock(statements);
    }
}
