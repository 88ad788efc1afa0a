package org.hwir.ir;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.outer.CircuitVisitor;
import org.hwir.ir.statement.HwBlock;
import org.hwir.util.IIndentStream;
import org.hwir.util.Linq;
import org.hwir.util.Utilities;

import java.util.List;

/** A module with a body. */
public final class HwModule extends HwModuleBase {
    public final HwBlock body;

    public HwModule(SourceInfo info, String name, List<HwPort> ports, HwBlock body) {
        super(info, name, ports);
        this.body = body;
    }

    public HwModule(String name, List<HwPort> ports, HwBlock body) {
        this(SourceInfo.EMPTY, name, ports, body);
    }

    /** A module with the same name and new contents, or this module if nothing changed. */
    public HwModule replace(List<HwPort> ports, HwBlock body) {
        if (Linq.same(ports, this.ports) && body == this.body)
            return this;
        return new HwModule(this.sourceInfo, this.name, ports, body);
    }

    @Override
    public void accept(CircuitVisitor visitor) {
        visitor.push(this);
        VisitDecision decision = visitor.preorder(this);
        if (!decision.stop())
            visitor.postorder(this);
        visitor.pop(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("module ")
                .append(this.name)
                .append(" :")
                .increase();
        this.portsToString(builder);
        return builder.append(this.body)
                .decrease()
                .newline();
    }

    @SuppressWarnings("unused")
    public static HwModule fromJson(JsonNode node, JsonDecoder decoder) {
        String name = Utilities.getStringProperty(node, "name");
        List<HwPort> ports = fromJsonInnerList(node, "ports", decoder, HwPort.class);
        HwBlock body = fromJsonInner(node, "body", decoder, HwBlock.class);
        return new HwModule(name, ports, body);
    }
}
