package org.hwir.ir;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.outer.CircuitVisitor;
import org.hwir.util.IIndentStream;
import org.hwir.util.Linq;
import org.hwir.util.Utilities;

import java.util.List;

/** A module implemented outside the circuit; only its ports are known. */
public final class HwExtModule extends HwModuleBase {
    public HwExtModule(SourceInfo info, String name, List<HwPort> ports) {
        super(info, name, ports);
    }

    public HwExtModule(String name, List<HwPort> ports) {
        this(SourceInfo.EMPTY, name, ports);
    }

    public HwExtModule replace(List<HwPort> ports) {
        if (Linq.same(ports, this.ports))
            return this;
        return new HwExtModule(this.sourceInfo, this.name, ports);
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
        builder.append("extmodule ")
                .append(this.name)
                .append(" :")
                .increase();
        return this.portsToString(builder)
                .decrease();
    }

    @SuppressWarnings("unused")
    public static HwExtModule fromJson(JsonNode node, JsonDecoder decoder) {
        String name = Utilities.getStringProperty(node, "name");
        List<HwPort> ports = fromJsonInnerList(node, "ports", decoder, HwPort.class);
        return new HwExtModule(name, ports);
    }
}
