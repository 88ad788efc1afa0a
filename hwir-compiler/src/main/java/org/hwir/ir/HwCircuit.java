package org.hwir.ir;

import com.fasterxml.jackson.databind.JsonNode;
import org.hwir.compiler.backend.JsonDecoder;
import org.hwir.compiler.visitors.VisitDecision;
import org.hwir.compiler.visitors.outer.CircuitVisitor;
import org.hwir.util.IIndentStream;
import org.hwir.util.Linq;
import org.hwir.util.Utilities;

import javax.annotation.Nullable;
import java.util.List;

/** A circuit: a collection of modules, one of which is the top-level module. */
public final class HwCircuit extends HwNode implements IHwOuterNode {
    /** Name of the top-level module. */
    public final String main;
    public final List<HwModuleBase> modules;

    public HwCircuit(SourceInfo info, String main, List<HwModuleBase> modules) {
        super(info);
        this.main = main;
        this.modules = modules;
        if (this.getModule(main) == null)
            throw this.error("Circuit " + main + " does not contain its main module");
    }

    public HwCircuit(String main, List<HwModuleBase> modules) {
        this(SourceInfo.EMPTY, main, modules);
    }

    public HwCircuit(HwModuleBase... modules) {
        this(modules[0].name, Linq.list(modules));
    }

    @Nullable
    public HwModuleBase getModule(String name) {
        for (HwModuleBase module: this.modules)
            if (module.name.equals(name))
                return module;
        return null;
    }

    /** A circuit with the same name and new modules, or this circuit if nothing changed. */
    public HwCircuit replace(List<HwModuleBase> modules) {
        if (Linq.same(modules, this.modules))
            return this;
        return new HwCircuit(this.sourceInfo, this.main, modules);
    }

    @Override
    public void accept(CircuitVisitor visitor) {
        visitor.push(this);
        VisitDecision decision = visitor.preorder(this);
        if (!decision.stop()) {
            visitor.startArrayProperty("modules");
            int index = 0;
            for (HwModuleBase module: this.modules) {
                visitor.propertyIndex(index);
                index++;
                module.accept(visitor);
            }
            visitor.endArrayProperty("modules");
            visitor.postorder(this);
        }
        visitor.pop(this);
    }

    @Override
    public IIndentStream toString(IIndentStream builder) {
        builder.append("circuit ")
                .append(this.main)
                .append(" :")
                .increase();
        for (HwModuleBase module: this.modules)
            builder.append(module);
        return builder.decrease();
    }

    @SuppressWarnings("unused")
    public static HwCircuit fromJson(JsonNode node, JsonDecoder decoder) {
        String main = Utilities.getStringProperty(node, "main");
        List<HwModuleBase> modules = fromJsonOuterList(node, "modules", decoder, HwModuleBase.class);
        return new HwCircuit(main, modules);
    }
}
