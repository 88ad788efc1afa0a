package org.hwir.ir;

import org.hwir.util.IIndentStream;

import javax.annotation.Nullable;
import java.util.List;

/** A module or an external module; both expose a list of ports. */
public abstract class HwModuleBase extends HwNode implements IHwOuterNode {
    public final String name;
    public final List<HwPort> ports;

    protected HwModuleBase(SourceInfo info, String name, List<HwPort> ports) {
        super(info);
        this.name = name;
        this.ports = ports;
    }

    @Nullable
    public HwPort getPort(String name) {
        for (HwPort port: this.ports)
            if (port.name.equals(name))
                return port;
        return null;
    }

    IIndentStream portsToString(IIndentStream builder) {
        for (HwPort port: this.ports)
            builder.append(port).newline();
        return builder;
    }
}
