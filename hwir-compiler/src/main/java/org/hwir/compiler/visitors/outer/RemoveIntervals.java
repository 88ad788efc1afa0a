package org.hwir.compiler.visitors.outer;

import org.hwir.compiler.CompilerOptions;
import org.hwir.compiler.HwCompiler;
import org.hwir.compiler.visitors.inner.AlignBinaryPoints;
import org.hwir.compiler.visitors.inner.CheckNoIntervals;
import org.hwir.compiler.visitors.inner.InferTypes;
import org.hwir.compiler.visitors.inner.LowerIntervals;

/** Replaces all interval types and operations of a circuit with integer
 * types and operations.  The binary points are aligned first, then
 * intervals are lowered, and finally all types are inferred again. */
public class RemoveIntervals extends Passes {
    public RemoveIntervals(HwCompiler compiler) {
        super("RemoveIntervals", compiler);
        CompilerOptions.Lowering options = compiler.options.loweringOptions;
        this.add(new AlignBinaryPoints(compiler).circuitRewriter());
        if (options.alignOnly)
            return;
        this.add(new LowerIntervals(compiler).circuitRewriter());
        if (!options.skipValidation)
            this.add(new CheckNoIntervals(compiler).circuitRewriter());
        if (!options.skipInference)
            this.add(new InferTypes(compiler).circuitRewriter());
    }
}
