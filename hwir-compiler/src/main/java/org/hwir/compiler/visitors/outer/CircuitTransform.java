package org.hwir.compiler.visitors.outer;

import org.hwir.ir.HwCircuit;

import java.util.function.Function;

public interface CircuitTransform extends Function<HwCircuit, HwCircuit> {
    /** Name of the circuit transformation pass */
    String getName();
}
