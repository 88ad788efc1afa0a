package org.hwir.compiler;

/** A component which belongs to a compiler instance. */
public interface ICompilerComponent {
    HwCompiler compiler();
}
