package org.hwir.util;

/** Marks classes which write to the {@link Logger}. */
public interface IWritesLogs {}
