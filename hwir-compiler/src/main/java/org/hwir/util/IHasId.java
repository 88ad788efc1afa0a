package org.hwir.util;

/** An object with a unique numeric identifier. */
public interface IHasId {
    long getId();
}
