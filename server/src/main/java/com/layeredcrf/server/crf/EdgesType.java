package com.layeredcrf.server.crf;

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;

/**
 * Classes of edges a layered grid graph can be built with.
 */
public enum EdgesType {
    // vertical and horizontal neighbours
    GRID(1),
    // both diagonals
    DIAG(2),
    // same site in adjacent layers
    LINK(4);

    private final int mask;

    EdgesType(int mask) {
        this.mask = mask;
    }

    public int mask() {
        return mask;
    }

    public static int toMask(Set<EdgesType> types) {
        int m = 0;
        for (EdgesType t : types) {
            m |= t.mask;
        }
        return m;
    }

    public static Set<EdgesType> fromMask(int mask) {
        if ((mask & ~(GRID.mask | DIAG.mask | LINK.mask)) != 0) {
            throw new IllegalArgumentException("Unknown edge type bits in mask " + mask);
        }
        EnumSet<EdgesType> types = EnumSet.noneOf(EdgesType.class);
        for (EdgesType t : values()) {
            if ((mask & t.mask) != 0) {
                types.add(t);
            }
        }
        return Collections.unmodifiableSet(types);
    }
}
