package com.layeredcrf.db;

public enum ModelKind {
    EDGE, LINK, LINK_UPPER
}
