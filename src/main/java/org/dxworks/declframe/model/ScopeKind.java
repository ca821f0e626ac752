package org.dxworks.declframe.model;

public enum ScopeKind {
    GLOBAL,
    BLOCK
}
