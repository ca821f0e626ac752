package org.dxworks.declframe.model;

import java.util.ArrayList;
import java.util.List;

/**
 * Serialized form of one {@link Scope}. Scopes are written as a flat list in the order their
 * opening braces appear, linked by {@code parentId}, so output depth stays constant however
 * deeply the source nests.
 */
public class ScopeRecord {
    public int id; // 0 is the global scope
    public Integer parentId; // null for the global scope
    public int depth;
    public ScopeKind kind;
    public int startLine;
    public int endLine;
    public List<Declaration> declarations = new ArrayList<>();
}
