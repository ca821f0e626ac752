package org.dxworks.declframe.model;

import java.util.Objects;

/**
 * One fuzzy-matched variable declaration.
 * Instances are plain data: created once by the extractor and never mutated afterwards.
 */
public final class Declaration {
    public final String name;
    public final String type; // base type, sigils and an optional "[]" marker
    public final String initializer; // empty when there is no "= ..." part
    public final int line;
    public final boolean isStatic;
    public final boolean isConst;

    public Declaration(String name, String type, String initializer, int line, boolean isStatic, boolean isConst) {
        this.name = name;
        this.type = type;
        this.initializer = initializer == null ? "" : initializer;
        this.line = line;
        this.isStatic = isStatic;
        this.isConst = isConst;
    }

    public boolean hasInitializer() {
        return !initializer.isEmpty();
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Declaration)) return false;
        Declaration that = (Declaration) o;
        return line == that.line
                && isStatic == that.isStatic
                && isConst == that.isConst
                && name.equals(that.name)
                && type.equals(that.type)
                && initializer.equals(that.initializer);
    }

    @Override
    public int hashCode() {
        return Objects.hash(name, type, initializer, line, isStatic, isConst);
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        if (isStatic) sb.append("static ");
        if (isConst) sb.append("const ");
        sb.append(type).append(' ').append(name);
        if (hasInitializer()) sb.append(" = ").append(initializer);
        return sb.append(" (line ").append(line).append(')').toString();
    }
}
