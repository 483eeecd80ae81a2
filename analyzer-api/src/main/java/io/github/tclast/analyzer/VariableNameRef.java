package io.github.tclast.analyzer;

/**
 * Target of a variable command: either a scalar name or an element of an array variable.
 *
 * <p>Consumers discriminate with {@code instanceof}; there is no implicit conversion to a plain string. Use
 * {@link #literal()} when the original spelling is needed.
 */
public sealed interface VariableNameRef permits VariableNameRef.PlainName, VariableNameRef.ArrayAccess {

    /** The variable name without any element key. */
    String name();

    /** The reference spelled the way Tcl spells it, {@code name} or {@code name(key)}. */
    String literal();

    record PlainName(String name) implements VariableNameRef {
        @Override
        public String literal() {
            return name;
        }
    }

    /** {@code name(key)}; the key is kept verbatim, substitutions included. */
    record ArrayAccess(String name, String key) implements VariableNameRef {
        @Override
        public String literal() {
            return name + "(" + key + ")";
        }
    }

    /**
     * Classifies an already-unquoted variable name. A name is an array access when it ends in {@code )} and has a
     * non-empty prefix before the first {@code (}; everything else, including the empty string, is a plain name.
     */
    static VariableNameRef parse(String text) {
        int open = text.indexOf('(');
        if (open > 0 && text.endsWith(")")) {
            return new ArrayAccess(text.substring(0, open), text.substring(open + 1, text.length() - 1));
        }
        return new PlainName(text);
    }
}
