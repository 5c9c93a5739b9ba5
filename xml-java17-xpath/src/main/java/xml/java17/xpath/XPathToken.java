package xml.java17.xpath;

import java.util.Objects;

/// A lexed XPath token: its category, its text (literal values exclude their quotes)
/// and the 0-based offset of its first character in the expression.
record XPathToken(Type type, String text, int position) {

    XPathToken {
        Objects.requireNonNull(type, "type must not be null");
        Objects.requireNonNull(text, "text must not be null");
    }

    XPathToken withType(Type newType) {
        return new XPathToken(newType, text, position);
    }

    /// Token categories. NCNAME, STAR_OP and the operator keywords are context sensitive;
    /// the lexer reclassifies them as described on [XPathLexer].
    enum Type {
        PATH_SEP,
        ABBREV_PATH_SEP,
        ABBREV_STEP_SELF,
        ABBREV_STEP_PARENT,
        AXIS_SEP,
        ABBREV_AXIS_AT,
        OPEN_PAREN,
        CLOSE_PAREN,
        OPEN_BRACKET,
        CLOSE_BRACKET,
        UNION_OP,
        EQUAL_OP,
        REL_OP,
        PLUS_OP,
        MINUS_OP,
        MULT_OP,
        STAR_OP,
        COMMA,
        LITERAL,
        FLOAT,
        INTEGER,
        NCNAME,
        NODETYPE,
        FUNCNAME,
        AXISNAME,
        COLON,
        DOLLAR,
        OR_OP,
        AND_OP,
        DIV_OP,
        MOD_OP,
        END
    }
}
