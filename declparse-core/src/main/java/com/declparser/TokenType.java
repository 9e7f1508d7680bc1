package com.declparser;

import java.util.HashMap;
import java.util.Map;

public enum TokenType {
    // Variable-text tokens
    IDENT(null),
    LIFETIME(null),
    INTEGER(null),
    FLOAT(null),
    STRING(null),
    CHAR(null),

    // Keywords
    AS("as"),
    CONST("const"),
    CRATE("crate"),
    DYN("dyn"),
    ENUM("enum"),
    EXTERN("extern"),
    FALSE("false"),
    FN("fn"),
    IMPL("impl"),
    IN("in"),
    LET("let"),
    MOD("mod"),
    MUT("mut"),
    PUB("pub"),
    SELF("self"),
    SELF_TYPE("Self"),
    STATIC("static"),
    STRUCT("struct"),
    SUPER("super"),
    TRUE("true"),
    TYPE("type"),
    UNION("union"),
    UNSAFE("unsafe"),
    USE("use"),
    WHERE("where"),
    UNDERSCORE("_"),

    // Punctuation
    EQ("="),
    EQ_EQ("=="),
    NE("!="),
    LT("<"),
    LE("<="),
    GT(">"),
    GE(">="),
    SHL("<<"),
    SHR(">>"),
    PLUS("+"),
    MINUS("-"),
    STAR("*"),
    SLASH("/"),
    PERCENT("%"),
    CARET("^"),
    BANG("!"),
    AND("&"),
    AND_AND("&&"),
    OR("|"),
    OR_OR("||"),
    DOT("."),
    DOT_DOT(".."),
    COMMA(","),
    SEMI(";"),
    COLON(":"),
    PATH_SEP("::"),
    R_ARROW("->"),
    FAT_ARROW("=>"),
    POUND("#"),
    DOLLAR("$"),
    QUESTION("?"),
    AT("@"),
    TILDE("~"),

    // Delimiters
    LPAREN("("),
    RPAREN(")"),
    LBRACE("{"),
    RBRACE("}"),
    LBRACKET("["),
    RBRACKET("]"),

    EOF("");

    private static final Map<String, TokenType> KEYWORDS = new HashMap<>();

    static {
        for (TokenType type : values()) {
            if (type.isKeyword()) {
                KEYWORDS.put(type.lexeme, type);
            }
        }
    }

    private final String lexeme;

    TokenType(String lexeme) {
        this.lexeme = lexeme;
    }

    /**
     * The fixed spelling of this token type, or null for identifiers, lifetimes and literals.
     */
    public String lexeme() {
        return lexeme;
    }

    public boolean isKeyword() {
        return ordinal() >= AS.ordinal() && ordinal() <= UNDERSCORE.ordinal();
    }

    public boolean isOpenDelimiter() {
        return this == LPAREN || this == LBRACE || this == LBRACKET;
    }

    public boolean isCloseDelimiter() {
        return this == RPAREN || this == RBRACE || this == RBRACKET;
    }

    /**
     * Looks up the keyword spelled by {@code word}, or returns null if it is an ordinary identifier.
     */
    public static TokenType keyword(String word) {
        return KEYWORDS.get(word);
    }
}
