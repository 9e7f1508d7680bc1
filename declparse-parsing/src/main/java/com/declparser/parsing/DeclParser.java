package com.declparser.parsing;

import com.declparser.Lexer;
import com.declparser.ParseException;
import com.declparser.Token;
import com.declparser.ast.Expr;
import com.declparser.ast.Field;
import com.declparser.ast.Fields;
import com.declparser.ast.FieldsNamed;
import com.declparser.ast.FieldsUnnamed;
import com.declparser.ast.Node;
import com.declparser.ast.Path;
import com.declparser.ast.Type;
import com.declparser.ast.Variant;
import com.declparser.ast.VariantList;
import com.declparser.ast.Visibility;
import com.declparser.parsing.combinator.Combinators;
import com.declparser.parsing.combinator.Cursor;
import com.declparser.parsing.combinator.Grammar;
import com.declparser.parsing.combinator.PResult;
import com.declparser.parsing.combinator.ParseError;

import java.util.List;

/**
 * Entry point for parsing declaration fragments from source text or tokens.
 *
 * <p>Every method parses exactly one node and, unless {@link ParserOptions#allowTrailingInput()}
 * is set, requires the whole input to be consumed. Failures are reported as
 * {@link ParseException}, positioned at the most specific mismatch found.</p>
 *
 * <p>Instances are immutable and may be shared between threads.</p>
 */
public final class DeclParser {
    private final ParserOptions options;

    public DeclParser() {
        this(ParserOptions.defaults());
    }

    public DeclParser(ParserOptions options) {
        this.options = options;
    }

    public ParserOptions options() {
        return options;
    }

    public Variant parseVariant(String source) {
        return parseVariant(Lexer.tokenize(source));
    }

    public Variant parseVariant(List<Token> tokens) {
        return run(VariantGrammar::variant, tokens);
    }

    public VariantList parseVariantList(String source) {
        return parseVariantList(Lexer.tokenize(source));
    }

    public VariantList parseVariantList(List<Token> tokens) {
        return run(VariantGrammar::variantList, tokens);
    }

    /**
     * Parses braced named fields, parenthesized unnamed fields, or (for empty input) unit fields.
     */
    public Fields parseFields(String source) {
        return parseFields(Lexer.tokenize(source));
    }

    public Fields parseFields(List<Token> tokens) {
        return run(FieldsGrammar::fields, tokens);
    }

    public FieldsNamed parseFieldsNamed(String source) {
        return parseFieldsNamed(Lexer.tokenize(source));
    }

    public FieldsNamed parseFieldsNamed(List<Token> tokens) {
        return run(FieldsGrammar::named, tokens);
    }

    public FieldsUnnamed parseFieldsUnnamed(String source) {
        return parseFieldsUnnamed(Lexer.tokenize(source));
    }

    public FieldsUnnamed parseFieldsUnnamed(List<Token> tokens) {
        return run(FieldsGrammar::unnamed, tokens);
    }

    public Field parseNamedField(String source) {
        return parseNamedField(Lexer.tokenize(source));
    }

    public Field parseNamedField(List<Token> tokens) {
        return run(FieldGrammar::named, tokens);
    }

    public Field parseUnnamedField(String source) {
        return parseUnnamedField(Lexer.tokenize(source));
    }

    public Field parseUnnamedField(List<Token> tokens) {
        return run(FieldGrammar::unnamed, tokens);
    }

    public Visibility parseVisibility(String source) {
        return parseVisibility(Lexer.tokenize(source));
    }

    public Visibility parseVisibility(List<Token> tokens) {
        return run(VisibilityGrammar::visibility, tokens);
    }

    public Type parseType(String source) {
        return parseType(Lexer.tokenize(source));
    }

    public Type parseType(List<Token> tokens) {
        return run(TypeGrammar::type, tokens);
    }

    public Expr parseExpr(String source) {
        return parseExpr(Lexer.tokenize(source));
    }

    public Expr parseExpr(List<Token> tokens) {
        return run(ExprGrammar::expr, tokens);
    }

    /**
     * Parses a type-style path such as {@code std::collections::HashMap<K, V>}.
     */
    public Path parsePath(String source) {
        return parsePath(Lexer.tokenize(source));
    }

    public Path parsePath(List<Token> tokens) {
        return run(PathGrammar::typePath, tokens);
    }

    public Node parse(NodeKind kind, String source) {
        return switch (kind) {
            case VARIANT -> parseVariant(source);
            case VARIANTS -> parseVariantList(source);
            case FIELDS -> parseFields(source);
            case FIELD -> parseNamedField(source);
            case UNNAMED_FIELD -> parseUnnamedField(source);
            case VISIBILITY -> parseVisibility(source);
            case TYPE -> parseType(source);
            case EXPR -> parseExpr(source);
            case PATH -> parsePath(source);
        };
    }

    private <T> T run(Grammar<T> grammar, List<Token> tokens) {
        Grammar<T> top = options.allowTrailingInput() ? grammar : Combinators.complete(grammar);
        PResult<T> result = top.parse(Cursor.of(tokens, options.maxDepth()));
        if (result instanceof PResult.Success<T> s) {
            return s.value();
        }
        ParseError error = result.error();
        throw new ParseException(error.message(), error.token(), error.description());
    }
}
