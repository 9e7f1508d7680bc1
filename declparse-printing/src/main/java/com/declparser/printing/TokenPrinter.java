package com.declparser.printing;

import com.declparser.Token;
import com.declparser.TokenType;
import com.declparser.ast.Attribute;
import com.declparser.ast.Delimiter;
import com.declparser.ast.Expr;
import com.declparser.ast.ExprBinary;
import com.declparser.ast.ExprCast;
import com.declparser.ast.ExprLit;
import com.declparser.ast.ExprParen;
import com.declparser.ast.ExprPath;
import com.declparser.ast.ExprUnary;
import com.declparser.ast.Field;
import com.declparser.ast.Fields;
import com.declparser.ast.FieldsNamed;
import com.declparser.ast.FieldsUnit;
import com.declparser.ast.FieldsUnnamed;
import com.declparser.ast.GenericArgument;
import com.declparser.ast.GenericArguments;
import com.declparser.ast.Ident;
import com.declparser.ast.Lifetime;
import com.declparser.ast.Node;
import com.declparser.ast.Path;
import com.declparser.ast.PathSegment;
import com.declparser.ast.Punctuated;
import com.declparser.ast.Type;
import com.declparser.ast.TypeArray;
import com.declparser.ast.TypeInfer;
import com.declparser.ast.TypeNever;
import com.declparser.ast.TypePath;
import com.declparser.ast.TypePtr;
import com.declparser.ast.TypeReference;
import com.declparser.ast.TypeSlice;
import com.declparser.ast.TypeTuple;
import com.declparser.ast.Variant;
import com.declparser.ast.VariantList;
import com.declparser.ast.VisCrate;
import com.declparser.ast.VisInherited;
import com.declparser.ast.VisPublic;
import com.declparser.ast.VisRestricted;
import com.declparser.ast.Visibility;

import java.util.function.Consumer;

/**
 * Turns syntax trees back into the tokens they were parsed from.
 *
 * <p>Every node writes its attributes first and then its structural tokens in source
 * order, reusing the captured tokens. Printing cannot fail for any tree the record
 * constructors accept.</p>
 */
public final class TokenPrinter {

    private TokenPrinter() {
    }

    public static TokenStream print(Node node) {
        TokenStream out = new TokenStream();
        node(node, out);
        return out;
    }

    /**
     * Convenience for {@code print(node).toString()}.
     */
    public static String render(Node node) {
        return print(node).toString();
    }

    private static void node(Node node, TokenStream out) {
        if (node instanceof Variant variant) {
            variant(variant, out);
        } else if (node instanceof VariantList list) {
            delimited(list.braceToken(), list.variants(), v -> variant(v, out), out);
        } else if (node instanceof Fields fields) {
            fields(fields, out);
        } else if (node instanceof Field field) {
            field(field, out);
        } else if (node instanceof Visibility vis) {
            visibility(vis, out);
        } else if (node instanceof Ident ident) {
            ident(ident, out);
        } else if (node instanceof Path path) {
            path(path, out);
        } else if (node instanceof PathSegment segment) {
            pathSegment(segment, out);
        } else if (node instanceof GenericArguments args) {
            genericArguments(args, out);
        } else if (node instanceof Type type) {
            type(type, out);
        } else if (node instanceof Lifetime lifetime) {
            out.append(lifetime.token());
        } else if (node instanceof Expr expr) {
            expr(expr, out);
        } else if (node instanceof Attribute attribute) {
            attribute(attribute, out);
        } else {
            throw new IllegalStateException("Unhandled node type: " + node.getClass().getName());
        }
    }

    // ========================================================================
    // Declarations
    // ========================================================================

    private static void variant(Variant variant, TokenStream out) {
        variant.attrs().forEach(attr -> attribute(attr, out));
        ident(variant.ident(), out);
        fields(variant.fields(), out);
        if (variant.discriminant() != null) {
            out.append(variant.discriminant().eqToken());
            expr(variant.discriminant().expr(), out);
        }
    }

    private static void fields(Fields fields, TokenStream out) {
        if (fields instanceof FieldsNamed named) {
            delimited(named.braceToken(), named.named(), f -> field(f, out), out);
        } else if (fields instanceof FieldsUnnamed unnamed) {
            delimited(unnamed.parenToken(), unnamed.unnamed(), f -> field(f, out), out);
        } else if (!(fields instanceof FieldsUnit)) {
            throw new IllegalStateException("Unhandled fields type: " + fields.getClass().getName());
        }
    }

    private static void field(Field field, TokenStream out) {
        field.attrs().forEach(attr -> attribute(attr, out));
        visibility(field.vis(), out);
        if (field.ident() != null) {
            ident(field.ident(), out);
            out.append(field.colonToken() != null ? field.colonToken() : Token.synthetic(TokenType.COLON));
        }
        type(field.ty(), out);
    }

    private static void visibility(Visibility vis, TokenStream out) {
        if (vis instanceof VisPublic pub) {
            out.append(pub.pubToken());
        } else if (vis instanceof VisCrate crate) {
            out.append(crate.pubToken());
            out.append(crate.parenToken().open());
            out.append(crate.crateToken());
            out.append(crate.parenToken().close());
        } else if (vis instanceof VisRestricted restricted) {
            out.append(restricted.pubToken());
            out.append(restricted.parenToken().open());
            // Written exactly as captured: pub(in self) and pub(self) stay distinct
            if (restricted.inToken() != null) {
                out.append(restricted.inToken());
            }
            path(restricted.path(), out);
            out.append(restricted.parenToken().close());
        } else if (!(vis instanceof VisInherited)) {
            throw new IllegalStateException("Unhandled visibility type: " + vis.getClass().getName());
        }
    }

    private static void attribute(Attribute attribute, TokenStream out) {
        out.append(attribute.pound());
        out.append(attribute.bracketToken().open());
        path(attribute.path(), out);
        attribute.tokens().forEach(out::append);
        out.append(attribute.bracketToken().close());
    }

    // ========================================================================
    // Paths
    // ========================================================================

    private static void ident(Ident ident, TokenStream out) {
        if (ident.token() != null) {
            out.append(ident.token());
        } else {
            TokenType keyword = TokenType.keyword(ident.name());
            out.append(Token.synthetic(keyword != null ? keyword : TokenType.IDENT, ident.name()));
        }
    }

    private static void path(Path path, TokenStream out) {
        if (path.leadingColon() != null) {
            out.append(path.leadingColon());
        }
        punctuated(path.segments(), s -> pathSegment(s, out), out);
    }

    private static void pathSegment(PathSegment segment, TokenStream out) {
        ident(segment.ident(), out);
        if (segment.arguments() != null) {
            genericArguments(segment.arguments(), out);
        }
    }

    private static void genericArguments(GenericArguments args, TokenStream out) {
        if (args.colon2() != null) {
            out.append(args.colon2());
        }
        out.append(args.lt());
        punctuated(args.args(), arg -> genericArgument(arg, out), out);
        out.append(args.gt());
    }

    private static void genericArgument(GenericArgument arg, TokenStream out) {
        if (arg instanceof Lifetime lifetime) {
            out.append(lifetime.token());
        } else {
            type((Type) arg, out);
        }
    }

    // ========================================================================
    // Types
    // ========================================================================

    private static void type(Type type, TokenStream out) {
        if (type instanceof TypePath t) {
            path(t.path(), out);
        } else if (type instanceof TypeReference t) {
            out.append(t.and());
            if (t.lifetime() != null) {
                out.append(t.lifetime().token());
            }
            if (t.mutability() != null) {
                out.append(t.mutability());
            }
            type(t.elem(), out);
        } else if (type instanceof TypePtr t) {
            out.append(t.star());
            out.append(t.constOrMut());
            type(t.elem(), out);
        } else if (type instanceof TypeTuple t) {
            delimited(t.parenToken(), t.elems(), e -> type(e, out), out);
        } else if (type instanceof TypeSlice t) {
            out.append(t.bracketToken().open());
            type(t.elem(), out);
            out.append(t.bracketToken().close());
        } else if (type instanceof TypeArray t) {
            out.append(t.bracketToken().open());
            type(t.elem(), out);
            out.append(t.semiToken());
            expr(t.len(), out);
            out.append(t.bracketToken().close());
        } else if (type instanceof TypeNever t) {
            out.append(t.bang());
        } else if (type instanceof TypeInfer t) {
            out.append(t.underscore());
        } else {
            throw new IllegalStateException("Unhandled type: " + type.getClass().getName());
        }
    }

    // ========================================================================
    // Expressions
    // ========================================================================

    private static void expr(Expr expr, TokenStream out) {
        if (expr instanceof ExprLit e) {
            out.append(e.literal());
        } else if (expr instanceof ExprPath e) {
            path(e.path(), out);
        } else if (expr instanceof ExprUnary e) {
            out.append(e.op());
            expr(e.expr(), out);
        } else if (expr instanceof ExprBinary e) {
            expr(e.left(), out);
            out.append(e.op());
            expr(e.right(), out);
        } else if (expr instanceof ExprCast e) {
            expr(e.expr(), out);
            out.append(e.asToken());
            type(e.ty(), out);
        } else if (expr instanceof ExprParen e) {
            out.append(e.parenToken().open());
            expr(e.expr(), out);
            out.append(e.parenToken().close());
        } else {
            throw new IllegalStateException("Unhandled expression: " + expr.getClass().getName());
        }
    }

    // ========================================================================
    // Helpers
    // ========================================================================

    private static <T> void delimited(Delimiter delimiter, Punctuated<T> items, Consumer<T> item, TokenStream out) {
        out.append(delimiter.open());
        punctuated(items, item, out);
        out.append(delimiter.close());
    }

    private static <T> void punctuated(Punctuated<T> items, Consumer<T> item, TokenStream out) {
        for (Punctuated.Pair<T> pair : items.pairs()) {
            item.accept(pair.value());
            if (pair.punct() != null) {
                out.append(pair.punct());
            }
        }
    }
}
