package com.declparser.jackson;

import com.declparser.Token;
import com.declparser.ast.Expr;
import com.declparser.ast.Fields;
import com.declparser.ast.GenericArgument;
import com.declparser.ast.Ident;
import com.declparser.ast.Node;
import com.declparser.ast.Punctuated;
import com.declparser.ast.Type;
import com.declparser.ast.Visibility;
import com.declparser.jackson.mixins.NodeMixin;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.core.Version;
import com.fasterxml.jackson.databind.jsontype.NamedType;
import com.fasterxml.jackson.databind.module.SimpleModule;

import java.util.ArrayList;
import java.util.List;

/**
 * Jackson module that configures serialization/deserialization for the syntax tree records.
 *
 * This module handles:
 * - Polymorphic node types via NodeMixin, with every concrete record registered under its simple name
 * - Hiding derived boolean accessors ({@code isEmpty()}, {@code isSynthetic()}, {@code isRaw()})
 *   that Jackson would otherwise write as properties
 */
public class AstModule extends SimpleModule {

    public AstModule() {
        super("AstModule", new Version(1, 0, 0, null, "com.declparser", "declparse-jackson"));
    }

    @Override
    public void setupModule(SetupContext context) {
        super.setupModule(context);

        // Mixins are set on every sealed supertype a property can be declared as;
        // relying on inheritance from Node alone does not cover GenericArgument
        context.setMixInAnnotations(Node.class, NodeMixin.class);
        context.setMixInAnnotations(Type.class, NodeMixin.class);
        context.setMixInAnnotations(Expr.class, NodeMixin.class);
        context.setMixInAnnotations(Fields.class, NodeMixin.class);
        context.setMixInAnnotations(Visibility.class, NodeMixin.class);
        context.setMixInAnnotations(GenericArgument.class, NodeMixin.class);

        context.setMixInAnnotations(Punctuated.class, PunctuatedMixin.class);
        context.setMixInAnnotations(Token.class, TokenMixin.class);
        context.setMixInAnnotations(Ident.class, IdentMixin.class);

        context.registerSubtypes(namedSubtypes(Node.class).toArray(new NamedType[0]));
    }

    /**
     * Walks the sealed hierarchy below {@code root}, naming every concrete record by its simple name.
     */
    static List<NamedType> namedSubtypes(Class<?> root) {
        List<NamedType> types = new ArrayList<>();
        collect(root, types);
        return types;
    }

    private static void collect(Class<?> type, List<NamedType> out) {
        if (type.isRecord()) {
            out.add(new NamedType(type, type.getSimpleName()));
            return;
        }
        Class<?>[] permitted = type.getPermittedSubclasses();
        if (permitted == null) {
            return;
        }
        for (Class<?> sub : permitted) {
            // Type and Lifetime are reachable both from Node and from GenericArgument
            boolean seen = out.stream().anyMatch(named -> named.getType() == sub);
            if (!seen) {
                collect(sub, out);
            }
        }
    }

    // ==================== Serialization Mixins ====================

    @JsonIgnoreProperties({"empty"})
    private abstract static class PunctuatedMixin {
    }

    @JsonIgnoreProperties({"synthetic"})
    private abstract static class TokenMixin {
    }

    @JsonIgnoreProperties({"raw"})
    private abstract static class IdentMixin {
    }
}
