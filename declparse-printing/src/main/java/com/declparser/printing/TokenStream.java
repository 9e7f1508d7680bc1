package com.declparser.printing;

import com.declparser.LexException;
import com.declparser.Lexer;
import com.declparser.Token;
import com.declparser.TokenType;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An append-only sequence of tokens produced by {@link TokenPrinter}.
 *
 * <p>{@link #toString()} renders the tokens as source text that lexes back to the same
 * sequence: tokens are separated by one space, except tokens that were adjacent in the
 * source they were parsed from and whose joined text lexes back to them (or to the
 * {@code >>}, {@code >=} or {@code &&} they were split from).</p>
 */
public final class TokenStream {
    private final List<Token> tokens = new ArrayList<>();

    public TokenStream append(Token token) {
        tokens.add(token);
        return this;
    }

    public List<Token> tokens() {
        return Collections.unmodifiableList(tokens);
    }

    public int size() {
        return tokens.size();
    }

    public boolean isEmpty() {
        return tokens.isEmpty();
    }

    @Override
    public String toString() {
        StringBuilder sb = new StringBuilder();
        Token previous = null;
        for (Token token : tokens) {
            if (previous != null && !joins(previous, token)) {
                sb.append(' ');
            }
            sb.append(token.lexeme());
            previous = token;
        }
        return sb.toString();
    }

    // Source-adjacent tokens are written together only when the joined text lexes back to
    // the same pair, or to the compound token a split pair came from (> > to >>).
    private static boolean joins(Token previous, Token next) {
        if (!previous.isJointWith(next)) {
            return false;
        }
        List<Token> relexed;
        try {
            relexed = Lexer.tokenize(previous.lexeme() + next.lexeme());
        } catch (LexException e) {
            return false;
        }
        if (relexed.size() == 3) {
            return relexed.get(0).equals(previous) && relexed.get(1).equals(next);
        }
        return relexed.size() == 2 && isSplitPair(previous, next, relexed.get(0));
    }

    private static boolean isSplitPair(Token previous, Token next, Token joined) {
        return previous.lexeme().length() == 1 && next.lexeme().length() == 1
            && (joined.is(TokenType.SHR) || joined.is(TokenType.GE) || joined.is(TokenType.AND_AND));
    }
}
