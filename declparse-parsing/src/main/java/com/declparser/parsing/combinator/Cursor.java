package com.declparser.parsing.combinator;

import com.declparser.Token;
import com.declparser.TokenType;

import java.util.ArrayList;
import java.util.List;

/**
 * An immutable position in a token list. Advancing returns a new cursor, so any
 * earlier cursor is a free checkpoint to backtrack to.
 */
public final class Cursor {
    private final List<Token> tokens;
    private final int index;
    private final Token pending; // second half of a split token, read before tokens[index]
    private final int depth;
    private final int maxDepth;

    private Cursor(List<Token> tokens, int index, Token pending, int depth, int maxDepth) {
        this.tokens = tokens;
        this.index = index;
        this.pending = pending;
        this.depth = depth;
        this.maxDepth = maxDepth;
    }

    /**
     * Starts at the first token. An EOF token is appended if the list does not end with one.
     */
    public static Cursor of(List<Token> tokens, int maxDepth) {
        List<Token> list = tokens;
        if (list.isEmpty() || !list.get(list.size() - 1).is(TokenType.EOF)) {
            list = new ArrayList<>(tokens);
            int end = tokens.isEmpty() ? 0 : tokens.get(tokens.size() - 1).endPosition();
            list.add(new Token(TokenType.EOF, "", end, end, 0, 0));
        }
        return new Cursor(List.copyOf(list), 0, null, 0, maxDepth);
    }

    public Token peek() {
        return pending != null ? pending : tokens.get(index);
    }

    public boolean check(TokenType type) {
        return peek().is(type);
    }

    public boolean isAtEnd() {
        return peek().is(TokenType.EOF);
    }

    public Cursor advance() {
        if (pending != null) {
            return new Cursor(tokens, index, null, depth, maxDepth);
        }
        if (isAtEnd()) {
            return this;
        }
        return new Cursor(tokens, index + 1, null, depth, maxDepth);
    }

    /**
     * Splits the current punctuation token after its first character, e.g. a {@code >>}
     * that closes two generic argument lists, and returns a cursor positioned on the
     * remainder. {@link #splitHead(TokenType)} builds the first half.
     */
    public Cursor splitTail(TokenType tail) {
        Token current = peek();
        Token second = new Token(tail, current.lexeme().substring(1),
            current.isSynthetic() ? -1 : current.position() + 1,
            current.endPosition(),
            current.line(),
            current.isSynthetic() ? 0 : current.column() + 1);
        int next = pending != null ? index : index + 1;
        return new Cursor(tokens, next, second, depth, maxDepth);
    }

    public Token splitHead(TokenType head) {
        Token current = peek();
        return new Token(head, current.lexeme().substring(0, 1),
            current.position(),
            current.isSynthetic() ? -1 : current.position() + 1,
            current.line(),
            current.column());
    }

    /**
     * Progress measure used to order failures and detect non-consuming loops.
     * A pending half-token counts as half a step past the token it came from.
     */
    public int offset() {
        return pending != null ? index * 2 - 1 : index * 2;
    }

    public int depth() {
        return depth;
    }

    public int maxDepth() {
        return maxDepth;
    }

    public Cursor withDepth(int newDepth) {
        if (newDepth == depth) {
            return this;
        }
        return new Cursor(tokens, index, pending, newDepth, maxDepth);
    }

    @Override
    public String toString() {
        return "Cursor@" + index + (pending != null ? "+" : "") + " " + peek();
    }
}
