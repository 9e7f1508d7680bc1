package com.declparser;

import java.util.ArrayList;
import java.util.List;

/**
 * Splits declaration source text into tokens. Whitespace and comments (including
 * doc comments) are dropped; the returned list always ends with an {@link TokenType#EOF} token.
 */
public class Lexer {
    private final String source;
    private final char[] buf;
    private final int length;
    private int position = 0;
    private int line = 1;
    private int lineStart = 0;

    public Lexer(String source) {
        this.source = source;
        this.buf = source.toCharArray();
        this.length = buf.length;
    }

    public static List<Token> tokenize(String source) {
        return new Lexer(source).tokenize();
    }

    public List<Token> tokenize() {
        List<Token> tokens = new ArrayList<>();
        while (true) {
            skipTrivia();
            if (position >= length) {
                tokens.add(new Token(TokenType.EOF, "", position, position, line, position - lineStart));
                return tokens;
            }
            tokens.add(nextToken());
        }
    }

    private void skipTrivia() {
        while (position < length) {
            char ch = buf[position];
            if (ch == '\n') {
                position++;
                line++;
                lineStart = position;
            } else if (Character.isWhitespace(ch)) {
                position++;
            } else if (ch == '/' && peekAt(1) == '/') {
                while (position < length && buf[position] != '\n') {
                    position++;
                }
            } else if (ch == '/' && peekAt(1) == '*') {
                skipBlockComment();
            } else {
                return;
            }
        }
    }

    // Block comments nest
    private void skipBlockComment() {
        int startPos = position;
        int startLine = line;
        int startCol = position - lineStart;
        int depth = 0;
        while (position < length) {
            if (buf[position] == '/' && peekAt(1) == '*') {
                depth++;
                position += 2;
            } else if (buf[position] == '*' && peekAt(1) == '/') {
                depth--;
                position += 2;
                if (depth == 0) {
                    return;
                }
            } else {
                advanceChar();
            }
        }
        throw new LexException("Unterminated block comment", startPos, startLine, startCol);
    }

    private Token nextToken() {
        int start = position;
        int startLine = line;
        int startCol = position - lineStart;
        char ch = buf[position];

        if (ch == 'r' && peekAt(1) == '#' && isIdentStart(peekAt(2))) {
            position += 2;
            scanIdentChars();
            return make(TokenType.IDENT, start, startLine, startCol);
        }
        if (ch == 'r' && (peekAt(1) == '"' || (peekAt(1) == '#' && (peekAt(2) == '"' || peekAt(2) == '#')))) {
            position++;
            scanRawString(start, startLine, startCol);
            return make(TokenType.STRING, start, startLine, startCol);
        }
        if (ch == 'b' && peekAt(1) == 'r' && (peekAt(2) == '"' || peekAt(2) == '#')) {
            position += 2;
            scanRawString(start, startLine, startCol);
            return make(TokenType.STRING, start, startLine, startCol);
        }
        if (ch == 'b' && peekAt(1) == '"') {
            position++;
            scanString(start, startLine, startCol);
            return make(TokenType.STRING, start, startLine, startCol);
        }
        if (ch == 'b' && peekAt(1) == '\'') {
            position++;
            scanChar(start, startLine, startCol);
            return make(TokenType.CHAR, start, startLine, startCol);
        }
        if (isIdentStart(ch)) {
            scanIdentChars();
            String word = source.substring(start, position);
            TokenType keyword = TokenType.keyword(word);
            return make(keyword != null ? keyword : TokenType.IDENT, start, startLine, startCol);
        }
        if (Character.isDigit(ch)) {
            return scanNumber(start, startLine, startCol);
        }
        if (ch == '"') {
            scanString(start, startLine, startCol);
            return make(TokenType.STRING, start, startLine, startCol);
        }
        if (ch == '\'') {
            // 'a is a lifetime, 'a' is a char literal
            if (isIdentStart(peekAt(1)) && peekAt(2) != '\'') {
                position++;
                scanIdentChars();
                return make(TokenType.LIFETIME, start, startLine, startCol);
            }
            scanChar(start, startLine, startCol);
            return make(TokenType.CHAR, start, startLine, startCol);
        }
        return scanPunct(start, startLine, startCol);
    }

    private Token scanPunct(int start, int startLine, int startCol) {
        char ch = buf[position];
        char next = peekAt(1);
        TokenType type = switch (ch) {
            case ':' -> next == ':' ? TokenType.PATH_SEP : TokenType.COLON;
            case '-' -> next == '>' ? TokenType.R_ARROW : TokenType.MINUS;
            case '=' -> next == '>' ? TokenType.FAT_ARROW : next == '=' ? TokenType.EQ_EQ : TokenType.EQ;
            case '!' -> next == '=' ? TokenType.NE : TokenType.BANG;
            case '<' -> next == '=' ? TokenType.LE : next == '<' ? TokenType.SHL : TokenType.LT;
            case '>' -> next == '=' ? TokenType.GE : next == '>' ? TokenType.SHR : TokenType.GT;
            case '&' -> next == '&' ? TokenType.AND_AND : TokenType.AND;
            case '|' -> next == '|' ? TokenType.OR_OR : TokenType.OR;
            case '.' -> next == '.' ? TokenType.DOT_DOT : TokenType.DOT;
            case '+' -> TokenType.PLUS;
            case '*' -> TokenType.STAR;
            case '/' -> TokenType.SLASH;
            case '%' -> TokenType.PERCENT;
            case '^' -> TokenType.CARET;
            case ',' -> TokenType.COMMA;
            case ';' -> TokenType.SEMI;
            case '#' -> TokenType.POUND;
            case '$' -> TokenType.DOLLAR;
            case '?' -> TokenType.QUESTION;
            case '@' -> TokenType.AT;
            case '~' -> TokenType.TILDE;
            case '(' -> TokenType.LPAREN;
            case ')' -> TokenType.RPAREN;
            case '{' -> TokenType.LBRACE;
            case '}' -> TokenType.RBRACE;
            case '[' -> TokenType.LBRACKET;
            case ']' -> TokenType.RBRACKET;
            default -> throw new LexException("Unexpected character '" + ch + "'", start, startLine, startCol);
        };
        position += type.lexeme().length();
        return make(type, start, startLine, startCol);
    }

    private Token scanNumber(int start, int startLine, int startCol) {
        boolean isFloat = false;
        if (buf[position] == '0' && (peekAt(1) == 'x' || peekAt(1) == 'o' || peekAt(1) == 'b')) {
            position += 2;
            while (position < length && (isHexDigit(buf[position]) || buf[position] == '_')) {
                position++;
            }
        } else {
            scanDigits();
            // 1.5 is a float, 1..2 and 1.foo are not
            if (position < length && buf[position] == '.' && peekAt(1) != '.' && !isIdentStart(peekAt(1))) {
                isFloat = true;
                position++;
                scanDigits();
            }
            if (position < length && (buf[position] == 'e' || buf[position] == 'E')) {
                char afterE = peekAt(1);
                int signOffset = (afterE == '+' || afterE == '-') ? 2 : 1;
                if (Character.isDigit(peekAt(signOffset))) {
                    isFloat = true;
                    position += signOffset;
                    scanDigits();
                }
            }
        }
        int suffixStart = position;
        if (position < length && isIdentStart(buf[position])) {
            scanIdentChars();
        }
        String suffix = source.substring(suffixStart, position);
        if (suffix.equals("f32") || suffix.equals("f64")) {
            isFloat = true;
        }
        return make(isFloat ? TokenType.FLOAT : TokenType.INTEGER, start, startLine, startCol);
    }

    private void scanDigits() {
        while (position < length && (Character.isDigit(buf[position]) || buf[position] == '_')) {
            position++;
        }
    }

    private void scanString(int start, int startLine, int startCol) {
        position++; // opening quote
        while (position < length && buf[position] != '"') {
            if (buf[position] == '\\') {
                position++;
                if (position >= length) {
                    break;
                }
            }
            advanceChar();
        }
        if (position >= length) {
            throw new LexException("Unterminated string literal", start, startLine, startCol);
        }
        position++; // closing quote
        scanSuffix();
    }

    // Positioned on the '#'s or quote following the r / br prefix
    private void scanRawString(int start, int startLine, int startCol) {
        int hashes = 0;
        while (position < length && buf[position] == '#') {
            hashes++;
            position++;
        }
        if (position >= length || buf[position] != '"') {
            throw new LexException("Expected '\"' in raw string literal", start, startLine, startCol);
        }
        position++;
        while (position < length) {
            if (buf[position] == '"' && closesRawString(hashes)) {
                position += 1 + hashes;
                scanSuffix();
                return;
            }
            advanceChar();
        }
        throw new LexException("Unterminated raw string literal", start, startLine, startCol);
    }

    private boolean closesRawString(int hashes) {
        for (int i = 1; i <= hashes; i++) {
            if (peekAt(i) != '#') {
                return false;
            }
        }
        return true;
    }

    private void scanChar(int start, int startLine, int startCol) {
        position++; // opening quote
        if (position < length && buf[position] == '\\') {
            position++;
            if (position < length && buf[position] == 'u' && peekAt(1) == '{') {
                while (position < length && buf[position] != '}') {
                    position++;
                }
            }
            position++;
        } else if (position < length) {
            position += Character.charCount(source.codePointAt(position));
        }
        if (position >= length || buf[position] != '\'') {
            throw new LexException("Unterminated character literal", start, startLine, startCol);
        }
        position++;
        scanSuffix();
    }

    private void scanSuffix() {
        if (position < length && isIdentStart(buf[position])) {
            scanIdentChars();
        }
    }

    private void scanIdentChars() {
        while (position < length && isIdentPart(buf[position])) {
            position++;
        }
    }

    private void advanceChar() {
        if (buf[position] == '\n') {
            line++;
            lineStart = position + 1;
        }
        position++;
    }

    private char peekAt(int offset) {
        int pos = position + offset;
        return pos < length ? buf[pos] : '\0';
    }

    private Token make(TokenType type, int start, int startLine, int startCol) {
        return new Token(type, source.substring(start, position), start, position, startLine, startCol);
    }

    private static boolean isIdentStart(char ch) {
        return ch == '_' || Character.isLetter(ch);
    }

    private static boolean isIdentPart(char ch) {
        return ch == '_' || Character.isLetterOrDigit(ch);
    }

    private static boolean isHexDigit(char ch) {
        return Character.digit(ch, 16) >= 0;
    }
}
