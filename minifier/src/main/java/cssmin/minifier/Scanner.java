package cssmin.minifier;

import static cssmin.minifier.Token.Kind.*;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;

import lombok.NonNull;
import lombok.RequiredArgsConstructor;

/**
 * Splits CSS source into tokens, one token per call to {@link #next()}.
 * <p>
 * The scan is forward-only: once a token has been handed out it cannot be
 * scanned again. Create a new scanner to start over.
 */
@RequiredArgsConstructor
public final class Scanner implements Iterator<Token> {

    private static final String WHITESPACE_TEXT = " ";

    private final @NonNull String source;

    private int start = 0;
    private int current = 0;

    /**
     * Drains the remaining tokens into a list.
     */
    public List<Token> getTokens() {
        var tokens = new ArrayList<Token>();
        while (hasNext()) {
            tokens.add(next());
        }
        return tokens;
    }

    @Override
    public boolean hasNext() {
        return !isAtEnd();
    }

    @Override
    public Token next() {
        if (isAtEnd()) {
            throw new NoSuchElementException("end of source");
        }
        start = current;
        return scanToken();
    }

    private boolean isAtEnd() {
        return current >= source.length();
    }

    private Token scanToken() {
        var c = advance();
        if (isWhitespace(c)) {
            while (isWhitespace(peek())) {
                advance();
            }
            return new Token(WHITESPACE, WHITESPACE_TEXT);
        }
        if (c == '"' || c == '\'') {
            return string(c);
        }
        if (c == '/' && peek() == '*') {
            return comment();
        }
        switch (c) {
        case '{':
            return token(BRACE_OPEN);
        case '}':
            return token(BRACE_CLOSE);
        case ':':
            return token(COLON);
        case ';':
            return token(SEMICOLON);
        case '(':
            return token(PAREN_OPEN);
        case ')':
            return token(PAREN_CLOSE);
        case ',':
        case '>':
        case '+':
        case '~':
            return token(OPERATOR);
        default:
            return word();
        }
    }

    private Token string(char quote) {
        while (!isAtEnd()) {
            var c = peek();
            if (c == '\\') {
                // the escaped character is taken as-is, even a quote or newline
                current = Math.min(current + 2, source.length());
            } else if (c == quote) {
                advance();
                break;
            } else if (c == '\n') {
                // unterminated, the newline belongs to whatever follows
                break;
            } else {
                advance();
            }
        }
        return token(STRING);
    }

    private Token comment() {
        var close = source.indexOf("*/", start + 2);
        current = close < 0 ? source.length() : close + 2;
        return token(COMMENT);
    }

    private Token word() {
        while (!isAtEnd() && !endsWord(peek(), peekNext())) {
            advance();
        }
        return token(WORD);
    }

    private static boolean endsWord(char c, char next) {
        if (isWhitespace(c)) {
            return true;
        }
        switch (c) {
        case '"':
        case '\'':
        case '{':
        case '}':
        case '(':
        case ')':
        case ':':
        case ';':
        case ',':
        case '>':
        case '+':
        case '~':
            return true;
        case '/':
            return next == '*';
        default:
            return false;
        }
    }

    /**
     * Space, tab, line feed, carriage return and form feed.
     */
    static boolean isWhitespace(char c) {
        switch (c) {
        case ' ':
        case '\t':
        case '\n':
        case '\r':
        case '\f':
            return true;
        default:
            return false;
        }
    }

    private char advance() {
        return source.charAt(current++);
    }

    private char peek() {
        if (isAtEnd()) {
            return '\0';
        }
        return source.charAt(current);
    }

    private char peekNext() {
        if (current + 1 >= source.length()) {
            return '\0';
        }
        return source.charAt(current + 1);
    }

    private Token token(Token.Kind kind) {
        return new Token(kind, source.substring(start, current));
    }
}
