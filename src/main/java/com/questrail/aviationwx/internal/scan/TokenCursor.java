package com.questrail.aviationwx.internal.scan;

import java.util.List;
import java.util.NoSuchElementException;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Forward-only read position over a scanned token list.
 *
 * <p>A cursor belongs to a single decode call and is never shared.</p>
 */
public final class TokenCursor
{
    private final List<ReportToken> tokens;
    private int index;

    public TokenCursor(List<ReportToken> tokens) {
        this.tokens = List.copyOf(Objects.requireNonNull(tokens, "tokens"));
    }

    public boolean hasNext() {
        return index < tokens.size();
    }

    /**
     * Returns {@code true} if at least {@code count} tokens remain.
     */
    public boolean hasNext(int count) {
        return index + count <= tokens.size();
    }

    /**
     * Returns the next token without consuming it.
     *
     * @throws NoSuchElementException if the input is exhausted
     */
    public ReportToken peek() {
        return peek(0);
    }

    /**
     * Returns the token {@code offset} positions ahead without consuming anything.
     */
    public ReportToken peek(int offset) {
        int at = index + offset;
        if (at >= tokens.size()) {
            throw new NoSuchElementException("No token at offset " + offset);
        }
        return tokens.get(at);
    }

    /**
     * Returns {@code true} if a token exists {@code offset} positions ahead and has the given shape.
     */
    public boolean nextMatches(int offset, TokenShape shape) {
        int at = index + offset;
        return at < tokens.size() && tokens.get(at).matches(shape);
    }

    public boolean nextMatches(TokenShape shape) {
        return nextMatches(0, shape);
    }

    public ReportToken next() {
        ReportToken token = peek();
        index++;
        return token;
    }

    /**
     * Consumes and joins every remaining token with single spaces.
     */
    public String drainText() {
        String rest = tokens.subList(index, tokens.size()).stream()
                .map(ReportToken::text)
                .collect(Collectors.joining(" "));
        index = tokens.size();
        return rest;
    }
}
