package org.dxworks.blockgrid.model;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Immutable registry of the tokens a user can place, keyed by catalog id
 * (for example {@code var-x} or {@code op-assign}).
 *
 * - Passed explicitly to whoever builds structures; there is no global instance.
 * - Not consulted by the parser or the evaluator, which only look at token kinds and values.
 */
public final class TokenCatalog {

    private static final TokenCatalog STANDARD = new Builder()
            .add("var-x", Token.variable("x"))
            .add("var-y", Token.variable("y"))
            .add("var-p", Token.variable("p"))
            .add("num-0", Token.number("0"))
            .add("num-1", Token.number("1"))
            .add("num-2", Token.number("2"))
            .add("num-3", Token.number("3"))
            .add("num-4", Token.number("4"))
            .add("op-assign", Token.operator("="))
            .add("op-equals", Token.operator("=="))
            .add("op-not-equals", Token.operator("!="))
            .add("op-less", Token.operator("<"))
            .add("op-greater", Token.operator(">"))
            .add("op-less-equal", Token.operator("<="))
            .add("op-greater-equal", Token.operator(">="))
            .add("color-red", Token.color("red"))
            .add("color-blue", Token.color("blue"))
            .add("color-green", Token.color("green"))
            .add("color-yellow", Token.color("yellow"))
            .add("color-purple", Token.color("purple"))
            .add("ctrl-if", Token.control("if"))
            .add("ctrl-else", Token.control("else"))
            .build();

    private final Map<String, Token> tokensById;
    private final AtomicLong placements = new AtomicLong();

    private TokenCatalog(Map<String, Token> tokensById) {
        this.tokensById = Collections.unmodifiableMap(new LinkedHashMap<>(tokensById));
    }

    /**
     * The toolbox the editor ships with: three variables, digits 0-4,
     * assignment and the six comparisons, five colors, if/else.
     */
    public static TokenCatalog standard() {
        return STANDARD;
    }

    public static Builder builder() {
        return new Builder();
    }

    public Optional<Token> find(String id) {
        return Optional.ofNullable(tokensById.get(id));
    }

    public Token require(String id) {
        Token token = tokensById.get(id);
        if (token == null) {
            throw new IllegalArgumentException("Unknown catalog token: " + id);
        }
        return token;
    }

    /**
     * Returns a copy of the catalog token carrying a fresh instance id.
     */
    public Token place(String id) {
        return require(id).withInstanceId("placed-" + id + "-" + placements.incrementAndGet());
    }

    public List<String> ids() {
        return new ArrayList<>(tokensById.keySet());
    }

    public int size() {
        return tokensById.size();
    }

    public static final class Builder {
        private final Map<String, Token> tokensById = new LinkedHashMap<>();

        public Builder add(String id, Token token) {
            Objects.requireNonNull(id, "id");
            Objects.requireNonNull(token, "token");
            if (tokensById.putIfAbsent(id, token) != null) {
                throw new IllegalArgumentException("Duplicate catalog id: " + id);
            }
            return this;
        }

        public TokenCatalog build() {
            return new TokenCatalog(tokensById);
        }
    }
}
