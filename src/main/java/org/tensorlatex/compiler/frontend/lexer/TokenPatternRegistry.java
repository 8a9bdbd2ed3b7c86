package org.tensorlatex.compiler.frontend.lexer;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Pattern;

/**
 * The ordered list of regular expressions the {@link Lexer} tries at each position.
 * <p>
 * Precedence: patterns are tried in registry order and the first one that matches wins.
 * Commands and keywords end in {@code (?![a-zA-Z])}, so a command never matches a prefix of a
 * longer one ({@code \sin} does not match inside {@code \sinh}). Order therefore only matters
 * between patterns that can match the very same text, e.g. the {@code \frac{1}{2}} rational
 * literal before the general {@code \frac} command, or {@code \pi} before the Greek letters.
 */
public class TokenPatternRegistry {

    private static final String WORD_END = "(?![a-zA-Z])";

    private static final String GREEK = "alpha|beta|gamma|delta|epsilon|varepsilon|zeta|eta|theta|vartheta|iota|kappa"
            + "|lambda|mu|nu|xi|omicron|pi|rho|sigma|tau|upsilon|phi|varphi|chi|psi|omega"
            + "|Gamma|Delta|Theta|Lambda|Xi|Pi|Sigma|Upsilon|Phi|Psi|Omega";

    /**
     * One entry of the registry.
     *
     * @param type    The token type produced on a match.
     * @param pattern The compiled pattern.
     */
    public record TokenPattern(TokenType type, Pattern pattern) {
    }

    private final List<TokenPattern> patterns = new ArrayList<>();

    /**
     * Appends a pattern with the lowest precedence so far.
     * @param type  The token type.
     * @param regex The regular expression.
     * @return This registry.
     */
    public TokenPatternRegistry register(TokenType type, String regex) {
        patterns.add(new TokenPattern(type, Pattern.compile(regex)));
        return this;
    }

    /**
     * Inserts a pattern directly before the first pattern of an existing type, without
     * changing any existing pattern.
     * @param existing The type whose first pattern the new one must precede.
     * @param type     The token type of the new pattern.
     * @param regex    The regular expression.
     * @return This registry.
     * @throws IllegalArgumentException if no pattern of type {@code existing} is registered.
     */
    public TokenPatternRegistry registerBefore(TokenType existing, TokenType type, String regex) {
        for (int i = 0; i < patterns.size(); i++) {
            if (patterns.get(i).type() == existing) {
                patterns.add(i, new TokenPattern(type, Pattern.compile(regex)));
                return this;
            }
        }
        throw new IllegalArgumentException("No pattern registered for " + existing);
    }

    public List<TokenPattern> patterns() {
        return Collections.unmodifiableList(patterns);
    }

    /**
     * Creates the registry with the built-in LaTeX dialect.
     * @return A new, independent registry.
     */
    public static TokenPatternRegistry defaults() {
        TokenPatternRegistry registry = new TokenPatternRegistry();
        registry.register(TokenType.SPACE, "(?:\\s|\\\\,|\\{\\}|&)+");
        registry.register(TokenType.SIZED_DELIMITER, "\\\\(?:[bB]igl|[bB]igr|left|right)" + WORD_END);
        registry.register(TokenType.RATIONAL, "[0-9]+/[1-9][0-9]*|\\\\frac\\{[0-9]+\\}\\{[1-9][0-9]*\\}");
        registry.register(TokenType.DECIMAL, "[0-9]+\\.[0-9]+");
        registry.register(TokenType.INTEGER, "[0-9]+");
        registry.register(TokenType.NABLA, "\\\\nabla" + WORD_END);
        registry.register(TokenType.PI, "\\\\pi" + WORD_END);
        registry.register(TokenType.EULER, "e");
        registry.register(TokenType.PLUS, "\\+");
        registry.register(TokenType.MINUS, "-");
        registry.register(TokenType.DIVIDE, "/");
        registry.register(TokenType.EQUAL, "=");
        registry.register(TokenType.CARET, "\\^");
        registry.register(TokenType.COMMA, ",");
        registry.register(TokenType.COLON, ":");
        registry.register(TokenType.COMMENT, "%");
        registry.register(TokenType.LEFT_PAREN, "\\(");
        registry.register(TokenType.RIGHT_PAREN, "\\)");
        registry.register(TokenType.LEFT_BRACE, "\\{");
        registry.register(TokenType.RIGHT_BRACE, "\\}");
        registry.register(TokenType.LEFT_BRACKET, "\\[");
        registry.register(TokenType.RIGHT_BRACKET, "\\]");
        registry.register(TokenType.LINE_BREAK, ";|\\\\\\\\|\\\\cr" + WORD_END);
        registry.register(TokenType.BEGIN_ALIGN, "\\\\begin\\{align\\*?\\}");
        registry.register(TokenType.END_ALIGN, "\\\\end\\{align\\*?\\}");
        registry.register(TokenType.PARTIAL, "\\\\partial" + WORD_END);
        registry.register(TokenType.SQRT_CMD, "\\\\sqrt" + WORD_END);
        registry.register(TokenType.FRAC_CMD, "\\\\frac" + WORD_END);
        registry.register(TokenType.TRIG_CMD, "\\\\(?:sinh|cosh|tanh|sin|cos|tan)" + WORD_END);
        registry.register(TokenType.NLOG_CMD, "\\\\(?:ln|log)" + WORD_END);
        registry.register(TokenType.VPHANTOM, "\\\\vphantom" + WORD_END);
        registry.register(TokenType.DEFINE_MACRO, "define" + WORD_END);
        registry.register(TokenType.UPDATE_MACRO, "(?:update|assign)" + WORD_END);
        registry.register(TokenType.PARSE_MACRO, "parse" + WORD_END);
        registry.register(TokenType.INDEX_KWRD, "index" + WORD_END);
        registry.register(TokenType.BASIS_KWRD, "basis" + WORD_END);
        registry.register(TokenType.DERIV_KWRD, "deriv" + WORD_END);
        registry.register(TokenType.DERIV_TYPE, "symbolic" + WORD_END);
        registry.register(TokenType.UNDERSCORE, "_");
        registry.register(TokenType.DIACRITIC, "\\\\(?:hat|tilde|bar)" + WORD_END);
        registry.register(TokenType.SYMMETRY,
                "(?:const|metric|permutation|kronecker|nosym|(?:sym|anti)[0-9]+(?:_(?:sym|anti)[0-9]+)*)" + WORD_END);
        registry.register(TokenType.MATHOP, "\\\\mathop" + WORD_END);
        registry.register(TokenType.LETTER, "[a-zA-Z]|\\\\(?:" + GREEK + ")" + WORD_END);
        registry.register(TokenType.COMMAND, "\\\\[a-zA-Z]+");
        return registry;
    }
}
