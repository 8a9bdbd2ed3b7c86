package org.tensorlatex.compiler.frontend.lexer;

import org.tensorlatex.compiler.diagnostics.LexException;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.List;
import java.util.NoSuchElementException;
import java.util.regex.Matcher;

/**
 * The Lexer (also known as Tokenizer or Scanner) is responsible for converting
 * a LaTeX sentence into a sequence of tokens.
 * <p>
 * Tokens are produced lazily: {@link #tokenize()} matches one token per call to
 * {@code next()}, so an error late in a sentence only surfaces once the parser gets there.
 * The stream is restarted by {@link #initialize(String)}.
 */
public class Lexer {

    private final TokenPatternRegistry registry;
    private String sentence;
    private int current;
    private boolean finished;

    /**
     * Creates a new Lexer for the built-in dialect.
     * @param sentence The sentence to tokenize.
     */
    public Lexer(String sentence) {
        this(sentence, TokenPatternRegistry.defaults());
    }

    /**
     * Creates a new Lexer with a custom pattern registry.
     * @param sentence The sentence to tokenize.
     * @param registry The ordered token patterns.
     */
    public Lexer(String sentence, TokenPatternRegistry registry) {
        this.registry = registry;
        initialize(sentence);
    }

    /**
     * Buffers a new sentence and resets the position.
     * @param sentence The sentence to tokenize.
     */
    public void initialize(String sentence) {
        this.sentence = sentence;
        this.current = 0;
        this.finished = false;
    }

    public String sentence() {
        return sentence;
    }

    /**
     * Returns the lazy token stream. Skipped tokens (whitespace, sizing commands) are consumed
     * but not returned; the last token is always {@link TokenType#END_OF_INPUT}.
     * @return An iterator over the remaining tokens.
     * @throws LexException from {@code next()} if no pattern matches at the current position.
     */
    public Iterator<Token> tokenize() {
        return new Iterator<>() {
            @Override
            public boolean hasNext() {
                return !finished;
            }

            @Override
            public Token next() {
                if (finished) {
                    throw new NoSuchElementException("Token stream exhausted");
                }
                return nextToken();
            }
        };
    }

    /**
     * Performs the tokenization of the entire remaining sentence.
     * @return A list of the recognized tokens, ending with {@link TokenType#END_OF_INPUT}.
     */
    public List<Token> scanTokens() {
        List<Token> tokens = new ArrayList<>();
        tokenize().forEachRemaining(tokens::add);
        return tokens;
    }

    /**
     * Skips the character that caused the last {@link LexException}, so tokenizing can go on.
     */
    public void recover() {
        if (current < sentence.length()) {
            current++;
        }
    }

    private Token nextToken() {
        while (current < sentence.length()) {
            Token token = match();
            current = token.end();
            if (!token.type().isSkipped()) {
                return token;
            }
        }
        finished = true;
        return new Token(TokenType.END_OF_INPUT, "", sentence.length());
    }

    private Token match() {
        for (TokenPatternRegistry.TokenPattern candidate : registry.patterns()) {
            Matcher matcher = candidate.pattern().matcher(sentence);
            matcher.region(current, sentence.length());
            matcher.useTransparentBounds(true);
            if (matcher.lookingAt() && matcher.end() > current) {
                return new Token(candidate.type(), matcher.group(), current);
            }
        }
        throw new LexException(String.format("unexpected character '%c' at position %d", sentence.charAt(current), current),
                sentence, current);
    }
}
