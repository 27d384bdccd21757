package com.all2md.core.transform;

import com.all2md.core.ast.Node;
import com.all2md.core.ast.Text;

import java.util.Objects;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Replaces text inside every {@link Text} node. Node structure is left unchanged.
 *
 * <p>In regex mode the replacement may use group references ({@code $1}); in literal mode
 * it is inserted as-is.
 */
public class TextReplacer extends NodeTransformer {

    private final Pattern pattern;
    private final String replacement;

    public TextReplacer(String pattern, String replacement) {
        this(pattern, replacement, false);
    }

    /**
     * @param pattern text or regular expression to find, must not be empty
     * @param replacement replacement text
     * @param useRegex whether {@code pattern} is a regular expression
     * @throws java.util.regex.PatternSyntaxException if {@code useRegex} is set and the pattern is invalid
     */
    public TextReplacer(String pattern, String replacement, boolean useRegex) {
        Objects.requireNonNull(pattern, "pattern must not be null");
        Objects.requireNonNull(replacement, "replacement must not be null");
        if (pattern.isEmpty()) {
            throw new IllegalArgumentException("pattern must not be empty");
        }
        this.pattern = useRegex ? Pattern.compile(pattern) : Pattern.compile(Pattern.quote(pattern));
        this.replacement = useRegex ? replacement : Matcher.quoteReplacement(replacement);
    }

    @Override
    public Node visitText(Text node) {
        String replaced = pattern.matcher(node.content()).replaceAll(replacement);
        return replaced.equals(node.content()) ? node : node.withContent(replaced);
    }
}
