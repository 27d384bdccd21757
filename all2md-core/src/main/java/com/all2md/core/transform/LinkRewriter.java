package com.all2md.core.transform;

import com.all2md.core.ast.Image;
import com.all2md.core.ast.Link;
import com.all2md.core.ast.Node;
import com.all2md.core.util.UrlSafety;

import java.util.Objects;
import java.util.Optional;
import java.util.function.UnaryOperator;

/**
 * Rewrites the URL of every {@link Link} and {@link Image}.
 *
 * <p>Rewritten URLs are screened with {@link UrlSafety} unless validation is disabled. Image
 * URLs may be {@code data:image/...} URIs; link URLs may not.
 */
public class LinkRewriter extends NodeTransformer {

    private final UnaryOperator<String> rewrite;
    private final boolean validateUrls;

    public LinkRewriter(UnaryOperator<String> rewrite) {
        this(rewrite, true);
    }

    public LinkRewriter(UnaryOperator<String> rewrite, boolean validateUrls) {
        this.rewrite = Objects.requireNonNull(rewrite, "rewrite must not be null");
        this.validateUrls = validateUrls;
    }

    @Override
    public Node visitLink(Link node) {
        Link rebuilt = (Link) visitDefault(node);
        return rebuilt.withUrl(rewriteUrl(node.url(), false));
    }

    @Override
    public Node visitImage(Image node) {
        return node.withUrl(rewriteUrl(node.url(), true));
    }

    private String rewriteUrl(String url, boolean image) {
        String rewritten = rewrite.apply(url);
        if (validateUrls) {
            Optional<String> problem = UrlSafety.check(rewritten, image);
            if (problem.isPresent()) {
                throw new IllegalArgumentException("Rewritten URL rejected: " + problem.get());
            }
        }
        return rewritten;
    }
}
