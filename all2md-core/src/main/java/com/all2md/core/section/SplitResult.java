package com.all2md.core.section;

import com.all2md.core.ast.Document;
import com.all2md.core.util.Slugs;

/**
 * One piece of a split document.
 *
 * @param document the piece
 * @param index 1-based position among the pieces
 * @param title heading text, "Preamble" or "Part N"; null when the piece has no natural title
 * @param wordCount approximate word count of the piece
 */
public record SplitResult(Document document, int index, String title, int wordCount) {

    private static final int MAX_SLUG_LENGTH = 100;

    /**
     * @return filesystem-safe slug of the title, or an empty string when there is no title
     */
    public String filenameSlug() {
        return filenameSlug(MAX_SLUG_LENGTH, Slugs.DEFAULT_SEPARATOR);
    }

    /**
     * @param maxLength maximum slug length; zero or negative uses the default of 100
     * @param separator word separator
     * @return filesystem-safe slug of the title, or an empty string when there is no title
     */
    public String filenameSlug(int maxLength, String separator) {
        if (title == null || title.isBlank()) {
            return "";
        }
        return Slugs.slugify(title, null, maxLength > 0 ? maxLength : MAX_SLUG_LENGTH, separator);
    }
}
