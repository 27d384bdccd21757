package com.all2md.core.transform;

import com.all2md.core.ast.Document;
import com.all2md.core.ast.Heading;
import com.all2md.core.ast.Paragraph;
import com.all2md.core.ast.Text;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.regex.PatternSyntaxException;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link TextReplacer}.
 */
class TextReplacerTest {

    @Test
    void transform_withLiteralPattern_replacesEverywhere() {
        Document document = new Document(List.of(new Heading(1, "Foo guide"), new Paragraph("use foo.bar and foo.bar")));

        Document result = new TextReplacer("foo.bar", "$x").transformDocument(document);

        assertThat(Transforms.extractNodes(result, Text.class)).extracting(Text::content)
            .containsExactly("Foo guide", "use $x and $x");
    }

    @Test
    void transform_withRegex_supportsGroupReferences() {
        Document document = new Document(List.of(new Paragraph("version 1.2")));

        Document result = new TextReplacer("(\\d+)\\.(\\d+)", "$2.$1", true).transformDocument(document);

        assertThat(Transforms.extractNodes(result, Text.class)).extracting(Text::content)
            .containsExactly("version 2.1");
    }

    @Test
    void visitText_withoutMatch_returnsSameInstance() {
        Text text = new Text("nothing here");

        assertThat(new TextReplacer("zzz", "y").visitText(text)).isSameAs(text);
    }

    @Test
    void constructor_withEmptyPattern_throwsException() {
        assertThatThrownBy(() -> new TextReplacer("", "x"))
            .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void constructor_withInvalidRegex_throwsPatternSyntaxException() {
        assertThatThrownBy(() -> new TextReplacer("(", "x", true))
            .isInstanceOf(PatternSyntaxException.class);
    }
}
