package com.all2md.core.visitor;

import com.all2md.core.ast.BlockQuote;
import com.all2md.core.ast.Document;
import com.all2md.core.ast.Heading;
import com.all2md.core.ast.Inline;
import com.all2md.core.ast.Link;
import com.all2md.core.ast.ListBlock;
import com.all2md.core.ast.ListItem;
import com.all2md.core.ast.Node;
import com.all2md.core.ast.Paragraph;
import com.all2md.core.ast.Text;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.*;

/**
 * Tests for {@link NodeCollector}.
 */
class NodeCollectorTest {

    private static Document document() {
        return new Document(List.of(
            new Heading(1, "Top"),
            new BlockQuote(List.of(new Heading(2, "Quoted"))),
            new ListBlock(false, List.of(new ListItem(List.of(new Paragraph(List.<Inline>of(
                new Link("#top", List.of(new Text("back")))))))))));
    }

    @Test
    void collect_byType_findsNestedNodesInDocumentOrder() {
        List<Heading> headings = NodeCollector.collect(document(), Heading.class);

        assertThat(headings).extracting(Heading::level).containsExactly(1, 2);
    }

    @Test
    void collect_byPredicate_includesRootWhenItMatches() {
        List<Node> nodes = NodeCollector.collect(document(), node -> true);

        assertThat(nodes.get(0)).isInstanceOf(Document.class);
        assertThat(nodes).hasSize(11);
    }

    @Test
    void collect_byType_findsInlineNodesInsideLists() {
        List<Link> links = NodeCollector.collect(document(), Link.class);

        assertThat(links).extracting(Link::url).containsExactly("#top");
    }

    @Test
    void collect_withNoMatches_returnsEmptyList() {
        assertThat(NodeCollector.collect(new Document(List.of()), Text.class)).isEmpty();
    }
}
