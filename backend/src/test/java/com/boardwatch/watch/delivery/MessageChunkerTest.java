package com.boardwatch.watch.delivery;

import com.boardwatch.watch.model.Article;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class MessageChunkerTest {
    private final MessageChunker chunker = new MessageChunker();

    @Test
    void emptyInputProducesSingleNoResultsMessage() {
        List<String> messages = chunker.chunk(List.of(), "Stock");

        assertThat(messages).containsExactly("📋 No matching articles for *Stock*");
    }

    @Test
    void fewArticlesFitInOneMessageWithHeader() {
        List<Article> articles = List.of(
            article("[新聞] first", "alice"),
            article("[心得] second", "bob")
        );

        List<String> messages = chunker.chunk(articles, "Stock");

        assertThat(messages).hasSize(1);
        String message = messages.get(0);
        assertThat(message).startsWith("📋 *Stock* latest posts (2)");
        assertThat(message).contains("1. \\[*新聞] first*", "2. \\[*心得] second*", "👤 alice", "🔗 https://www.ptt.cc/bbs/Stock/");
        assertThat(message.indexOf("first")).isLessThan(message.indexOf("second"));
    }

    @Test
    void manyArticlesAreSplitWithinLimitAndKeepOrder() {
        List<Article> articles = new ArrayList<>();
        for (int i = 0; i < 100; i++) {
            articles.add(article("Article number " + i + " " + "x".repeat(150), "author" + i));
        }

        List<String> messages = chunker.chunk(articles, "Stock");

        assertThat(messages.size()).isGreaterThan(1);
        assertThat(messages).allSatisfy(message -> assertThat(message.length()).isLessThanOrEqualTo(MessageChunker.MAX_MESSAGE_LENGTH));
        assertThat(messages.get(1)).startsWith("📋 *Stock* latest posts (continued)");

        String joined = String.join("\n", messages);
        int previous = -1;
        for (int i = 0; i < 100; i++) {
            int position = joined.indexOf("Article number " + i + " ");
            assertThat(position).isGreaterThan(previous);
            previous = position;
        }
    }

    @Test
    void oversizedTitleIsTruncatedSoEntryStillFits() {
        Article huge = article("y".repeat(10_000), "alice");

        List<String> messages = chunker.chunk(List.of(huge), "Stock");

        assertThat(messages).hasSize(1);
        assertThat(messages.get(0).length()).isLessThanOrEqualTo(MessageChunker.MAX_MESSAGE_LENGTH);
        assertThat(messages.get(0)).contains("…");
    }

    @Test
    void controlCharactersInTitlesStayOutsideBoldSpans() {
        Article article = new Article("[新聞] 台積電 2*2=4", "user_1", "5/01", "https://www.ptt.cc/bbs/C_Chat/M.1.A.html", "C_Chat");

        String message = chunker.chunk(List.of(article), "C_Chat").get(0);

        assertThat(message).startsWith("📋 *C*\\_*Chat* latest posts (1)");
        assertThat(message).contains("1. \\[*新聞] 台積電 2*\\**2=4*");
        assertThat(message).contains("👤 user\\_1");
        assertThat(message).contains("🔗 https://www.ptt.cc/bbs/C\\_Chat/M.1.A.html");
        assertWellFormedBold(message);
    }

    @Test
    void boldSpansNeverContainEscapesOrOnlyWhitespace() {
        assertThat(MessageChunker.bold("a_b *c* [d] `e`")).isEqualTo("*a*\\_*b *\\**c*\\* \\[*d] *\\`*e*\\`");
        assertThat(MessageChunker.bold("**")).isEqualTo("\\*\\*");
        assertThat(MessageChunker.bold("plain")).isEqualTo("*plain*");
        assertThat(MessageChunker.bold(null)).isEmpty();
        assertThat(MessageChunker.escape("a_b [c]")).isEqualTo("a\\_b \\[c]");
        assertThat(MessageChunker.escape(null)).isEmpty();
    }

    @Test
    void truncatedTitleKeepsMarkupBalanced() {
        Article article = article("*".repeat(299) + "tail that gets cut", "alice");

        String message = chunker.chunk(List.of(article), "Stock").get(0);

        assertThat(message.length()).isLessThanOrEqualTo(MessageChunker.MAX_MESSAGE_LENGTH);
        assertWellFormedBold(message);
    }

    // Drops escaped characters, then every remaining '*' must pair up with no backslash between.
    private static void assertWellFormedBold(String message) {
        String unescaped = message.replaceAll("\\\\[_*`\\[]", "");
        long asterisks = unescaped.chars().filter(c -> c == '*').count();
        assertThat(asterisks % 2).isZero();
        assertThat(unescaped).doesNotContain("\\");
    }

    private static Article article(String title, String author) {
        return new Article(title, author, "5/01", "https://www.ptt.cc/bbs/Stock/M.1.A.html", "Stock");
    }
}
