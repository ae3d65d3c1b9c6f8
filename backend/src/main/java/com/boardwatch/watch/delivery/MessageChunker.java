package com.boardwatch.watch.delivery;

import com.boardwatch.watch.model.Article;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

@Component
public class MessageChunker {
    public static final int MAX_MESSAGE_LENGTH = 4096;
    private static final int MAX_TITLE_LENGTH = 300;
    private static final int MAX_FIELD_LENGTH = 64;
    private static final int MAX_LINK_LENGTH = 512;

    public List<String> chunk(List<Article> articles, String boardId) {
        String board = bold(truncate(boardId == null ? "" : boardId.trim(), MAX_FIELD_LENGTH));
        if (articles == null || articles.isEmpty()) {
            return List.of("📋 No matching articles for " + board);
        }

        List<String> messages = new ArrayList<>();
        StringBuilder current = new StringBuilder(header(board, articles.size()));
        int entriesInCurrent = 0;
        for (int i = 0; i < articles.size(); i++) {
            String entry = formatEntry(i + 1, articles.get(i));
            if (entriesInCurrent > 0 && current.length() + entry.length() > MAX_MESSAGE_LENGTH) {
                messages.add(current.toString().strip());
                current = new StringBuilder(continuedHeader(board));
                entriesInCurrent = 0;
            }
            current.append(entry);
            entriesInCurrent++;
        }
        messages.add(current.toString().strip());
        return messages;
    }

    String formatEntry(int index, Article article) {
        return index + ". " + bold(truncate(article.title(), MAX_TITLE_LENGTH)) + "\n"
            + "   👤 " + escape(truncate(article.author(), MAX_FIELD_LENGTH))
            + " | 📅 " + escape(truncate(article.dateLabel(), MAX_FIELD_LENGTH)) + "\n"
            + "   🔗 " + escape(truncate(article.link(), MAX_LINK_LENGTH)) + "\n\n";
    }

    private String header(String board, int total) {
        return "📋 " + board + " latest posts (" + total + ")\n\n";
    }

    private String continuedHeader(String board) {
        return "📋 " + board + " latest posts (continued)\n\n";
    }

    // Escapes are not honoured inside an entity: "2*2" becomes "*2*\**2*".
    static String bold(String value) {
        if (value == null || value.isEmpty()) {
            return "";
        }
        StringBuilder out = new StringBuilder(value.length() + 8);
        StringBuilder run = new StringBuilder();
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (isControl(c)) {
                appendBoldRun(out, run);
                out.append('\\').append(c);
            } else {
                run.append(c);
            }
        }
        appendBoldRun(out, run);
        return out.toString();
    }

    // Outside entities only these four are delimiters.
    static String escape(String value) {
        if (value == null) {
            return "";
        }
        StringBuilder out = new StringBuilder(value.length());
        for (int i = 0; i < value.length(); i++) {
            char c = value.charAt(i);
            if (isControl(c)) {
                out.append('\\');
            }
            out.append(c);
        }
        return out.toString();
    }

    private static boolean isControl(char c) {
        return c == '_' || c == '*' || c == '`' || c == '[';
    }

    private static void appendBoldRun(StringBuilder out, StringBuilder run) {
        if (run.length() == 0) {
            return;
        }
        if (run.toString().isBlank()) {
            out.append(run);
        } else {
            out.append('*').append(run).append('*');
        }
        run.setLength(0);
    }

    private static String truncate(String value, int maxLength) {
        if (value == null) {
            return "";
        }
        if (value.length() <= maxLength) {
            return value;
        }
        return value.substring(0, maxLength - 1) + "…";
    }
}
