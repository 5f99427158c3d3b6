package com.ragingest.ingest;

import java.util.regex.Pattern;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

public final class TextNormalizer {
    private static final Pattern CODE_FENCE = Pattern.compile("```[\\s\\S]*?```");
    private static final Pattern INLINE_CODE = Pattern.compile("`([^`]+)`");
    private static final Pattern IMAGE = Pattern.compile("!\\[([^\\]]*)\\]\\([^)]*\\)");
    private static final Pattern LINK = Pattern.compile("\\[([^\\]]+)\\]\\([^)]*\\)");
    private static final Pattern HEADING = Pattern.compile("(?m)^#{1,6}\\s+");
    private static final Pattern BOLD_STARS = Pattern.compile("\\*\\*([^*]+)\\*\\*");
    private static final Pattern ITALIC_STARS = Pattern.compile("\\*([^*]+)\\*");
    private static final Pattern BOLD_UNDERSCORES = Pattern.compile("(?<!\\w)__([^_]+)__(?!\\w)");
    private static final Pattern ITALIC_UNDERSCORES = Pattern.compile("(?<!\\w)_([^_]+)_(?!\\w)");
    private static final Pattern CONTROL = Pattern.compile("[\\x00-\\x08\\x0B\\x0C\\x0E-\\x1F\\x7F-\\x9F]");
    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    private TextNormalizer() {
    }

    public static String normalize(String text, DocumentFormat format) {
        if (text == null || text.isBlank()) {
            return "";
        }
        if (format == DocumentFormat.HTML) {
            return clean(stripHtml(text));
        }
        if (format == DocumentFormat.MARKDOWN) {
            return clean(stripMarkdown(text));
        }
        return clean(text);
    }

    public static String stripHtml(String html) {
        org.jsoup.nodes.Document document = Jsoup.parse(html);
        document.select("script, style, noscript, template").remove();
        StringBuilder out = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode) {
                    out.append(((TextNode) node).getWholeText());
                } else if (isLineBreak(node)) {
                    out.append('\n');
                } else if (isBlock(node)) {
                    out.append("\n\n");
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (isBlock(node)) {
                    out.append("\n\n");
                }
            }
        }, document.body());
        return out.toString();
    }

    private static boolean isLineBreak(Node node) {
        return node instanceof Element && ((Element) node).normalName().equals("br");
    }

    private static boolean isBlock(Node node) {
        return node instanceof Element && ((Element) node).isBlock();
    }

    public static String stripMarkdown(String markdown) {
        String text = CODE_FENCE.matcher(markdown).replaceAll("");
        text = INLINE_CODE.matcher(text).replaceAll("$1");
        text = IMAGE.matcher(text).replaceAll("");
        text = LINK.matcher(text).replaceAll("$1");
        text = HEADING.matcher(text).replaceAll("");
        text = BOLD_STARS.matcher(text).replaceAll("$1");
        text = ITALIC_STARS.matcher(text).replaceAll("$1");
        text = BOLD_UNDERSCORES.matcher(text).replaceAll("$1");
        return ITALIC_UNDERSCORES.matcher(text).replaceAll("$1");
    }

    public static String clean(String text) {
        String withoutControl = CONTROL.matcher(text).replaceAll("");
        String collapsed = WHITESPACE.matcher(withoutControl)
                .replaceAll(match -> newlineCount(match.group()) >= 2 ? "\n\n" : " ");
        return collapsed.strip();
    }

    private static int newlineCount(String run) {
        int count = 0;
        for (int i = 0; i < run.length(); i++) {
            if (run.charAt(i) == '\n') {
                count++;
            }
        }
        return count;
    }
}
