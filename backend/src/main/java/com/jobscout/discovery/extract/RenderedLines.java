package com.jobscout.discovery.extract;

import com.jobscout.discovery.util.TextUtils;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Approximates a browser's innerText line breaks: block elements and {@code <br>} start new lines.
 */
final class RenderedLines {
    private RenderedLines() {
    }

    static List<String> of(Element root) {
        StringBuilder buffer = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode text) {
                    buffer.append(text.getWholeText());
                } else if (node instanceof Element element && breaksLine(element)) {
                    buffer.append('\n');
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element element && element.isBlock()) {
                    buffer.append('\n');
                }
            }
        }, root);

        List<String> lines = new ArrayList<>();
        for (String raw : buffer.toString().split("\n")) {
            String line = TextUtils.collapseWhitespace(raw);
            if (line != null && !line.isEmpty()) {
                lines.add(line);
            }
        }
        return lines;
    }

    private static boolean breaksLine(Element element) {
        return element.isBlock() || "br".equals(element.normalName());
    }
}
