package com.eventharvester.parser;

import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Flattens markup into visible text lines, breaking at block elements and {@code <br>}.
 */
public final class DocumentLines {

    private DocumentLines() {
    }

    public static List<String> of(Element root) {
        StringBuilder buffer = new StringBuilder();
        NodeTraversor.traverse(new NodeVisitor() {
            @Override
            public void head(Node node, int depth) {
                if (node instanceof TextNode) {
                    buffer.append(((TextNode) node).getWholeText());
                } else if (node instanceof Element) {
                    Element element = (Element) node;
                    if (element.isBlock() || "br".equals(element.normalName())) {
                        buffer.append('\n');
                    }
                }
            }

            @Override
            public void tail(Node node, int depth) {
                if (node instanceof Element && ((Element) node).isBlock()) {
                    buffer.append('\n');
                }
            }
        }, root);

        List<String> lines = new ArrayList<>();
        for (String line : buffer.toString().split("\n")) {
            String cleaned = line.replace('\u00A0', ' ').replaceAll("\\s+", " ").trim();
            if (!cleaned.isEmpty()) {
                lines.add(cleaned);
            }
        }
        return lines;
    }
}
