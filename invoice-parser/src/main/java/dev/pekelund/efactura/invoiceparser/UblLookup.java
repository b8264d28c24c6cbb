package dev.pekelund.efactura.invoiceparser;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import org.springframework.util.StringUtils;
import org.w3c.dom.Element;
import org.w3c.dom.Node;
import org.w3c.dom.NodeList;

/**
 * Ordered-alternatives lookup over a non-namespace-aware DOM. Every field read by the parser goes
 * through here: each tag is matched against its unprefixed, prefixed and lower-camel names, and each
 * call accepts several alternative paths of which the first present one wins.
 */
public final class UblLookup {

    private UblLookup() {
    }

    public static Optional<Element> element(Element context, UblPath... alternatives) {
        if (context == null) {
            return Optional.empty();
        }
        for (UblPath path : alternatives) {
            Element resolved = walk(context, path);
            if (resolved != null) {
                return Optional.of(resolved);
            }
        }
        return Optional.empty();
    }

    /**
     * First alternative that resolves to an element carrying non-blank text.
     */
    public static Optional<Element> elementWithText(Element context, UblPath... alternatives) {
        if (context == null) {
            return Optional.empty();
        }
        for (UblPath path : alternatives) {
            Element resolved = walk(context, path);
            if (resolved != null && StringUtils.hasText(resolved.getTextContent())) {
                return Optional.of(resolved);
            }
        }
        return Optional.empty();
    }

    public static Optional<String> text(Element context, UblPath... alternatives) {
        return elementWithText(context, alternatives).map(UblLookup::textOf);
    }

    /**
     * All direct children of {@code context} matching {@code tag}, in document order.
     */
    public static List<Element> children(Element context, UblTag tag) {
        List<Element> matches = new ArrayList<>();
        if (context == null) {
            return matches;
        }
        List<String> candidates = tag.candidates();
        NodeList nodes = context.getChildNodes();
        for (int i = 0; i < nodes.getLength(); i++) {
            Node node = nodes.item(i);
            if (node instanceof Element child && candidates.contains(child.getNodeName())) {
                matches.add(child);
            }
        }
        return matches;
    }

    public static Optional<String> attribute(Element element, String name) {
        if (element == null || !element.hasAttribute(name)) {
            return Optional.empty();
        }
        String value = element.getAttribute(name).trim();
        return value.isEmpty() ? Optional.empty() : Optional.of(value);
    }

    public static String textOf(Element element) {
        String text = element.getTextContent();
        return text != null ? text.trim() : null;
    }

    /**
     * Element name without any namespace prefix.
     */
    public static String localName(Node node) {
        String name = node.getNodeName();
        int colon = name.indexOf(':');
        return colon >= 0 ? name.substring(colon + 1) : name;
    }

    private static Element walk(Element context, UblPath path) {
        Element current = context;
        for (UblTag step : path.steps()) {
            current = child(current, step);
            if (current == null) {
                return null;
            }
        }
        return current;
    }

    private static Element child(Element parent, UblTag tag) {
        NodeList nodes = parent.getChildNodes();
        for (String candidate : tag.candidates()) {
            for (int i = 0; i < nodes.getLength(); i++) {
                Node node = nodes.item(i);
                if (node instanceof Element child && candidate.equals(child.getNodeName())) {
                    return child;
                }
            }
        }
        return null;
    }
}
