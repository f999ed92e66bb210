package org.perlcheck.element;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Forward, depth-first traversal that starts at an arbitrary element rather than
 * at the root of a subtree.
 * <p>
 * The start element and each of its later siblings are visited in document
 * order. The children of a visited node are visited right after it, before its
 * remaining siblings. A structure contributes its opening brace, its children
 * and its closing brace, in that order.
 */
public final class TreeScanner {

    private TreeScanner() {
    }

    /**
     * Scans forward from {@code start}.
     *
     * @param start  first element to visit; a null start yields an empty result
     * @param wanted classifies each visited element
     * @param stop   optional; the first element it accepts ends the scan and becomes
     *               {@link ScanResult#last()} without being passed to {@code wanted}
     */
    public static ScanResult scan(Element start, Function<Element, Interest> wanted, Predicate<Element> stop) {
        List<Element> found = new ArrayList<>();
        Deque<Element> queue = new ArrayDeque<>();
        for (Element sibling = start; sibling != null; sibling = sibling.nextSibling()) {
            queue.addLast(sibling);
        }

        while (!queue.isEmpty()) {
            Element element = queue.pollFirst();
            if (stop != null && stop.test(element)) {
                return new ScanResult(found, element);
            }

            Interest interest = wanted.apply(element);
            if (interest == Interest.INCLUDE) {
                found.add(element);
            }
            if (interest == Interest.PRUNE || !(element instanceof Node)) {
                continue;
            }

            if (element instanceof Structure) {
                Structure structure = (Structure) element;
                if (structure.getFinish() != null) {
                    queue.addFirst(structure.getFinish());
                }
                pushChildren(queue, structure);
                queue.addFirst(structure.getStart());
            } else {
                pushChildren(queue, (Node) element);
            }
        }
        return new ScanResult(found, null);
    }

    private static void pushChildren(Deque<Element> queue, Node node) {
        List<Element> children = node.children();
        for (int i = children.size() - 1; i >= 0; i--) {
            queue.addFirst(children.get(i));
        }
    }
}
