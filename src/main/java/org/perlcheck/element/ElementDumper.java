package org.perlcheck.element;

/*
 * Usage:
 *
 *   String tree = new ElementDumper().dump(document);
 *
 * Whitespace tokens are left out unless requested.
 */
public class ElementDumper {

    private final boolean showWhitespace;
    private final StringBuilder sb = new StringBuilder();
    private int indentLevel = 0;

    public ElementDumper() {
        this(false);
    }

    public ElementDumper(boolean showWhitespace) {
        this.showWhitespace = showWhitespace;
    }

    public String dump(Element element) {
        sb.setLength(0);
        indentLevel = 0;
        append(element);
        return sb.toString();
    }

    private void appendIndent() {
        sb.append("  ".repeat(Math.max(0, indentLevel)));
    }

    private void append(Element element) {
        if (element.getKind() == ElementKind.WHITESPACE && !showWhitespace) {
            return;
        }
        appendIndent();
        sb.append(element.getKind());
        if (element instanceof Token) {
            sb.append("  ").append(printable(element.content()));
            sb.append('\n');
            return;
        }
        if (element instanceof Structure) {
            Structure structure = (Structure) element;
            sb.append("  ").append(structure.getStart().content())
                    .append(" ... ")
                    .append(structure.getFinish() == null ? "" : structure.getFinish().content());
        }
        sb.append('\n');
        indentLevel++;
        for (Element child : ((Node) element).children()) {
            append(child);
        }
        indentLevel--;
    }

    private static String printable(String text) {
        StringBuilder quoted = new StringBuilder("'");
        for (char c : text.toCharArray()) {
            switch (c) {
                case '\n' -> quoted.append("\\n");
                case '\t' -> quoted.append("\\t");
                case '\'' -> quoted.append("\\'");
                case '\\' -> quoted.append("\\\\");
                default -> quoted.append(c);
            }
        }
        return quoted.append('\'').toString();
    }
}
