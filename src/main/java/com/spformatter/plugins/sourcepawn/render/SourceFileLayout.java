package com.spformatter.plugins.sourcepawn.render;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;

import com.spformatter.config.FormattingOptions;
import com.spformatter.plugins.sourcepawn.recovery.MisclassificationRecovery;
import com.spformatter.syntax.NodeKind;
import com.spformatter.syntax.SyntaxNode;

/**
 * Lays out the top level of a file. Items are bucketed into sections and emitted in
 * section order with blank-line separators; a file with conditional preprocessor
 * directives keeps its source order instead.
 */
class SourceFileLayout {

    enum Section {
        HEADER,
        INCLUDES,
        DECLARATIONS,
        STATEMENTS,
        FUNCTIONS
    }

    private static final class Item {
        final Section section;
        final int sourceIndex;
        final int firstRow;
        int lastRow;
        String text;
        final List<String> leading = new ArrayList<>();

        Item(Section section, int sourceIndex, int firstRow, int lastRow, String text) {
            this.section = section;
            this.sourceIndex = sourceIndex;
            this.firstRow = firstRow;
            this.lastRow = lastRow;
            this.text = text;
        }

        int topRow(int leadingRow) {
            return leading.isEmpty() ? firstRow : leadingRow;
        }

        String fullText() {
            if (leading.isEmpty()) {
                return text;
            }
            return String.join("\n", leading) + "\n" + text;
        }
    }

    private final Renderer renderer;
    private final FormattingOptions options;
    private final MisclassificationRecovery recovery;

    SourceFileLayout(Renderer renderer) {
        this.renderer = renderer;
        this.options = renderer.getOptions();
        this.recovery = renderer.getRecovery();
    }

    String render(SyntaxNode root) {
        List<SyntaxNode> children = root.getChildren();
        List<Item> items = new ArrayList<>();
        List<Integer> leadingRows = new ArrayList<>();
        List<SyntaxNode> pendingComments = new ArrayList<>();
        SyntaxNode previousNode = null;
        boolean headerOpen = true;
        boolean conditional = false;

        for (int i = 0; i < children.size(); i++) {
            SyntaxNode child = children.get(i);
            if (child.is(NodeKind.COMMENT)) {
                Item last = items.isEmpty() ? null : items.get(items.size() - 1);
                if (last != null && pendingComments.isEmpty() && previousNode != null
                        && child.getStartPoint().getRow() == last.lastRow
                        && child.getStartOffset() >= previousNode.getEndOffset()) {
                    last.text = last.text + " " + child.getText();
                } else {
                    pendingComments.add(child);
                }
                continue;
            }
            if (child.getNodeKind() == NodeKind.PREPROC_IF || child.getNodeKind() == NodeKind.PREPROC_ELSEIF
                    || child.getNodeKind() == NodeKind.PREPROC_ELSE || child.getNodeKind() == NodeKind.PREPROC_ENDIF) {
                conditional = true;
            }

            if (items.isEmpty() && !pendingComments.isEmpty()) {
                items.add(_commentItem(pendingComments, i));
                leadingRows.add(-1);
                pendingComments.clear();
            }

            SyntaxNode last = child;
            String text;
            Section section;
            Optional<String> merged = i + 1 < children.size()
                    ? recovery.tryPrefixPattern(child, children.get(i + 1), 0)
                    : Optional.empty();
            if (merged.isPresent()) {
                last = children.get(++i);
                text = merged.get();
                section = Section.STATEMENTS;
            } else {
                text = renderer.render(child, 0);
                section = _classify(child, headerOpen);
            }
            if (section != Section.HEADER) {
                headerOpen = false;
            }
            if (child.is(NodeKind.PREPROC_INCLUDE) || child.is(NodeKind.PREPROC_TRYINCLUDE)) {
                headerOpen = false;
            }

            Item previous = items.isEmpty() ? null : items.get(items.size() - 1);
            if (section == Section.STATEMENTS && recovery.isContinuation(child, previousNode) && previous != null
                    && previous.section == Section.STATEMENTS && pendingComments.isEmpty()) {
                previous.text = previous.text + renderer.continuationSeparator(0) + text.strip();
                previous.lastRow = last.getEndPoint().getRow();
                previousNode = last;
                continue;
            }

            Item item = new Item(section, i, child.getStartPoint().getRow(), last.getEndPoint().getRow(), text);
            leadingRows.add(_attachLeading(item, pendingComments));
            pendingComments.clear();
            items.add(item);
            previousNode = last;
        }

        if (!pendingComments.isEmpty()) {
            if (items.isEmpty()) {
                items.add(_commentItem(pendingComments, children.size()));
                leadingRows.add(-1);
            } else {
                _attachTrailing(items.get(items.size() - 1), pendingComments);
            }
        }

        String output = conditional ? _emitInSourceOrder(items, leadingRows) : _emitBySection(items, leadingRows);
        return capBlankLines(output, options.getMaxConsecutiveEmptyLines());
    }

    private Section _classify(SyntaxNode node, boolean headerOpen) {
        NodeKind kind = node.getNodeKind();
        if (kind == NodeKind.PREPROC_INCLUDE || kind == NodeKind.PREPROC_TRYINCLUDE) {
            return Section.INCLUDES;
        }
        if (kind.isPreprocessor()) {
            return headerOpen ? Section.HEADER : Section.DECLARATIONS;
        }
        if (kind == NodeKind.FUNCTION_DEFINITION) {
            return recovery.isMisclassified(node) ? Section.STATEMENTS : Section.FUNCTIONS;
        }
        if (node.isError() || kind == NodeKind.FUNCTION_DECLARATION && recovery.isMisclassified(node)) {
            return Section.STATEMENTS;
        }
        return Section.DECLARATIONS;
    }

    private Item _commentItem(List<SyntaxNode> comments, int sourceIndex) {
        SyntaxNode first = comments.get(0);
        SyntaxNode last = comments.get(comments.size() - 1);
        Item item = new Item(Section.HEADER, sourceIndex - comments.size(), first.getStartPoint().getRow(),
                last.getEndPoint().getRow(), "");
        item.text = String.join("\n", _commentLines(comments));
        return item;
    }

    /**
     * Comments directly above an item travel with it, blank lines between them included.
     *
     * @return the source row of the first leading comment, or -1
     */
    private int _attachLeading(Item item, List<SyntaxNode> comments) {
        if (comments.isEmpty()) {
            return -1;
        }
        item.leading.addAll(_commentLines(comments));
        int gap = item.firstRow - comments.get(comments.size() - 1).getEndPoint().getRow() - 1;
        for (int b = 0; b < renderer.blankLinesFor(gap); b++) {
            item.leading.add("");
        }
        return comments.get(0).getStartPoint().getRow();
    }

    private void _attachTrailing(Item item, List<SyntaxNode> comments) {
        StringBuilder sb = new StringBuilder(item.text);
        int gap = comments.get(0).getStartPoint().getRow() - item.lastRow - 1;
        sb.append('\n');
        for (int b = 0; b < renderer.blankLinesFor(gap); b++) {
            sb.append('\n');
        }
        sb.append(String.join("\n", _commentLines(comments)));
        item.text = sb.toString();
        item.lastRow = comments.get(comments.size() - 1).getEndPoint().getRow();
    }

    private List<String> _commentLines(List<SyntaxNode> comments) {
        List<String> lines = new ArrayList<>();
        SyntaxNode previous = null;
        for (SyntaxNode comment : comments) {
            if (previous != null) {
                int gap = comment.getStartPoint().getRow() - previous.getEndPoint().getRow() - 1;
                for (int b = 0; b < renderer.blankLinesFor(gap); b++) {
                    lines.add("");
                }
            }
            lines.add(comment.getText());
            previous = comment;
        }
        return lines;
    }

    // ---------------------------------------------------------------- emission

    private String _emitBySection(List<Item> items, List<Integer> leadingRows) {
        List<String> out = new ArrayList<>();
        Section previousSection = null;
        for (Section section : Section.values()) {
            List<Integer> members = new ArrayList<>();
            for (int i = 0; i < items.size(); i++) {
                if (items.get(i).section == section) {
                    members.add(i);
                }
            }
            if (members.isEmpty()) {
                continue;
            }
            boolean sorted = section == Section.INCLUDES && options.isSortIncludes();
            if (sorted) {
                members.sort(Comparator.comparing(index -> items.get(index).text));
            }
            if (previousSection != null) {
                int separator = previousSection == Section.INCLUDES && !options.isNewLineAfterIncludes() ? 0 : 1;
                _blank(out, separator);
            }
            for (int m = 0; m < members.size(); m++) {
                Item item = items.get(members.get(m));
                if (m > 0) {
                    Item before = items.get(members.get(m - 1));
                    int blank = sorted ? 0 : _gapBetween(before, item, leadingRows.get(members.get(m)));
                    _blank(out, blank);
                }
                out.add(item.fullText());
            }
            previousSection = section;
        }
        return String.join("\n", out);
    }

    private String _emitInSourceOrder(List<Item> items, List<Integer> leadingRows) {
        List<String> out = new ArrayList<>();
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) {
                _blank(out, _gapBetween(items.get(i - 1), items.get(i), leadingRows.get(i)));
            }
            out.add(items.get(i).fullText());
        }
        return String.join("\n", out);
    }

    /**
     * Blank lines between two items of one section. Items adjacent in the source keep their
     * gap; consecutive functions get at least the configured separation.
     */
    private int _gapBetween(Item before, Item item, int leadingRow) {
        int blank;
        if (item.sourceIndex == before.sourceIndex + 1 || _adjacent(before, item)) {
            blank = renderer.blankLinesFor(item.topRow(leadingRow) - before.lastRow - 1);
        } else {
            blank = renderer.blankLinesFor(1);
        }
        if (before.section == Section.FUNCTIONS && item.section == Section.FUNCTIONS) {
            blank = Math.max(blank, options.getLinesBetweenFunctions());
        }
        return blank;
    }

    private static boolean _adjacent(Item before, Item item) {
        return item.sourceIndex > before.sourceIndex && item.firstRow > before.lastRow
                && item.sourceIndex - before.sourceIndex <= 2 && item.leading.isEmpty();
    }

    private static void _blank(List<String> out, int count) {
        for (int i = 0; i < count; i++) {
            out.add("");
        }
    }

    /**
     * Collapses runs of blank lines longer than {@code max}, strips trailing whitespace and
     * drops blank lines at both ends.
     */
    static String capBlankLines(String text, int max) {
        String[] lines = text.split("\n", -1);
        List<String> out = new ArrayList<>();
        int run = 0;
        for (String line : lines) {
            String trimmed = line.stripTrailing();
            if (trimmed.isEmpty()) {
                run++;
                if (run > max || out.isEmpty()) {
                    continue;
                }
            } else {
                run = 0;
            }
            out.add(trimmed);
        }
        while (!out.isEmpty() && out.get(out.size() - 1).isEmpty()) {
            out.remove(out.size() - 1);
        }
        return String.join("\n", out);
    }
}
