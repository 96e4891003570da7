package net.synchro.util.parser;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import net.synchro.api.parser.ParseTree;
import net.synchro.util.Formats;

public class ParseTreeImpl<S> implements ParseTree<S> {

    private static final ParseTreeImpl<Object> EMPTY =
        new ParseTreeImpl<Object>(Kind.EMPTY, null, null,
                                  Collections.<ParseTree<Object>>emptyList());

    private final Kind kind;
    private final S tag;
    private final String content;
    private final List<ParseTree<S>> children;
    private final int hash;

    protected ParseTreeImpl(Kind kind, S tag, String content,
                            List<ParseTree<S>> children) {
        this.kind = kind;
        this.tag = tag;
        this.content = content;
        this.children = children;
        this.hash = computeHash();
    }

    public String toString() {
        switch (kind) {
            case TERMINAL:
                return tag + "(" + Formats.formatString(content) + ")";
            case NONTERMINAL:
                StringBuilder sb = new StringBuilder();
                sb.append(tag).append('(');
                boolean first = true;
                for (ParseTree<S> ch : children) {
                    if (first) {
                        first = false;
                    } else {
                        sb.append(", ");
                    }
                    sb.append(ch);
                }
                return sb.append(')').toString();
            default:
                return "<empty>";
        }
    }

    public boolean equals(Object other) {
        if (other == this) return true;
        if (! (other instanceof ParseTreeImpl)) return false;
        ParseTreeImpl<?> to = (ParseTreeImpl<?>) other;
        return (hash == to.hash && kind == to.kind &&
                equalOrNull(tag, to.tag) && equalOrNull(content, to.content) &&
                children.equals(to.children));
    }

    public int hashCode() {
        return hash;
    }

    private int computeHash() {
        return kind.hashCode() ^ hashCodeOrNull(tag) * 31 ^
            hashCodeOrNull(content) * 17 ^ children.hashCode();
    }

    public Kind getKind() {
        return kind;
    }

    public S getTag() {
        return tag;
    }

    public String getContent() {
        return content;
    }

    public List<ParseTree<S>> getChildren() {
        return children;
    }

    public int childCount() {
        return children.size();
    }

    public ParseTree<S> childAt(int index) {
        return children.get(index);
    }

    private static boolean equalOrNull(Object a, Object b) {
        return (a == null) ? (b == null) : a.equals(b);
    }
    private static int hashCodeOrNull(Object o) {
        return (o == null) ? 0 : o.hashCode();
    }

    public static <S> ParseTreeImpl<S> terminal(S tag, String content) {
        if (tag == null)
            throw new NullPointerException("Terminal tag may not be null");
        if (content == null)
            throw new NullPointerException(
                "Terminal content may not be null");
        return new ParseTreeImpl<S>(Kind.TERMINAL, tag, content,
            Collections.<ParseTree<S>>emptyList());
    }

    public static <S> ParseTreeImpl<S> nonterminal(S head,
            List<? extends ParseTree<S>> children) {
        if (head == null)
            throw new NullPointerException(
                "Nonterminal head may not be null");
        return new ParseTreeImpl<S>(Kind.NONTERMINAL, head, null,
            Collections.unmodifiableList(
                new ArrayList<ParseTree<S>>(children)));
    }
    @SafeVarargs
    public static <S> ParseTreeImpl<S> nonterminal(S head,
                                                   ParseTree<S>... children) {
        return nonterminal(head, Arrays.asList(children));
    }

    @SuppressWarnings("unchecked")
    public static <S> ParseTreeImpl<S> empty() {
        return (ParseTreeImpl<S>) EMPTY;
    }

}
