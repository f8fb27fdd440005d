package org.dxworks.sieveframe.sieve;

import org.dxworks.sieveframe.sieve.ast.ActionCommand;
import org.dxworks.sieveframe.sieve.ast.AddressPartTest;
import org.dxworks.sieveframe.sieve.ast.Alternative;
import org.dxworks.sieveframe.sieve.ast.Argument;
import org.dxworks.sieveframe.sieve.ast.BodyTest;
import org.dxworks.sieveframe.sieve.ast.BooleanTest;
import org.dxworks.sieveframe.sieve.ast.Command;
import org.dxworks.sieveframe.sieve.ast.CommentCommand;
import org.dxworks.sieveframe.sieve.ast.ElsIfBranch;
import org.dxworks.sieveframe.sieve.ast.ExistsTest;
import org.dxworks.sieveframe.sieve.ast.HeaderTest;
import org.dxworks.sieveframe.sieve.ast.IfBlock;
import org.dxworks.sieveframe.sieve.ast.NotTest;
import org.dxworks.sieveframe.sieve.ast.RawCommand;
import org.dxworks.sieveframe.sieve.ast.RequireCommand;
import org.dxworks.sieveframe.sieve.ast.Script;
import org.dxworks.sieveframe.sieve.ast.SizeTest;
import org.dxworks.sieveframe.sieve.ast.TestExpr;
import org.dxworks.sieveframe.sieve.ast.TestListExpr;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.regex.Pattern;

/**
 * Renders an AST as SIEVE text. Output depends on the AST only.
 * <p>
 * All {@code require} commands are merged into one leading statement. {@code if} blocks are
 * separated from the previous command by a blank line; comments are not.
 */
public class SieveEmitter {

    private static final String INDENT = "    ";
    private static final Pattern NUMERIC_LIMIT = Pattern.compile("[0-9]+[KkMmGg]?");

    private final MetadataConvention metadataConvention;

    public SieveEmitter() {
        this(new FilterCommentConvention());
    }

    public SieveEmitter(MetadataConvention metadataConvention) {
        this.metadataConvention = metadataConvention;
    }

    public String emit(Script script) {
        StringBuilder out = new StringBuilder();
        boolean first = true;

        List<String> requires = mergedRequires(script);
        if (!requires.isEmpty()) {
            out.append("require ");
            if (requires.size() == 1) {
                out.append(quote(requires.get(0)));
            } else {
                appendList(out, requires);
            }
            out.append(";\n");
            first = false;
        }

        for (Command command : script.commands) {
            if (command instanceof RequireCommand) {
                continue;
            }
            if (command instanceof IfBlock block) {
                if (!first) out.append('\n');
                emitIfBlock(out, block);
                first = false;
            } else if (command instanceof ActionCommand action) {
                emitAction(out, action, 0);
                first = false;
            } else if (command instanceof CommentCommand comment) {
                out.append(comment.text.isEmpty() ? "#" : "# " + comment.text).append('\n');
            } else if (command instanceof RawCommand raw) {
                if (!first) out.append('\n');
                out.append(raw.text);
                if (!raw.text.endsWith("\n")) out.append('\n');
                first = false;
            }
        }

        return out.toString();
    }

    private static List<String> mergedRequires(Script script) {
        Set<String> merged = new LinkedHashSet<>();
        for (Command command : script.commands) {
            if (command instanceof RequireCommand require) {
                merged.addAll(require.extensions);
            }
        }
        return new ArrayList<>(merged);
    }

    private void emitIfBlock(StringBuilder out, IfBlock block) {
        String comment = metadataConvention.write(new RuleMetadata(block.name, block.enabled));
        if (comment != null) {
            out.append("# ").append(comment).append('\n');
        }

        out.append("if ");
        emitTest(out, block.condition);
        emitBlock(out, block.actions);

        for (Alternative alternative : block.alternatives) {
            if (alternative instanceof ElsIfBranch elsIf) {
                out.append(" elsif ");
                emitTest(out, elsIf.condition);
            } else {
                out.append(" else");
            }
            emitBlock(out, alternative.actions);
        }
        out.append('\n');
    }

    private void emitBlock(StringBuilder out, List<ActionCommand> actions) {
        out.append(" {\n");
        for (ActionCommand action : actions) {
            emitAction(out, action, 1);
        }
        out.append('}');
    }

    void emitTest(StringBuilder out, TestExpr test) {
        if (test instanceof TestListExpr list) {
            out.append(list.keyword()).append(" (");
            for (int i = 0; i < list.tests.size(); i++) {
                if (i > 0) out.append(", ");
                emitTest(out, list.tests.get(i));
            }
            out.append(')');
        } else if (test instanceof NotTest not) {
            out.append("not ");
            emitTest(out, not.inner);
        } else if (test instanceof HeaderTest header) {
            out.append("header ").append(header.matchType).append(' ');
            appendStringOrList(out, header.headerNames);
            out.append(' ');
            appendStringOrList(out, header.keys);
        } else if (test instanceof AddressPartTest address) {
            out.append(address.keyword()).append(' ').append(address.matchType);
            // :all is the default address part
            if (address.addressPart != null && !address.addressPart.equals(":all")) {
                out.append(' ').append(address.addressPart);
            }
            out.append(' ');
            appendStringOrList(out, address.headerNames);
            out.append(' ');
            appendStringOrList(out, address.keys);
        } else if (test instanceof SizeTest size) {
            out.append("size ").append(size.comparator).append(' ');
            out.append(NUMERIC_LIMIT.matcher(size.limit).matches() ? size.limit : quote(size.limit));
        } else if (test instanceof ExistsTest exists) {
            out.append("exists ");
            appendStringOrList(out, exists.headerNames);
        } else if (test instanceof BodyTest body) {
            out.append("body ").append(body.matchType).append(' ');
            appendStringOrList(out, body.keys);
        } else if (test instanceof BooleanTest bool) {
            out.append(bool.keyword());
        } else {
            throw new IllegalArgumentException("Unsupported test node: " + test);
        }
    }

    private void emitAction(StringBuilder out, ActionCommand action, int depth) {
        out.append(INDENT.repeat(depth)).append(action.name);
        for (Argument argument : action.arguments) {
            out.append(' ');
            switch (argument.kind) {
                case QUOTED_STRING -> out.append(quote(argument.value));
                case NUMBER, TAG -> out.append(argument.value);
                case STRING_LIST -> appendStringOrList(out, argument.values);
                case MULTI_LINE_STRING -> appendMultiLine(out, argument.value);
            }
        }
        out.append(";\n");
    }

    private static void appendMultiLine(StringBuilder out, String body) {
        out.append("text:\n").append(body);
        if (!body.isEmpty() && !body.endsWith("\n")) {
            out.append('\n');
        }
        out.append(".\n");
    }

    private static void appendStringOrList(StringBuilder out, List<String> items) {
        if (items.size() == 1) {
            out.append(quote(items.get(0)));
        } else {
            appendList(out, items);
        }
    }

    private static void appendList(StringBuilder out, List<String> items) {
        out.append('[');
        for (int i = 0; i < items.size(); i++) {
            if (i > 0) out.append(", ");
            out.append(quote(items.get(i)));
        }
        out.append(']');
    }

    static String quote(String value) {
        return "\"" + escape(value) + "\"";
    }

    static String escape(String value) {
        return value.replace("\\", "\\\\").replace("\"", "\\\"");
    }
}
