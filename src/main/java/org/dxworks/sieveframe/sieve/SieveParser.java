package org.dxworks.sieveframe.sieve;

import org.dxworks.sieveframe.sieve.ast.ActionCommand;
import org.dxworks.sieveframe.sieve.ast.AddressTest;
import org.dxworks.sieveframe.sieve.ast.AllOfTest;
import org.dxworks.sieveframe.sieve.ast.Alternative;
import org.dxworks.sieveframe.sieve.ast.AnyOfTest;
import org.dxworks.sieveframe.sieve.ast.Argument;
import org.dxworks.sieveframe.sieve.ast.BodyTest;
import org.dxworks.sieveframe.sieve.ast.BooleanTest;
import org.dxworks.sieveframe.sieve.ast.Command;
import org.dxworks.sieveframe.sieve.ast.CommentCommand;
import org.dxworks.sieveframe.sieve.ast.ElseBranch;
import org.dxworks.sieveframe.sieve.ast.ElsIfBranch;
import org.dxworks.sieveframe.sieve.ast.EnvelopeTest;
import org.dxworks.sieveframe.sieve.ast.ExistsTest;
import org.dxworks.sieveframe.sieve.ast.HeaderTest;
import org.dxworks.sieveframe.sieve.ast.IfBlock;
import org.dxworks.sieveframe.sieve.ast.NotTest;
import org.dxworks.sieveframe.sieve.ast.RequireCommand;
import org.dxworks.sieveframe.sieve.ast.Script;
import org.dxworks.sieveframe.sieve.ast.SizeTest;
import org.dxworks.sieveframe.sieve.ast.TestExpr;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Recursive-descent parser for the supported SIEVE subset.
 * <p>
 * One pass over the token list, no backtracking. A parse either succeeds completely or fails
 * with a {@link SieveParseException}; there is no partial result.
 */
public class SieveParser {

    static final Set<String> ACTION_COMMANDS = Set.of(
            "keep", "stop", "discard", "fileinto", "redirect",
            "reject", "setflag", "addflag", "removeflag");

    static final Set<String> ADDRESS_PARTS = Set.of(":all", ":localpart", ":domain");

    private static final String DEFAULT_MATCH_TYPE = ":is";
    private static final String DEFAULT_SIZE_COMPARATOR = ":over";
    private static final String DEFAULT_SIZE_LIMIT = "0";

    private final MetadataConvention metadataConvention;

    public SieveParser() {
        this(new FilterCommentConvention());
    }

    public SieveParser(MetadataConvention metadataConvention) {
        this.metadataConvention = metadataConvention;
    }

    public Script parse(String text) throws SieveParseException {
        if (text == null || text.isBlank()) {
            return Script.empty();
        }

        TokenCursor cursor = new TokenCursor(SieveLexer.tokenize(text));
        List<Command> commands = new ArrayList<>();
        String pendingComment = null;

        while (!cursor.atEnd()) {
            Token token = cursor.peek();
            switch (token.type) {
                case COMMENT -> {
                    if (pendingComment != null) {
                        commands.add(new CommentCommand(pendingComment));
                    }
                    pendingComment = token.text;
                    cursor.advance();
                }
                case BLOCK_COMMENT -> cursor.advance();
                case IDENTIFIER -> {
                    String keyword = token.text.toLowerCase(Locale.ROOT);
                    if (keyword.equals("require")) {
                        cursor.advance();
                        commands.add(new RequireCommand(parseRequireArguments(cursor)));
                    } else if (keyword.equals("if")) {
                        cursor.advance();
                        RuleMetadata metadata = pendingComment != null
                                ? metadataConvention.read(pendingComment)
                                : RuleMetadata.NONE;
                        pendingComment = null;
                        commands.add(parseIfBlock(cursor, metadata));
                    } else if (ACTION_COMMANDS.contains(keyword)) {
                        if (pendingComment != null) {
                            commands.add(new CommentCommand(pendingComment));
                            pendingComment = null;
                        }
                        commands.add(parseActionCommand(cursor));
                    } else {
                        throw new SieveParseException(ErrorKind.UNKNOWN_COMMAND, token.offset,
                                "Unknown command '" + token.text + "' at top level (offset " + token.offset + ")");
                    }
                }
                default -> throw new SieveParseException(ErrorKind.UNEXPECTED_TOKEN, token.offset,
                        "Unexpected token " + TokenCursor.describe(token) + " at top level");
            }
        }

        if (pendingComment != null) {
            commands.add(new CommentCommand(pendingComment));
        }
        return new Script(commands);
    }

    private List<String> parseRequireArguments(TokenCursor cursor) {
        List<String> extensions = new ArrayList<>();
        if (cursor.check(TokenType.QUOTED_STRING)) {
            extensions.add(cursor.advance().text);
        } else if (cursor.match(TokenType.LEFT_BRACKET)) {
            extensions.addAll(parseStringListBody(cursor));
        }
        cursor.match(TokenType.SEMICOLON);
        return extensions;
    }

    private IfBlock parseIfBlock(TokenCursor cursor, RuleMetadata metadata) throws SieveParseException {
        TestExpr condition = parseTestExpr(cursor);
        List<ActionCommand> actions = parseActionBlock(cursor);
        List<Alternative> alternatives = new ArrayList<>();

        while (true) {
            if (cursor.checkIdentifier("elsif")) {
                cursor.advance();
                TestExpr branchCondition = parseTestExpr(cursor);
                alternatives.add(new ElsIfBranch(branchCondition, parseActionBlock(cursor)));
            } else if (cursor.checkIdentifier("else")) {
                cursor.advance();
                alternatives.add(new ElseBranch(parseActionBlock(cursor)));
                break;
            } else {
                break;
            }
        }

        return new IfBlock(metadata.name, metadata.enabled, condition, actions, alternatives);
    }

    // ---- Tests ----

    TestExpr parseTestExpr(TokenCursor cursor) throws SieveParseException {
        Token token = cursor.peek();
        if (token == null) {
            throw new SieveParseException(ErrorKind.UNEXPECTED_END, SieveParseException.END_OF_INPUT,
                    "Expected test expression, got end of input");
        }
        if (token.type != TokenType.IDENTIFIER) {
            throw new SieveParseException(ErrorKind.UNEXPECTED_TOKEN, token.offset,
                    "Expected test expression, got " + TokenCursor.describe(token));
        }

        String name = token.text.toLowerCase(Locale.ROOT);
        cursor.advance();
        switch (name) {
            case "allof":
                return new AllOfTest(parseTestList(cursor));
            case "anyof":
                return new AnyOfTest(parseTestList(cursor));
            case "not":
                return new NotTest(parseTestExpr(cursor));
            case "header": {
                TaggedArguments tags = parseTags(cursor, false);
                List<String> headerNames = parseStringOrList(cursor);
                return new HeaderTest(tags.matchType, headerNames, parseStringOrList(cursor));
            }
            case "address":
            case "envelope": {
                TaggedArguments tags = parseTags(cursor, true);
                List<String> headerNames = parseStringOrList(cursor);
                List<String> keys = parseStringOrList(cursor);
                return name.equals("address")
                        ? new AddressTest(tags.addressPart, tags.matchType, headerNames, keys)
                        : new EnvelopeTest(tags.addressPart, tags.matchType, headerNames, keys);
            }
            case "body": {
                TaggedArguments tags = parseTags(cursor, false);
                return new BodyTest(tags.matchType, parseStringOrList(cursor));
            }
            case "size":
                return parseSizeTest(cursor);
            case "exists":
                return new ExistsTest(parseStringOrList(cursor));
            case "true":
                return BooleanTest.TRUE;
            case "false":
                return BooleanTest.FALSE;
            default:
                throw new SieveParseException(ErrorKind.UNKNOWN_TEST, token.offset,
                        "Unknown test '" + token.text + "' at offset " + token.offset);
        }
    }

    private List<TestExpr> parseTestList(TokenCursor cursor) throws SieveParseException {
        if (!cursor.match(TokenType.LEFT_PAREN)) {
            throw new SieveParseException(ErrorKind.UNEXPECTED_TOKEN, cursor.offset(),
                    "Expected '(' in test list, got " + cursor.describeCurrent());
        }

        List<TestExpr> tests = new ArrayList<>();
        while (true) {
            if (cursor.match(TokenType.RIGHT_PAREN)) break;
            if (!tests.isEmpty()) {
                cursor.match(TokenType.COMMA);
            }
            // trailing comma before ')'
            if (cursor.match(TokenType.RIGHT_PAREN)) break;
            tests.add(parseTestExpr(cursor));
        }
        return tests;
    }

    /**
     * Leading {@code :tag} run of header-like tests. {@code :comparator} and its argument are
     * skipped, address parts are recognised when {@code allowAddressPart} is set, and any other
     * tag is taken as the match type (the last one wins).
     */
    private TaggedArguments parseTags(TokenCursor cursor, boolean allowAddressPart) {
        TaggedArguments tags = new TaggedArguments();
        while (cursor.check(TokenType.TAG)) {
            String tag = cursor.advance().text;
            if (tag.equals(":comparator")) {
                cursor.match(TokenType.QUOTED_STRING);
            } else if (allowAddressPart && ADDRESS_PARTS.contains(tag)) {
                tags.addressPart = tag;
            } else {
                tags.matchType = tag;
            }
        }
        return tags;
    }

    private SizeTest parseSizeTest(TokenCursor cursor) {
        String comparator = DEFAULT_SIZE_COMPARATOR;
        if (cursor.check(TokenType.TAG)) {
            comparator = cursor.advance().text;
        }

        String limit = DEFAULT_SIZE_LIMIT;
        if (cursor.check(TokenType.NUMBER) || cursor.check(TokenType.QUOTED_STRING)) {
            limit = cursor.advance().text;
        }
        return new SizeTest(comparator, limit);
    }

    /**
     * A single quoted string or a bracketed list of them. Anything else yields an empty list
     * without consuming input.
     */
    private List<String> parseStringOrList(TokenCursor cursor) {
        if (cursor.check(TokenType.QUOTED_STRING)) {
            return List.of(cursor.advance().text);
        }
        if (cursor.match(TokenType.LEFT_BRACKET)) {
            return parseStringListBody(cursor);
        }
        return List.of();
    }

    /** Items after an opening '[' up to and including the closing ']'. */
    private List<String> parseStringListBody(TokenCursor cursor) {
        List<String> items = new ArrayList<>();
        while (true) {
            if (cursor.check(TokenType.QUOTED_STRING)) {
                items.add(cursor.advance().text);
            } else if (cursor.match(TokenType.COMMA)) {
                continue;
            } else {
                cursor.match(TokenType.RIGHT_BRACKET);
                break;
            }
        }
        return items;
    }

    // ---- Actions ----

    private List<ActionCommand> parseActionBlock(TokenCursor cursor) throws SieveParseException {
        if (!cursor.match(TokenType.LEFT_BRACE)) {
            throw new SieveParseException(ErrorKind.MISSING_BLOCK, cursor.offset(),
                    "Expected '{' to start action block, got " + cursor.describeCurrent());
        }

        List<ActionCommand> actions = new ArrayList<>();
        while (true) {
            while (cursor.peek() != null && cursor.peek().type.isComment()) {
                cursor.advance();
            }
            if (cursor.match(TokenType.RIGHT_BRACE)) break;
            if (cursor.atEnd()) {
                throw new SieveParseException(ErrorKind.UNEXPECTED_END, SieveParseException.END_OF_INPUT,
                        "Unexpected end of input in action block");
            }
            actions.add(parseActionCommand(cursor));
        }
        return actions;
    }

    /**
     * Action name followed by its arguments up to the terminating ';'. Argument collection also
     * stops, without consuming, at any token that cannot be an argument.
     */
    private ActionCommand parseActionCommand(TokenCursor cursor) throws SieveParseException {
        Token nameToken = cursor.peek();
        if (nameToken == null) {
            throw new SieveParseException(ErrorKind.UNEXPECTED_END, SieveParseException.END_OF_INPUT,
                    "Expected action name, got end of input");
        }
        if (nameToken.type != TokenType.IDENTIFIER) {
            throw new SieveParseException(ErrorKind.UNEXPECTED_TOKEN, nameToken.offset,
                    "Expected action name, got " + TokenCursor.describe(nameToken));
        }
        cursor.advance();

        List<Argument> arguments = new ArrayList<>();
        boolean collecting = true;
        while (collecting && !cursor.atEnd()) {
            Token token = cursor.peek();
            switch (token.type) {
                case SEMICOLON -> {
                    cursor.advance();
                    collecting = false;
                }
                case QUOTED_STRING -> arguments.add(Argument.quoted(cursor.advance().text));
                case MULTI_LINE_STRING -> arguments.add(Argument.multiLine(cursor.advance().text));
                case NUMBER -> arguments.add(Argument.number(cursor.advance().text));
                case TAG -> arguments.add(Argument.tag(cursor.advance().text));
                case LEFT_BRACKET -> {
                    cursor.advance();
                    arguments.add(Argument.stringList(parseStringListBody(cursor)));
                }
                default -> collecting = false;
            }
        }
        return new ActionCommand(nameToken.text, arguments);
    }

    private static class TaggedArguments {
        String matchType = DEFAULT_MATCH_TYPE;
        String addressPart;
    }
}
