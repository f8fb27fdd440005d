package org.dxworks.sieveframe.converter;

import org.dxworks.sieveframe.model.SieveRule;
import org.dxworks.sieveframe.model.SieveScript;
import org.dxworks.sieveframe.sieve.FilterCommentConvention;
import org.dxworks.sieveframe.sieve.MetadataConvention;
import org.dxworks.sieveframe.sieve.SieveEmitter;
import org.dxworks.sieveframe.sieve.SieveParseException;
import org.dxworks.sieveframe.sieve.SieveParser;
import org.dxworks.sieveframe.sieve.ast.Command;
import org.dxworks.sieveframe.sieve.ast.IfBlock;
import org.dxworks.sieveframe.sieve.ast.RawCommand;
import org.dxworks.sieveframe.sieve.ast.RequireCommand;
import org.dxworks.sieveframe.sieve.ast.Script;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * Converts between SIEVE text and the rule model.
 * <p>
 * Neither direction fails on script content: text that does not parse becomes a single
 * {@value #PARSE_ERROR_RULE_NAME} rule holding the whole input, and a raw block that no longer
 * parses is written back unchanged.
 */
public class SieveScriptConverter {

    private static final Logger LOG = LoggerFactory.getLogger(SieveScriptConverter.class);

    public static final String PARSE_ERROR_RULE_NAME = "(parse error)";

    private final SieveParser parser;
    private final SieveEmitter emitter;
    private final RuleReducer reducer;
    private final RuleBuilder builder = new RuleBuilder();

    public SieveScriptConverter() {
        this(new FilterCommentConvention());
    }

    public SieveScriptConverter(MetadataConvention metadataConvention) {
        this.parser = new SieveParser(metadataConvention);
        this.emitter = new SieveEmitter(metadataConvention);
        this.reducer = new RuleReducer(emitter);
    }

    public SieveScript textToScript(String text, String name) {
        SieveScript script = new SieveScript(name);
        if (text == null || text.isBlank()) {
            return script;
        }

        Script ast;
        try {
            ast = parser.parse(text);
        } catch (SieveParseException e) {
            LOG.debug("Script '{}' does not parse ({} at {}), keeping it as one raw rule",
                    name, e.getKind(), e.describePosition(text));
            script.rules.add(parseErrorRule(text));
            return script;
        }

        Set<String> requires = new LinkedHashSet<>();
        for (Command command : ast.commands) {
            if (command instanceof RequireCommand require) {
                requires.addAll(require.extensions);
            } else if (command instanceof IfBlock block) {
                script.rules.add(toRule(block));
            }
        }
        script.requires.addAll(requires);
        return script;
    }

    public String scriptToText(SieveScript script) {
        return emitter.emit(scriptToAst(script));
    }

    /** The AST {@link #scriptToText} emits: one leading require, then one command per rule. */
    public Script scriptToAst(SieveScript script) {
        List<Command> body = new ArrayList<>();
        for (SieveRule rule : script.rules) {
            body.add(rule.hasRawBlock() ? fromRawBlock(rule) : builder.build(rule));
        }

        Set<String> requires = new LinkedHashSet<>(RequirementCollector.collect(body));
        if (script.requires != null) {
            requires.addAll(script.requires);
        }

        List<Command> commands = new ArrayList<>();
        if (!requires.isEmpty()) {
            commands.add(new RequireCommand(new ArrayList<>(requires)));
        }
        commands.addAll(body);
        return new Script(commands);
    }

    private SieveRule toRule(IfBlock block) {
        SieveRule rule = new SieveRule();
        rule.name = block.name == null ? "" : block.name;
        rule.enabled = block.enabled;

        Reduction reduction = reducer.reduce(block);
        if (reduction instanceof Reduction.Reduced reduced) {
            rule.logic = reduced.logic;
            rule.conditions.addAll(reduced.conditions);
            rule.actions.addAll(reduced.actions);
        } else if (reduction instanceof Reduction.Unreduced unreduced) {
            LOG.debug("Rule '{}' kept as raw block: {}", rule.name, unreduced.reason);
            rule.rawBlock = unreduced.originalText;
        }
        return rule;
    }

    private static SieveRule parseErrorRule(String text) {
        SieveRule rule = new SieveRule();
        rule.name = PARSE_ERROR_RULE_NAME;
        rule.rawBlock = text;
        return rule;
    }

    private Command fromRawBlock(SieveRule rule) {
        Script parsed;
        try {
            parsed = parser.parse(rule.rawBlock);
        } catch (SieveParseException e) {
            if (!PARSE_ERROR_RULE_NAME.equals(rule.name)) {
                LOG.warn("Raw block of rule '{}' no longer parses ({}), writing it unchanged",
                        rule.name, e.getMessage());
            }
            return new RawCommand(rule.rawBlock);
        }

        for (Command command : parsed.commands) {
            if (command instanceof IfBlock block) {
                if (PARSE_ERROR_RULE_NAME.equals(rule.name)) {
                    return block;
                }
                return block.withMetadata(RuleBuilder.ruleName(rule), rule.enabled);
            }
        }
        LOG.debug("Raw block of rule '{}' holds no if command, writing it unchanged", rule.name);
        return new RawCommand(rule.rawBlock);
    }
}
