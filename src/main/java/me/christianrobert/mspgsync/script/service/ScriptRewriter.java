package me.christianrobert.mspgsync.script.service;

import me.christianrobert.mspgsync.collation.model.CollationMappingTable;
import me.christianrobert.mspgsync.core.exception.ScriptConversionException;
import me.christianrobert.mspgsync.core.job.model.script.AppliedChange;
import me.christianrobert.mspgsync.core.job.model.script.FileConversionResult;
import me.christianrobert.mspgsync.script.model.SqlToken;
import me.christianrobert.mspgsync.script.model.StatementGroup;
import me.christianrobert.mspgsync.script.rule.BatchSeparatorRule;
import me.christianrobert.mspgsync.script.rule.BracketIdentifierRule;
import me.christianrobert.mspgsync.script.rule.CollateRule;
import me.christianrobert.mspgsync.script.rule.ConversionRule;
import me.christianrobert.mspgsync.script.rule.DataTypeRule;
import me.christianrobert.mspgsync.script.rule.DropConstraintRule;
import me.christianrobert.mspgsync.script.rule.DropIndexRule;
import me.christianrobert.mspgsync.script.rule.ExistenceGuardRule;
import me.christianrobert.mspgsync.script.rule.ExtendedPropertyRule;
import me.christianrobert.mspgsync.script.rule.FunctionRule;
import me.christianrobert.mspgsync.script.rule.IdentityRule;
import me.christianrobert.mspgsync.script.rule.SchemaPrefixRule;
import me.christianrobert.mspgsync.script.rule.TransactionRule;
import me.christianrobert.mspgsync.typemapping.model.TypeMappingTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

/**
 * Rewrites one T-SQL script into PostgreSQL syntax.
 *
 * <p>The script is tokenized once and split at its GO separators. Every statement group then
 * passes through the rules in a fixed order. The rewriter works on immutable snapshots of the
 * mapping tables, so an instance can be shared by the workers of one conversion run.</p>
 */
public class ScriptRewriter {

    private static final Logger log = LoggerFactory.getLogger(ScriptRewriter.class);

    private final BatchSeparatorRule batchSeparator = new BatchSeparatorRule();
    private final List<ConversionRule> rules;

    public ScriptRewriter(TypeMappingTable typeMappings, CollationMappingTable collations,
                          boolean identityAlways, boolean skipCollations) {
        this.rules = List.of(
                new SchemaPrefixRule(),
                new DataTypeRule(typeMappings),
                new FunctionRule(),
                new ExistenceGuardRule(),
                new DropIndexRule(),
                new IdentityRule(identityAlways),
                new CollateRule(collations, skipCollations),
                new TransactionRule(),
                new DropConstraintRule(),
                new ExtendedPropertyRule(),
                new BracketIdentifierRule());
    }

    /**
     * Ids of all rules in application order, starting with the batch separator.
     */
    public List<String> getRuleIds() {
        List<String> ids = new ArrayList<>();
        ids.add(BatchSeparatorRule.ID);
        for (ConversionRule rule : rules) {
            ids.add(rule.getId());
        }
        return ids;
    }

    public FileConversionResult convert(String fileName, String content) {
        List<SqlToken> tokens;
        try {
            tokens = SqlTokenizer.tokenize(content);
        } catch (ScriptConversionException e) {
            log.warn("Cannot convert {}: {}", fileName, e.getMessage());
            return FileConversionResult.failed(fileName, e.getMessage());
        }

        List<AppliedChange> changes = new ArrayList<>();
        List<String> warnings = new ArrayList<>();
        List<BatchSeparatorRule.Batch> batches = batchSeparator.split(tokens, changes);

        StringBuilder output = new StringBuilder();
        List<String> groupTexts = new ArrayList<>();
        for (BatchSeparatorRule.Batch batch : batches) {
            StatementGroup group = new StatementGroup(batch.getTokens(), changes, warnings);
            try {
                for (ConversionRule rule : rules) {
                    if (rule.isApplicable(group)) {
                        rule.apply(group);
                    }
                }
            } catch (ScriptConversionException e) {
                log.warn("Cannot convert {}: {}", fileName, e.getMessage());
                return FileConversionResult.failed(fileName, e.getMessage());
            }

            String text = group.toText();
            // empty groups between two separators count as groups of their own
            groupTexts.add(text.trim());
            if (batch.isTerminated()) {
                output.append(terminate(text)).append('\n');
            } else {
                output.append(text);
            }
        }

        log.debug("Converted {}: {} statement groups, {} changes", fileName, groupTexts.size(), changes.size());
        return FileConversionResult.converted(fileName, output.toString(), groupTexts, changes, warnings);
    }

    /**
     * A group closed by GO ends with a semicolon in the output.
     */
    private String terminate(String groupText) {
        String trimmed = groupText.stripTrailing();
        if (trimmed.isBlank() || trimmed.endsWith(";")) {
            return trimmed;
        }
        return trimmed + ";";
    }
}
