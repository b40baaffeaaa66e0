package me.christianrobert.mspgsync.constraint.service;

import me.christianrobert.mspgsync.core.job.model.table.ColumnMapping;
import me.christianrobert.mspgsync.core.job.model.table.TableDefinition;
import me.christianrobert.mspgsync.core.tools.PostgresIdentifierNormalizer;
import me.christianrobert.mspgsync.script.model.SqlToken;
import me.christianrobert.mspgsync.script.model.StatementGroup;
import me.christianrobert.mspgsync.script.model.TokenType;
import me.christianrobert.mspgsync.script.rule.FunctionRule;
import me.christianrobert.mspgsync.script.service.SqlTokenizer;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;

/**
 * Translates SQL Server CHECK constraint definitions and filtered index predicates to
 * PostgreSQL syntax.
 *
 * Uses the script tokenizer, so string literals are never touched:
 * - column references ([Qty], Qty) become the quoted target column names
 * - built-in functions are mapped as in scripts (GETDATE() -> CURRENT_TIMESTAMP, ISNULL -> COALESCE)
 */
public class CheckConstraintTranslator {

    private static final Logger log = LoggerFactory.getLogger(CheckConstraintTranslator.class);

    private static final FunctionRule FUNCTIONS = new FunctionRule();

    /**
     * @param condition SQL Server predicate, e.g. {@code ([Qty]>(0))}
     * @param table     definition supplying the source-to-target column names
     * @throws me.christianrobert.mspgsync.core.exception.ScriptConversionException if the predicate cannot be tokenized
     */
    public static String translate(String condition, TableDefinition table) {
        if (condition == null || condition.trim().isEmpty()) {
            return condition;
        }

        StatementGroup group = new StatementGroup(SqlTokenizer.tokenize(condition), new ArrayList<>(), new ArrayList<>());
        FUNCTIONS.apply(group);

        StringBuilder translated = new StringBuilder();
        for (int i = 0; i < group.size(); i++) {
            SqlToken token = group.get(i);
            ColumnMapping column = isColumnReference(group, i) ? table.findBySourceName(token.identifierName()) : null;
            if (column != null) {
                translated.append(PostgresIdentifierNormalizer.quote(column.getTargetName()));
            } else if (token.getType() == TokenType.BRACKET_IDENTIFIER) {
                translated.append(PostgresIdentifierNormalizer.quote(token.identifierName()));
            } else {
                translated.append(token.getText());
            }
        }

        String result = translated.toString().trim();
        if (!result.equals(condition.trim())) {
            log.debug("Translated predicate: '{}' -> '{}'", condition, result);
        }
        return result;
    }

    private static boolean isColumnReference(StatementGroup group, int index) {
        SqlToken token = group.get(index);
        if (!token.isIdentifier()) {
            return false;
        }
        if (index > 0 && group.get(index - 1).isSymbol('.')) {
            return false;
        }
        SqlToken next = group.significantAt(group.nextSignificant(index + 1));
        return next == null || !next.isSymbol('(');
    }
}
