package me.christianrobert.mspgsync.script.rule;

import me.christianrobert.mspgsync.script.model.StatementGroup;

/**
 * One T-SQL to PostgreSQL rewrite applied to every statement group of a script.
 * Rules run in a fixed order and record every edit through the group.
 */
public interface ConversionRule {

    /**
     * Stable id used in change records, e.g. "data-type".
     */
    String getId();

    String getDescription();

    default boolean isApplicable(StatementGroup group) {
        return !group.isBlank();
    }

    void apply(StatementGroup group);
}
