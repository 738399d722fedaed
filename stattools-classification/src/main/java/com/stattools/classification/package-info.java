/**
 * Classification of raw categorical codes into a small set of stable labels.
 * <ul>
 *   <li>{@link com.stattools.classification.ClassificationRule} – include/exclude patterns compiled once, one label</li>
 *   <li>{@link com.stattools.classification.ClassificationRuleSet} – ordered rules, first match wins, default label, {@code "Unknown"} for missing codes</li>
 *   <li>{@link com.stattools.classification.ColumnClassifier} – appends a label column to dataset rows</li>
 *   <li>{@link com.stattools.classification.load.ClassificationRuleSetLoader} – JSON rule-set file; missing file is recoverable</li>
 * </ul>
 */
package com.stattools.classification;
