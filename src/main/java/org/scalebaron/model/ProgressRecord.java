package org.scalebaron.model;

/**
 * Read-only view of one progress cell.
 *
 * @param sample sample name
 * @param element element column
 * @param status status derived from the output folder at scan time
 * @param included the sample's inclusion flag at scan time
 * @param inputAvailable false when no matrix file exists for the pair (shown greyed out);
 *                       such a pair is always {@link ProgressStatus#MISSING}
 */
public record ProgressRecord(String sample, ElementKey element, ProgressStatus status,
                             boolean included, boolean inputAvailable) {
}
