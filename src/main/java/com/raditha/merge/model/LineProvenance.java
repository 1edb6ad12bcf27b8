package com.raditha.merge.model;

/**
 * Where one output line came from.
 *
 * @param decision     why the line was emitted
 * @param templateLine source line in the template, or null
 * @param destLine     source line in the destination, or null
 * @param comment      optional free-form note
 * @param resultLine   0-indexed position in the output
 */
public record LineProvenance(Decision decision, Integer templateLine, Integer destLine, String comment,
        int resultLine) {
}
