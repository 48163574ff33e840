package com.bracketscan.domain.markup.model;

/**
 * Ratios computed across the three validator reports.
 *
 * @param commentToBracketRatio comment-marker delimiters / all delimiters
 * @param elementToPairRatio    elements / matched delimiter pairs; diagnostic only, may exceed 1.0
 * @param structureIntegrity    mean of the three consistency scores
 */
public record CrossValidationSummary(
        double commentToBracketRatio,
        double elementToPairRatio,
        double structureIntegrity
) {}
