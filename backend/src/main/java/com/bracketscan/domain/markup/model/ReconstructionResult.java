package com.bracketscan.domain.markup.model;

/**
 * The three text views rebuilt from an element sequence.
 *
 * @param full                    pre-element text and element text interleaved; equals the source document
 * @param elementsOnly            element slices only, delimiters included
 * @param nonElementsOnly         text outside every element
 * @param overlappingElements     elements that started before the end of an earlier element
 * @param sourceUtf8Length        UTF-8 byte length of the source document
 * @param reconstructedUtf8Length UTF-8 byte length of {@code full}
 * @param roundTripExact          true iff {@code full} equals the source document
 */
public record ReconstructionResult(
        String full,
        String elementsOnly,
        String nonElementsOnly,
        int overlappingElements,
        long sourceUtf8Length,
        long reconstructedUtf8Length,
        boolean roundTripExact
) {}
