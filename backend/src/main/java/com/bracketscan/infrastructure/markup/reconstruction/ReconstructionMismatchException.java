package com.bracketscan.infrastructure.markup.reconstruction;

/**
 * The full view rebuilt from the element sequence differs from the source document.
 * Always a defect in element construction or slicing, never a property of the input.
 */
public class ReconstructionMismatchException extends IllegalStateException {

    private final int firstDifference;

    public ReconstructionMismatchException(String message, int firstDifference) {
        super(message);
        this.firstDifference = firstDifference;
    }

    public int getFirstDifference() {
        return firstDifference;
    }
}
