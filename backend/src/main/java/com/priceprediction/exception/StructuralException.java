package com.priceprediction.exception;

/**
 * A request too malformed to price: non-positive size, bedrooms on a type that
 * cannot have them, or a required field with no default. Terminal for the item.
 */
public class StructuralException extends PricePredictionException {
    public StructuralException(String message) {
        super("STRUCTURAL_ERROR", message);
    }
}
