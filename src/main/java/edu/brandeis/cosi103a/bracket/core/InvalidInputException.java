package edu.brandeis.cosi103a.bracket.core;

/**
 * Thrown when bracket input cannot produce a meaningful bracket, such as an empty competitor list.
 */
public class InvalidInputException extends RuntimeException {
    public InvalidInputException(String message) {
        super(message);
    }
}
