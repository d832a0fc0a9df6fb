package timetabler.model;

/**
 * Thrown when a problem description breaks its input contract: negative
 * counts, a capacity list that does not match the room count, or ids out of
 * range.
 */
public class InputContractViolationException extends IllegalArgumentException {

    public InputContractViolationException(String message) {
        super(message);
    }
}
