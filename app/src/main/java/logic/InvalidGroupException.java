package logic;

/**
 * A blast was requested for a group that cannot be removed
 * (null, too small, mixed colors, or tiles that are busy or no longer on the board).
 */
public class InvalidGroupException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public InvalidGroupException(String message) {
        super(message);
    }
}
