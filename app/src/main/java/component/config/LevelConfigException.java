package component.config;

/**
 * Raised when a level file cannot be read or describes an impossible board.
 */
public class LevelConfigException extends RuntimeException {
    private static final long serialVersionUID = 1L;

    public LevelConfigException(String message) {
        super(message);
    }

    public LevelConfigException(String message, Throwable cause) {
        super(message, cause);
    }
}
