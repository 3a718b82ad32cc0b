package authz.modelgraph.load;

/**
 * Model file is not a well-formed JSON authorization model.
 */
public class ModelFormatException extends RuntimeException {

    public ModelFormatException(String message) {
        super(message);
    }

    public ModelFormatException(String message, Throwable cause) {
        super(message, cause);
    }
}
