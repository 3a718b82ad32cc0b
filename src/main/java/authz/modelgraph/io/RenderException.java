package authz.modelgraph.io;

import java.io.IOException;

/**
 * Rendered output could not be written to its sink.
 */
public class RenderException extends IOException {

    public RenderException(String message, Throwable cause) {
        super(message, cause);
    }
}
