package ai.regula.ingest.parse;

/**
 * Raised when the document source cannot be read. Structural problems in the text never raise.
 */
public class DocumentParseException extends RuntimeException {

    public DocumentParseException(String message, Throwable cause) {
        super(message, cause);
    }
}
