package uk.gegc.lessondocs.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

@ResponseStatus(HttpStatus.INTERNAL_SERVER_ERROR)
public class DocumentRenderException extends RuntimeException {

    public DocumentRenderException(String message) {
        super(message);
    }

    public DocumentRenderException(String message, Throwable cause) {
        super(message, cause);
    }

    public DocumentRenderException(String documentType, String title, Throwable cause) {
        super(String.format("Failed to render %s document for '%s': %s", documentType, title, cause.getMessage()), cause);
    }
}
