package uk.gegc.lessondocs.shared.exception;

import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.ResponseStatus;

/**
 * Rubric data handed to the renderer does not have the rubric question shape.
 */
@ResponseStatus(HttpStatus.UNPROCESSABLE_ENTITY)
public class InvalidRubricDataException extends RuntimeException {

    public InvalidRubricDataException(String message) {
        super(message);
    }

    public InvalidRubricDataException(String message, Throwable cause) {
        super(message, cause);
    }
}
