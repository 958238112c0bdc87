package quest.gekko.creators.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class DuplicateCreatorException extends ResponseStatusException {
    public DuplicateCreatorException(String handle) {
        super(HttpStatus.CONFLICT, "Creator @" + handle + " is already being tracked.");
    }
}
