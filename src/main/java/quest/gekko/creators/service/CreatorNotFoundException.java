package quest.gekko.creators.service;

import org.springframework.http.HttpStatus;
import org.springframework.web.server.ResponseStatusException;

public class CreatorNotFoundException extends ResponseStatusException {
    public CreatorNotFoundException(Long creatorId) {
        super(HttpStatus.NOT_FOUND, "Creator not found: " + creatorId);
    }
}
