package eu.virtualparadox.docassist.api;

import eu.virtualparadox.docassist.api.dto.SessionResponse;
import eu.virtualparadox.docassist.session.SessionRegistry;
import eu.virtualparadox.docassist.session.UserSession;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/sessions")
@RequiredArgsConstructor
public class SessionController {

    private final SessionRegistry sessionRegistry;

    @PostMapping
    @ResponseStatus(HttpStatus.CREATED)
    public SessionResponse create() {
        final UserSession session = sessionRegistry.create();
        return new SessionResponse(session.id(), session.createdAt());
    }

    @DeleteMapping("/{sessionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void delete(@PathVariable("sessionId") final String sessionId) {
        sessionRegistry.remove(sessionId);
    }
}
