package eu.virtualparadox.docassist.api;

import eu.virtualparadox.docassist.agent.loop.AgentSession;
import eu.virtualparadox.docassist.agent.loop.ResearchAgent;
import eu.virtualparadox.docassist.agent.model.AgentResult;
import eu.virtualparadox.docassist.agent.tool.ToolDescriptor;
import eu.virtualparadox.docassist.api.dto.ResearchRequest;
import eu.virtualparadox.docassist.session.SessionRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

import java.util.List;

@RestController
@RequestMapping("/api/agent")
@RequiredArgsConstructor
public class AgentController {

    private final SessionRegistry sessionRegistry;
    private final ResearchAgent researchAgent;

    @GetMapping("/tools")
    public List<ToolDescriptor> tools() {
        return researchAgent.getAvailableTools();
    }

    /**
     * Always 200: an unreachable model is reported in the body with {@code success=false}.
     */
    @PostMapping("/{sessionId}/research")
    public AgentResult research(@PathVariable("sessionId") final String sessionId,
                                @Valid @RequestBody final ResearchRequest request) {
        final AgentSession session = sessionRegistry.get(sessionId).agent();
        synchronized (session) {
            return request.maxIterations() == null
                    ? researchAgent.research(session, request.query())
                    : researchAgent.research(session, request.query(), request.maxIterations());
        }
    }

    @DeleteMapping("/{sessionId}/memory")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clearMemory(@PathVariable("sessionId") final String sessionId) {
        final AgentSession session = sessionRegistry.get(sessionId).agent();
        synchronized (session) {
            researchAgent.clearMemory(session);
        }
    }
}
