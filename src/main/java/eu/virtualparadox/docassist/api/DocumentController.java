package eu.virtualparadox.docassist.api;

import eu.virtualparadox.docassist.api.dto.QuestionRequest;
import eu.virtualparadox.docassist.api.dto.SummaryResponse;
import eu.virtualparadox.docassist.api.dto.UploadResponse;
import eu.virtualparadox.docassist.rag.answer.Answer;
import eu.virtualparadox.docassist.rag.chat.DocumentChatService;
import eu.virtualparadox.docassist.rag.chat.DocumentSession;
import eu.virtualparadox.docassist.rag.chat.DocumentUploadService;
import eu.virtualparadox.docassist.session.SessionRegistry;
import jakarta.validation.Valid;
import lombok.RequiredArgsConstructor;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.DeleteMapping;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.multipart.MultipartFile;

import java.io.IOException;
import java.util.List;

/**
 * Document chat endpoints. Calls on the same session are serialized on its {@link DocumentSession}.
 */
@RestController
@RequestMapping("/api/documents")
@RequiredArgsConstructor
public class DocumentController {

    private final SessionRegistry sessionRegistry;
    private final DocumentUploadService uploadService;
    private final DocumentChatService chatService;

    @GetMapping("/formats")
    public List<String> formats() {
        return chatService.getSupportedFormats();
    }

    @PostMapping(value = "/{sessionId}", consumes = MediaType.MULTIPART_FORM_DATA_VALUE)
    public UploadResponse upload(@PathVariable("sessionId") final String sessionId,
                                 @RequestParam("file") final MultipartFile file) throws IOException {
        final DocumentSession session = sessionRegistry.get(sessionId).documents();
        final String fileName = file.getOriginalFilename();
        final byte[] content = file.getBytes();
        synchronized (session) {
            final int chunks = uploadService.upload(session, fileName, content);
            return new UploadResponse(fileName, chunks,
                    "Document processed successfully! Created " + chunks + " chunks.");
        }
    }

    @PostMapping("/{sessionId}/questions")
    public Answer ask(@PathVariable("sessionId") final String sessionId,
                      @Valid @RequestBody final QuestionRequest request) {
        final DocumentSession session = sessionRegistry.get(sessionId).documents();
        synchronized (session) {
            return chatService.ask(session, request.question());
        }
    }

    @GetMapping("/{sessionId}/summary")
    public SummaryResponse summary(@PathVariable("sessionId") final String sessionId) {
        final DocumentSession session = sessionRegistry.get(sessionId).documents();
        synchronized (session) {
            return new SummaryResponse(chatService.summarize(session));
        }
    }

    @DeleteMapping("/{sessionId}")
    @ResponseStatus(HttpStatus.NO_CONTENT)
    public void clear(@PathVariable("sessionId") final String sessionId) {
        final DocumentSession session = sessionRegistry.get(sessionId).documents();
        synchronized (session) {
            chatService.clear(session);
        }
    }
}
