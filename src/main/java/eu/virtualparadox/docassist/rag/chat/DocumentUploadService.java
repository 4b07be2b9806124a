package eu.virtualparadox.docassist.rag.chat;

import eu.virtualparadox.docassist.exception.UnsupportedFormatException;
import eu.virtualparadox.docassist.ingest.loader.DocumentLoader;
import eu.virtualparadox.docassist.ingest.model.Document;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

/**
 * Upload entry point: loads the file and ingests it into the session synchronously.
 */
@Service
@Slf4j
@RequiredArgsConstructor
public class DocumentUploadService {

    private final DocumentLoader documentLoader;
    private final DocumentChatService documentChatService;

    /**
     * @param session  target session; its previous document is replaced
     * @param fileName original file name, its extension selects the loader
     * @param content  file bytes
     * @return number of chunks indexed
     * @throws UnsupportedFormatException if the file type is not supported; the session is untouched
     */
    public int upload(final DocumentSession session, final String fileName, final byte[] content) {
        final Document document = documentLoader.load(fileName, content);
        log.info("Session {}: uploading {} ({} bytes)", session.getId(), fileName, content.length);
        return documentChatService.ingest(session, document);
    }
}
