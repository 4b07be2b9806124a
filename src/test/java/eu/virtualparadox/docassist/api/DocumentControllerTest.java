package eu.virtualparadox.docassist.api;

import eu.virtualparadox.docassist.application.config.ApplicationConfig;
import eu.virtualparadox.docassist.ingest.chunker.Chunker;
import eu.virtualparadox.docassist.ingest.cleaner.TextCleaner;
import eu.virtualparadox.docassist.ingest.loader.DocumentLoader;
import eu.virtualparadox.docassist.ingest.loader.PdfTextExtractor;
import eu.virtualparadox.docassist.ingest.loader.PlainTextExtractor;
import eu.virtualparadox.docassist.ingest.loader.WordTextExtractor;
import eu.virtualparadox.docassist.rag.chat.DocumentChatService;
import eu.virtualparadox.docassist.rag.chat.DocumentUploadService;
import eu.virtualparadox.docassist.rag.index.InMemoryVectorIndex;
import eu.virtualparadox.docassist.rag.retriever.Retriever;
import eu.virtualparadox.docassist.session.SessionRegistry;
import eu.virtualparadox.docassist.support.HashingEmbeddingGateway;
import eu.virtualparadox.docassist.support.ScriptedGenerationGateway;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.MediaType;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.nio.charset.StandardCharsets;
import java.util.List;

import static org.hamcrest.Matchers.endsWith;
import static org.hamcrest.Matchers.hasSize;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class DocumentControllerTest {

    private final ScriptedGenerationGateway generation = new ScriptedGenerationGateway();
    private SessionRegistry registry;
    private MockMvc mvc;

    @BeforeEach
    void setUp() {
        HashingEmbeddingGateway embeddings = new HashingEmbeddingGateway();
        DocumentChatService chatService = new DocumentChatService(new Chunker(1000, 200), embeddings,
                new Retriever(embeddings), generation, new ApplicationConfig());
        DocumentLoader loader = new DocumentLoader(
                List.of(new PdfTextExtractor(), new WordTextExtractor(), new PlainTextExtractor()), new TextCleaner());
        registry = new SessionRegistry(InMemoryVectorIndex::new);

        mvc = MockMvcBuilders
                .standaloneSetup(
                        new DocumentController(registry, new DocumentUploadService(loader, chatService), chatService),
                        new SessionController(registry))
                .setControllerAdvice(new GlobalExceptionHandler())
                .build();
    }

    private static MockMultipartFile txt(String name, String content) {
        return new MockMultipartFile("file", name, MediaType.TEXT_PLAIN_VALUE, content.getBytes(StandardCharsets.UTF_8));
    }

    @Test
    void createsSessions() throws Exception {
        mvc.perform(post("/api/sessions"))
                .andExpect(status().isCreated())
                .andExpect(jsonPath("$.sessionId").isNotEmpty());
    }

    @Test
    void listsFormats() throws Exception {
        mvc.perform(get("/api/documents/formats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0]").value("pdf"))
                .andExpect(jsonPath("$", hasSize(4)));
    }

    @Test
    void uploadThenAsk() throws Exception {
        String id = registry.create().id();
        generation.reply("The harbour opens at dawn.");

        mvc.perform(multipart("/api/documents/{id}", id).file(txt("harbour.txt", "Boats leave the harbour at dawn.")))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.fileName").value("harbour.txt"))
                .andExpect(jsonPath("$.chunks").value(1))
                .andExpect(jsonPath("$.message").value("Document processed successfully! Created 1 chunks."));

        mvc.perform(post("/api/documents/{id}/questions", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"When do boats leave?\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.text").value("The harbour opens at dawn."))
                .andExpect(jsonPath("$.sources", hasSize(1)))
                .andExpect(jsonPath("$.sources[0].metadata.source").value("harbour.txt"));
    }

    @Test
    void askBeforeUploadIsAConflict() throws Exception {
        String id = registry.create().id();

        mvc.perform(post("/api/documents/{id}/questions", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"Anything?\"}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error.code").value("NOT_READY"));
    }

    @Test
    void unsupportedFormatIsABadRequest() throws Exception {
        String id = registry.create().id();

        mvc.perform(multipart("/api/documents/{id}", id)
                        .file(new MockMultipartFile("file", "photo.png", "image/png", new byte[]{1, 2})))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("UNSUPPORTED_FORMAT"))
                .andExpect(jsonPath("$.error.message").value("Unsupported file type: png"));
    }

    @Test
    void blankQuestionFailsValidation() throws Exception {
        String id = registry.create().id();

        mvc.perform(post("/api/documents/{id}/questions", id)
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"question\":\"  \"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error.code").value("VALIDATION_ERROR"));
    }

    @Test
    void unknownSessionIsNotFound() throws Exception {
        mvc.perform(get("/api/documents/{id}/summary", "nope"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.error.code").value("SESSION_NOT_FOUND"));
    }

    @Test
    void summaryAndClear() throws Exception {
        String id = registry.create().id();

        mvc.perform(get("/api/documents/{id}/summary", id))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.summary").value("No document uploaded."));

        mvc.perform(multipart("/api/documents/{id}", id).file(txt("notes.txt", "Some notes about lanterns.")))
                .andExpect(status().isOk());
        generation.reply("Notes about lanterns.");
        mvc.perform(get("/api/documents/{id}/summary", id))
                .andExpect(jsonPath("$.summary").value("Notes about lanterns."));

        mvc.perform(delete("/api/documents/{id}", id)).andExpect(status().isNoContent());
        mvc.perform(get("/api/documents/{id}/summary", id))
                .andExpect(jsonPath("$.summary", endsWith("uploaded.")));
    }

    @Test
    void deletingASessionMakesItUnknown() throws Exception {
        String id = registry.create().id();

        mvc.perform(delete("/api/sessions/{id}", id)).andExpect(status().isNoContent());
        mvc.perform(get("/api/documents/{id}/summary", id)).andExpect(status().isNotFound());
    }
}
