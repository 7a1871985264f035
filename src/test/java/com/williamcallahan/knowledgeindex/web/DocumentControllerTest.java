package com.williamcallahan.knowledgeindex.web;

import static org.hamcrest.Matchers.containsString;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.delete;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.multipart;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.williamcallahan.knowledgeindex.domain.document.KnowledgeDocument;
import com.williamcallahan.knowledgeindex.domain.ingestion.EnqueueResult;
import com.williamcallahan.knowledgeindex.domain.ingestion.UploadOutcome;
import com.williamcallahan.knowledgeindex.service.ingestion.DocumentIngestionService;
import com.williamcallahan.knowledgeindex.store.DocumentNotFoundException;
import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.mock.web.MockMultipartFile;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = DocumentController.class)
@Import(ExceptionResponseBuilder.class)
class DocumentControllerTest {

    private static final MockMultipartFile NOTES = new MockMultipartFile(
            "file", "notes.txt", "text/plain", "Quarterly notes".getBytes(StandardCharsets.UTF_8));

    @Autowired
    MockMvc mvc;

    @MockitoBean
    DocumentIngestionService documentIngestionService;

    @Test
    void upload_acceptedReturns202WithIds() throws Exception {
        given(documentIngestionService.upload(
                        eq("team"), eq("docs/notes.txt"), eq("notes.txt"), eq("text/plain"), any(byte[].class),
                        isNull(), anyMap()))
                .willReturn(new UploadOutcome("doc-1", "job-1", false, EnqueueResult.ACCEPTED));

        mvc.perform(multipart("/api/documents").file(NOTES).param("scopeId", "team").param("path", "docs/notes.txt"))
                .andExpect(status().isAccepted())
                .andExpect(jsonPath("$.documentId").value("doc-1"))
                .andExpect(jsonPath("$.jobId").value("job-1"))
                .andExpect(jsonPath("$.duplicate").value(false));
    }

    @Test
    void upload_fullQueueReturns503() throws Exception {
        given(documentIngestionService.upload(any(), any(), any(), any(), any(byte[].class), any(), anyMap()))
                .willReturn(new UploadOutcome("doc-1", "", false, EnqueueResult.QUEUE_FULL));

        mvc.perform(multipart("/api/documents").file(NOTES).param("scopeId", "team"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("error"))
                .andExpect(jsonPath("$.message", containsString("doc-1")));
    }

    @Test
    void upload_emptyFileIsRejected() throws Exception {
        MockMultipartFile empty = new MockMultipartFile("file", "empty.txt", "text/plain", new byte[0]);

        mvc.perform(multipart("/api/documents").file(empty).param("scopeId", "team"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Uploaded file is empty"));
    }

    @Test
    void upload_missingScopeIsRejected() throws Exception {
        mvc.perform(multipart("/api/documents").file(NOTES)).andExpect(status().isBadRequest());
    }

    @Test
    void get_unknownDocumentReturns404() throws Exception {
        given(documentIngestionService.require("missing")).willThrow(new DocumentNotFoundException("missing"));

        mvc.perform(get("/api/documents/missing"))
                .andExpect(status().isNotFound())
                .andExpect(jsonPath("$.status").value("error"));
    }

    @Test
    void delete_returnsConfirmation() throws Exception {
        KnowledgeDocument document = KnowledgeDocument.pending(
                "doc-1", "team", "notes.txt", "notes.txt", "text/plain", "hash", 15, Map.of(), Instant.now());
        given(documentIngestionService.delete("doc-1")).willReturn(document);

        mvc.perform(delete("/api/documents/doc-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.message").value("Deleted document doc-1"));
    }
}
