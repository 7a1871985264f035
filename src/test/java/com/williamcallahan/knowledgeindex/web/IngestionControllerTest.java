package com.williamcallahan.knowledgeindex.web;

import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionBatchStatus;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJob;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionJobStatus;
import com.williamcallahan.knowledgeindex.domain.ingestion.IngestionOptions;
import com.williamcallahan.knowledgeindex.service.ingestion.IngestionQueue;
import java.time.Instant;
import java.util.List;
import java.util.Optional;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = IngestionController.class)
@Import(ExceptionResponseBuilder.class)
class IngestionControllerTest {

    @Autowired
    MockMvc mvc;

    @MockitoBean
    IngestionQueue ingestionQueue;

    @Test
    void jobStatus_returnsQueuedStatus() throws Exception {
        IngestionJob job = IngestionJob.create("doc-1", "a.txt", IngestionOptions.forScope("team"), "");
        given(ingestionQueue.getStatus(job.jobId()))
                .willReturn(Optional.of(IngestionJobStatus.queued(job, Instant.now())));

        mvc.perform(get("/api/ingestion/jobs/" + job.jobId()))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.documentId").value("doc-1"))
                .andExpect(jsonPath("$.state").value("QUEUED"));
    }

    @Test
    void jobStatus_unknownJobReturns404() throws Exception {
        given(ingestionQueue.getStatus("missing")).willReturn(Optional.empty());

        mvc.perform(get("/api/ingestion/jobs/missing")).andExpect(status().isNotFound());
    }

    @Test
    void batchStatus_aggregatesJobStates() throws Exception {
        IngestionJob first = IngestionJob.create("doc-1", "a.txt", IngestionOptions.forScope("team"), "batch-1");
        IngestionJob second = IngestionJob.create("doc-2", "b.txt", IngestionOptions.forScope("team"), "batch-1");
        Instant now = Instant.now();
        IngestionBatchStatus batch = IngestionBatchStatus.of("batch-1", List.of(
                IngestionJobStatus.queued(first, now).processing(now).completed(now),
                IngestionJobStatus.queued(second, now)));
        given(ingestionQueue.getBatchStatus("batch-1")).willReturn(Optional.of(batch));

        mvc.perform(get("/api/ingestion/batches/batch-1"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalJobs").value(2))
                .andExpect(jsonPath("$.stateCounts.COMPLETED").value(1))
                .andExpect(jsonPath("$.stateCounts.QUEUED").value(1))
                .andExpect(jsonPath("$.percentComplete").value(50))
                .andExpect(jsonPath("$.finished").value(false));
    }

    @Test
    void batchStatus_unknownBatchReturns404() throws Exception {
        given(ingestionQueue.getBatchStatus("missing")).willReturn(Optional.empty());

        mvc.perform(get("/api/ingestion/batches/missing")).andExpect(status().isNotFound());
    }

    @Test
    void cancel_withoutActiveJobReturns404() throws Exception {
        given(ingestionQueue.cancelJobForDocument("doc-1")).willReturn(false);

        mvc.perform(post("/api/ingestion/documents/doc-1/cancel")).andExpect(status().isNotFound());
    }

    @Test
    void cancel_activeJobIsAcknowledged() throws Exception {
        given(ingestionQueue.cancelJobForDocument("doc-1")).willReturn(true);

        mvc.perform(post("/api/ingestion/documents/doc-1/cancel"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"));
    }
}
