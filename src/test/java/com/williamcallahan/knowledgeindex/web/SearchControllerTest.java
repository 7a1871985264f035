package com.williamcallahan.knowledgeindex.web;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.BDDMockito.given;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

import com.williamcallahan.knowledgeindex.domain.search.SearchHit;
import com.williamcallahan.knowledgeindex.domain.search.SearchNotice;
import com.williamcallahan.knowledgeindex.domain.search.SearchRequest;
import com.williamcallahan.knowledgeindex.domain.search.SearchResult;
import com.williamcallahan.knowledgeindex.service.search.HybridSearchPartialFailureException;
import com.williamcallahan.knowledgeindex.service.search.HybridSearchService;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.context.annotation.Import;
import org.springframework.http.MediaType;
import org.springframework.test.context.bean.override.mockito.MockitoBean;
import org.springframework.test.web.servlet.MockMvc;

@WebMvcTest(controllers = SearchController.class)
@Import(ExceptionResponseBuilder.class)
class SearchControllerTest {

    @Autowired
    MockMvc mvc;

    @MockitoBean
    HybridSearchService hybridSearchService;

    @Test
    void search_returnsHitsAndNotices() throws Exception {
        SearchHit hit = new SearchHit("doc-1#0", "doc-1", "revenue grew", 1.0, Map.of("reranker", "RRF"));
        given(hybridSearchService.search(any(SearchRequest.class))).willReturn(new SearchResult(
                List.of(hit),
                4,
                Duration.ofMillis(12),
                List.of(new SearchNotice("Partial retrieval failure in vector search", "Timeout: exceeded"))));

        mvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"revenue\",\"scopeId\":\"team\",\"topK\":5}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.hits[0].chunkId").value("doc-1#0"))
                .andExpect(jsonPath("$.totalCandidates").value(4))
                .andExpect(jsonPath("$.notices[0].summary").value("Partial retrieval failure in vector search"));
    }

    @Test
    void search_invalidTopKIsRejected() throws Exception {
        mvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"revenue\",\"scopeId\":\"team\",\"topK\":0}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.message").value("Invalid request"));
    }

    @Test
    void search_strictModeFailureReturns502() throws Exception {
        given(hybridSearchService.search(any(SearchRequest.class))).willThrow(new HybridSearchPartialFailureException(
                "Hybrid retrieval failed for 1 branch(es)",
                List.of(new HybridSearchPartialFailureException.BranchFailure(
                        "keyword", "IOException", "index unavailable"))));

        mvc.perform(post("/api/search")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"query\":\"revenue\",\"scopeId\":\"team\"}"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.failures[0].branch").value("keyword"))
                .andExpect(jsonPath("$.failures[0].failureType").value("IOException"));
    }
}
