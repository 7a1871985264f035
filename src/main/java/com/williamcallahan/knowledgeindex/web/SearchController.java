package com.williamcallahan.knowledgeindex.web;

import com.williamcallahan.knowledgeindex.domain.search.SearchResult;
import com.williamcallahan.knowledgeindex.service.search.HybridSearchPartialFailureException;
import com.williamcallahan.knowledgeindex.service.search.HybridSearchService;
import jakarta.validation.Valid;
import java.util.LinkedHashMap;
import java.util.Map;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.ExceptionHandler;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/search")
public class SearchController extends BaseController {

    private final HybridSearchService hybridSearchService;

    public SearchController(HybridSearchService hybridSearchService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.hybridSearchService = hybridSearchService;
    }

    @PostMapping
    public SearchResult search(@Valid @RequestBody SearchQueryRequest request) {
        return hybridSearchService.search(request.toSearchRequest());
    }

    /**
     * Strict-mode branch failures surface as 502 with the failed branches listed.
     */
    @ExceptionHandler(HybridSearchPartialFailureException.class)
    public ResponseEntity<Map<String, Object>> handlePartialFailure(HybridSearchPartialFailureException e) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("status", "error");
        body.put("message", e.getMessage());
        body.put("details", exceptionBuilder.describeException(e));
        body.put("failures", e.branchFailures());
        return ResponseEntity.status(HttpStatus.BAD_GATEWAY).body(body);
    }
}
