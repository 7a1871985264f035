package com.williamcallahan.knowledgeindex.web;

import com.williamcallahan.knowledgeindex.domain.reindex.ReindexCheck;
import com.williamcallahan.knowledgeindex.domain.reindex.ReindexResult;
import com.williamcallahan.knowledgeindex.service.reindex.ReindexService;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/reindex")
public class ReindexController extends BaseController {

    private final ReindexService reindexService;

    public ReindexController(ReindexService reindexService, ExceptionResponseBuilder exceptionBuilder) {
        super(exceptionBuilder);
        this.reindexService = reindexService;
    }

    @PostMapping
    public ReindexResult reindex(@RequestBody ReindexBatchRequest request) {
        return reindexService.reindex(request.toReindexRequest());
    }

    /**
     * Reports whether a document needs reindexing without queueing anything.
     */
    @GetMapping("/check/{documentId}")
    public ReindexCheck check(@PathVariable("documentId") String documentId) {
        return reindexService.checkDocument(documentId);
    }
}
