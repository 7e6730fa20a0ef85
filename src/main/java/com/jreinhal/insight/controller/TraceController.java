package com.jreinhal.insight.controller;

import com.jreinhal.insight.filter.SecurityContext;
import com.jreinhal.insight.model.TraceRecord;
import com.jreinhal.insight.trace.TraceQueryService;
import io.swagger.v3.oas.annotations.Operation;
import io.swagger.v3.oas.annotations.tags.Tag;
import jakarta.servlet.http.HttpServletRequest;
import java.util.List;
import java.util.Map;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping(value={"/api/admin/traces"})
@Tag(name="Admin")
public class TraceController {
    private final TraceQueryService traceQueryService;

    public TraceController(TraceQueryService traceQueryService) {
        this.traceQueryService = traceQueryService;
    }

    @GetMapping
    @Operation(summary="Most recent message traces, newest first")
    public Map<String, Object> recent(@RequestParam(value="limit", defaultValue="50") int limit,
                                      @RequestParam(value="userId", required=false) String userId,
                                      @RequestParam(value="conversationId", required=false) String conversationId,
                                      HttpServletRequest request) {
        List<TraceRecord> traces = this.traceQueryService.recent(SecurityContext.getCurrentUser(), limit, userId, conversationId, request);
        return Map.of("count", traces.size(), "traces", traces);
    }
}
