package com.example.channelinsight.controller;

import com.example.channelinsight.dto.AnalysisHistoryResponse;
import com.example.channelinsight.dto.AnalyzeChannelRequest;
import com.example.channelinsight.dto.ChannelAnalysisResponse;
import com.example.channelinsight.dto.QuotaStatusResponse;
import com.example.channelinsight.service.QuotaStatusService;
import com.example.channelinsight.service.ResolutionEngine;
import jakarta.validation.Valid;
import java.util.List;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api")
public class ChannelAnalysisController {

    private final ResolutionEngine resolutionEngine;
    private final QuotaStatusService quotaStatusService;

    public ChannelAnalysisController(ResolutionEngine resolutionEngine, QuotaStatusService quotaStatusService) {
        this.resolutionEngine = resolutionEngine;
        this.quotaStatusService = quotaStatusService;
    }

    @PostMapping("/channels/analyze")
    public ChannelAnalysisResponse analyze(@Valid @RequestBody AnalyzeChannelRequest request) {
        return resolutionEngine.resolve(request.channelUrl());
    }

    @GetMapping("/channels/{reference}/analysis")
    public ChannelAnalysisResponse getAnalysis(@PathVariable("reference") String reference) {
        return resolutionEngine.getExisting(reference);
    }

    @GetMapping("/channels/{channelId}/analysis/history")
    public List<AnalysisHistoryResponse> getHistory(@PathVariable("channelId") String channelId) {
        return resolutionEngine.history(channelId);
    }

    @GetMapping("/quota")
    public QuotaStatusResponse getQuota() {
        return quotaStatusService.status();
    }
}
