package com.example.channelinsight.dto;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Size;

public record AnalyzeChannelRequest(
        @NotBlank @Size(max = 500) String channelUrl
) {
}
