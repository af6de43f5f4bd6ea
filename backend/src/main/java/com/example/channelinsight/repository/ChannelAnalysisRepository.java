package com.example.channelinsight.repository;

import com.example.channelinsight.model.ChannelAnalysis;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ChannelAnalysisRepository extends JpaRepository<ChannelAnalysis, Long> {
    Optional<ChannelAnalysis> findByChannelId(String channelId);
}
