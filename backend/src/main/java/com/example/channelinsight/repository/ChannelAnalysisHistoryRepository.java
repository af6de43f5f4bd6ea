package com.example.channelinsight.repository;

import com.example.channelinsight.model.ChannelAnalysisHistory;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ChannelAnalysisHistoryRepository extends JpaRepository<ChannelAnalysisHistory, Long> {
    List<ChannelAnalysisHistory> findByChannelIdOrderByAnalyzedAtDesc(String channelId);
}
