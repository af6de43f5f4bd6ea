package com.example.channelinsight.repository;

import com.example.channelinsight.model.Channel;
import java.util.Optional;
import org.springframework.data.jpa.repository.JpaRepository;

public interface ChannelRepository extends JpaRepository<Channel, Long> {
    Optional<Channel> findByChannelId(String channelId);

    Optional<Channel> findFirstByCustomUrlIgnoreCase(String customUrl);
}
