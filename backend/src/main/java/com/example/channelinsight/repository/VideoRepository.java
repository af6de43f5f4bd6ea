package com.example.channelinsight.repository;

import com.example.channelinsight.model.Video;
import java.util.Collection;
import java.util.List;
import org.springframework.data.jpa.repository.JpaRepository;

public interface VideoRepository extends JpaRepository<Video, Long> {
    List<Video> findByVideoIdIn(Collection<String> videoIds);
}
