package com.edustream.studio.repository;

import com.edustream.studio.model.ContentItem;
import com.edustream.studio.model.ContentStatus;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ContentItemRepository extends JpaRepository<ContentItem, Long> {

    // Most recent first; used to build the template recency list
    List<ContentItem> findByScriptDataIsNotNullOrderByCreatedAtDesc(Pageable pageable);

    List<ContentItem> findByStatusAndDiagramPathIsNotNullOrderByCreatedAtAsc(ContentStatus status);
}
