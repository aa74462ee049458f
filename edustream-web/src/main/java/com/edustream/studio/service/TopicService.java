package com.edustream.studio.service;

import com.edustream.studio.model.Topic;
import com.edustream.studio.repository.TopicRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.stereotype.Service;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.TransactionDefinition;
import org.springframework.transaction.support.TransactionTemplate;

@Service
@Slf4j
public class TopicService {

    private final TopicRepository topicRepository;
    private final TransactionTemplate insertTx;

    public TopicService(TopicRepository topicRepository, PlatformTransactionManager transactionManager) {
        this.topicRepository = topicRepository;
        this.insertTx = new TransactionTemplate(transactionManager);
        this.insertTx.setPropagationBehavior(TransactionDefinition.PROPAGATION_REQUIRES_NEW);
    }

    /**
     * Returns the topic with this name and category, creating it on first use. Two requests
     * racing to create the same topic both get the row that won the insert.
     */
    public Topic findOrCreate(String name, String category, String description) {
        return topicRepository.findByNameAndCategory(name, category)
                .orElseGet(() -> create(name, category, description));
    }

    private Topic create(String name, String category, String description) {
        try {
            Topic topic = insertTx.execute(status -> topicRepository.save(new Topic(name, category, description)));
            log.info("Created topic '{}' in category '{}'", name, category);
            return topic;
        } catch (DataIntegrityViolationException e) {
            log.info("Topic '{}' in category '{}' was created concurrently, reusing it", name, category);
            return topicRepository.findByNameAndCategory(name, category).orElseThrow(() -> e);
        }
    }
}
