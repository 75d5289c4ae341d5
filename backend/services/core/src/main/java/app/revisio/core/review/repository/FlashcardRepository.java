package app.revisio.core.review.repository;

import app.revisio.core.review.entity.FlashcardEntity;
import jakarta.persistence.LockModeType;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Lock;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.time.Instant;
import java.util.List;
import java.util.Optional;
import java.util.UUID;

@Repository
public interface FlashcardRepository extends JpaRepository<FlashcardEntity, UUID> {

    interface TopicSummaryProjection {
        String getTopic();

        long getTotal();

        long getDue();

        long getNewCount();

        long getLearningCount();

        long getReviewCount();

        long getRelearningCount();
    }

    @Lock(LockModeType.PESSIMISTIC_WRITE)
    @Query("select c from FlashcardEntity c where c.cardId = :id")
    Optional<FlashcardEntity> findByIdForUpdate(@Param("id") UUID id);

    @Query("""
            select c
            from FlashcardEntity c
            where c.userId = :userId
              and c.topic = :topic
              and c.state <> 0
              and c.dueAt <= :now
            order by c.dueAt asc
            """)
    List<FlashcardEntity> findDueCards(@Param("userId") UUID userId,
                                       @Param("topic") String topic,
                                       @Param("now") Instant now);

    @Query("""
            select c
            from FlashcardEntity c
            where c.userId = :userId
              and c.topic = :topic
              and c.state = 0
            order by c.createdAt asc, c.cardId asc
            """)
    List<FlashcardEntity> findNewCards(@Param("userId") UUID userId,
                                       @Param("topic") String topic,
                                       Pageable pageable);

    // new cards always count as due
    @Query("""
            select c.topic as topic,
                   count(c) as total,
                   sum(case when c.state = 0 or c.dueAt <= :now then 1 else 0 end) as due,
                   sum(case when c.state = 0 then 1 else 0 end) as newCount,
                   sum(case when c.state = 1 then 1 else 0 end) as learningCount,
                   sum(case when c.state = 2 then 1 else 0 end) as reviewCount,
                   sum(case when c.state = 3 then 1 else 0 end) as relearningCount
            from FlashcardEntity c
            where c.userId = :userId
            group by c.topic
            order by c.topic asc
            """)
    List<TopicSummaryProjection> summarizeByTopic(@Param("userId") UUID userId,
                                                  @Param("now") Instant now);
}
