package app.revisio.core.review.repository;

import app.revisio.core.review.entity.ReviewLogEntity;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ReviewLogRepository extends JpaRepository<ReviewLogEntity, Long> {
}
