package catalogwatch.repository;

import catalogwatch.model.CrawlState;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Modifying;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

@Repository
public interface CrawlStateRepository extends JpaRepository<CrawlState, Long> {

    Optional<CrawlState> findByStateType(String stateType);

    @Modifying(flushAutomatically = true, clearAutomatically = true)
    @Transactional
    @Query("DELETE FROM CrawlState s WHERE s.stateType = :stateType")
    void deleteByStateType(@Param("stateType") String stateType);
}
