package catalogwatch.repository;

import catalogwatch.model.BookChange;
import org.springframework.data.domain.Pageable;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface BookChangeRepository extends JpaRepository<BookChange, Long> {

    @Query("SELECT c FROM BookChange c ORDER BY c.changedAt DESC, c.id DESC")
    List<BookChange> findRecent(Pageable pageable);
}
