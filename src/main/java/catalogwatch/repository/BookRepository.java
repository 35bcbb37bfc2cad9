package catalogwatch.repository;

import catalogwatch.model.Book;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.stereotype.Repository;

import java.util.List;
import java.util.Optional;

@Repository
public interface BookRepository extends JpaRepository<Book, Long> {

    Optional<Book> findByUrl(String url);

    boolean existsByUrl(String url);

    @Query("SELECT b FROM Book b ORDER BY b.id")
    List<Book> findAllOrdered();
}
