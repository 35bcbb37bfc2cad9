package catalogwatch.services.impl;

import catalogwatch.exception.BookValidationException;
import catalogwatch.model.Book;
import jakarta.validation.ConstraintViolation;
import jakarta.validation.Validator;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Checks the bean constraints of a parsed book before it reaches the store.
 */
@Component
@RequiredArgsConstructor
public class BookValidator {
    private final Validator validator;

    public Book validate(Book book) {
        Set<ConstraintViolation<Book>> violations = validator.validate(book);
        if (!violations.isEmpty()) {
            List<String> messages = violations.stream()
                    .sorted(Comparator.comparing(v -> v.getPropertyPath().toString()))
                    .map(v -> v.getPropertyPath() + " " + v.getMessage())
                    .toList();
            throw new BookValidationException(book.getUrl(), messages);
        }
        return book;
    }
}
