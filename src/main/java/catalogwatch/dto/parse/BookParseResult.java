package catalogwatch.dto.parse;

import catalogwatch.model.Book;
import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

import java.util.Optional;

@Getter
@ToString
@AllArgsConstructor(access = AccessLevel.PRIVATE)
public class BookParseResult {
    private final boolean success;
    private final Book book;
    private final String error;
    private final String url;

    public static BookParseResult success(Book book, String url) {
        return new BookParseResult(true, book, null, url);
    }

    public static BookParseResult failure(String error, String url) {
        return new BookParseResult(false, null, error, url);
    }

    public Optional<Book> book() {
        return Optional.ofNullable(book);
    }
}
