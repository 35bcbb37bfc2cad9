package catalogwatch.services.impl;

import catalogwatch.dto.parse.BookParseResult;
import catalogwatch.dto.parse.CategoryLink;
import catalogwatch.model.Book;
import catalogwatch.util.FieldExtractors;
import catalogwatch.util.UrlResolver;
import lombok.extern.slf4j.Slf4j;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static catalogwatch.util.FieldExtractors.cleanText;
import static catalogwatch.util.FieldExtractors.extractPrice;
import static catalogwatch.util.FieldExtractors.extractRating;

/**
 * Extracts books, book links, pagination and categories from catalogue markup. No I/O.
 */
@Slf4j
public class BookParser {
    private static final String INFO_TABLE = "table.table-striped tr";

    private final UrlResolver urlResolver;

    public BookParser(UrlResolver urlResolver) {
        this.urlResolver = urlResolver;
    }

    /**
     * Parses a book detail page. Never throws: missing required fields and broken markup are
     * reported through {@link BookParseResult#isSuccess()}.
     */
    public BookParseResult parse(String html, String url) {
        try {
            Document document = Jsoup.parse(html == null ? "" : html, url == null ? "" : url);

            String title = extractTitle(document);
            String category = extractCategory(document);
            BigDecimal priceExclTax = extractPrice(infoValue(document, "Price (excl. tax)").orElse(""));
            BigDecimal priceInclTax = extractPriceInclTax(document);
            int rating = extractStarRating(document);

            List<String> missing = new ArrayList<>();
            if (title.isEmpty()) {
                missing.add("title");
            }
            if (category.isEmpty()) {
                missing.add("category");
            }
            if (priceInclTax.signum() <= 0) {
                missing.add("price_incl_tax");
            }
            if (rating <= 0) {
                missing.add("rating");
            }
            if (!missing.isEmpty()) {
                String error = "Missing required fields: " + String.join(", ", missing);
                log.warn("Incomplete book data for {}: {}", url, error);
                return BookParseResult.failure(error, url);
            }

            Book book = new Book(url, title, category, priceExclTax, priceInclTax,
                    extractAvailability(document),
                    infoValue(document, "Number of reviews").map(FieldExtractors::extractNumber).orElse(0),
                    extractImageUrl(document),
                    rating);
            book.setDescription(extractDescription(document));
            book.setRawHtml(html);
            return BookParseResult.success(book, url);
        } catch (RuntimeException ex) {
            log.error("Error parsing book page {}: {}", url, ex.getMessage());
            return BookParseResult.failure(String.valueOf(ex.getMessage()), url);
        }
    }

    /**
     * Absolute URLs of the books listed on a category page, in page order.
     */
    public List<String> parseIndexPage(String html) {
        Document document = Jsoup.parse(html);
        List<String> bookUrls = new ArrayList<>();
        for (Element link : document.select("article.product_pod h3 a[href]")) {
            bookUrls.add(urlResolver.buildAbsoluteUrl(link.attr("href")));
        }
        log.debug("Found {} books on page", bookUrls.size());
        return bookUrls;
    }

    public Optional<String> nextPageUrl(String html) {
        Element next = Jsoup.parse(html).selectFirst("li.next a[href]");
        if (next == null || next.attr("href").isBlank()) {
            return Optional.empty();
        }
        return Optional.of(next.attr("href"));
    }

    /**
     * Categories from the side navigation, skipping the leading "Books" parent link.
     */
    public List<CategoryLink> parseCategoryIndex(String html) {
        Elements links = Jsoup.parse(html).select("ul.nav-list a[href]");
        List<CategoryLink> categories = new ArrayList<>();
        for (int i = 1; i < links.size(); i++) {
            Element link = links.get(i);
            categories.add(new CategoryLink(cleanText(link.text()), urlResolver.buildAbsoluteUrl(link.attr("href"))));
        }
        log.info("Found {} categories", categories.size());
        return categories;
    }

    private String extractTitle(Document document) {
        Element title = document.selectFirst("div.product_main h1");
        if (title == null) {
            title = document.selectFirst("h1");
        }
        return title == null ? "" : cleanText(title.text());
    }

    private String extractDescription(Document document) {
        Element description = document.selectFirst("#product_description ~ p");
        return description == null ? null : cleanText(description.text());
    }

    // Home > Books > Category > Title
    private String extractCategory(Document document) {
        Elements crumbs = document.select("ul.breadcrumb a");
        return crumbs.size() >= 3 ? cleanText(crumbs.get(2).text()) : "";
    }

    private BigDecimal extractPriceInclTax(Document document) {
        Optional<String> fromTable = infoValue(document, "Price (incl. tax)");
        if (fromTable.isPresent()) {
            return extractPrice(fromTable.get());
        }
        Element price = document.selectFirst("p.price_color");
        return extractPrice(price == null ? "" : price.text());
    }

    private String extractAvailability(Document document) {
        Optional<String> fromTable = infoValue(document, "Availability");
        if (fromTable.isPresent()) {
            return cleanText(fromTable.get());
        }
        Element availability = document.selectFirst("p.instock.availability");
        return availability == null ? "Unknown" : cleanText(availability.text());
    }

    private String extractImageUrl(Document document) {
        Element image = document.selectFirst("#product_gallery img[src]");
        if (image == null) {
            image = document.selectFirst("div.item.active img[src]");
        }
        if (image == null) {
            return "";
        }
        String absolute = image.absUrl("src");
        return absolute.isEmpty() ? urlResolver.buildAbsoluteUrl(image.attr("src")) : absolute;
    }

    private int extractStarRating(Document document) {
        Element rating = document.selectFirst("p.star-rating");
        return rating == null ? 0 : extractRating(rating.className());
    }

    private Optional<String> infoValue(Document document, String header) {
        for (Element row : document.select(INFO_TABLE)) {
            Element th = row.selectFirst("th");
            Element td = row.selectFirst("td");
            if (th != null && td != null && th.text().contains(header)) {
                return Optional.of(td.text());
            }
        }
        return Optional.empty();
    }
}
