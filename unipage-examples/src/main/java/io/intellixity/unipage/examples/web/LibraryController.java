package io.intellixity.unipage.examples.web;

import io.intellixity.unipage.api.UnionHandler;
import io.intellixity.unipage.examples.domain.Book;
import io.intellixity.unipage.examples.domain.BookFilter;
import io.intellixity.unipage.exec.Result;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.*;

/**
 * Union over every configured source.\n
 *
 * {@code sources=a,b} puts those sources first for this request; the rest follow in registration order.
 */
@RestController
@RequestMapping("/api/v1/library")
public final class LibraryController {
  private final UnionHandler<BookFilter, Book> library;
  private final Paging paging;

  public LibraryController(UnionHandler<BookFilter, Book> library, Paging paging) {
    this.library = library;
    this.paging = paging;
  }

  public record LibrarySearch(String author, Integer minYear, String sources, Integer limit, Integer offset) {}

  @GetMapping
  public Result<Book> search(@RequestParam(name = "author", required = false) String author,
                             @RequestParam(name = "minYear", required = false) Integer minYear,
                             @RequestParam(name = "sources", required = false) String sources,
                             @RequestParam(name = "limit", required = false) Integer limit,
                             @RequestParam(name = "offset", required = false) Integer offset,
                             HttpServletRequest request) {
    return library.handle(new BookFilter(author, minYear), paging.limit(limit), paging.offset(offset),
        sources, library.resolveContext(request));
  }

  @PostMapping
  public Result<Book> search(@RequestBody(required = false) LibrarySearch body, HttpServletRequest request) {
    LibrarySearch s = (body == null) ? new LibrarySearch(null, null, null, null, null) : body;
    return search(s.author(), s.minYear(), s.sources(), s.limit(), s.offset(), request);
  }
}
