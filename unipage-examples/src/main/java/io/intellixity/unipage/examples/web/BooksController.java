package io.intellixity.unipage.examples.web;

import io.intellixity.unipage.api.SelectHandler;
import io.intellixity.unipage.examples.domain.Book;
import io.intellixity.unipage.examples.domain.BookFilter;
import io.intellixity.unipage.exec.Result;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.*;

import java.util.Map;

@RestController
public final class BooksController {
  private final SelectHandler<Map<String, Object>, Map<String, Object>> books;
  private final SelectHandler<BookFilter, Book> typedBooks;
  private final Paging paging;

  public BooksController(SelectHandler<Map<String, Object>, Map<String, Object>> books,
                         SelectHandler<BookFilter, Book> typedBooks,
                         Paging paging) {
    this.books = books;
    this.typedBooks = typedBooks;
    this.paging = paging;
  }

  public record PageRequest(Integer limit, Integer offset) {}

  public record BookSearch(String author, Integer minYear, Integer limit, Integer offset) {}

  @GetMapping("/api/v1/books")
  public Result<Map<String, Object>> list(@RequestParam(name = "limit", required = false) Integer limit,
                                          @RequestParam(name = "offset", required = false) Integer offset,
                                          HttpServletRequest request) {
    return books.handle(null, paging.limit(limit), paging.offset(offset), books.resolveContext(request));
  }

  @PostMapping("/api/v1/books")
  public Result<Map<String, Object>> list(@RequestBody(required = false) PageRequest body, HttpServletRequest request) {
    PageRequest p = (body == null) ? new PageRequest(null, null) : body;
    return list(p.limit(), p.offset(), request);
  }

  @GetMapping("/api/v2/books")
  public Result<Book> search(@RequestParam(name = "author", required = false) String author,
                             @RequestParam(name = "minYear", required = false) Integer minYear,
                             @RequestParam(name = "limit", required = false) Integer limit,
                             @RequestParam(name = "offset", required = false) Integer offset,
                             HttpServletRequest request) {
    return typedBooks.handle(new BookFilter(author, minYear), paging.limit(limit), paging.offset(offset),
        typedBooks.resolveContext(request));
  }

  @PostMapping("/api/v2/books")
  public Result<Book> search(@RequestBody(required = false) BookSearch body, HttpServletRequest request) {
    BookSearch s = (body == null) ? new BookSearch(null, null, null, null) : body;
    return search(s.author(), s.minYear(), s.limit(), s.offset(), request);
  }
}
