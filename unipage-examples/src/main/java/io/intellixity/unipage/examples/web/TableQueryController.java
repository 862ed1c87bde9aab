package io.intellixity.unipage.examples.web;

import io.intellixity.unipage.api.SelectHandler;
import io.intellixity.unipage.examples.domain.TableQuery;
import io.intellixity.unipage.exec.Result;
import jakarta.servlet.http.HttpServletRequest;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import java.util.Map;

/** Lists any table of the primary source; requires {@code X-User-Id}. */
@RestController
public final class TableQueryController {
  private final SelectHandler<TableQuery, Map<String, Object>> tables;
  private final Paging paging;

  public TableQueryController(SelectHandler<TableQuery, Map<String, Object>> tables, Paging paging) {
    this.tables = tables;
    this.paging = paging;
  }

  @GetMapping("/api/v1/query")
  public Result<Map<String, Object>> query(@RequestParam(name = "table") String table,
                                           @RequestParam(name = "orderBy", defaultValue = "id") String orderBy,
                                           @RequestParam(name = "limit", required = false) Integer limit,
                                           @RequestParam(name = "offset", required = false) Integer offset,
                                           HttpServletRequest request) {
    return tables.handle(new TableQuery(table, orderBy), paging.limit(limit), paging.offset(offset),
        tables.resolveContext(request));
  }
}
