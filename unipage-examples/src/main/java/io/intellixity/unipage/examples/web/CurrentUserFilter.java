package io.intellixity.unipage.examples.web;

import jakarta.servlet.FilterChain;
import jakarta.servlet.ServletException;
import jakarta.servlet.http.HttpServletRequest;
import jakarta.servlet.http.HttpServletResponse;
import org.springframework.stereotype.Component;
import org.springframework.web.filter.OncePerRequestFilter;

import java.io.IOException;

/** Copies {@code X-User-Id} into a request attribute; the contextual provider reads it from there. */
@Component
public final class CurrentUserFilter extends OncePerRequestFilter {
  public static final String USER_HEADER = "X-User-Id";
  public static final String USER_ATTRIBUTE = CurrentUserFilter.class.getName() + ".user";

  @Override
  protected void doFilterInternal(HttpServletRequest request,
                                  HttpServletResponse response,
                                  FilterChain filterChain) throws ServletException, IOException {
    String userId = request.getHeader(USER_HEADER);
    if (userId != null && !userId.isBlank()) {
      request.setAttribute(USER_ATTRIBUTE, userId.trim());
    }
    filterChain.doFilter(request, response);
  }
}
