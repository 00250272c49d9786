package com.tallybook.service;

import java.util.UUID;
import org.springframework.security.authentication.AnonymousAuthenticationToken;
import org.springframework.security.core.Authentication;
import org.springframework.security.core.context.SecurityContextHolder;
import org.springframework.stereotype.Service;

@Service
public class CurrentUserService {
  public UUID requireUserId() {
    Authentication authentication = SecurityContextHolder.getContext().getAuthentication();
    if (authentication == null
        || !authentication.isAuthenticated()
        || authentication instanceof AnonymousAuthenticationToken
        || authentication.getPrincipal() == null) {
      throw new BookkeepingException(ErrorKind.UNAUTHORIZED, "Not authenticated");
    }
    Object principal = authentication.getPrincipal();
    if (principal instanceof UUID) {
      return (UUID) principal;
    }
    if (principal instanceof String) {
      String value = (String) principal;
      try {
        return UUID.fromString(value);
      } catch (IllegalArgumentException ex) {
        throw new BookkeepingException(ErrorKind.UNAUTHORIZED, "Invalid authentication");
      }
    }
    throw new BookkeepingException(ErrorKind.UNAUTHORIZED, "Invalid authentication");
  }
}
