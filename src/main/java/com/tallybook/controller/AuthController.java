package com.tallybook.controller;

import com.tallybook.dto.ActionResult;
import com.tallybook.dto.AuthRequest;
import com.tallybook.dto.AuthResponse;
import com.tallybook.dto.RefreshTokenRequest;
import com.tallybook.dto.RegisterRequest;
import com.tallybook.dto.UserResponse;
import com.tallybook.model.User;
import com.tallybook.service.CurrentUserService;
import com.tallybook.service.JwtService;
import com.tallybook.service.RefreshTokenService;
import com.tallybook.service.UserService;
import jakarta.validation.Valid;
import org.springframework.http.HttpStatus;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.ResponseStatus;
import org.springframework.web.bind.annotation.RestController;

@RestController
@RequestMapping("/api/auth")
public class AuthController {
  private final UserService userService;
  private final JwtService jwtService;
  private final RefreshTokenService refreshTokenService;
  private final CurrentUserService currentUserService;

  public AuthController(UserService userService,
                        JwtService jwtService,
                        RefreshTokenService refreshTokenService,
                        CurrentUserService currentUserService) {
    this.userService = userService;
    this.jwtService = jwtService;
    this.refreshTokenService = refreshTokenService;
    this.currentUserService = currentUserService;
  }

  @PostMapping("/register")
  @ResponseStatus(HttpStatus.CREATED)
  public ActionResult<AuthResponse> register(@RequestBody RegisterRequest request) {
    User user = userService.register(request);
    return ActionResult.ok(openSession(user));
  }

  @PostMapping("/login")
  public ActionResult<AuthResponse> login(@Valid @RequestBody AuthRequest request) {
    User user = userService.authenticate(request.getEmail(), request.getPassword());
    return ActionResult.ok(openSession(user));
  }

  @PostMapping("/refresh")
  public ActionResult<AuthResponse> refresh(@Valid @RequestBody RefreshTokenRequest request) {
    RefreshTokenService.TokenResult refresh = refreshTokenService.rotate(request.getRefreshToken());
    User user = userService.findById(refresh.userId());
    return ActionResult.ok(session(user, refresh));
  }

  @PostMapping("/logout")
  public ActionResult<Void> logout(@Valid @RequestBody RefreshTokenRequest request) {
    refreshTokenService.revoke(request.getRefreshToken());
    return ActionResult.ok();
  }

  @GetMapping("/me")
  public ActionResult<UserResponse> me() {
    User user = userService.findById(currentUserService.requireUserId());
    return ActionResult.ok(toUserResponse(user));
  }

  private AuthResponse openSession(User user) {
    return session(user, refreshTokenService.issue(user.getId()));
  }

  private AuthResponse session(User user, RefreshTokenService.TokenResult refresh) {
    JwtService.AccessToken access = jwtService.issue(user);
    return new AuthResponse(access.token(), access.expiresAt(), refresh.token(), refresh.expiresAt(),
        toUserResponse(user));
  }

  private static UserResponse toUserResponse(User user) {
    return new UserResponse(user.getId(), user.getEmail(), user.getName());
  }
}
