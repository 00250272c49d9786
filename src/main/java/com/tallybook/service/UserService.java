package com.tallybook.service;

import com.tallybook.dto.RegisterRequest;
import com.tallybook.model.User;
import com.tallybook.repository.UserRepository;
import java.util.Optional;
import java.util.UUID;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

@Service
public class UserService {
  private static final Logger log = LoggerFactory.getLogger(UserService.class);
  private static final int MIN_PASSWORD_LENGTH = 8;

  private final UserRepository userRepository;
  private final PasswordEncoder passwordEncoder;
  private final CategoryService categoryService;

  public UserService(UserRepository userRepository,
                     PasswordEncoder passwordEncoder,
                     CategoryService categoryService) {
    this.userRepository = userRepository;
    this.passwordEncoder = passwordEncoder;
    this.categoryService = categoryService;
  }

  @Transactional
  public User register(RegisterRequest request) {
    String email = request.getEmail() == null ? null : request.getEmail().trim();
    String password = request.getPassword();
    String confirmPassword = request.getConfirmPassword();
    String name = request.getName() == null ? null : request.getName().trim();
    if (isBlank(email) || isBlank(password) || isBlank(confirmPassword) || isBlank(name)) {
      throw BookkeepingException.validation("All fields are required");
    }
    if (!EmailAddresses.isValid(email)) {
      throw BookkeepingException.validation("Invalid email format");
    }
    FieldLimits.requireMaxLength(email, User.EMAIL_LENGTH, "Email");
    FieldLimits.requireMaxLength(name, User.NAME_LENGTH, "Name");
    if (password.length() < MIN_PASSWORD_LENGTH) {
      throw BookkeepingException.validation("Password must be at least " + MIN_PASSWORD_LENGTH + " characters");
    }
    if (!password.equals(confirmPassword)) {
      throw BookkeepingException.validation("Passwords do not match");
    }
    String normalizedEmail = EmailAddresses.normalize(email);
    if (userRepository.existsByEmail(normalizedEmail)) {
      throw new BookkeepingException(ErrorKind.DUPLICATE, "An account with this email already exists");
    }

    User user = new User();
    user.setEmail(normalizedEmail);
    user.setName(name);
    user.setPasswordHash(passwordEncoder.encode(password));
    User saved = userRepository.save(user);
    categoryService.seedDefaults(saved);
    log.info("Registered user {}", saved.getId());
    return saved;
  }

  @Transactional(readOnly = true)
  public User authenticate(String email, String password) {
    Optional<User> existing = userRepository.findByEmail(EmailAddresses.normalize(email));
    if (existing.isEmpty() || password == null
        || !passwordEncoder.matches(password, existing.get().getPasswordHash())) {
      throw new BookkeepingException(ErrorKind.UNAUTHORIZED, "Invalid credentials");
    }
    return existing.get();
  }

  @Transactional(readOnly = true)
  public User findById(UUID userId) {
    return userRepository.findById(userId)
        .orElseThrow(() -> new BookkeepingException(ErrorKind.UNAUTHORIZED, "Not authenticated"));
  }

  private static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }
}
