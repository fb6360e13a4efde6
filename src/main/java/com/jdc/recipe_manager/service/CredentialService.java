package com.jdc.recipe_manager.service;

import com.jdc.recipe_manager.config.RecipeManagerProperties;
import com.jdc.recipe_manager.domain.dto.user.UserResponseDto;
import com.jdc.recipe_manager.domain.entity.User;
import com.jdc.recipe_manager.domain.repository.UserRepository;
import com.jdc.recipe_manager.domain.type.Role;
import com.jdc.recipe_manager.exception.ErrorCode;
import com.jdc.recipe_manager.exception.StorageException;
import com.jdc.recipe_manager.exception.ValidationException;
import com.jdc.recipe_manager.mapper.UserMapper;
import com.jdc.recipe_manager.util.InputValidator;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataIntegrityViolationException;
import org.springframework.security.crypto.password.PasswordEncoder;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;
import org.springframework.util.StringUtils;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.time.LocalDateTime;
import java.util.Optional;

@Slf4j
@Service
@RequiredArgsConstructor
public class CredentialService {

    private final UserRepository userRepository;
    private final PasswordEncoder passwordEncoder;
    private final RecipeManagerProperties properties;

    @Transactional
    public Long register(String username, String password) {
        return register(username, password, Role.USER);
    }

    @Transactional
    public Long register(String username, String password, Role role) {
        String name = InputValidator.validateUsername(username);
        String rawPassword = InputValidator.validatePassword(password);
        Role assigned = role == null ? Role.USER : role;

        if (userRepository.existsByUsername(name)) {
            throw new ValidationException(ErrorCode.DUPLICATE_USERNAME);
        }

        try {
            User saved = userRepository.saveAndFlush(
                    UserMapper.toEntity(name, passwordEncoder.encode(rawPassword), assigned));
            log.info("User {} registered with role {}", name, assigned);
            return saved.getId();
        } catch (DataIntegrityViolationException e) {
            // lost a race with a concurrent registration of the same name
            throw new ValidationException(ErrorCode.DUPLICATE_USERNAME);
        } catch (DataAccessException e) {
            log.error("Failed to register user {}", name, e);
            throw new StorageException("Failed to register user: " + name, e);
        }
    }

    /**
     * Admin accounts require the configured passphrase. Registration is refused
     * outright while no passphrase is configured.
     */
    @Transactional
    public Long registerAdmin(String username, String password, String passphrase) {
        String configured = properties.getAdmin().getPassphrase();
        if (!StringUtils.hasText(configured)) {
            throw new ValidationException(ErrorCode.ADMIN_REGISTRATION_DISABLED);
        }
        if (passphrase == null || !MessageDigest.isEqual(
                configured.getBytes(StandardCharsets.UTF_8), passphrase.getBytes(StandardCharsets.UTF_8))) {
            log.warn("Rejected admin registration for {}: wrong passphrase", username);
            throw new ValidationException(ErrorCode.INVALID_ADMIN_PASSPHRASE);
        }
        return register(username, password, Role.ADMIN);
    }

    /**
     * @return the stored role, or empty when the user is unknown or the password does not match
     */
    @Transactional
    public Optional<Role> login(String username, String password) {
        String name = InputValidator.validateUsername(username);
        String rawPassword = InputValidator.validatePassword(password);

        Optional<User> found = userRepository.findByUsername(name);
        if (found.isEmpty() || !passwordEncoder.matches(rawPassword, found.get().getPasswordHash())) {
            log.warn("Failed login attempt for {}", name);
            return Optional.empty();
        }

        User user = found.get();
        user.recordLogin(LocalDateTime.now());
        log.info("User {} logged in", name);
        return Optional.of(user.getRole());
    }

    public Optional<UserResponseDto> getUser(String username) {
        try {
            return userRepository.findByUsername(username).map(UserMapper::toResponseDto);
        } catch (DataAccessException e) {
            log.error("Failed to load user {}", username, e);
            return Optional.empty();
        }
    }
}
