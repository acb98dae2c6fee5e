package com.eduhub.data.service;

import com.eduhub.data.domain.DomainModels;
import com.eduhub.data.error.ValidationException;
import com.eduhub.data.repository.UserMongoRepository;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

@Service
@Slf4j
public class UserService {
    private final UserMongoRepository repository;
    private final Clock clock;

    public UserService(UserMongoRepository repository, Clock clock) {
        this.repository = repository;
        this.clock = clock;
    }

    public String createUser(DomainModels.NewUser user) {
        String id = repository.insert(user, Instant.now(clock));
        log.info("Created user {} with role {}", id, user.role());
        return id;
    }

    public Optional<DomainModels.User> findUserById(String id) {
        return repository.findById(id);
    }

    public Optional<DomainModels.User> findUserByEmail(String email) {
        return repository.findByEmail(email);
    }

    public List<DomainModels.User> findActiveStudents() {
        return repository.findActiveByRole(DomainModels.UserRole.STUDENT);
    }

    public long updateUserProfile(String userId, Map<String, Object> updates) {
        if (updates == null || updates.isEmpty()) return 0;
        if (updates.containsKey("_id")) {
            throw new ValidationException("_id cannot be updated");
        }
        long modified = repository.update(userId, updates);
        log.debug("Profile update for {} modified {} record(s)", userId, modified);
        return modified;
    }
}
