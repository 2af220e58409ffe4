package com.starscape.contacts.features.users.app;

import com.starscape.contacts.features.auth.domain.UserRepository;
import com.starscape.contacts.features.users.infra.RedisUserCache;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

import java.util.Optional;

/**
 * Resolves the user behind an access token: cache first, then the database.
 */
@Service
public class CurrentUserLookup {

    private final RedisUserCache userCache;
    private final UserRepository userRepository;

    public CurrentUserLookup(RedisUserCache userCache, UserRepository userRepository) {
        this.userCache = userCache;
        this.userRepository = userRepository;
    }

    @Transactional(readOnly = true)
    public Optional<UserSnapshot> findById(String userId) {
        Optional<UserSnapshot> cached = userCache.get(userId);
        if (cached.isPresent()) {
            return cached;
        }

        Optional<UserSnapshot> loaded = userRepository.findById(userId).map(UserSnapshot::of);
        loaded.ifPresent(userCache::put);
        return loaded;
    }
}
