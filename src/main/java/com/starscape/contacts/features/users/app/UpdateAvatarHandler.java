package com.starscape.contacts.features.users.app;

import com.starscape.contacts.common.exception.NotFoundException;
import com.starscape.contacts.features.auth.domain.User;
import com.starscape.contacts.features.auth.domain.UserRepository;
import com.starscape.contacts.features.users.api.dto.UserResponse;
import com.starscape.contacts.features.users.infra.AvatarResizer;
import com.starscape.contacts.features.users.infra.S3AvatarStorage;
import org.springframework.stereotype.Service;
import org.springframework.transaction.annotation.Transactional;

/**
 * Handler for replacing the caller's avatar with an uploaded image.
 */
@Service
public class UpdateAvatarHandler {
    
    private final UserRepository userRepository;
    private final AvatarResizer avatarResizer;
    private final S3AvatarStorage avatarStorage;
    
    public UpdateAvatarHandler(
            UserRepository userRepository,
            AvatarResizer avatarResizer,
            S3AvatarStorage avatarStorage) {
        this.userRepository = userRepository;
        this.avatarResizer = avatarResizer;
        this.avatarStorage = avatarStorage;
    }
    
    @Transactional
    public UserResponse handle(String userId, byte[] imageBytes) {
        User user = userRepository.findById(userId)
                .orElseThrow(() -> new NotFoundException("User not found: " + userId));
        
        byte[] avatar = avatarResizer.resize(imageBytes);
        String avatarUrl = avatarStorage.store(userId, avatar);
        
        user.changeAvatar(avatarUrl);
        // Cache eviction and removal of the replaced object follow the commit
        userRepository.save(user);
        
        return UserResponse.of(user);
    }
}
