package com.starscape.contacts.features.users.infra;

import com.starscape.contacts.common.exception.MediaStorageException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import software.amazon.awssdk.core.exception.SdkException;
import software.amazon.awssdk.core.sync.RequestBody;
import software.amazon.awssdk.services.s3.S3Client;
import software.amazon.awssdk.services.s3.model.DeleteObjectRequest;
import software.amazon.awssdk.services.s3.model.GetUrlRequest;
import software.amazon.awssdk.services.s3.model.PutObjectRequest;

import java.util.Optional;
import java.util.UUID;

/**
 * Stores avatars in S3 under {@code avatars/{userId}/{uuid}.png}.
 */
@Service
public class S3AvatarStorage {
    
    private static final Logger log = LoggerFactory.getLogger(S3AvatarStorage.class);
    
    static final String KEY_PREFIX = "avatars/";
    
    private final S3Client s3Client;
    private final String bucket;
    
    public S3AvatarStorage(S3Client s3Client, @Value("${aws.s3.bucket}") String bucket) {
        this.s3Client = s3Client;
        this.bucket = bucket;
    }
    
    /**
     * Upload a PNG avatar.
     * @return public URL of the stored object
     * @throws MediaStorageException if S3 rejects the upload
     */
    public String store(String userId, byte[] png) {
        String key = KEY_PREFIX + userId + "/" + UUID.randomUUID().toString().replace("-", "") + ".png";
        PutObjectRequest putRequest = PutObjectRequest.builder()
                .bucket(bucket)
                .key(key)
                .contentType("image/png")
                .contentLength((long) png.length)
                .build();
        
        try {
            s3Client.putObject(putRequest, RequestBody.fromBytes(png));
        } catch (SdkException e) {
            throw new MediaStorageException("Failed to store avatar", e);
        }
        
        log.info("Stored avatar: bucket={}, key={}", bucket, key);
        return s3Client.utilities()
                .getUrl(GetUrlRequest.builder().bucket(bucket).key(key).build())
                .toExternalForm();
    }
    
    /**
     * Delete an avatar previously returned by {@link #store}. URLs pointing elsewhere
     * (Gravatar defaults) are ignored, as are S3 errors.
     */
    public void deleteQuietly(String userId, String avatarUrl) {
        Optional<String> key = keyOf(userId, avatarUrl);
        if (key.isEmpty()) {
            return;
        }
        
        try {
            s3Client.deleteObject(DeleteObjectRequest.builder().bucket(bucket).key(key.get()).build());
            log.debug("Deleted avatar: bucket={}, key={}", bucket, key.get());
        } catch (SdkException e) {
            log.warn("Failed to delete old avatar: bucket={}, key={}", bucket, key.get(), e);
        }
    }
    
    static Optional<String> keyOf(String userId, String avatarUrl) {
        if (avatarUrl == null) {
            return Optional.empty();
        }
        String userPrefix = KEY_PREFIX + userId + "/";
        int start = avatarUrl.indexOf(userPrefix);
        if (start < 0) {
            return Optional.empty();
        }
        String key = avatarUrl.substring(start);
        int query = key.indexOf('?');
        return Optional.of(query >= 0 ? key.substring(0, query) : key);
    }
}
