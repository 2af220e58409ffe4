package com.starscape.contacts.features.users.infra;

import com.starscape.contacts.common.exception.UnprocessableEntityException;
import net.coobird.thumbnailator.Thumbnails;
import net.coobird.thumbnailator.geometry.Positions;
import org.springframework.stereotype.Component;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;

/**
 * Scales and center-crops uploaded images to a square PNG avatar.
 */
@Component
public class AvatarResizer {
    
    static final int AVATAR_SIZE = 250;
    static final String OUTPUT_FORMAT = "png";
    
    public byte[] resize(byte[] imageBytes) {
        BufferedImage image;
        try {
            image = ImageIO.read(new ByteArrayInputStream(imageBytes));
        } catch (IOException e) {
            throw new UnprocessableEntityException("Uploaded file is not a readable image");
        }
        if (image == null) {
            throw new UnprocessableEntityException("Uploaded file is not a readable image");
        }
        
        try {
            ByteArrayOutputStream output = new ByteArrayOutputStream();
            Thumbnails.of(image)
                    .size(AVATAR_SIZE, AVATAR_SIZE)
                    .crop(Positions.CENTER)
                    .outputFormat(OUTPUT_FORMAT)
                    .toOutputStream(output);
            return output.toByteArray();
        } catch (IOException e) {
            throw new UnprocessableEntityException("Uploaded image could not be resized");
        }
    }
}
