package com.starscape.contacts.features.users.infra;

import com.starscape.contacts.common.exception.UnprocessableEntityException;
import org.junit.jupiter.api.Test;

import javax.imageio.ImageIO;
import java.awt.image.BufferedImage;
import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.*;

class AvatarResizerTest {
    
    private final AvatarResizer resizer = new AvatarResizer();
    
    @Test
    void producesSquarePng() throws Exception {
        BufferedImage source = new BufferedImage(640, 360, BufferedImage.TYPE_INT_RGB);
        ByteArrayOutputStream jpeg = new ByteArrayOutputStream();
        ImageIO.write(source, "jpg", jpeg);
        
        byte[] avatar = resizer.resize(jpeg.toByteArray());
        
        BufferedImage result = ImageIO.read(new ByteArrayInputStream(avatar));
        assertEquals(250, result.getWidth());
        assertEquals(250, result.getHeight());
        // PNG signature
        assertEquals((byte) 0x89, avatar[0]);
        assertEquals('P', avatar[1]);
    }
    
    @Test
    void rejectsNonImages() {
        byte[] text = "definitely not an image".getBytes(StandardCharsets.UTF_8);
        
        assertThrows(UnprocessableEntityException.class, () -> resizer.resize(text));
    }
}
