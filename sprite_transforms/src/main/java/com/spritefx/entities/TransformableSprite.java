package com.spritefx.entities;

import com.spritefx.image.PixelImage;

/**
 * Host-side sprite whose image the rotation engine replaces.
 *
 * <p>Implementations are owned by the host's entity system. The engine only
 * reads the id and current image, and hands back a freshly computed image;
 * it never keeps a reference to the sprite itself.
 */
public interface TransformableSprite {

    /**
     * @return an identifier that stays stable for the sprite's lifetime
     */
    int getId();

    /**
     * @return the image currently displayed by the sprite
     */
    PixelImage getImage();

    /**
     * Replace the displayed image.
     *
     * @param image newly computed image, owned by the sprite from now on
     */
    void setImage(PixelImage image);
}
